package com.forex.cli;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CommandRegistry单元测试")
class CommandRegistryTest {

    @Test
    @DisplayName("按名称和别名查找命令")
    void testLookupByNameAndAlias() {
        StubCommand optimize = new StubCommand("optimize", List.of("opt"));
        StubCommand prepare = new StubCommand("prepare", List.of());
        CommandRegistry registry = new CommandRegistry(List.of(optimize, prepare));

        assertThat(registry.getCommand("optimize")).isSameAs(optimize);
        assertThat(registry.getCommand("opt")).isSameAs(optimize);
        assertThat(registry.getCommand("prepare")).isSameAs(prepare);
        assertThat(registry.getCommand("backtest")).isNull();
        assertThat(registry.getAllCommands()).hasSize(2);
    }

    @Test
    @DisplayName("前缀匹配忽略大小写")
    void testFindMatchingCommands() {
        CommandRegistry registry = new CommandRegistry(List.of(
                new StubCommand("optimize", List.of("opt")),
                new StubCommand("prepare", List.of()),
                new StubCommand("check-data", List.of())));

        assertThat(registry.findMatchingCommands("OP")).containsExactly("opt", "optimize");
        assertThat(registry.findMatchingCommands("x")).isEmpty();
    }

    @Test
    @DisplayName("执行命令时传入去掉命令名后的参数")
    void testExecute() {
        StubCommand command = new StubCommand("check-data", List.of());
        CommandRegistry registry = new CommandRegistry(List.of(command));

        registry.getCommand("check-data").execute(new String[]{"--symbol", "EURUSD"});

        assertThat(command.lastArgs).containsExactly("--symbol", "EURUSD");
    }

    private static class StubCommand implements Command {
        private final String name;
        private final List<String> aliases;
        private String[] lastArgs;

        StubCommand(String name, List<String> aliases) {
            this.name = name;
            this.aliases = aliases;
        }

        @Override
        public String getName() {
            return name;
        }

        @Override
        public String getDescription() {
            return name;
        }

        @Override
        public void execute(String[] args) {
            this.lastArgs = args;
        }

        @Override
        public void printUsage() {
        }

        @Override
        public List<String> getAliases() {
            return aliases;
        }
    }
}
