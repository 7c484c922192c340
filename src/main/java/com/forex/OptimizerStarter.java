package com.forex;

import com.forex.cli.Command;
import com.forex.cli.CommandException;
import com.forex.cli.CommandRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * 外汇策略参数优化器启动器
 */
@Slf4j
@SpringBootApplication
@RequiredArgsConstructor
public class OptimizerStarter implements CommandLineRunner {

    private final CommandRegistry commandRegistry;

    public static void main(String[] args) {
        SpringApplication.run(OptimizerStarter.class, args);
    }

    @Override
    public void run(String... args) {
        int exitCode = dispatch(args);
        if (args.length > 0) {
            // CLI命令执行完成后退出应用
            System.exit(exitCode);
        }
    }

    /**
     * 执行命令并返回退出码
     */
    int dispatch(String... args) {
        if (args.length == 0) {
            printAvailableCommands();
            return 0;
        }

        String commandName = args[0];
        if ("help".equals(commandName) || "--help".equals(commandName) || "-h".equals(commandName)) {
            if (args.length > 1) {
                showCommandHelp(args[1]);
            } else {
                commandRegistry.printHelp();
            }
            return 0;
        }

        Command command = commandRegistry.getCommand(commandName);
        if (command == null) {
            System.err.println("❌ 未知命令: " + commandName);
            System.err.println("💡 使用 'help' 查看可用命令列表");
            suggestSimilarCommands(commandName);
            return 1;
        }

        try {
            command.execute(Arrays.copyOfRange(args, 1, args.length));
            return 0;
        } catch (CommandException e) {
            System.err.println("❌ " + e.getMessage());
            log.debug("命令执行失败", e);
            return 1;
        } catch (RuntimeException e) {
            System.err.println("❌ 系统错误: " + e.getMessage());
            log.error("命令执行异常", e);
            return 1;
        }
    }

    private void printAvailableCommands() {
        System.out.println("=====================================");
        System.out.println("🚀 外汇策略参数优化器 v1.0");
        System.out.println("=====================================");
        System.out.println("💡 可用命令:");
        commandRegistry.getAllCommands().stream()
                .sorted(Comparator.comparing(Command::getName))
                .forEach(cmd -> System.out.printf("  %-12s %s%n", cmd.getName(), cmd.getDescription()));
        System.out.println();
        System.out.println("🔗 获取帮助: java -jar forex-optimizer.jar help [command]");
    }

    private void showCommandHelp(String commandName) {
        Command command = commandRegistry.getCommand(commandName);
        if (command == null) {
            System.err.println("❌ 未知命令: " + commandName);
            suggestSimilarCommands(commandName);
            return;
        }
        command.printUsage();
    }

    private void suggestSimilarCommands(String input) {
        List<String> suggestions = commandRegistry.findMatchingCommands(input.substring(0, Math.min(2, input.length())));
        if (!suggestions.isEmpty()) {
            System.out.println();
            System.out.println("🤔 您是否想要执行以下命令之一？");
            suggestions.stream().limit(3).forEach(cmd -> System.out.println("  " + cmd));
        }
    }
}
