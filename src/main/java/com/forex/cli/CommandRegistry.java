package com.forex.cli;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 命令注册器
 * 按名称和别名查找命令
 */
@Slf4j
@Component
public class CommandRegistry {

    private final Map<String, Command> commands = new ConcurrentHashMap<>();
    private final Map<String, Command> aliases = new ConcurrentHashMap<>();

    public CommandRegistry(List<Command> commandList) {
        if (commandList != null) {
            commandList.forEach(this::register);
        }
        log.debug("已注册 {} 个命令，{} 个别名", commands.size(), aliases.size());
    }

    public void register(Command command) {
        String name = command.getName();
        if (name == null || name.isBlank()) {
            log.warn("命令名称为空，忽略: {}", command.getClass().getName());
            return;
        }
        if (commands.containsKey(name)) {
            log.warn("命令名称冲突，覆盖原有命令: {}", name);
        }
        commands.put(name, command);

        for (String alias : command.getAliases()) {
            if (alias != null && !alias.isBlank()) {
                if (aliases.containsKey(alias)) {
                    log.warn("别名冲突，覆盖原有别名: {} -> {}", alias, name);
                }
                aliases.put(alias, command);
            }
        }
    }

    /**
     * 根据名称或别名获取命令，不存在时返回null
     */
    public Command getCommand(String name) {
        if (name == null) {
            return null;
        }
        Command command = commands.get(name);
        return command != null ? command : aliases.get(name);
    }

    public Collection<Command> getAllCommands() {
        return new ArrayList<>(commands.values());
    }

    /**
     * 按前缀查找命令名和别名（忽略大小写）
     */
    public List<String> findMatchingCommands(String prefix) {
        if (prefix == null || prefix.isBlank()) {
            return new ArrayList<>(commands.keySet());
        }
        String lowerPrefix = prefix.toLowerCase();
        List<String> matches = new ArrayList<>();
        for (String name : commands.keySet()) {
            if (name.toLowerCase().startsWith(lowerPrefix)) {
                matches.add(name);
            }
        }
        for (String alias : aliases.keySet()) {
            if (alias.toLowerCase().startsWith(lowerPrefix) && !matches.contains(alias)) {
                matches.add(alias);
            }
        }
        Collections.sort(matches);
        return matches;
    }

    public void printHelp() {
        System.out.println("外汇策略参数优化器 CLI v1.0");
        System.out.println("=====================================");
        System.out.println();
        System.out.println("可用命令:");

        List<Command> sortedCommands = new ArrayList<>(commands.values());
        sortedCommands.sort(Comparator.comparing(Command::getName));
        for (Command command : sortedCommands) {
            String aliasText = command.getAliases().isEmpty()
                    ? "" : " (" + String.join(", ", command.getAliases()) + ")";
            System.out.printf("  %-15s %s%s%n", command.getName(), command.getDescription(), aliasText);
        }

        System.out.println();
        System.out.println("使用示例:");
        System.out.println("  java -jar forex-optimizer.jar prepare --file EURUSD.csv --symbol EURUSD");
        System.out.println("  java -jar forex-optimizer.jar optimize --symbol EURUSD --top 10");
        System.out.println("  java -jar forex-optimizer.jar help <command>");
    }
}
