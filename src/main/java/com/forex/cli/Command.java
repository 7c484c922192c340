package com.forex.cli;

import java.util.List;

/**
 * CLI命令
 */
public interface Command {

    String getName();

    String getDescription();

    /**
     * 执行命令
     * @param args 去掉命令名后的参数
     * @throws CommandException 参数错误或执行失败
     */
    void execute(String[] args) throws CommandException;

    void printUsage();

    default List<String> getAliases() {
        return List.of();
    }

    default List<String> getExamples() {
        return List.of();
    }
}
