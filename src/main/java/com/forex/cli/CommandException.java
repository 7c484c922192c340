package com.forex.cli;

/**
 * 命令执行异常，启动器捕获后以退出码1结束
 */
public class CommandException extends RuntimeException {

    private final String commandName;

    public CommandException(String commandName, String message) {
        super(String.format("命令 '%s' 执行失败: %s", commandName, message));
        this.commandName = commandName;
    }

    public CommandException(String commandName, String message, Throwable cause) {
        super(String.format("命令 '%s' 执行失败: %s", commandName, message), cause);
        this.commandName = commandName;
    }

    public String getCommandName() {
        return commandName;
    }

    public static CommandException invalidArgument(String commandName, String message) {
        return new CommandException(commandName, "参数错误: " + message);
    }

    public static CommandException missingRequired(String commandName, String paramName) {
        return new CommandException(commandName, "缺少必需参数: " + paramName);
    }

    public static CommandException executionFailed(String commandName, String message, Throwable cause) {
        return new CommandException(commandName, "执行失败: " + message, cause);
    }
}
