package com.respkv.command;

/**
 * Exception thrown when a request is well-formed on the wire but cannot be executed.
 * The message becomes the error reply; the connection stays open.
 */
public class CommandException extends RuntimeException {

    public CommandException(String message) {
        super(message);
    }

    public static CommandException wrongArity(String command) {
        return new CommandException("ERR wrong number of arguments for '" + command + "' command");
    }

    public static CommandException syntaxError() {
        return new CommandException("ERR syntax error");
    }

    public static CommandException notAnInteger() {
        return new CommandException("ERR value is not an integer or out of range");
    }

    public static CommandException invalidExpireTime(String command) {
        return new CommandException("ERR invalid expire time in '" + command + "' command");
    }
}
