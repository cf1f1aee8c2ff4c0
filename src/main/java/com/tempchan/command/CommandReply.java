package com.tempchan.command;

/**
 * Text shown to whoever issued a command. {@code success} lets the gateway
 * decide between a public and an ephemeral reply.
 */
public record CommandReply(boolean success, String message) {

    public static CommandReply ok(String message) {
        return new CommandReply(true, message);
    }

    public static CommandReply error(String message) {
        return new CommandReply(false, message);
    }
}
