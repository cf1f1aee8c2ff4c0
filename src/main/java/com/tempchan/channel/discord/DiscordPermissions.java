package com.tempchan.channel.discord;

import com.tempchan.permission.Permission;

import java.util.Collection;
import java.util.EnumSet;
import java.util.Set;

/**
 * Maps between the planner's permissions and JDA's. Discord permissions with
 * no planner counterpart are dropped when reading category overrides.
 */
final class DiscordPermissions {

    private DiscordPermissions() {}

    static net.dv8tion.jda.api.Permission toDiscord(Permission permission) {
        return switch (permission) {
            case VIEW -> net.dv8tion.jda.api.Permission.VIEW_CHANNEL;
            case SEND -> net.dv8tion.jda.api.Permission.MESSAGE_SEND;
            case MANAGE_MESSAGES -> net.dv8tion.jda.api.Permission.MESSAGE_MANAGE;
            case MANAGE_CHANNEL -> net.dv8tion.jda.api.Permission.MANAGE_CHANNEL;
        };
    }

    static EnumSet<net.dv8tion.jda.api.Permission> toDiscord(Collection<Permission> permissions) {
        EnumSet<net.dv8tion.jda.api.Permission> result = EnumSet.noneOf(net.dv8tion.jda.api.Permission.class);
        for (Permission p : permissions) {
            result.add(toDiscord(p));
        }
        return result;
    }

    static Set<Permission> fromDiscord(Collection<net.dv8tion.jda.api.Permission> permissions) {
        EnumSet<Permission> result = EnumSet.noneOf(Permission.class);
        for (net.dv8tion.jda.api.Permission p : permissions) {
            switch (p) {
                case VIEW_CHANNEL -> result.add(Permission.VIEW);
                case MESSAGE_SEND -> result.add(Permission.SEND);
                case MESSAGE_MANAGE -> result.add(Permission.MANAGE_MESSAGES);
                case MANAGE_CHANNEL -> result.add(Permission.MANAGE_CHANNEL);
                default -> { }
            }
        }
        return result;
    }
}
