package com.tempchan.channel.discord;

import com.tempchan.error.PlatformException;
import com.tempchan.permission.Permission;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

class DiscordPermissionsTest {

    @Test
    void everyPlannerPermissionHasADiscordCounterpart() {
        assertEquals(EnumSet.of(net.dv8tion.jda.api.Permission.VIEW_CHANNEL,
                        net.dv8tion.jda.api.Permission.MESSAGE_SEND,
                        net.dv8tion.jda.api.Permission.MESSAGE_MANAGE,
                        net.dv8tion.jda.api.Permission.MANAGE_CHANNEL),
                DiscordPermissions.toDiscord(EnumSet.allOf(Permission.class)));
    }

    @Test
    void unmappedDiscordPermissionsAreDropped() {
        Set<Permission> mapped = DiscordPermissions.fromDiscord(List.of(
                net.dv8tion.jda.api.Permission.VIEW_CHANNEL,
                net.dv8tion.jda.api.Permission.BAN_MEMBERS,
                net.dv8tion.jda.api.Permission.MESSAGE_SEND));

        assertEquals(Set.of(Permission.VIEW, Permission.SEND), mapped);
    }

    @Test
    void ioFailuresAreTransient() {
        PlatformException e = DiscordChannelPlatform.toPlatformException("deleteChannel",
                new CompletionException(new IOException("connection reset")));

        assertTrue(e.isTransient());
        assertEquals("deleteChannel", e.operation());
    }

    @Test
    void otherFailuresArePermanent() {
        PlatformException e = DiscordChannelPlatform.toPlatformException("createChannel",
                new IllegalArgumentException("Name too long"));

        assertFalse(e.isTransient());
        assertEquals("Discord createChannel failed: Name too long", e.getMessage());
    }

    @Test
    void platformExceptionsPassThrough() {
        PlatformException original = new PlatformException("sendMessage", "not connected", false);

        assertSame(original, DiscordChannelPlatform.toPlatformException("sendMessage", original));
    }
}
