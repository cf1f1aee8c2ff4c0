package com.tempchan.channel;

import java.time.Instant;

/**
 * A channel disappeared on the platform without going through the engine.
 */
public record ChannelRemovedEvent(
        String channelId,
        Instant receivedAt
) {}
