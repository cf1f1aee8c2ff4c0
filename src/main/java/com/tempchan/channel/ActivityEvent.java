package com.tempchan.channel;

import java.time.Instant;

/**
 * A user posted in a channel. Only the fact and time of activity matter, not the content.
 */
public record ActivityEvent(
        String scopeId,
        String channelId,
        String userId,
        Instant receivedAt
) {}
