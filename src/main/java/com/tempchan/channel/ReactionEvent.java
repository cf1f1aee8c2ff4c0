package com.tempchan.channel;

import java.time.Instant;

public record ReactionEvent(
        String scopeId,
        String channelId,
        String messageId,
        String userId,
        String userName,
        String emoji,
        boolean platformAdmin,
        Instant receivedAt
) {}
