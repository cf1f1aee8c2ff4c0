package com.tempchan.lifecycle;

import java.time.Duration;
import java.time.Instant;
import java.util.Set;

/**
 * Immutable copy of a descriptor, safe to hand out of the engine.
 */
public record ChannelSnapshot(
        String id,
        String scopeId,
        String ownerId,
        String topic,
        String displayTopic,
        Visibility visibility,
        DurationOption duration,
        Instant createdAt,
        Instant expiresAt,
        Instant lastActivityAt,
        Instant inactivityDeadline,
        Set<String> invitedUsers,
        DescriptorState state,
        DeletionReason deletionReason,
        boolean extended,
        String displayName
) {
    public Duration remaining(Instant now) {
        Duration left = Duration.between(now, expiresAt);
        return left.isNegative() ? Duration.ZERO : left;
    }
}
