package com.tempchan.security;

/**
 * Who issued a command or reaction. {@code platformAdmin} is resolved by the
 * gateway from the member's platform permissions.
 */
public record Requester(
        String userId,
        String displayName,
        String scopeId,
        boolean platformAdmin
) {
    public Requester(String userId, String scopeId) {
        this(userId, userId, scopeId, false);
    }
}
