package com.tempchan.lifecycle;

import java.time.Duration;
import java.time.Instant;

/**
 * Outcome of an extension. {@code applied} is less than {@code requested} when
 * the maximum lifetime capped it.
 */
public record ExtensionResult(
        Duration requested,
        Duration applied,
        Instant newExpiresAt,
        boolean capped
) {}
