package com.tempchan.security;

import com.tempchan.config.TempchanProperties;
import com.tempchan.error.RateLimitException;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Per-user gate on channel creation: a cap on concurrently active channels
 * and a cooldown between creations. Limits are configurable via
 * tempchan.rate-limit properties.
 *
 * <p>All updates to a user's record go through {@link ConcurrentHashMap#compute},
 * so two concurrent requests from one user never both take the last slot.
 */
@Component
public class CreationRateLimiter {

    private static final Logger log = LoggerFactory.getLogger(CreationRateLimiter.class);

    private final Map<String, RateLimitRecord> records = new ConcurrentHashMap<>();
    private final int maxChannelsPerUser;
    private final Duration cooldown;

    public CreationRateLimiter(TempchanProperties properties) {
        this.maxChannelsPerUser = properties.getRateLimit().getMaxChannelsPerUser();
        this.cooldown = properties.getRateLimit().getCreationCooldown();
    }

    /**
     * Takes a provisional slot for {@code userId}. The caller must either
     * {@link Reservation#commit commit} it once the channel exists or
     * {@link Reservation#release release} it.
     *
     * @throws RateLimitException when the user is at the channel cap or in cooldown;
     *                            nothing is changed in that case
     */
    public Reservation tryReserve(String userId, Instant now) {
        RateLimitException[] denial = new RateLimitException[1];
        records.compute(userId, (id, current) -> {
            RateLimitRecord record = current != null ? current : RateLimitRecord.EMPTY;
            if (record.activeCount() + record.pendingCount() >= maxChannelsPerUser) {
                denial[0] = new RateLimitException(RateLimitException.Reason.MAX_CHANNELS_REACHED,
                        "You already have " + maxChannelsPerUser + " temp channels! Close one first.");
                return current;
            }
            if (record.pendingCount() > 0 || inCooldown(record, now)) {
                denial[0] = new RateLimitException(RateLimitException.Reason.COOLDOWN_ACTIVE,
                        "You're on cooldown! Wait " + cooldown.toMinutes() + " minutes between channel creations.");
                return current;
            }
            return record.withPending(record.pendingCount() + 1);
        });
        if (denial[0] != null) {
            log.debug("Creation denied for user={} reason={}", userId, denial[0].reason());
            throw denial[0];
        }
        return new Reservation(userId);
    }

    /**
     * Gives back one active slot. Called exactly once per channel, when it
     * starts closing.
     */
    public void releaseActive(String userId) {
        records.computeIfPresent(userId, (id, record) -> {
            if (record.activeCount() == 0) {
                log.warn("Active channel count for user={} already zero, ignoring release", userId);
                return record;
            }
            return record.withActive(record.activeCount() - 1);
        });
    }

    public RateLimitRecord snapshot(String userId) {
        return records.getOrDefault(userId, RateLimitRecord.EMPTY);
    }

    @PreDestroy
    public void clear() {
        records.clear();
    }

    private boolean inCooldown(RateLimitRecord record, Instant now) {
        return record.lastCreationAt() != null
                && now.isBefore(record.lastCreationAt().plus(cooldown));
    }

    public record RateLimitRecord(int activeCount, int pendingCount, Instant lastCreationAt) {

        static final RateLimitRecord EMPTY = new RateLimitRecord(0, 0, null);

        RateLimitRecord withActive(int active) {
            return new RateLimitRecord(active, pendingCount, lastCreationAt);
        }

        RateLimitRecord withPending(int pending) {
            return new RateLimitRecord(activeCount, pending, lastCreationAt);
        }
    }

    /**
     * Provisional slot handed out by {@link #tryReserve}. Commit and release are
     * idempotent and only the first of them takes effect.
     */
    public final class Reservation {

        private final String userId;
        private final AtomicBoolean settled = new AtomicBoolean(false);

        private Reservation(String userId) {
            this.userId = userId;
        }

        public void commit(Instant createdAt) {
            if (!settled.compareAndSet(false, true)) return;
            records.compute(userId, (id, current) -> {
                RateLimitRecord record = current != null ? current : RateLimitRecord.EMPTY;
                return new RateLimitRecord(record.activeCount() + 1,
                        Math.max(0, record.pendingCount() - 1), createdAt);
            });
        }

        public void release() {
            if (!settled.compareAndSet(false, true)) return;
            records.computeIfPresent(userId, (id, record) ->
                    record.withPending(Math.max(0, record.pendingCount() - 1)));
        }

        public String userId() {
            return userId;
        }
    }
}
