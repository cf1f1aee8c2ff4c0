package com.tempchan.lifecycle;

import com.tempchan.channel.ChannelPlatform;
import com.tempchan.channel.ChannelSpec;
import com.tempchan.channel.DeleteOutcome;
import com.tempchan.channel.OutboundMessage;
import com.tempchan.config.TempchanProperties;
import com.tempchan.error.AuthorizationException;
import com.tempchan.error.ChannelStateException;
import com.tempchan.error.PlatformException;
import com.tempchan.error.RateLimitException;
import com.tempchan.error.TempChannelException;
import com.tempchan.error.ValidationException;
import com.tempchan.observability.TempChannelMetrics;
import com.tempchan.permission.GrantDelta;
import com.tempchan.permission.PermissionPlanner;
import com.tempchan.security.CreationRateLimiter;
import com.tempchan.security.FeatureToggleService;
import com.tempchan.security.RbacService;
import com.tempchan.security.Requester;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.util.retry.Retry;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Owns the lifecycle of every temp channel: creation, the periodic tick that
 * renames, warns and expires, and the user/admin actions that extend, close
 * or change membership.
 *
 * <p>Every decision about a descriptor is taken while holding its lock, and
 * the lock is never held across a platform call. Whatever decides that a
 * channel must go calls {@link #beginDeletion}, which flips the descriptor to
 * {@link DescriptorState#PENDING_DELETION} exactly once; only the caller that
 * made that flip issues the platform delete.
 *
 * <p>Deletions run on their own subscription: the tick only starts them and
 * callers of {@link #close} merely observe them. Every platform call is
 * bounded by {@code tempchan.lifecycle.platform-call-timeout}.
 */
@Service
public class LifecycleEngine {

    private static final Logger log = LoggerFactory.getLogger(LifecycleEngine.class);

    private final DescriptorStore store;
    private final CreationRateLimiter rateLimiter;
    private final PermissionPlanner planner;
    private final ChannelPlatform platform;
    private final RbacService rbacService;
    private final FeatureToggleService featureToggle;
    private final TempChannelMetrics metrics;
    private final TempchanProperties.LifecycleProperties lifecycle;
    private final TempchanProperties.ChannelProperties channelProperties;
    private final Clock clock;

    public LifecycleEngine(DescriptorStore store,
                           CreationRateLimiter rateLimiter,
                           PermissionPlanner planner,
                           ChannelPlatform platform,
                           RbacService rbacService,
                           FeatureToggleService featureToggle,
                           TempChannelMetrics metrics,
                           TempchanProperties properties,
                           Clock clock) {
        this.store = store;
        this.rateLimiter = rateLimiter;
        this.planner = planner;
        this.platform = platform;
        this.rbacService = rbacService;
        this.featureToggle = featureToggle;
        this.metrics = metrics;
        this.lifecycle = properties.getLifecycle();
        this.channelProperties = properties.getChannel();
        this.clock = clock;
    }

    // --- Creation ---

    public Mono<ChannelSnapshot> create(Requester requester, String topic,
                                        Visibility visibility, DurationOption duration) {
        return Mono.defer(() -> {
            Objects.requireNonNull(topic, "topic");
            if (!featureToggle.isEnabled(requester.scopeId())) {
                throw new ChannelStateException("Temp channels are currently disabled by administrators.");
            }

            String displayTopic = CountdownFormatter.slug(topic);
            String name = CountdownFormatter.channelName(
                    channelProperties.getNamePrefix(), displayTopic, duration.duration());
            String category = channelProperties.getCategoryName();

            CreationRateLimiter.Reservation reservation;
            try {
                reservation = rateLimiter.tryReserve(requester.userId(), clock.instant());
            } catch (RateLimitException e) {
                metrics.recordRateLimited(e.reason().name());
                throw e;
            }

            return bounded(platform.categoryGrants(requester.scopeId(), category), "categoryGrants")
                    .defaultIfEmpty(List.of())
                    .map(defaults -> planner.planCreate(visibility, requester.userId(), defaults))
                    .flatMap(grants -> bounded(platform.createChannel(new ChannelSpec(
                            requester.scopeId(), category, name,
                            ChannelNotices.topicLine(duration, requester.displayName()), grants)),
                            "createChannel"))
                    .switchIfEmpty(Mono.error(() -> new PlatformException(
                            "createChannel", "Platform returned no channel id", false)))
                    .map(channelId -> register(channelId, requester, topic, displayTopic,
                            visibility, duration, name, reservation))
                    .onErrorMap(e -> !(e instanceof TempChannelException),
                            e -> asPlatformException("createChannel", e))
                    .doOnError(e -> {
                        reservation.release();
                        metrics.recordPlatformFailure("createChannel");
                        log.warn("Temp channel creation failed for user={}: {}",
                                requester.userId(), e.getMessage());
                    })
                    .doOnCancel(reservation::release)
                    .flatMap(this::sendWelcome);
        });
    }

    private ChannelDescriptor register(String channelId, Requester requester, String topic,
                                       String displayTopic, Visibility visibility,
                                       DurationOption duration, String name,
                                       CreationRateLimiter.Reservation reservation) {
        Instant now = clock.instant();
        ChannelDescriptor descriptor = new ChannelDescriptor(channelId, requester.scopeId(),
                requester.userId(), requester.displayName(), topic, displayTopic, visibility,
                duration, now, now.plus(duration.duration()));
        descriptor.rendered(name, now);
        refreshDeadline(descriptor);

        // the slot must be counted before anyone can find the descriptor and close it
        reservation.commit(now);
        try {
            store.register(descriptor);
        } catch (IllegalStateException e) {
            rateLimiter.releaseActive(requester.userId());
            throw e;
        }
        metrics.channelCreated(visibility.label());
        log.info("Temp channel created: id={} owner={} visibility={} duration={} expiresAt={}",
                channelId, requester.userId(), visibility, duration.label(), descriptor.expiresAt());
        return descriptor;
    }

    private Mono<ChannelSnapshot> sendWelcome(ChannelDescriptor d) {
        String text;
        ChannelSnapshot snapshot;
        d.lock();
        try {
            text = ChannelNotices.welcome(d, platform.mention(d.ownerId()), effectiveGrace(d));
            snapshot = d.snapshot();
        } finally {
            d.unlock();
        }
        return bounded(platform.sendMessage(new OutboundMessage(d.id(), text)), "sendMessage")
                .onErrorResume(e -> {
                    log.debug("Welcome message for channel={} not delivered: {}", d.id(), e.getMessage());
                    return Mono.empty();
                })
                .thenReturn(snapshot);
    }

    // --- Tick ---

    /**
     * One scheduling pass over all descriptors. Per descriptor, in order:
     * expire (duration wins over inactivity when both are due), warn once
     * per deadline, or refresh the countdown in the display name. Deletions
     * are started here but not awaited.
     */
    public Mono<Void> tick() {
        return Flux.fromIterable(store.all())
                .flatMap(d -> evaluate(d)
                        .onErrorResume(e -> {
                            log.error("Lifecycle evaluation failed for channel={}", d.id(), e);
                            return Mono.empty();
                        }))
                .then();
    }

    Mono<Void> evaluate(ChannelDescriptor d) {
        Instant now = clock.instant();
        TickDecision decision;
        MDC.put("channelId", d.id());
        d.lock();
        try {
            decision = decide(d, now);
        } finally {
            d.unlock();
            MDC.remove("channelId");
        }

        if (decision.deleteReason() != null) {
            startDeletion(d, decision.deleteReason(), false);
            return Mono.empty();
        }
        if (!decision.notices().isEmpty()) {
            return Flux.fromIterable(decision.notices())
                    .concatMap(notice -> bounded(platform.sendMessage(notice), "sendMessage")
                            .doOnNext(messageId -> {
                                if (!notice.reactions().isEmpty()) rememberWarning(d, messageId);
                            })
                            .onErrorResume(e -> {
                                metrics.recordPlatformFailure("sendMessage");
                                log.warn("Failed to post warning in channel={}: {}", d.id(), e.getMessage());
                                return Mono.empty();
                            }))
                    .then();
        }
        return renameQuietly(d, decision.rename());
    }

    private TickDecision decide(ChannelDescriptor d, Instant now) {
        if (!d.isActive()) return TickDecision.NONE;

        if (!now.isBefore(d.expiresAt())) {
            beginDeletion(d, DeletionReason.EXPIRED);
            return TickDecision.delete(DeletionReason.EXPIRED);
        }
        if (!now.isBefore(d.inactivityDeadline())) {
            beginDeletion(d, DeletionReason.INACTIVE);
            return TickDecision.delete(DeletionReason.INACTIVE);
        }

        List<OutboundMessage> notices = new ArrayList<>();
        if (!d.isExpiryWarned()
                && !now.isBefore(d.expiresAt().minus(lifecycle.getWarningWindow()))) {
            d.markExpiryWarned();
            notices.add(new OutboundMessage(d.id(),
                    ChannelNotices.expiryWarning(Duration.between(now, d.expiresAt())),
                    ExtensionShortcut.emojis()));
        }
        if (!d.isInactivityWarned()
                && d.inactivityDeadline().isBefore(d.expiresAt())
                && !now.isBefore(d.inactivityDeadline().minus(inactivityWarningWindow(d)))) {
            d.markInactivityWarned();
            notices.add(new OutboundMessage(d.id(),
                    ChannelNotices.inactivityWarning(Duration.between(now, d.inactivityDeadline()))));
        }
        if (!notices.isEmpty()) {
            return new TickDecision(null, notices, null);
        }
        return new TickDecision(null, List.of(), prepareRename(d, now, false));
    }

    private void rememberWarning(ChannelDescriptor d, String messageId) {
        d.lock();
        try {
            d.setWarningMessageId(messageId);
        } finally {
            d.unlock();
        }
    }

    // --- Activity ---

    /** Ignored for unknown or closing channels. */
    public void recordActivity(String channelId, Instant at) {
        store.get(channelId).ifPresent(d -> {
            d.lock();
            try {
                if (!d.isActive()) return;
                d.touch(at);
                refreshDeadline(d);
            } finally {
                d.unlock();
            }
        });
    }

    // --- Extension ---

    public Mono<ExtensionResult> extend(Requester requester, String channelId, Duration delta) {
        return Mono.defer(() -> {
            if (delta == null || delta.isZero() || delta.isNegative()) {
                throw new ValidationException("Extension must be a positive duration");
            }
            ChannelDescriptor d = require(channelId);
            ExtensionResult result;
            String rename;
            d.lock();
            try {
                ensureActive(d);
                if (!rbacService.isOwnerOrAdmin(requester, d.ownerId())) {
                    throw new AuthorizationException("Only the channel creator can extend the channel!");
                }
                Instant now = clock.instant();
                Instant cap = d.createdAt().plus(lifecycle.getMaxLifetime());
                Instant previous = d.expiresAt();
                Instant target = previous.plus(delta);
                Instant next = target.isAfter(cap) ? cap : target;
                if (next.isBefore(previous)) next = previous;

                d.extendTo(next);
                refreshDeadline(d);
                rename = prepareRename(d, now, true);
                result = new ExtensionResult(delta, Duration.between(previous, next), next, target.isAfter(cap));
            } finally {
                d.unlock();
            }

            metrics.recordExtension(result.capped());
            log.info("Temp channel extended: id={} by={} requested={} applied={} expiresAt={}",
                    channelId, requester.userId(), delta, result.applied(), result.newExpiresAt());
            return renameQuietly(d, rename).thenReturn(result);
        });
    }

    // --- Closure ---

    /**
     * Owner or admin. Completes once the platform delete has been settled;
     * cancelling the returned Mono does not stop the delete.
     */
    public Mono<DeletionReason> close(Requester requester, String channelId) {
        return closeChannel(requester, channelId, false);
    }

    /** Admin override: closes regardless of ownership. */
    public Mono<DeletionReason> forceClose(Requester requester, String channelId) {
        return closeChannel(requester, channelId, true);
    }

    private Mono<DeletionReason> closeChannel(Requester requester, String channelId, boolean force) {
        return Mono.defer(() -> {
            boolean admin = rbacService.isAdmin(requester);
            if (force && !admin) {
                throw new AuthorizationException("Only administrators can force-close channels!");
            }
            ChannelDescriptor d = require(channelId);
            DeletionReason reason;
            d.lock();
            try {
                ensureActive(d);
                boolean owner = d.ownerId().equals(requester.userId());
                if (!owner && !admin) {
                    throw new AuthorizationException(
                            "Only the channel creator or administrators can close the channel!");
                }
                reason = owner && !force ? DeletionReason.CLOSED_BY_OWNER : DeletionReason.CLOSED_BY_ADMIN;
                beginDeletion(d, reason);
            } finally {
                d.unlock();
            }
            return startDeletion(d, reason, false).thenReturn(reason);
        });
    }

    /** The platform reports the channel gone; drop it without another delete call. */
    public Mono<Void> onChannelRemoved(String channelId) {
        return Mono.defer(() -> {
            ChannelDescriptor d = store.get(channelId).orElse(null);
            if (d == null) return Mono.empty();
            d.lock();
            try {
                if (!d.isActive()) return Mono.empty();
                beginDeletion(d, DeletionReason.REMOVED_EXTERNALLY);
            } finally {
                d.unlock();
            }
            return startDeletion(d, DeletionReason.REMOVED_EXTERNALLY, true);
        });
    }

    // --- Membership ---

    public Mono<MembershipChange> invite(Requester requester, String channelId, String targetId) {
        return Mono.defer(() -> {
            ChannelDescriptor d = require(channelId);
            GrantDelta delta;
            d.lock();
            try {
                checkMembershipChange(d, requester, "invite users",
                        "This is a public channel - anyone can join!");
                delta = planner.planInvite(d, targetId);
                if (delta.isEmpty()) return Mono.just(MembershipChange.UNCHANGED);
                d.addInvited(targetId);
                d.touch(clock.instant());
                refreshDeadline(d);
                d.setMembershipChangeInFlight(true);
            } finally {
                d.unlock();
            }
            return applyMembership(d, delta, "invite", targetId, () -> d.removeInvited(targetId));
        });
    }

    public Mono<MembershipChange> kick(Requester requester, String channelId, String targetId) {
        return Mono.defer(() -> {
            ChannelDescriptor d = require(channelId);
            GrantDelta delta;
            d.lock();
            try {
                checkMembershipChange(d, requester, "kick users",
                        "You can only kick users from private channels!");
                if (d.ownerId().equals(targetId)) {
                    throw new ValidationException(
                            "The channel creator can't be kicked. Close the channel instead.");
                }
                delta = planner.planKick(d, targetId);
                if (delta.isEmpty()) return Mono.just(MembershipChange.UNCHANGED);
                d.removeInvited(targetId);
                d.touch(clock.instant());
                refreshDeadline(d);
                d.setMembershipChangeInFlight(true);
            } finally {
                d.unlock();
            }
            return applyMembership(d, delta, "kick", targetId, () -> d.addInvited(targetId));
        });
    }

    private void checkMembershipChange(ChannelDescriptor d, Requester requester,
                                       String action, String publicChannelMessage) {
        ensureActive(d);
        if (!rbacService.isOwnerOrAdmin(requester, d.ownerId())) {
            throw new AuthorizationException("Only the channel creator can " + action + "!");
        }
        if (d.visibility() != Visibility.PRIVATE) {
            throw new ValidationException(publicChannelMessage);
        }
        if (d.isMembershipChangeInFlight()) {
            throw new ChannelStateException("Another invite or kick is in progress, try again in a moment.");
        }
    }

    private Mono<MembershipChange> applyMembership(ChannelDescriptor d, GrantDelta delta, String action,
                                                   String targetId, Runnable revert) {
        return bounded(platform.applyGrants(d.id(), delta), "applyGrants")
                .doOnSuccess(v -> log.info("Temp channel {}: id={} user={}", action, d.id(), targetId))
                .onErrorResume(e -> {
                    metrics.recordPlatformFailure("applyGrants");
                    d.lock();
                    try {
                        if (d.isActive()) revert.run();
                    } finally {
                        d.unlock();
                    }
                    return Mono.error(asPlatformException("applyGrants", e));
                })
                .doFinally(signal -> {
                    d.lock();
                    try {
                        d.setMembershipChangeInFlight(false);
                    } finally {
                        d.unlock();
                    }
                })
                .thenReturn(MembershipChange.APPLIED);
    }

    // --- Queries ---

    public Optional<ChannelSnapshot> find(String channelId) {
        return store.get(channelId).map(this::snapshotOf);
    }

    /** Active channels owned by {@code userId}, oldest first. */
    public List<ChannelSnapshot> listOwnedBy(String userId) {
        return store.ownedBy(userId).stream()
                .map(this::snapshotOf)
                .filter(s -> s.state() == DescriptorState.ACTIVE)
                .toList();
    }

    /** Descriptors in the store, including those still being deleted. */
    public int trackedCount() {
        return store.size();
    }

    public long activeCount() {
        return store.all().stream().map(this::snapshotOf)
                .filter(s -> s.state() == DescriptorState.ACTIVE)
                .count();
    }

    private ChannelSnapshot snapshotOf(ChannelDescriptor d) {
        d.lock();
        try {
            return d.snapshot();
        } finally {
            d.unlock();
        }
    }

    // --- Deletion ---

    /** Must be called with the descriptor lock held and the descriptor ACTIVE. */
    private void beginDeletion(ChannelDescriptor d, DeletionReason reason) {
        d.markPendingDeletion(reason);
        rateLimiter.releaseActive(d.ownerId());
        log.info("Temp channel closing: id={} owner={} reason={}", d.id(), d.ownerId(), reason);
    }

    /**
     * Subscribes the deletion pipeline independently of whoever triggered it.
     * The returned Mono completes once the descriptor has left the store.
     */
    private Mono<Void> startDeletion(ChannelDescriptor d, DeletionReason reason, boolean alreadyGone) {
        Sinks.Empty<Void> settled = Sinks.empty();
        deletion(d, reason, alreadyGone)
                .doFinally(signal -> settled.tryEmitEmpty())
                .subscribe(
                        v -> { },
                        error -> log.error("Deletion of channel={} ended unexpectedly", d.id(), error));
        return settled.asMono();
    }

    private Mono<Void> deletion(ChannelDescriptor d, DeletionReason reason, boolean alreadyGone) {
        if (alreadyGone) {
            return Mono.fromRunnable(() -> finish(d, reason, DeleteOutcome.NOT_FOUND));
        }

        Mono<Void> farewell = bounded(platform.sendMessage(new OutboundMessage(d.id(), reason.farewell())),
                        "sendMessage")
                .onErrorResume(e -> {
                    log.debug("Farewell for channel={} not delivered: {}", d.id(), e.getMessage());
                    return Mono.empty();
                })
                .then(farewellDelay());

        Mono<DeleteOutcome> delete = Mono.defer(() -> bounded(platform.deleteChannel(d.id(), reason.farewell()),
                        "deleteChannel"))
                .retryWhen(Retry.backoff(lifecycle.getDeleteMaxRetries(), lifecycle.getDeleteRetryBackoff())
                        .filter(PlatformException::isTransientFailure)
                        .doBeforeRetry(signal -> log.warn("Retrying delete of channel={} (retry {}): {}",
                                d.id(), signal.totalRetries() + 1, signal.failure().getMessage())))
                .defaultIfEmpty(DeleteOutcome.DELETED);

        return farewell.then(delete)
                .doOnNext(outcome -> finish(d, reason, outcome))
                .onErrorResume(e -> {
                    metrics.recordPlatformFailure("deleteChannel");
                    log.error("Deleting channel={} failed, dropping local state anyway; "
                            + "the platform channel may be left behind: {}", d.id(), e.getMessage());
                    finish(d, reason, null);
                    return Mono.empty();
                })
                .then();
    }

    private Mono<Void> farewellDelay() {
        Duration delay = lifecycle.getFarewellDelay();
        return delay == null || delay.isZero() ? Mono.empty() : Mono.delay(delay).then();
    }

    private void finish(ChannelDescriptor d, DeletionReason reason, DeleteOutcome outcome) {
        if (store.remove(d)) {
            metrics.channelRemoved(reason.name());
            log.info("Temp channel removed: id={} reason={} outcome={}",
                    d.id(), reason, outcome != null ? outcome : "ABANDONED");
        }
    }

    // --- Display ---

    /**
     * Returns the new display name if a rename is due, recording it as rendered.
     * Must be called with the descriptor lock held.
     */
    private String prepareRename(ChannelDescriptor d, Instant now, boolean force) {
        String name = CountdownFormatter.channelName(channelProperties.getNamePrefix(),
                d.displayTopic(), Duration.between(now, d.expiresAt()));
        if (name.equals(d.lastRenderedName())) return null;
        if (!force && d.lastRenamedAt() != null
                && Duration.between(d.lastRenamedAt(), now).compareTo(lifecycle.getDisplayRefreshInterval()) < 0) {
            return null;
        }
        d.rendered(name, now);
        return name;
    }

    private Mono<Void> renameQuietly(ChannelDescriptor d, String name) {
        if (name == null) return Mono.empty();
        return bounded(platform.renameChannel(d.id(), name), "renameChannel")
                .doOnSuccess(v -> log.debug("Renamed channel={} to {}", d.id(), name))
                .onErrorResume(e -> {
                    metrics.recordPlatformFailure("renameChannel");
                    log.warn("Failed to rename channel={} to {}: {}", d.id(), name, e.getMessage());
                    d.lock();
                    try {
                        // forget the name so the next refresh retries it
                        if (name.equals(d.lastRenderedName())) d.rendered(null, d.lastRenamedAt());
                    } finally {
                        d.unlock();
                    }
                    return Mono.empty();
                });
    }

    // --- Timing policy ---

    /**
     * Inactivity grace for a descriptor. In adaptive mode a channel may sit idle
     * for at most half its lifetime, but never less than the configured minimum
     * (or the whole lifetime, if shorter).
     */
    Duration effectiveGrace(ChannelDescriptor d) {
        Duration grace = lifecycle.getInactivityGracePeriod();
        if (!lifecycle.isAdaptiveInactivity()) return grace;

        Duration lifetime = Duration.between(d.createdAt(), d.expiresAt());
        Duration half = lifetime.dividedBy(2);
        Duration adaptive = half.compareTo(grace) < 0 ? half : grace;
        Duration floor = lifecycle.getMinInactivityGrace().compareTo(lifetime) < 0
                ? lifecycle.getMinInactivityGrace() : lifetime;
        return adaptive.compareTo(floor) < 0 ? floor : adaptive;
    }

    private void refreshDeadline(ChannelDescriptor d) {
        d.setInactivityDeadline(d.lastActivityAt().plus(effectiveGrace(d)));
    }

    /** Warn once half the grace has passed idle (at least a minute in), or within the warning window. */
    private Duration inactivityWarningWindow(ChannelDescriptor d) {
        Duration grace = effectiveGrace(d);
        Duration warnAfter = grace.dividedBy(2);
        if (warnAfter.compareTo(Duration.ofMinutes(1)) < 0) warnAfter = Duration.ofMinutes(1);
        Duration window = grace.minus(warnAfter);
        if (window.isNegative()) return Duration.ZERO;
        return window.compareTo(lifecycle.getWarningWindow()) < 0 ? window : lifecycle.getWarningWindow();
    }

    // --- Helpers ---

    private ChannelDescriptor require(String channelId) {
        return store.get(channelId).orElseThrow(() -> ChannelStateException.notTracked(channelId));
    }

    private static void ensureActive(ChannelDescriptor d) {
        if (!d.isActive()) throw ChannelStateException.closing(d.id());
    }

    /** A platform call that outlives the timeout fails as a transient error. */
    private <T> Mono<T> bounded(Mono<T> call, String operation) {
        Duration timeout = lifecycle.getPlatformCallTimeout();
        return call.timeout(timeout, Mono.error(() -> new PlatformException(operation,
                "Platform " + operation + " timed out after " + timeout.toMillis() + " ms", true)));
    }

    private static PlatformException asPlatformException(String operation, Throwable e) {
        if (e instanceof PlatformException pe) return pe;
        return new PlatformException(operation, "Error during " + operation + ": " + e.getMessage(), false, e);
    }

    private record TickDecision(DeletionReason deleteReason, List<OutboundMessage> notices, String rename) {

        static final TickDecision NONE = new TickDecision(null, List.of(), null);

        static TickDecision delete(DeletionReason reason) {
            return new TickDecision(reason, List.of(), null);
        }
    }
}
