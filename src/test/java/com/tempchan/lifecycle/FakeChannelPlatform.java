package com.tempchan.lifecycle;

import com.tempchan.channel.ActivityEvent;
import com.tempchan.channel.ChannelPlatform;
import com.tempchan.channel.ChannelRemovedEvent;
import com.tempchan.channel.ChannelSpec;
import com.tempchan.channel.DeleteOutcome;
import com.tempchan.channel.OutboundMessage;
import com.tempchan.channel.ReactionEvent;
import com.tempchan.error.PlatformException;
import com.tempchan.permission.Grant;
import com.tempchan.permission.GrantDelta;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory platform that records every call. Failures are switched on per
 * operation by the test.
 */
class FakeChannelPlatform implements ChannelPlatform {

    final List<ChannelSpec> created = new CopyOnWriteArrayList<>();
    final List<String> deleted = new CopyOnWriteArrayList<>();
    final List<OutboundMessage> sent = new CopyOnWriteArrayList<>();
    final Map<String, String> names = new ConcurrentHashMap<>();
    final List<String> renames = new CopyOnWriteArrayList<>();
    final List<GrantDelta> appliedDeltas = new CopyOnWriteArrayList<>();
    final AtomicInteger deleteCalls = new AtomicInteger();

    volatile List<Grant> categoryDefaults = List.of();
    volatile PlatformException createFailure;
    volatile PlatformException applyFailure;
    volatile PlatformException deleteFailure;
    volatile DeleteOutcome deleteOutcome = DeleteOutcome.DELETED;
    volatile boolean deleteHangs;
    volatile Sinks.One<DeleteOutcome> deleteGate;
    final Set<String> hangingDeletes = ConcurrentHashMap.newKeySet();

    private final AtomicInteger channelSeq = new AtomicInteger();
    private final AtomicInteger messageSeq = new AtomicInteger();
    private final Sinks.Many<ActivityEvent> activity = Sinks.many().multicast().onBackpressureBuffer();
    private final Sinks.Many<ReactionEvent> reactions = Sinks.many().multicast().onBackpressureBuffer();
    private final Sinks.Many<ChannelRemovedEvent> removed = Sinks.many().multicast().onBackpressureBuffer();

    @Override
    public String platformType() { return "fake"; }

    @Override
    public Mono<List<Grant>> categoryGrants(String scopeId, String categoryName) {
        return Mono.just(categoryDefaults);
    }

    @Override
    public Mono<String> createChannel(ChannelSpec spec) {
        return Mono.defer(() -> {
            if (createFailure != null) return Mono.error(createFailure);
            created.add(spec);
            String id = "chan-" + channelSeq.incrementAndGet();
            names.put(id, spec.name());
            return Mono.just(id);
        });
    }

    @Override
    public Mono<DeleteOutcome> deleteChannel(String channelId, String reason) {
        return Mono.defer(() -> {
            deleteCalls.incrementAndGet();
            if (deleteHangs || hangingDeletes.contains(channelId)) return Mono.never();
            if (deleteGate != null) {
                return deleteGate.asMono().doOnNext(outcome -> {
                    deleted.add(channelId);
                    names.remove(channelId);
                });
            }
            if (deleteFailure != null) return Mono.error(deleteFailure);
            deleted.add(channelId);
            names.remove(channelId);
            return Mono.just(deleteOutcome);
        });
    }

    @Override
    public Mono<Void> renameChannel(String channelId, String newName) {
        return Mono.fromRunnable(() -> {
            renames.add(newName);
            names.put(channelId, newName);
        });
    }

    @Override
    public Mono<Void> applyGrants(String channelId, GrantDelta delta) {
        return Mono.defer(() -> {
            if (applyFailure != null) return Mono.error(applyFailure);
            appliedDeltas.add(delta);
            return Mono.empty();
        });
    }

    @Override
    public Mono<String> sendMessage(OutboundMessage message) {
        return Mono.fromSupplier(() -> {
            sent.add(message);
            return "msg-" + messageSeq.incrementAndGet();
        });
    }

    @Override
    public Flux<ActivityEvent> activityEvents() { return activity.asFlux(); }

    @Override
    public Flux<ReactionEvent> reactionEvents() { return reactions.asFlux(); }

    @Override
    public Flux<ChannelRemovedEvent> removedChannels() { return removed.asFlux(); }

    @Override
    public boolean isConnected() { return true; }

    List<String> sentTexts() {
        return sent.stream().map(OutboundMessage::content).toList();
    }
}
