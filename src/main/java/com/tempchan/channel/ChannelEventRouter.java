package com.tempchan.channel;

import com.tempchan.command.CommandFacade;
import com.tempchan.error.PlatformException;
import com.tempchan.lifecycle.LifecycleEngine;
import com.tempchan.observability.TempChannelMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Feeds platform events into the lifecycle: messages count as activity,
 * shortcut reactions extend, and channels deleted by hand are forgotten.
 */
@Service
public class ChannelEventRouter {

    private static final Logger log = LoggerFactory.getLogger(ChannelEventRouter.class);

    private final ChannelPlatform platform;
    private final LifecycleEngine engine;
    private final CommandFacade commandFacade;
    private final TempChannelMetrics metrics;
    private final Disposable.Composite subscriptions = Disposables.composite();

    public ChannelEventRouter(ChannelPlatform platform,
                              LifecycleEngine engine,
                              CommandFacade commandFacade,
                              TempChannelMetrics metrics) {
        this.platform = platform;
        this.engine = engine;
        this.commandFacade = commandFacade;
        this.metrics = metrics;
    }

    @PostConstruct
    public void startRouting() {
        subscriptions.add(route("activity", platform.activityEvents(), ActivityEvent::channelId,
                event -> {
                    engine.recordActivity(event.channelId(), event.receivedAt());
                    return Mono.empty();
                }));
        subscriptions.add(route("reaction", platform.reactionEvents(), ReactionEvent::channelId,
                this::handleReaction));
        subscriptions.add(route("removal", platform.removedChannels(), ChannelRemovedEvent::channelId,
                event -> engine.onChannelRemoved(event.channelId())));
        log.info("Event routing started for platform={}", platform.platformType());
    }

    @PreDestroy
    public void stopRouting() {
        subscriptions.dispose();
    }

    private <E> Disposable route(String kind, Flux<E> events, Function<E, String> channelOf,
                                 Function<E, Mono<Void>> handler) {
        return events
                .publishOn(Schedulers.boundedElastic())
                .flatMap(event -> dispatch(channelOf.apply(event), () -> handler.apply(event))
                        .onErrorResume(e -> {
                            log.error("Error handling {} event for channel={}", kind, channelOf.apply(event), e);
                            return Mono.empty();
                        }))
                .retryWhen(Retry.backoff(Long.MAX_VALUE, Duration.ofSeconds(5))
                        .maxBackoff(Duration.ofMinutes(1)))
                .subscribe(
                        v -> { },
                        error -> log.error("Fatal error in {} routing for platform={}",
                                kind, platform.platformType(), error));
    }

    private Mono<Void> dispatch(String channelId, Supplier<Mono<Void>> handler) {
        MDC.put("channelId", channelId);
        try {
            return handler.get();
        } catch (RuntimeException e) {
            return Mono.error(e);
        } finally {
            MDC.remove("channelId");
        }
    }

    private Mono<Void> handleReaction(ReactionEvent event) {
        return commandFacade.handleReaction(event)
                .flatMap(reply -> deliverWithRetry(new OutboundMessage(event.channelId(), reply.message())));
    }

    private Mono<Void> deliverWithRetry(OutboundMessage msg) {
        return platform.sendMessage(msg)
                .retryWhen(Retry.backoff(3, Duration.ofSeconds(1))
                        .maxBackoff(Duration.ofSeconds(10))
                        .filter(PlatformException::isTransientFailure))
                .doOnError(e -> {
                    log.error("Reply delivery failed after retries for channel={}: {}",
                            msg.channelId(), e.getMessage());
                    metrics.recordPlatformFailure("sendMessage");
                })
                .onErrorResume(e -> Mono.empty())
                .then();
    }
}
