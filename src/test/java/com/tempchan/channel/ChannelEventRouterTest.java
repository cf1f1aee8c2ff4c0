package com.tempchan.channel;

import com.tempchan.command.CommandFacade;
import com.tempchan.command.CommandReply;
import com.tempchan.lifecycle.LifecycleEngine;
import com.tempchan.observability.TempChannelMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Instant;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ChannelEventRouterTest {

    private static final Instant NOW = Instant.parse("2026-01-01T12:00:00Z");

    @Mock private ChannelPlatform platform;
    @Mock private LifecycleEngine engine;
    @Mock private CommandFacade commandFacade;

    private final Sinks.Many<ActivityEvent> activity = Sinks.many().multicast().onBackpressureBuffer();
    private final Sinks.Many<ReactionEvent> reactions = Sinks.many().multicast().onBackpressureBuffer();
    private final Sinks.Many<ChannelRemovedEvent> removed = Sinks.many().multicast().onBackpressureBuffer();

    private ChannelEventRouter router;

    @BeforeEach
    void setUp() {
        when(platform.platformType()).thenReturn("fake");
        when(platform.activityEvents()).thenReturn(activity.asFlux());
        when(platform.reactionEvents()).thenReturn(reactions.asFlux());
        when(platform.removedChannels()).thenReturn(removed.asFlux());
        when(platform.sendMessage(any())).thenReturn(Mono.just("msg-1"));
        when(engine.onChannelRemoved(anyString())).thenReturn(Mono.empty());

        router = new ChannelEventRouter(platform, engine, commandFacade,
                new TempChannelMetrics(new SimpleMeterRegistry()));
        router.startRouting();
    }

    @AfterEach
    void tearDown() {
        router.stopRouting();
    }

    @Test
    void messagesAreRecordedAsActivity() {
        activity.tryEmitNext(new ActivityEvent("guild-1", "chan-1", "user-1", NOW));

        verify(engine, timeout(1000)).recordActivity("chan-1", NOW);
    }

    @Test
    void reactionRepliesArePostedInTheChannel() {
        ReactionEvent event = new ReactionEvent("guild-1", "chan-1", "m1", "owner-1", "Owner", "🕐", false, NOW);
        when(commandFacade.handleReaction(event))
                .thenReturn(Mono.just(CommandReply.ok("✅ Channel extended by 5 minutes!")));

        reactions.tryEmitNext(event);

        verify(platform, timeout(1000)).sendMessage(argThat(m ->
                m.channelId().equals("chan-1") && m.content().equals("✅ Channel extended by 5 minutes!")));
    }

    @Test
    void ignoredReactionsPostNothing() {
        ReactionEvent event = new ReactionEvent("guild-1", "chan-1", "m1", "user-2", "Someone", "👍", false, NOW);
        when(commandFacade.handleReaction(event)).thenReturn(Mono.empty());

        reactions.tryEmitNext(event);

        verify(commandFacade, timeout(1000)).handleReaction(event);
        verify(platform, after(200).never()).sendMessage(any());
    }

    @Test
    void removedChannelsAreForwarded() {
        removed.tryEmitNext(new ChannelRemovedEvent("chan-1", NOW));

        verify(engine, timeout(1000)).onChannelRemoved("chan-1");
    }

    @Test
    void failingHandlerDoesNotStopRouting() {
        doThrow(new IllegalStateException("boom")).when(engine).recordActivity(eq("chan-1"), any());

        activity.tryEmitNext(new ActivityEvent("guild-1", "chan-1", "user-1", NOW));
        activity.tryEmitNext(new ActivityEvent("guild-1", "chan-2", "user-1", NOW));

        verify(engine, timeout(1000)).recordActivity("chan-2", NOW);
    }
}
