package com.tempchan.observability;

import com.tempchan.channel.ChannelPlatform;
import com.tempchan.lifecycle.LifecycleEngine;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Status;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class TempChannelMetricsTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final TempChannelMetrics metrics = new TempChannelMetrics(registry);

    @Test
    void activeGaugeFollowsCreateAndRemove() {
        metrics.channelCreated("public");
        metrics.channelCreated("private");
        metrics.channelRemoved("EXPIRED");

        assertEquals(1.0, registry.get("tempchan.channels.active").gauge().value());
        assertEquals(1.0, registry.counter("tempchan.channels.created", "visibility", "private").count());
        assertEquals(1.0, registry.counter("tempchan.channels.deleted", "reason", "EXPIRED").count());
    }

    @Test
    void extensionsAreTaggedByCap() {
        metrics.recordExtension(false);
        metrics.recordExtension(true);
        metrics.recordExtension(true);

        assertEquals(2.0, registry.counter("tempchan.channels.extended", "capped", "true").count());
    }

    @Test
    void healthReflectsPlatformConnection() {
        ChannelPlatform platform = mock(ChannelPlatform.class);
        LifecycleEngine engine = mock(LifecycleEngine.class);
        when(platform.platformType()).thenReturn("discord");
        when(engine.trackedCount()).thenReturn(4);
        PlatformHealthIndicator indicator = new PlatformHealthIndicator(platform, engine);

        when(platform.isConnected()).thenReturn(false);
        assertEquals(Status.DOWN, indicator.health().getStatus());

        when(platform.isConnected()).thenReturn(true);
        assertEquals(Status.UP, indicator.health().getStatus());
        assertEquals(4, indicator.health().getDetails().get("trackedChannels"));
    }
}
