package com.tempchan.observability;

import com.tempchan.channel.ChannelPlatform;
import com.tempchan.lifecycle.LifecycleEngine;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

@Component
public class PlatformHealthIndicator implements HealthIndicator {

    private final ChannelPlatform platform;
    private final LifecycleEngine engine;

    public PlatformHealthIndicator(ChannelPlatform platform, LifecycleEngine engine) {
        this.platform = platform;
        this.engine = engine;
    }

    @Override
    public Health health() {
        boolean connected = platform.isConnected();
        Health.Builder builder = connected ? Health.up() : Health.down();
        return builder
                .withDetail("platform", platform.platformType())
                .withDetail("status", connected ? "connected" : "disconnected")
                .withDetail("trackedChannels", engine.trackedCount())
                .build();
    }
}
