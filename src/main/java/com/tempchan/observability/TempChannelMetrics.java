package com.tempchan.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Centralized Micrometer metrics for the temp channel lifecycle.
 */
@Component
public class TempChannelMetrics {

    private final MeterRegistry registry;
    private final AtomicLong activeChannels = new AtomicLong(0);

    public TempChannelMetrics(MeterRegistry registry) {
        this.registry = registry;
        registry.gauge("tempchan.channels.active", activeChannels);
    }

    // --- Lifecycle metrics ---

    public void channelCreated(String visibility) {
        activeChannels.incrementAndGet();
        Counter.builder("tempchan.channels.created")
                .tag("visibility", visibility)
                .register(registry).increment();
    }

    public void channelRemoved(String reason) {
        activeChannels.decrementAndGet();
        Counter.builder("tempchan.channels.deleted")
                .tag("reason", reason)
                .register(registry).increment();
    }

    public void recordExtension(boolean capped) {
        Counter.builder("tempchan.channels.extended")
                .tag("capped", String.valueOf(capped))
                .register(registry).increment();
    }

    // --- Gate metrics ---

    public void recordRateLimited(String reason) {
        Counter.builder("tempchan.rate_limit.rejected")
                .tag("reason", reason)
                .register(registry).increment();
    }

    // --- Platform metrics ---

    public void recordPlatformFailure(String operation) {
        Counter.builder("tempchan.platform.failures")
                .tag("operation", operation)
                .register(registry).increment();
    }

    public long activeChannels() {
        return activeChannels.get();
    }

    public MeterRegistry getRegistry() {
        return registry;
    }
}
