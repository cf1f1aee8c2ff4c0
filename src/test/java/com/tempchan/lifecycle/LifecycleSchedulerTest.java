package com.tempchan.lifecycle;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class LifecycleSchedulerTest {

    @Mock private LifecycleEngine engine;

    @Test
    void overlappingTicksAreSkipped() {
        Sinks.Empty<Void> pending = Sinks.empty();
        when(engine.tick()).thenReturn(pending.asMono());
        LifecycleScheduler scheduler = new LifecycleScheduler(engine);

        scheduler.runTick();
        scheduler.runTick();

        verify(engine, times(1)).tick();
        assertTrue(scheduler.isRunning());

        pending.tryEmitEmpty();
        assertFalse(scheduler.isRunning());

        when(engine.tick()).thenReturn(Mono.empty());
        scheduler.runTick();
        verify(engine, times(2)).tick();
    }

    @Test
    void failedTickReleasesTheGuard() {
        when(engine.tick()).thenReturn(Mono.error(new IllegalStateException("boom")));
        LifecycleScheduler scheduler = new LifecycleScheduler(engine);

        scheduler.runTick();

        assertFalse(scheduler.isRunning());
    }
}
