package com.tempchan.lifecycle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drives {@link LifecycleEngine#tick()} on a fixed delay. A tick that is still
 * running (slow warnings or renames, each bounded by the platform call timeout)
 * makes the next trigger a no-op. Deletions never hold a tick open.
 */
@Component
public class LifecycleScheduler {

    private static final Logger log = LoggerFactory.getLogger(LifecycleScheduler.class);

    private final LifecycleEngine engine;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public LifecycleScheduler(LifecycleEngine engine) {
        this.engine = engine;
    }

    @Scheduled(fixedDelayString = "${tempchan.lifecycle.check-interval-ms:60000}",
               initialDelayString = "${tempchan.lifecycle.check-interval-ms:60000}")
    public void runTick() {
        if (!running.compareAndSet(false, true)) {
            log.debug("Previous lifecycle tick still running, skipping");
            return;
        }
        long started = System.nanoTime();
        engine.tick()
                .doFinally(signal -> {
                    running.set(false);
                    log.debug("Lifecycle tick finished ({}) in {} ms, tracking {} channels", signal,
                            Duration.ofNanos(System.nanoTime() - started).toMillis(), engine.trackedCount());
                })
                .subscribe(
                        v -> { },
                        error -> log.error("Lifecycle tick failed", error));
    }

    boolean isRunning() {
        return running.get();
    }
}
