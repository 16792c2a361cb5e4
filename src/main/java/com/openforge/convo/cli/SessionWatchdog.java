package com.openforge.convo.cli;

import com.openforge.convo.agent.CancellationToken;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.IntConsumer;

/**
 * Wall-clock guard for a non-interactive session.
 *
 *   timeout ──► cancel the session ──► grace ──► halt(124) if still running
 *
 * Closing the returned {@link Armed} handle disarms both steps.
 */
@Slf4j
@Component
public class SessionWatchdog implements DisposableBean {

    private final ScheduledExecutorService scheduler;
    private final IntConsumer              halter;

    public SessionWatchdog() {
        this(code -> Runtime.getRuntime().halt(code));
    }

    SessionWatchdog(IntConsumer halter) {
        this.halter    = halter;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "convo-watchdog");
            t.setDaemon(true);
            return t;
        });
    }

    public Armed arm(CancellationToken cancellation, Duration timeout, Duration grace) {
        Armed armed = new Armed();
        armed.timeoutTask = scheduler.schedule(() -> {
            log.warn("[Watchdog] Session exceeded {}; cancelling", timeout);
            armed.timedOut.set(true);
            cancellation.cancel("timed out after " + timeout.toSeconds() + "s");
            armed.haltTask = scheduler.schedule(() -> {
                if (armed.closed) return;
                log.error("[Watchdog] Session did not stop within {}; halting", grace);
                halter.accept(ExitCodes.TIMEOUT);
            }, grace.toMillis(), TimeUnit.MILLISECONDS);
        }, timeout.toMillis(), TimeUnit.MILLISECONDS);
        return armed;
    }

    @Override
    public void destroy() {
        scheduler.shutdownNow();
    }

    public static final class Armed implements AutoCloseable {

        private final    AtomicBoolean      timedOut = new AtomicBoolean();
        private volatile ScheduledFuture<?> timeoutTask;
        private volatile ScheduledFuture<?> haltTask;
        private volatile boolean            closed;

        public boolean timedOut() {
            return timedOut.get();
        }

        @Override
        public void close() {
            closed = true;
            if (timeoutTask != null) timeoutTask.cancel(false);
            if (haltTask != null) haltTask.cancel(false);
        }
    }
}
