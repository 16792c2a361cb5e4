package com.openforge.convo.cli;

import com.openforge.convo.agent.CancellationToken;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Turns Ctrl-C into a cancelled session.
 *
 *   SIGINT ──► shutdown hook ──► cancel("interrupted") ──► wait for the session
 *              to end (at most the shutdown grace) ──► JVM exits with 130
 *
 * The session therefore still emits its ABORTED event before the process
 * goes away.  The hook is registered once, on the first guarded session.
 */
@Slf4j
@Component
public class InterruptHandler {

    static final String REASON = "interrupted";

    private final Consumer<Thread> hookRegistrar;

    private volatile Guard   active;
    private volatile boolean hookRegistered;

    public InterruptHandler() {
        this(hook -> Runtime.getRuntime().addShutdownHook(hook));
    }

    InterruptHandler(Consumer<Thread> hookRegistrar) {
        this.hookRegistrar = hookRegistrar;
    }

    /** Makes {@code cancellation} the target of the next interrupt until the guard is closed. */
    public Guard guard(CancellationToken cancellation, Duration grace) {
        registerHookOnce();
        Guard guard = new Guard(cancellation, grace);
        active = guard;
        return guard;
    }

    /** Cancels the guarded session, if any, and waits for it to finish. */
    void interruptActive() {
        Guard guard = active;
        if (guard == null) return;

        log.warn("[CLI] Interrupt received; cancelling the running session");
        guard.cancellation.cancel(REASON);
        try {
            if (!guard.finished.await(guard.grace.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("[CLI] Session did not stop within {} after interrupt", guard.grace);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void registerHookOnce() {
        if (hookRegistered) return;
        synchronized (this) {
            if (!hookRegistered) {
                hookRegistrar.accept(new Thread(this::interruptActive, "convo-interrupt-hook"));
                hookRegistered = true;
            }
        }
    }

    public final class Guard implements AutoCloseable {

        private final CancellationToken cancellation;
        private final Duration          grace;
        private final CountDownLatch    finished = new CountDownLatch(1);

        private Guard(CancellationToken cancellation, Duration grace) {
            this.cancellation = cancellation;
            this.grace        = grace;
        }

        @Override
        public void close() {
            finished.countDown();
            if (active == this) active = null;
        }
    }
}
