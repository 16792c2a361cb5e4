package com.openforge.convo.agent;

import com.openforge.convo.llm.exception.AbortedException;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Single shared cancellation signal for one session.
 *
 * Observed at the start of every turn, on every stream chunk and by every
 * running tool.  Once cancelled it stays cancelled.
 */
public class CancellationToken {

    private final AtomicReference<String> reason = new AtomicReference<>();

    public void cancel(String why) {
        reason.compareAndSet(null, why == null ? "cancelled" : why);
    }

    public boolean isCancelled() {
        return reason.get() != null;
    }

    public String reason() {
        return reason.get();
    }

    public void throwIfCancelled() {
        String why = reason.get();
        if (why != null) throw new AbortedException(why);
    }
}
