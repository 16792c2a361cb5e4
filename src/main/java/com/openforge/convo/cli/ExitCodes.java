package com.openforge.convo.cli;

import com.openforge.convo.agent.SessionOutcome;

/** Process exit codes. */
public final class ExitCodes {

    public static final int COMPLETED = 0;
    public static final int ERROR     = 1;
    public static final int USAGE     = 2;
    public static final int TIMEOUT   = 124;
    public static final int ABORTED   = 130;

    private ExitCodes() {}

    public static int of(SessionOutcome outcome, boolean timedOut) {
        if (timedOut) return TIMEOUT;
        return switch (outcome.status()) {
            case COMPLETED -> COMPLETED;
            case ERROR     -> ERROR;
            case ABORTED   -> ABORTED;
        };
    }
}
