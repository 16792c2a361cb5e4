package com.openforge.convo.agent.event;

/**
 * Classifies every event a session emits.
 *
 * Flow: TURN_STARTED → TEXT_DELTA* → (TOOL_EXECUTING* → TOOL_RESULT* → TURN_STARTED …)
 *       → exactly one of COMPLETED / ERROR / ABORTED.
 */
public enum EventType {

    /** A new model round-trip is starting. */
    TURN_STARTED,

    /** A piece of model text, in arrival order. */
    TEXT_DELTA,

    /** Informational message for the user, e.g. a model downgrade. */
    NOTICE,

    /** The session is about to invoke a tool. payload = ToolCallRequest. */
    TOOL_EXECUTING,

    /** A tool has returned. payload = ToolCallResult. */
    TOOL_RESULT,

    /** Final answer; session complete. */
    COMPLETED,

    /** Unrecoverable error. content = user-facing message. */
    ERROR,

    /** The session was cancelled. */
    ABORTED;

    public boolean isTerminal() {
        return this == COMPLETED || this == ERROR || this == ABORTED;
    }
}
