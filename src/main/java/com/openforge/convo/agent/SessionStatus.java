package com.openforge.convo.agent;

/** How a session ended. */
public enum SessionStatus {
    COMPLETED,
    ERROR,
    ABORTED
}
