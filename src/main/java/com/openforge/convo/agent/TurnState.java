package com.openforge.convo.agent;

/**
 * States of the turn loop.
 *
 *   AWAITING_MODEL ──► TOOL_CALLS_PENDING ──► EXECUTING_TOOLS ──┐
 *        ▲  │                                                   │
 *        │  ├──► DONE                                           │
 *        │  └──► ERROR                                          │
 *        └──────────────────────────────────────────────────────┘
 *
 *   any ──► ABORTED on cancellation
 */
public enum TurnState {
    AWAITING_MODEL,
    TOOL_CALLS_PENDING,
    EXECUTING_TOOLS,
    DONE,
    ERROR,
    ABORTED;

    public boolean isTerminal() {
        return this == DONE || this == ERROR || this == ABORTED;
    }
}
