package com.openforge.convo.agent.event;

/**
 * Receives a session's events in emission order, on the session thread.
 * Must not block; a throwing listener is logged and ignored.
 */
@FunctionalInterface
public interface SessionEventListener {

    void onEvent(SessionEvent event);

    SessionEventListener NONE = event -> { };
}
