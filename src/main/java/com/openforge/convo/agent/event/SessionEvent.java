package com.openforge.convo.agent.event;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.openforge.convo.llm.model.ToolCallRequest;
import com.openforge.convo.llm.model.ToolCallResult;

/**
 * The single event envelope handed to a {@link SessionEventListener}.
 *
 * Fields:
 *   sessionId  the session this event belongs to
 *   type       discriminator; tells the listener how to render the event
 *   content    free-form text (delta for TEXT_DELTA, answer for COMPLETED,
 *              message for NOTICE / ERROR / ABORTED)
 *   payload    structured object for tool events, null otherwise
 *   turn       index of the turn that produced this event (0-based);
 *              terminal events carry the number of turns run instead
 *   timestamp  epoch millis
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SessionEvent(
        String    sessionId,
        EventType type,
        String    content,
        Object    payload,
        int       turn,
        long      timestamp
) {

    // ── Static factory helpers ───────────────────────────────────────────────

    public static SessionEvent turnStarted(String sessionId, int turn, String model) {
        return new SessionEvent(sessionId, EventType.TURN_STARTED, model, null, turn, now());
    }

    public static SessionEvent textDelta(String sessionId, String delta, int turn) {
        return new SessionEvent(sessionId, EventType.TEXT_DELTA, delta, null, turn, now());
    }

    public static SessionEvent notice(String sessionId, String message, int turn) {
        return new SessionEvent(sessionId, EventType.NOTICE, message, null, turn, now());
    }

    public static SessionEvent toolExecuting(String sessionId, ToolCallRequest call, int turn) {
        return new SessionEvent(sessionId, EventType.TOOL_EXECUTING, call.name(), call, turn, now());
    }

    public static SessionEvent toolResult(String sessionId, ToolCallResult result, int turn) {
        return new SessionEvent(sessionId, EventType.TOOL_RESULT, result.contentForModel(), result, turn, now());
    }

    public static SessionEvent completed(String sessionId, String answer, int turn) {
        return new SessionEvent(sessionId, EventType.COMPLETED, answer, null, turn, now());
    }

    public static SessionEvent error(String sessionId, String message, int turn) {
        return new SessionEvent(sessionId, EventType.ERROR, message, null, turn, now());
    }

    public static SessionEvent aborted(String sessionId, String reason, int turn) {
        return new SessionEvent(sessionId, EventType.ABORTED, reason, null, turn, now());
    }

    private static long now() {
        return System.currentTimeMillis();
    }
}
