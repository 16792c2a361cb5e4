package com.openforge.convo.agent;

/**
 * Result of {@link TurnOrchestrator#run}.
 *
 *   finalText  the model's last answer (COMPLETED only)
 *   message    user-facing error or abort reason
 *   error      the cause, for ERROR
 *   turns      number of turns taken
 *   model      the model active when the session ended
 */
public record SessionOutcome(
        String        sessionId,
        SessionStatus status,
        String        finalText,
        String        message,
        Throwable     error,
        int           turns,
        String        model
) {

    public boolean isCompleted() {
        return status == SessionStatus.COMPLETED;
    }
}
