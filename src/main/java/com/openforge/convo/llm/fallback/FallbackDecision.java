package com.openforge.convo.llm.fallback;

/**
 * Outcome of {@link FallbackPolicy#decide}.
 *
 *   SWITCH  - active model was downgraded; re-issue the same turn once
 *   FAIL    - surface the error and end the session
 */
public record FallbackDecision(
        Action        action,
        ErrorCategory category,
        String        fromModel,
        String        toModel,
        String        notice
) {

    public enum Action { SWITCH, FAIL }

    public static FallbackDecision switchModel(ErrorCategory category, String from, String to, String notice) {
        return new FallbackDecision(Action.SWITCH, category, from, to, notice);
    }

    public static FallbackDecision fail(ErrorCategory category) {
        return new FallbackDecision(Action.FAIL, category, null, null, null);
    }

    public boolean isSwitch() {
        return action == Action.SWITCH;
    }
}
