package com.openforge.convo.llm.fallback;

import com.openforge.convo.llm.exception.QuotaExceededException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Decides what a failed model call means for the session.
 *
 *   quota exceeded on the active model
 *     ├─ fallback configured, differs from active, not yet tried this turn
 *     │     → SWITCH: active model := fallback for the rest of the session,
 *     │       the same turn is re-issued once, a notice goes to the caller
 *     └─ otherwise → FAIL
 *   API error / transport error / anything else → FAIL (no automatic retry)
 */
@Slf4j
@Component
public class FallbackPolicy {

    public FallbackDecision decide(ModelSelection selection, Throwable error, boolean retriedThisTurn) {
        ErrorCategory category = ErrorClassifier.classify(error);
        if (!category.isQuota()) {
            return FallbackDecision.fail(category);
        }
        if (retriedThisTurn) {
            log.warn("[FallbackPolicy] Quota error again after switching to {}; giving up", selection.activeModel());
            return FallbackDecision.fail(category);
        }

        String current  = selection.activeModel();
        String fallback = selection.fallbackModel();
        if (fallback == null || fallback.isBlank() || fallback.equals(current)) {
            log.warn("[FallbackPolicy] Quota exceeded on {} and no distinct fallback model is available", current);
            return FallbackDecision.fail(category);
        }

        QuotaExceededException quota = findQuota(error);
        String notice = ApiErrorFormatter.downgradeNotice(quota, current, fallback);

        selection.switchActiveModel(fallback);
        log.warn("[FallbackPolicy] {} on {}; switched to {}", category, current, fallback);
        return FallbackDecision.switchModel(category, current, fallback, notice);
    }

    private static QuotaExceededException findQuota(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof QuotaExceededException quota) return quota;
        }
        throw new IllegalArgumentException("Not a quota error", error);
    }
}
