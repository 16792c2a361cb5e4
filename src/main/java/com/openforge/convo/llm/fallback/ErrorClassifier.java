package com.openforge.convo.llm.fallback;

import com.openforge.convo.llm.exception.AbortedException;
import com.openforge.convo.llm.exception.ApiException;
import com.openforge.convo.llm.exception.QuotaExceededException;
import com.openforge.convo.llm.exception.QuotaKind;
import com.openforge.convo.llm.exception.TransportException;

/**
 * Maps a provider failure to the category the fallback policy acts on.
 * Follows the cause chain, so wrapped failures classify like their cause.
 */
public final class ErrorClassifier {

    private static final int MAX_CAUSE_DEPTH = 10;

    private ErrorClassifier() {
    }

    public static ErrorCategory classify(Throwable error) {
        int depth = 0;
        for (Throwable t = error; t != null && depth < MAX_CAUSE_DEPTH; t = t.getCause(), depth++) {
            if (t instanceof QuotaExceededException quota) {
                return quota.getKind() == QuotaKind.PRO ? ErrorCategory.PRO_QUOTA : ErrorCategory.GENERIC_QUOTA;
            }
            if (t instanceof ApiException)         return ErrorCategory.API;
            if (t instanceof TransportException)   return ErrorCategory.TRANSPORT;
            if (t instanceof AbortedException)     return ErrorCategory.ABORT;
            if (t instanceof InterruptedException) return ErrorCategory.ABORT;
        }
        return ErrorCategory.FATAL;
    }
}
