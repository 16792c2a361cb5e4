package com.openforge.convo.llm.fallback;

import com.openforge.convo.llm.exception.ApiException;
import com.openforge.convo.llm.exception.QuotaExceededException;
import com.openforge.convo.llm.exception.QuotaKind;

/**
 * User-facing rendering of provider errors and downgrade notices.
 *
 *   [API Error: Quota exceeded for ... (Status: RESOURCE_EXHAUSTED)]
 *   You have reached your daily gemini-2.5-pro quota limit. You will be switched to ...
 */
public final class ApiErrorFormatter {

    private static final String QUOTA_METRIC_MARKER = "Quota exceeded for quota metric";

    private ApiErrorFormatter() {
    }

    public static String format(Throwable error) {
        if (error instanceof ApiException api) {
            String status = api.getErrorStatus() != null ? api.getErrorStatus() : String.valueOf(api.getStatusCode());
            String text = "[API Error: %s (Status: %s)]".formatted(api.getMessage(), status);
            if (api instanceof QuotaExceededException) {
                text += "\nPlease wait and try again later, or switch to another model with --model.";
            }
            return text;
        }
        if (error == null || error.getMessage() == null) {
            return "[API Error: An unknown error occurred.]";
        }
        return "[API Error: %s]".formatted(error.getMessage());
    }

    /** Informational notice shown when the session switches to the fallback model. */
    public static String downgradeNotice(QuotaExceededException error, String currentModel, String fallbackModel) {
        String status = error.getErrorStatus() != null ? error.getErrorStatus() : String.valueOf(error.getStatusCode());
        String head   = "[API Error: %s (Status: %s)]".formatted(error.getMessage(), status);

        if (error.getKind() == QuotaKind.PRO) {
            return head + "\nYou have reached your daily %s quota limit. You will be switched to the %s model for the rest of this session."
                    .formatted(currentModel, fallbackModel);
        }
        if (error.getMessage() != null && error.getMessage().contains(QUOTA_METRIC_MARKER)) {
            return head + "\nYou have reached your daily quota limit. You will be switched to the %s model for the rest of this session."
                    .formatted(fallbackModel);
        }
        return head + "\nPossible quota limitations in place or slow response times detected. Switching to the %s model for the rest of this session."
                .formatted(fallbackModel);
    }
}
