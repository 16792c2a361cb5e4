package com.openforge.convo.llm.exception;

import com.openforge.convo.llm.provider.ProviderId;
import lombok.Getter;

import java.time.Duration;

/** HTTP 429 / RESOURCE_EXHAUSTED.  Triggers the fallback policy instead of failing the turn. */
@Getter
public class QuotaExceededException extends ApiException {

    private final QuotaKind kind;
    private final Duration  retryAfter;

    public QuotaExceededException(ProviderId provider, int statusCode, String errorStatus,
                                  String message, String rawBody,
                                  QuotaKind kind, Duration retryAfter) {
        super(provider, statusCode, errorStatus, message, rawBody);
        this.kind       = kind;
        this.retryAfter = retryAfter;
    }
}
