package com.openforge.convo.llm.exception;

import com.openforge.convo.llm.provider.ProviderId;
import lombok.Getter;

/**
 * The provider answered, and rejected the request.
 *
 *   statusCode   - HTTP status (or the "code" field of the error body)
 *   errorStatus  - symbolic status from the body, e.g. "RESOURCE_EXHAUSTED"
 *   rawBody      - response body as received, for logs
 */
@Getter
public class ApiException extends LlmException {

    private final ProviderId provider;
    private final int        statusCode;
    private final String     errorStatus;
    private final String     rawBody;

    public ApiException(ProviderId provider, int statusCode, String errorStatus,
                        String message, String rawBody) {
        super(message);
        this.provider    = provider;
        this.statusCode  = statusCode;
        this.errorStatus = errorStatus;
        this.rawBody     = rawBody;
    }

    public boolean isAuthenticationError() {
        return statusCode == 401 || statusCode == 403;
    }
}
