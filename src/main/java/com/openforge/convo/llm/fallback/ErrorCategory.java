package com.openforge.convo.llm.fallback;

public enum ErrorCategory {

    /** Provider rejected the request (4xx/5xx other than quota). */
    API,

    /** Quota of the premium model itself is exhausted. */
    PRO_QUOTA,

    /** Any other quota or rate limit. */
    GENERIC_QUOTA,

    /** Network failure or timeout. */
    TRANSPORT,

    /** Cancelled by the caller. */
    ABORT,

    /** Configuration problems and anything unexpected. */
    FATAL;

    public boolean isQuota() {
        return this == PRO_QUOTA || this == GENERIC_QUOTA;
    }
}
