package com.openforge.convo.llm.exception;

public enum QuotaKind {

    /** The premium model's own quota metric is exhausted. */
    PRO,

    /** Any other quota or rate limit. */
    GENERIC
}
