package com.openforge.convo.llm.exception;

/**
 * Root of every provider-level failure.  Unchecked, like the rest of the
 * stack: the turn loop catches it in one place and hands it to the fallback
 * policy.
 */
public class LlmException extends RuntimeException {

    public LlmException(String message) {
        super(message);
    }

    public LlmException(String message, Throwable cause) {
        super(message, cause);
    }
}
