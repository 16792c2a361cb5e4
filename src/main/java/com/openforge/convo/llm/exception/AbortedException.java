package com.openforge.convo.llm.exception;

/** The caller cancelled the session. */
public class AbortedException extends LlmException {

    public AbortedException(String message) {
        super(message);
    }
}
