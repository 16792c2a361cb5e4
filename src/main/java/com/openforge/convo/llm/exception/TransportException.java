package com.openforge.convo.llm.exception;

/** I/O failure or timeout talking to the provider.  Never retried by the fallback policy. */
public class TransportException extends LlmException {

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
