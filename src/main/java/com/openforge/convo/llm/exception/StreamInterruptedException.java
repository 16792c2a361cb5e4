package com.openforge.convo.llm.exception;

/** The stream broke after it had started delivering chunks. */
public class StreamInterruptedException extends TransportException {

    public StreamInterruptedException(String message, Throwable cause) {
        super(message, cause);
    }
}
