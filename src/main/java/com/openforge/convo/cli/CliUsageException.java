package com.openforge.convo.cli;

/** Bad command-line usage; exits with code 2. */
public class CliUsageException extends RuntimeException {

    public CliUsageException(String message) {
        super(message);
    }
}
