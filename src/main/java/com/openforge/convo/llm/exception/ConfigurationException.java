package com.openforge.convo.llm.exception;

/** Missing or invalid provider configuration.  Raised before any network call. */
public class ConfigurationException extends LlmException {

    public ConfigurationException(String message) {
        super(message);
    }
}
