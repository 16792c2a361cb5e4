package com.openforge.convo.llm.model;

import java.util.List;
import java.util.Map;

/**
 * Canonical result of a non-streaming call (or of a fully drained stream).
 *
 * {@code metadata} holds provider-specific extras (response id, stop
 * sequence, ...) that nothing in the core interprets.
 */
public record ChatResponse(
        CanonicalMessage    message,
        FinishReason        finishReason,
        Usage               usage,
        String              model,
        Map<String, Object> metadata
) {

    public ChatResponse {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public String text() {
        return message == null ? "" : message.text();
    }

    /** True if the model wants to call one or more tools. */
    public boolean hasFunctionCalls() {
        return message != null && message.hasFunctionCalls();
    }

    public List<ToolCallRequest> functionCalls() {
        return message == null ? List.of() : message.functionCalls();
    }
}
