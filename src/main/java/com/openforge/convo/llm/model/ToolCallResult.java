package com.openforge.convo.llm.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Outcome of executing one {@link ToolCallRequest}.
 *
 * Domain failures are values, never exceptions: a failed result carries a
 * {@link ToolError} and the conversation continues so the model can react.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ToolCallResult(
        String    id,
        String    name,
        boolean   success,
        String    output,
        ToolError error
) {

    // ── Static factory helpers ───────────────────────────────────────────────

    public static ToolCallResult success(ToolCallRequest request, String output) {
        return new ToolCallResult(request.id(), request.name(), true, output, null);
    }

    public static ToolCallResult failure(ToolCallRequest request, ToolErrorType type, String message) {
        return new ToolCallResult(request.id(), request.name(), false, null, new ToolError(type, message));
    }

    /** Text handed back to the model: the output, or a tagged error line. */
    public String contentForModel() {
        if (success) {
            return output == null ? "" : output;
        }
        return "[ToolError:%s] %s".formatted(error.type(), error.message());
    }
}
