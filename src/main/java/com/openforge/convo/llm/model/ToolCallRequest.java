package com.openforge.convo.llm.model;

import java.util.Map;

/**
 * A single tool invocation request produced by the model.
 *
 * {@code id} is unique within a turn.  Providers that do not assign ids
 * (Gemini, Ollama) get a synthesized one before the call reaches the registry.
 *
 * Example:
 *   name = "read_file"
 *   args = {"path": "notes/todo.md"}
 */
public record ToolCallRequest(
        String id,
        String name,
        Map<String, Object> args
) {

    public ToolCallRequest {
        args = args == null ? Map.of() : args;
    }

    public ToolCallRequest withId(String newId) {
        return new ToolCallRequest(newId, name, args);
    }
}
