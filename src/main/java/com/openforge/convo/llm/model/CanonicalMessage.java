package com.openforge.convo.llm.model;

import java.util.ArrayList;
import java.util.List;

/**
 * A single entry in the conversation history, independent of any wire format.
 *
 * A MODEL message that carries function calls holds no continuation text
 * unless the provider interleaves text and calls natively (Anthropic, Gemini).
 */
public record CanonicalMessage(
        Role       role,
        List<Part> parts
) {

    public CanonicalMessage {
        parts = parts == null ? List.of() : List.copyOf(parts);
    }

    // ── Static factory helpers ──────────────────────────────────────────────

    public static CanonicalMessage user(String text) {
        return new CanonicalMessage(Role.USER, List.of(new TextPart(text)));
    }

    public static CanonicalMessage modelText(String text) {
        return new CanonicalMessage(Role.MODEL, List.of(new TextPart(text)));
    }

    public static CanonicalMessage model(List<Part> parts) {
        return new CanonicalMessage(Role.MODEL, parts);
    }

    public static CanonicalMessage toolResults(List<ToolCallResult> results) {
        List<Part> parts = new ArrayList<>(results.size());
        for (ToolCallResult result : results) {
            parts.add(new FunctionResponsePart(result));
        }
        return new CanonicalMessage(Role.TOOL, parts);
    }

    // ── Accessors ───────────────────────────────────────────────────────────

    /** Concatenation of all text parts, in order. */
    public String text() {
        StringBuilder sb = new StringBuilder();
        for (Part part : parts) {
            if (part instanceof TextPart textPart) {
                sb.append(textPart.text());
            }
        }
        return sb.toString();
    }

    public List<ToolCallRequest> functionCalls() {
        List<ToolCallRequest> calls = new ArrayList<>();
        for (Part part : parts) {
            if (part instanceof FunctionCallPart callPart) {
                calls.add(callPart.call());
            }
        }
        return calls;
    }

    public List<ToolCallResult> functionResponses() {
        List<ToolCallResult> results = new ArrayList<>();
        for (Part part : parts) {
            if (part instanceof FunctionResponsePart responsePart) {
                results.add(responsePart.result());
            }
        }
        return results;
    }

    public boolean hasFunctionCalls() {
        for (Part part : parts) {
            if (part instanceof FunctionCallPart) return true;
        }
        return false;
    }
}
