package com.openforge.convo.llm.model;

public record ToolError(ToolErrorType type, String message) {
}
