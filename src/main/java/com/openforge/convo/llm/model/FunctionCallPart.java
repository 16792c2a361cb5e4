package com.openforge.convo.llm.model;

/** A function call requested by the model. */
public record FunctionCallPart(ToolCallRequest call) implements Part {
}
