package com.openforge.convo.llm.model;

/** The outcome of one function call, sent back to the model. */
public record FunctionResponsePart(ToolCallResult result) implements Part {
}
