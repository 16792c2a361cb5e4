package com.openforge.convo.llm.model;

/**
 * One ordered piece of a {@link CanonicalMessage}.
 */
public sealed interface Part permits TextPart, FunctionCallPart, FunctionResponsePart {
}
