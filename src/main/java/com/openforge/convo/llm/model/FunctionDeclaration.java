package com.openforge.convo.llm.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * A tool the model may call.
 *
 * "parameters" is a JSON Schema kept as a JsonNode so each adapter can embed
 * it verbatim in its own wire format (OpenAI "parameters", Anthropic
 * "input_schema", Gemini "functionDeclarations[].parameters").
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FunctionDeclaration(
        String   name,
        String   description,
        JsonNode parameters
) {}
