package com.openforge.convo.llm.model;

import lombok.Builder;

import java.util.List;

/**
 * A provider-agnostic request: model id, ordered history, optional system
 * instruction, sampling parameters and the tools the model may call.
 */
@Builder(toBuilder = true)
public record ChatRequest(
        String                    model,
        List<CanonicalMessage>    messages,
        String                    systemInstruction,
        GenerationConfig          generationConfig,
        List<FunctionDeclaration> tools
) {

    public ChatRequest {
        messages = messages == null ? List.of() : List.copyOf(messages);
        tools    = tools == null ? List.of() : List.copyOf(tools);
        if (generationConfig == null) generationConfig = GenerationConfig.defaults();
    }

    public ChatRequest withModel(String modelId) {
        return toBuilder().model(modelId).build();
    }
}
