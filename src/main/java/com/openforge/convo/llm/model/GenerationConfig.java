package com.openforge.convo.llm.model;

import lombok.Builder;

import java.util.List;

/**
 * Sampling parameters.  Null fields are left out of the outbound payload so
 * the provider's own default applies.
 */
@Builder(toBuilder = true)
public record GenerationConfig(
        Double       temperature,
        Integer      maxTokens,
        Double       topP,
        Integer      topK,
        List<String> stopSequences
) {

    public static GenerationConfig defaults() {
        return GenerationConfig.builder()
                .temperature(0.7)
                .maxTokens(2048)
                .topP(1.0)
                .build();
    }
}
