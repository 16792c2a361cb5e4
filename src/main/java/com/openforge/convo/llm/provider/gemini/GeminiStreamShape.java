package com.openforge.convo.llm.provider.gemini;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.convo.llm.exception.ApiErrorParser;
import com.openforge.convo.llm.model.FunctionCallPart;
import com.openforge.convo.llm.model.Part;
import com.openforge.convo.llm.model.TextPart;
import com.openforge.convo.llm.model.ToolCallRequest;
import com.openforge.convo.llm.provider.ProviderId;
import com.openforge.convo.llm.stream.ProviderDelta;
import com.openforge.convo.llm.stream.SseEvent;
import com.openforge.convo.llm.stream.StreamShape;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Each SSE frame is a complete GenerateContentResponse holding only the new
 * parts.  Function calls arrive whole, never fragmented.
 */
@Slf4j
class GeminiStreamShape implements StreamShape<SseEvent> {

    private final GeminiAdapter  adapter;
    private final ObjectMapper   objectMapper;
    private final ApiErrorParser errorParser;

    GeminiStreamShape(GeminiAdapter adapter, ObjectMapper objectMapper, ApiErrorParser errorParser) {
        this.adapter      = adapter;
        this.objectMapper = objectMapper;
        this.errorParser  = errorParser;
    }

    @Override
    public ProviderDelta interpret(SseEvent event) {
        JsonNode frame;
        try {
            frame = objectMapper.readTree(event.data());
        } catch (JsonProcessingException e) {
            log.warn("[GeminiStream] Failed to parse SSE chunk: {}", event.data());
            return ProviderDelta.EMPTY;
        }

        if (frame.hasNonNull("error")) {
            int code = frame.path("error").path("code").asInt(500);
            throw errorParser.toException(ProviderId.GEMINI, code, event.data(), Optional.empty());
        }

        JsonNode candidate = frame.path("candidates").path(0);
        StringBuilder         text  = new StringBuilder();
        List<ToolCallRequest> calls = new ArrayList<>();
        for (Part part : adapter.readParts(candidate.path("content").path("parts"))) {
            if (part instanceof TextPart textPart) {
                text.append(textPart.text());
            } else if (part instanceof FunctionCallPart callPart) {
                calls.add(callPart.call());
            }
        }

        return new ProviderDelta(text.toString(), calls,
                GeminiAdapter.parseUsage(frame.get("usageMetadata")),
                GeminiAdapter.mapFinishReason(candidate.path("finishReason").asText(null)),
                false);
    }
}
