package com.openforge.convo.llm.provider.openai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.convo.llm.exception.ApiErrorParser;
import com.openforge.convo.llm.model.FinishReason;
import com.openforge.convo.llm.model.ToolCallRequest;
import com.openforge.convo.llm.model.Usage;
import com.openforge.convo.llm.provider.ProviderId;
import com.openforge.convo.llm.stream.ProviderDelta;
import com.openforge.convo.llm.stream.SseEvent;
import com.openforge.convo.llm.stream.StreamShape;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Reads /chat/completions SSE frames.
 *
 *   data: {"choices":[{"delta":{"content":"Hel"}}]}
 *   data: {"choices":[{"delta":{"tool_calls":[{"index":0,"id":"call_1","function":{"name":"read_file","arguments":"{\"pa"}}]}}]}
 *   data: {"choices":[{"delta":{"tool_calls":[{"index":0,"function":{"arguments":"th\":\"a\"}"}}]}}]}
 *   data: {"choices":[{"delta":{},"finish_reason":"tool_calls"}]}
 *   data: {"choices":[],"usage":{"prompt_tokens":9,"completion_tokens":12,"total_tokens":21}}
 *   data: [DONE]
 *
 * Tool-call arguments are accumulated per index and released once the
 * frame carrying finish_reason arrives (or at [DONE] / end of input).
 */
@Slf4j
class OpenAiStreamShape implements StreamShape<SseEvent> {

    private final ProviderId                              providerId;
    private final ObjectMapper                            objectMapper;
    private final ApiErrorParser                          errorParser;
    private final Function<String, Map<String, Object>>   argumentParser;

    // index → accumulated call, in index order
    private final Map<Integer, ToolCallAccumulator> toolCalls = new TreeMap<>();

    OpenAiStreamShape(ProviderId providerId,
                      ObjectMapper objectMapper,
                      ApiErrorParser errorParser,
                      Function<String, Map<String, Object>> argumentParser) {
        this.providerId     = providerId;
        this.objectMapper   = objectMapper;
        this.errorParser    = errorParser;
        this.argumentParser = argumentParser;
    }

    @Override
    public ProviderDelta interpret(SseEvent event) {
        if (event.isDoneSentinel()) return ProviderDelta.endOfStream();

        JsonNode frame;
        try {
            frame = objectMapper.readTree(event.data());
        } catch (JsonProcessingException e) {
            log.warn("[OpenAiStream:{}] Failed to parse SSE chunk: {}", providerId, event.data());
            return ProviderDelta.EMPTY;
        }

        if (frame.hasNonNull("error")) {
            int code = frame.path("error").path("code").asInt(500);
            throw errorParser.toException(providerId, code, event.data(), Optional.empty());
        }

        Usage usage = OpenAiCompatibleAdapter.parseUsage(frame.get("usage"));

        JsonNode choice = frame.path("choices").path(0);
        if (choice.isMissingNode()) {
            return new ProviderDelta("", List.of(), usage, null, false);
        }

        JsonNode delta = choice.path("delta");
        String   text  = delta.path("content").asText("");

        // ── Tool-call fragments ──────────────────────────────────────────────
        for (JsonNode fragment : delta.path("tool_calls")) {
            int idx = fragment.path("index").asInt(0);
            ToolCallAccumulator acc = toolCalls.computeIfAbsent(idx, i -> new ToolCallAccumulator());
            if (fragment.hasNonNull("id")) acc.id = fragment.get("id").asText();
            JsonNode function = fragment.path("function");
            if (function.hasNonNull("name"))      acc.name = function.get("name").asText();
            if (function.hasNonNull("arguments")) acc.argsBuilder.append(function.get("arguments").asText());
        }

        FinishReason finishReason = OpenAiCompatibleAdapter.mapFinishReason(choice.path("finish_reason").asText(null));
        List<ToolCallRequest> completed = finishReason != null ? drainPendingCalls() : List.of();

        return new ProviderDelta(text, completed, usage, finishReason, false);
    }

    @Override
    public List<ToolCallRequest> drainPendingCalls() {
        if (toolCalls.isEmpty()) return List.of();
        List<ToolCallRequest> calls = new ArrayList<>(toolCalls.size());
        for (ToolCallAccumulator acc : toolCalls.values()) {
            calls.add(new ToolCallRequest(acc.id, acc.name, argumentParser.apply(acc.argsBuilder.toString())));
        }
        toolCalls.clear();
        return calls;
    }

    // ── Accumulator for streaming tool-call assembly ─────────────────────────

    private static class ToolCallAccumulator {
        String        id;
        String        name        = "";
        StringBuilder argsBuilder = new StringBuilder();
    }
}
