package com.openforge.convo.llm.provider.anthropic;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.convo.llm.exception.ApiErrorParser;
import com.openforge.convo.llm.model.ToolCallRequest;
import com.openforge.convo.llm.model.Usage;
import com.openforge.convo.llm.provider.ProviderId;
import com.openforge.convo.llm.stream.ProviderDelta;
import com.openforge.convo.llm.stream.SseEvent;
import com.openforge.convo.llm.stream.StreamShape;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Reads the Messages API event stream.
 *
 *   message_start        → prompt token count
 *   content_block_start  → opens a text or tool_use block at an index
 *   content_block_delta  → text_delta (text) or input_json_delta (tool args fragment)
 *   content_block_stop   → a tool_use block is complete
 *   message_delta        → stop_reason and output token count
 *   message_stop         → end of stream
 *   ping                 → ignored
 *   error                → raised as an API error
 */
@Slf4j
class AnthropicStreamShape implements StreamShape<SseEvent> {

    private final ObjectMapper                          objectMapper;
    private final ApiErrorParser                        errorParser;
    private final Function<String, Map<String, Object>> argumentParser;

    // content block index → open tool_use block
    private final Map<Integer, ToolUseAccumulator> openToolUses = new HashMap<>();
    private int inputTokens;

    AnthropicStreamShape(ObjectMapper objectMapper,
                         ApiErrorParser errorParser,
                         Function<String, Map<String, Object>> argumentParser) {
        this.objectMapper   = objectMapper;
        this.errorParser    = errorParser;
        this.argumentParser = argumentParser;
    }

    @Override
    public ProviderDelta interpret(SseEvent event) {
        JsonNode data;
        try {
            data = objectMapper.readTree(event.data());
        } catch (JsonProcessingException e) {
            log.warn("[AnthropicStream] Failed to parse SSE chunk: {}", event.data());
            return ProviderDelta.EMPTY;
        }

        String type = event.event() != null ? event.event() : data.path("type").asText();
        switch (type) {
            case "message_start" -> {
                inputTokens = data.path("message").path("usage").path("input_tokens").asInt(0);
                return ProviderDelta.EMPTY;
            }
            case "content_block_start" -> {
                JsonNode block = data.path("content_block");
                if ("tool_use".equals(block.path("type").asText())) {
                    openToolUses.put(data.path("index").asInt(),
                            new ToolUseAccumulator(block.path("id").asText(null), block.path("name").asText()));
                }
                return ProviderDelta.text(block.path("text").asText(""));
            }
            case "content_block_delta" -> {
                JsonNode delta = data.path("delta");
                if ("input_json_delta".equals(delta.path("type").asText())) {
                    ToolUseAccumulator acc = openToolUses.get(data.path("index").asInt());
                    if (acc != null) acc.inputJson.append(delta.path("partial_json").asText(""));
                    return ProviderDelta.EMPTY;
                }
                return ProviderDelta.text(delta.path("text").asText(""));
            }
            case "content_block_stop" -> {
                ToolUseAccumulator acc = openToolUses.remove(data.path("index").asInt());
                if (acc == null) return ProviderDelta.EMPTY;
                return new ProviderDelta("", List.of(acc.toRequest(argumentParser)), null, null, false);
            }
            case "message_delta" -> {
                int outputTokens = data.path("usage").path("output_tokens").asInt(0);
                return new ProviderDelta("", List.of(), Usage.of(inputTokens, outputTokens),
                        AnthropicAdapter.mapStopReason(data.path("delta").path("stop_reason").asText(null)),
                        false);
            }
            case "message_stop" -> {
                return ProviderDelta.endOfStream();
            }
            case "error" -> {
                int status = "overloaded_error".equals(data.path("error").path("type").asText()) ? 529 : 500;
                throw errorParser.toException(ProviderId.ANTHROPIC, status, event.data(), Optional.empty());
            }
            default -> {
                return ProviderDelta.EMPTY;
            }
        }
    }

    @Override
    public List<ToolCallRequest> drainPendingCalls() {
        if (openToolUses.isEmpty()) return List.of();
        List<ToolCallRequest> calls = new ArrayList<>();
        openToolUses.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .forEach(e -> calls.add(e.getValue().toRequest(argumentParser)));
        openToolUses.clear();
        return calls;
    }

    private static class ToolUseAccumulator {
        final String        id;
        final String        name;
        final StringBuilder inputJson = new StringBuilder();

        ToolUseAccumulator(String id, String name) {
            this.id   = id;
            this.name = name;
        }

        ToolCallRequest toRequest(Function<String, Map<String, Object>> argumentParser) {
            return new ToolCallRequest(id, name, argumentParser.apply(inputJson.toString()));
        }
    }
}
