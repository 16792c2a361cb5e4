package com.openforge.convo.llm.provider.anthropic;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openforge.convo.llm.model.CanonicalMessage;
import com.openforge.convo.llm.model.ChatRequest;
import com.openforge.convo.llm.model.ChatResponse;
import com.openforge.convo.llm.model.FinishReason;
import com.openforge.convo.llm.model.FunctionCallPart;
import com.openforge.convo.llm.model.FunctionDeclaration;
import com.openforge.convo.llm.model.FunctionResponsePart;
import com.openforge.convo.llm.model.GenerationConfig;
import com.openforge.convo.llm.model.Part;
import com.openforge.convo.llm.model.TextPart;
import com.openforge.convo.llm.model.ToolCallRequest;
import com.openforge.convo.llm.model.ToolCallResult;
import com.openforge.convo.llm.model.Usage;
import com.openforge.convo.llm.provider.AbstractProviderAdapter;
import com.openforge.convo.llm.provider.ProviderId;
import com.openforge.convo.llm.stream.ChunkStream;
import com.openforge.convo.llm.stream.NormalizingChunkStream;
import com.openforge.convo.llm.stream.SseEvent;
import com.openforge.convo.llm.stream.SseEventReader;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Adapter for the Anthropic Messages API (POST {base}/messages).
 *
 * Differences from the OpenAI dialect:
 *   - the system instruction is a top-level "system" field
 *   - max_tokens is mandatory
 *   - calls are "tool_use" content blocks, results are "tool_result" blocks
 *     inside a user message
 *   - the stream is a sequence of typed events ending with message_stop
 */
@Slf4j
public class AnthropicAdapter extends AbstractProviderAdapter {

    static final String API_VERSION        = "2023-06-01";
    static final int    DEFAULT_MAX_TOKENS = 4096;

    public AnthropicAdapter(HttpClient httpClient,
                            ObjectMapper objectMapper,
                            RetryRegistry retryRegistry,
                            CircuitBreakerRegistry circuitBreakerRegistry) {
        super(ProviderId.ANTHROPIC, httpClient, objectMapper, retryRegistry, circuitBreakerRegistry);
    }

    // ── Public API ───────────────────────────────────────────────────────────

    @Override
    public ChatResponse chat(ChatRequest request) {
        ensureReady();
        String body = serialize(toWire(request, false));
        log.debug("[{}] → messages model={} body-length={}", label(), request.model(), body.length());

        String responseBody = sendForBody(newRequest("/messages", false)
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build());
        return parseResponse(readTree(responseBody), request.model());
    }

    @Override
    protected ChunkStream openStream(ChatRequest request) {
        String body = serialize(toWire(request, true));
        log.debug("[{}] → messages(stream) model={} body-length={}", label(), request.model(), body.length());

        Stream<String> lines = sendForLines(newRequest("/messages", true)
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build());
        return new NormalizingChunkStream<SseEvent>(label(),
                new SseEventReader(lines.iterator()),
                new AnthropicStreamShape(objectMapper, errorParser, this::parseArguments),
                lines::close);
    }

    @Override
    public boolean interleavesTextWithCalls() {
        return true;
    }

    @Override
    protected void authorize(HttpRequest.Builder builder) {
        builder.header("x-api-key", config.apiKey())
               .header("anthropic-version", API_VERSION);
    }

    // ── Canonical → wire ─────────────────────────────────────────────────────

    ObjectNode toWire(ChatRequest request, boolean streaming) {
        GenerationConfig generation = request.generationConfig();

        ObjectNode root = objectMapper.createObjectNode();
        root.put("model", request.model());
        root.put("max_tokens", generation.maxTokens() != null ? generation.maxTokens() : DEFAULT_MAX_TOKENS);
        if (request.systemInstruction() != null && !request.systemInstruction().isBlank()) {
            root.put("system", request.systemInstruction());
        }

        ArrayNode messages = root.putArray("messages");
        for (CanonicalMessage message : request.messages()) {
            ObjectNode wire = messages.addObject();
            wire.put("role", switch (message.role()) {
                case USER, TOOL -> "user";
                case MODEL      -> "assistant";
            });
            ArrayNode content = wire.putArray("content");
            for (Part part : message.parts()) {
                appendBlock(content, part);
            }
        }

        if (!request.tools().isEmpty()) {
            ArrayNode tools = root.putArray("tools");
            for (FunctionDeclaration declaration : request.tools()) {
                ObjectNode tool = tools.addObject().put("name", declaration.name());
                if (declaration.description() != null) tool.put("description", declaration.description());
                if (declaration.parameters() != null) {
                    tool.set("input_schema", declaration.parameters());
                } else {
                    tool.putObject("input_schema").put("type", "object");
                }
            }
        }

        if (generation.temperature() != null) root.put("temperature", generation.temperature());
        if (generation.topP() != null)        root.put("top_p", generation.topP());
        if (generation.topK() != null)        root.put("top_k", generation.topK());
        if (generation.stopSequences() != null && !generation.stopSequences().isEmpty()) {
            ArrayNode stop = root.putArray("stop_sequences");
            generation.stopSequences().forEach(stop::add);
        }
        if (streaming) root.put("stream", true);
        return root;
    }

    private void appendBlock(ArrayNode content, Part part) {
        if (part instanceof TextPart text) {
            if (!text.text().isEmpty()) {
                content.addObject().put("type", "text").put("text", text.text());
            }
        } else if (part instanceof FunctionCallPart call) {
            ObjectNode block = content.addObject()
                    .put("type", "tool_use")
                    .put("id", call.call().id())
                    .put("name", call.call().name());
            block.set("input", objectMapper.valueToTree(call.call().args()));
        } else if (part instanceof FunctionResponsePart response) {
            ToolCallResult result = response.result();
            ObjectNode block = content.addObject()
                    .put("type", "tool_result")
                    .put("tool_use_id", result.id())
                    .put("content", result.contentForModel());
            if (!result.success()) block.put("is_error", true);
        }
    }

    // ── Wire → canonical ─────────────────────────────────────────────────────

    ChatResponse parseResponse(JsonNode root, String requestedModel) {
        List<Part> parts = new ArrayList<>();
        for (JsonNode block : root.path("content")) {
            switch (block.path("type").asText()) {
                case "text" -> parts.add(new TextPart(block.path("text").asText("")));
                case "tool_use" -> parts.add(new FunctionCallPart(new ToolCallRequest(
                        block.path("id").asText(null),
                        block.path("name").asText(),
                        toArgs(block.get("input")))));
                default -> log.debug("[{}] Skipping content block type={}", label(), block.path("type").asText());
            }
        }

        JsonNode usage = root.get("usage");
        Usage parsedUsage = usage == null ? null
                : Usage.of(usage.path("input_tokens").asInt(0), usage.path("output_tokens").asInt(0));

        Map<String, Object> metadata = new HashMap<>();
        if (root.hasNonNull("id"))            metadata.put("id", root.get("id").asText());
        if (root.hasNonNull("stop_sequence")) metadata.put("stop_sequence", root.get("stop_sequence").asText());

        return new ChatResponse(
                CanonicalMessage.model(parts),
                mapStopReason(root.path("stop_reason").asText(null)),
                parsedUsage,
                root.path("model").asText(requestedModel),
                metadata);
    }

    static FinishReason mapStopReason(String reason) {
        if (reason == null) return null;
        return switch (reason) {
            case "end_turn", "stop_sequence" -> FinishReason.STOP;
            case "max_tokens"                -> FinishReason.LENGTH;
            case "tool_use"                  -> FinishReason.TOOL_CALLS;
            case "refusal"                   -> FinishReason.CONTENT_FILTER;
            default                          -> FinishReason.STOP;
        };
    }
}
