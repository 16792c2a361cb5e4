package com.openforge.convo.llm.provider.openai;

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
import com.openforge.convo.llm.model.GenerationConfig;
import com.openforge.convo.llm.model.Part;
import com.openforge.convo.llm.model.TextPart;
import com.openforge.convo.llm.model.ToolCallRequest;
import com.openforge.convo.llm.model.ToolCallResult;
import com.openforge.convo.llm.model.Usage;
import com.openforge.convo.llm.provider.AbstractProviderAdapter;
import com.openforge.convo.llm.provider.ProviderClassifier;
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
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Adapter for every backend that speaks the OpenAI /chat/completions dialect:
 * OpenAI, DeepSeek, Qwen (DashScope compatible mode), Groq, Mistral, Moonshot.
 *
 * Canonical → wire:
 *   systemInstruction        → {"role":"system"}
 *   USER text                → {"role":"user","content":...}
 *   MODEL text / calls       → {"role":"assistant","content":...,"tool_calls":[...]}
 *   TOOL results             → one {"role":"tool","tool_call_id":...} per result
 *
 * Streaming: SSE "data:" frames, fragments of tool-call arguments are
 * assembled per index, "data: [DONE]" ends the stream.
 */
@Slf4j
public class OpenAiCompatibleAdapter extends AbstractProviderAdapter {

    /** Providers known to honour stream_options.include_usage. */
    private static final Set<ProviderId> STREAM_USAGE_PROVIDERS =
            EnumSet.of(ProviderId.OPENAI, ProviderId.DEEPSEEK, ProviderId.QWEN);

    public OpenAiCompatibleAdapter(ProviderId providerId,
                                   HttpClient httpClient,
                                   ObjectMapper objectMapper,
                                   RetryRegistry retryRegistry,
                                   CircuitBreakerRegistry circuitBreakerRegistry) {
        super(providerId, httpClient, objectMapper, retryRegistry, circuitBreakerRegistry);
    }

    // ── Public API ───────────────────────────────────────────────────────────

    @Override
    public ChatResponse chat(ChatRequest request) {
        ensureReady();
        String body = serialize(toWire(request, false));
        log.debug("[{}] → chat model={} body-length={}", label(), request.model(), body.length());

        String responseBody = sendForBody(newRequest("/chat/completions", false)
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build());
        return parseResponse(readTree(responseBody), request.model());
    }

    @Override
    protected ChunkStream openStream(ChatRequest request) {
        String body = serialize(toWire(request, true));
        log.debug("[{}] → streamChat model={} body-length={}", label(), request.model(), body.length());

        Stream<String> lines = sendForLines(newRequest("/chat/completions", true)
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build());
        return new NormalizingChunkStream<SseEvent>(label(),
                new SseEventReader(lines.iterator()),
                new OpenAiStreamShape(providerId(), objectMapper, errorParser, this::parseArguments),
                lines::close);
    }

    @Override
    public boolean interleavesTextWithCalls() {
        return false;
    }

    @Override
    protected void authorize(HttpRequest.Builder builder) {
        builder.header("Authorization", "Bearer " + config.apiKey());
    }

    // ── Canonical → wire ─────────────────────────────────────────────────────

    ObjectNode toWire(ChatRequest request, boolean streaming) {
        String model = ProviderClassifier.wireModelName(request.model());

        ObjectNode root = objectMapper.createObjectNode();
        root.put("model", model);

        ArrayNode messages = root.putArray("messages");
        if (request.systemInstruction() != null && !request.systemInstruction().isBlank()) {
            messages.addObject().put("role", "system").put("content", request.systemInstruction());
        }
        for (CanonicalMessage message : request.messages()) {
            appendMessage(messages, message);
        }

        if (!request.tools().isEmpty()) {
            ArrayNode tools = root.putArray("tools");
            for (FunctionDeclaration declaration : request.tools()) {
                ObjectNode function = tools.addObject().put("type", "function").putObject("function");
                function.put("name", declaration.name());
                if (declaration.description() != null) function.put("description", declaration.description());
                if (declaration.parameters() != null) function.set("parameters", declaration.parameters());
            }
            root.put("tool_choice", "auto");
        }

        applyGenerationConfig(root, request.generationConfig(), model);

        if (streaming) {
            root.put("stream", true);
            if (STREAM_USAGE_PROVIDERS.contains(providerId())) {
                root.putObject("stream_options").put("include_usage", true);
            }
        }
        return root;
    }

    private void appendMessage(ArrayNode messages, CanonicalMessage message) {
        switch (message.role()) {
            case USER -> messages.addObject().put("role", "user").put("content", message.text());
            case MODEL -> {
                ObjectNode assistant = messages.addObject().put("role", "assistant");
                List<ToolCallRequest> calls = message.functionCalls();
                String text = message.text();
                if (calls.isEmpty() || !text.isEmpty()) {
                    assistant.put("content", text);
                } else {
                    assistant.putNull("content");
                }
                if (!calls.isEmpty()) {
                    ArrayNode toolCalls = assistant.putArray("tool_calls");
                    for (ToolCallRequest call : calls) {
                        ObjectNode toolCall = toolCalls.addObject()
                                .put("id", call.id())
                                .put("type", "function");
                        toolCall.putObject("function")
                                .put("name", call.name())
                                .put("arguments", serialize(call.args()));
                    }
                }
            }
            case TOOL -> {
                for (ToolCallResult result : message.functionResponses()) {
                    messages.addObject()
                            .put("role", "tool")
                            .put("tool_call_id", result.id())
                            .put("content", result.contentForModel());
                }
            }
        }
    }

    /**
     * DeepSeek reasoner models reject sampling parameters, so temperature,
     * top_p and stop are left out for them.  top_k has no OpenAI equivalent.
     */
    private void applyGenerationConfig(ObjectNode root, GenerationConfig generation, String model) {
        boolean reasoner = providerId() == ProviderId.DEEPSEEK && model != null && model.contains("reasoner");

        if (generation.maxTokens() != null) root.put("max_tokens", generation.maxTokens());
        if (reasoner) return;

        if (generation.temperature() != null) root.put("temperature", generation.temperature());
        if (generation.topP() != null)        root.put("top_p", generation.topP());
        if (generation.stopSequences() != null && !generation.stopSequences().isEmpty()) {
            ArrayNode stop = root.putArray("stop");
            generation.stopSequences().forEach(stop::add);
        }
    }

    // ── Wire → canonical ─────────────────────────────────────────────────────

    ChatResponse parseResponse(JsonNode root, String requestedModel) {
        JsonNode choice  = root.path("choices").path(0);
        JsonNode message = choice.path("message");

        List<Part> parts = new ArrayList<>();
        String content = message.path("content").asText("");
        if (!content.isEmpty()) parts.add(new TextPart(content));

        for (JsonNode toolCall : message.path("tool_calls")) {
            JsonNode function = toolCall.path("function");
            parts.add(new FunctionCallPart(new ToolCallRequest(
                    toolCall.path("id").asText(null),
                    function.path("name").asText(),
                    parseArguments(function.path("arguments").asText(null)))));
        }

        Map<String, Object> metadata = new HashMap<>();
        if (root.hasNonNull("id")) metadata.put("id", root.get("id").asText());

        return new ChatResponse(
                CanonicalMessage.model(parts),
                mapFinishReason(choice.path("finish_reason").asText(null)),
                parseUsage(root.get("usage")),
                root.path("model").asText(requestedModel),
                metadata);
    }

    static Usage parseUsage(JsonNode usage) {
        if (usage == null || usage.isNull()) return null;
        int prompt     = usage.path("prompt_tokens").asInt(0);
        int completion = usage.path("completion_tokens").asInt(0);
        int total      = usage.path("total_tokens").asInt(prompt + completion);
        return new Usage(prompt, completion, total);
    }

    static FinishReason mapFinishReason(String reason) {
        if (reason == null) return null;
        return switch (reason) {
            case "stop"                        -> FinishReason.STOP;
            case "length"                      -> FinishReason.LENGTH;
            case "tool_calls", "function_call" -> FinishReason.TOOL_CALLS;
            case "content_filter"              -> FinishReason.CONTENT_FILTER;
            default                            -> FinishReason.STOP;
        };
    }
}
