package com.openforge.convo.llm.provider.ollama;

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
import com.openforge.convo.llm.stream.NdjsonLineReader;
import com.openforge.convo.llm.stream.NormalizingChunkStream;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Adapter for a local Ollama server (POST {base}/api/chat).
 *
 * Model ids are routed here with an "ollama/" prefix, which is stripped
 * before sending.  No key is needed.  Streaming responses are one JSON
 * object per line; the last one carries "done": true plus token counts.
 */
@Slf4j
public class OllamaAdapter extends AbstractProviderAdapter {

    public OllamaAdapter(HttpClient httpClient,
                         ObjectMapper objectMapper,
                         RetryRegistry retryRegistry,
                         CircuitBreakerRegistry circuitBreakerRegistry) {
        super(ProviderId.OLLAMA, httpClient, objectMapper, retryRegistry, circuitBreakerRegistry);
    }

    @Override
    public ChatResponse chat(ChatRequest request) {
        ensureReady();
        String body = serialize(toWire(request, false));
        log.debug("[{}] → api/chat model={} body-length={}", label(), request.model(), body.length());

        String responseBody = sendForBody(newRequest("/api/chat", false)
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build());
        return parseResponse(readTree(responseBody), request.model());
    }

    @Override
    protected ChunkStream openStream(ChatRequest request) {
        String body = serialize(toWire(request, true));
        log.debug("[{}] → api/chat(stream) model={} body-length={}", label(), request.model(), body.length());

        Stream<String> lines = sendForLines(newRequest("/api/chat", false)
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build());
        return new NormalizingChunkStream<JsonNode>(label(),
                new NdjsonLineReader(lines.iterator(), objectMapper),
                new OllamaStreamShape(this, errorParser),
                lines::close);
    }

    @Override
    public boolean interleavesTextWithCalls() {
        return false;
    }

    @Override
    protected void authorize(HttpRequest.Builder builder) {
        // local server, no credentials
    }

    // ── Canonical → wire ─────────────────────────────────────────────────────

    ObjectNode toWire(ChatRequest request, boolean streaming) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("model", ProviderClassifier.wireModelName(request.model()));
        root.put("stream", streaming);

        ArrayNode messages = root.putArray("messages");
        if (request.systemInstruction() != null && !request.systemInstruction().isBlank()) {
            messages.addObject().put("role", "system").put("content", request.systemInstruction());
        }
        for (CanonicalMessage message : request.messages()) {
            switch (message.role()) {
                case USER -> messages.addObject().put("role", "user").put("content", message.text());
                case MODEL -> {
                    ObjectNode assistant = messages.addObject()
                            .put("role", "assistant")
                            .put("content", message.text());
                    List<ToolCallRequest> calls = message.functionCalls();
                    if (!calls.isEmpty()) {
                        ArrayNode toolCalls = assistant.putArray("tool_calls");
                        for (ToolCallRequest call : calls) {
                            ObjectNode function = toolCalls.addObject().putObject("function");
                            function.put("name", call.name());
                            function.set("arguments", objectMapper.valueToTree(call.args()));
                        }
                    }
                }
                case TOOL -> {
                    for (ToolCallResult result : message.functionResponses()) {
                        messages.addObject().put("role", "tool").put("content", result.contentForModel());
                    }
                }
            }
        }

        if (!request.tools().isEmpty()) {
            ArrayNode tools = root.putArray("tools");
            for (FunctionDeclaration declaration : request.tools()) {
                ObjectNode function = tools.addObject().put("type", "function").putObject("function");
                function.put("name", declaration.name());
                if (declaration.description() != null) function.put("description", declaration.description());
                if (declaration.parameters() != null)  function.set("parameters", declaration.parameters());
            }
        }

        ObjectNode options = toOptions(request.generationConfig());
        if (!options.isEmpty()) root.set("options", options);
        return root;
    }

    private ObjectNode toOptions(GenerationConfig generation) {
        ObjectNode options = objectMapper.createObjectNode();
        if (generation.temperature() != null) options.put("temperature", generation.temperature());
        if (generation.maxTokens() != null)   options.put("num_predict", generation.maxTokens());
        if (generation.topP() != null)        options.put("top_p", generation.topP());
        if (generation.topK() != null)        options.put("top_k", generation.topK());
        if (generation.stopSequences() != null && !generation.stopSequences().isEmpty()) {
            ArrayNode stop = options.putArray("stop");
            generation.stopSequences().forEach(stop::add);
        }
        return options;
    }

    // ── Wire → canonical ─────────────────────────────────────────────────────

    ChatResponse parseResponse(JsonNode root, String requestedModel) {
        JsonNode message = root.path("message");
        List<Part> parts = new ArrayList<>();
        String content = message.path("content").asText("");
        if (!content.isEmpty()) parts.add(new TextPart(content));
        for (ToolCallRequest call : readToolCalls(message)) {
            parts.add(new FunctionCallPart(call));
        }

        return new ChatResponse(
                CanonicalMessage.model(parts),
                mapDoneReason(root.path("done_reason").asText(null)),
                readUsage(root),
                root.path("model").asText(requestedModel),
                Map.of());
    }

    List<ToolCallRequest> readToolCalls(JsonNode message) {
        List<ToolCallRequest> calls = new ArrayList<>();
        for (JsonNode toolCall : message.path("tool_calls")) {
            JsonNode function = toolCall.path("function");
            calls.add(new ToolCallRequest(null, function.path("name").asText(), toArgs(function.get("arguments"))));
        }
        return calls;
    }

    static Usage readUsage(JsonNode root) {
        if (!root.has("prompt_eval_count") && !root.has("eval_count")) return null;
        return Usage.of(root.path("prompt_eval_count").asInt(0), root.path("eval_count").asInt(0));
    }

    static FinishReason mapDoneReason(String reason) {
        if (reason == null) return null;
        return "length".equals(reason) ? FinishReason.LENGTH : FinishReason.STOP;
    }
}
