package com.openforge.convo.llm.provider.gemini;

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

import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Adapter for the Gemini generateContent API.
 *
 *   chat        → POST {base}/models/{model}:generateContent
 *   streamChat  → POST {base}/models/{model}:streamGenerateContent?alt=sse
 *   countTokens → POST {base}/models/{model}:countTokens
 *
 * Gemini has native functionCall / functionResponse parts and returns the
 * model's text and calls in one candidate, so text and calls may interleave.
 * The stream has no end marker: it ends when the body is exhausted.
 */
@Slf4j
public class GeminiAdapter extends AbstractProviderAdapter {

    public GeminiAdapter(HttpClient httpClient,
                         ObjectMapper objectMapper,
                         RetryRegistry retryRegistry,
                         CircuitBreakerRegistry circuitBreakerRegistry) {
        super(ProviderId.GEMINI, httpClient, objectMapper, retryRegistry, circuitBreakerRegistry);
    }

    // ── Public API ───────────────────────────────────────────────────────────

    @Override
    public ChatResponse chat(ChatRequest request) {
        ensureReady();
        String body = serialize(toWire(request));
        log.debug("[{}] → generateContent model={} body-length={}", label(), request.model(), body.length());

        String responseBody = sendForBody(newRequest(modelPath(request.model(), ":generateContent"), false)
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build());
        return parseResponse(readTree(responseBody), request.model());
    }

    @Override
    protected ChunkStream openStream(ChatRequest request) {
        String body = serialize(toWire(request));
        log.debug("[{}] → streamGenerateContent model={} body-length={}", label(), request.model(), body.length());

        Stream<String> lines = sendForLines(newRequest(modelPath(request.model(), ":streamGenerateContent?alt=sse"), true)
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build());
        return new NormalizingChunkStream<SseEvent>(label(),
                new SseEventReader(lines.iterator()),
                new GeminiStreamShape(this, objectMapper, errorParser),
                lines::close);
    }

    @Override
    public int countTokens(ChatRequest request) {
        ensureReady();
        ObjectNode payload = objectMapper.createObjectNode();
        payload.set("contents", toWire(request).get("contents"));

        String responseBody = sendForBody(newRequest(modelPath(request.model(), ":countTokens"), false)
                .POST(HttpRequest.BodyPublishers.ofString(serialize(payload)))
                .build());
        return readTree(responseBody).path("totalTokens").asInt(0);
    }

    @Override
    public boolean interleavesTextWithCalls() {
        return true;
    }

    @Override
    protected void authorize(HttpRequest.Builder builder) {
        builder.header("x-goog-api-key", config.apiKey());
    }

    // ── Canonical → wire ─────────────────────────────────────────────────────

    ObjectNode toWire(ChatRequest request) {
        ObjectNode root = objectMapper.createObjectNode();

        ArrayNode contents = root.putArray("contents");
        for (CanonicalMessage message : request.messages()) {
            ObjectNode content = contents.addObject();
            // function responses travel in a user-role content
            content.put("role", switch (message.role()) {
                case USER, TOOL -> "user";
                case MODEL      -> "model";
            });
            ArrayNode parts = content.putArray("parts");
            for (Part part : message.parts()) {
                appendPart(parts, part);
            }
        }

        if (request.systemInstruction() != null && !request.systemInstruction().isBlank()) {
            root.putObject("systemInstruction").putArray("parts").addObject()
                    .put("text", request.systemInstruction());
        }

        if (!request.tools().isEmpty()) {
            ArrayNode declarations = root.putArray("tools").addObject().putArray("functionDeclarations");
            for (FunctionDeclaration declaration : request.tools()) {
                ObjectNode function = declarations.addObject().put("name", declaration.name());
                if (declaration.description() != null) function.put("description", declaration.description());
                if (declaration.parameters() != null)  function.set("parameters", declaration.parameters());
            }
        }

        ObjectNode generationConfig = toGenerationConfig(request.generationConfig());
        if (!generationConfig.isEmpty()) root.set("generationConfig", generationConfig);
        return root;
    }

    private void appendPart(ArrayNode parts, Part part) {
        if (part instanceof TextPart text) {
            parts.addObject().put("text", text.text());
        } else if (part instanceof FunctionCallPart call) {
            ObjectNode functionCall = parts.addObject().putObject("functionCall");
            functionCall.put("name", call.call().name());
            functionCall.set("args", objectMapper.valueToTree(call.call().args()));
        } else if (part instanceof FunctionResponsePart response) {
            ToolCallResult result = response.result();
            ObjectNode functionResponse = parts.addObject().putObject("functionResponse");
            functionResponse.put("name", result.name());
            ObjectNode payload = functionResponse.putObject("response");
            if (result.success()) {
                payload.put("output", result.output() == null ? "" : result.output());
            } else {
                payload.put("error", result.contentForModel());
            }
        }
    }

    private ObjectNode toGenerationConfig(GenerationConfig generation) {
        ObjectNode node = objectMapper.createObjectNode();
        if (generation.temperature() != null) node.put("temperature", generation.temperature());
        if (generation.maxTokens() != null)   node.put("maxOutputTokens", generation.maxTokens());
        if (generation.topP() != null)        node.put("topP", generation.topP());
        if (generation.topK() != null)        node.put("topK", generation.topK());
        if (generation.stopSequences() != null && !generation.stopSequences().isEmpty()) {
            ArrayNode stop = node.putArray("stopSequences");
            generation.stopSequences().forEach(stop::add);
        }
        return node;
    }

    // ── Wire → canonical ─────────────────────────────────────────────────────

    ChatResponse parseResponse(JsonNode root, String requestedModel) {
        JsonNode candidate = root.path("candidates").path(0);
        List<Part> parts = readParts(candidate.path("content").path("parts"));

        return new ChatResponse(
                CanonicalMessage.model(parts),
                mapFinishReason(candidate.path("finishReason").asText(null)),
                parseUsage(root.get("usageMetadata")),
                root.path("modelVersion").asText(requestedModel),
                Map.of());
    }

    /** Text and function-call parts of one candidate; "thought" parts are skipped. */
    List<Part> readParts(JsonNode partsNode) {
        List<Part> parts = new ArrayList<>();
        for (JsonNode part : partsNode) {
            if (part.path("thought").asBoolean(false)) continue;
            if (part.hasNonNull("text")) {
                parts.add(new TextPart(part.get("text").asText()));
            } else if (part.hasNonNull("functionCall")) {
                JsonNode call = part.get("functionCall");
                parts.add(new FunctionCallPart(new ToolCallRequest(
                        call.path("id").asText(null),
                        call.path("name").asText(),
                        toArgs(call.get("args")))));
            }
        }
        return parts;
    }

    static Usage parseUsage(JsonNode usage) {
        if (usage == null || usage.isNull()) return null;
        int prompt     = usage.path("promptTokenCount").asInt(0);
        int completion = usage.path("candidatesTokenCount").asInt(0);
        int total      = usage.path("totalTokenCount").asInt(prompt + completion);
        return new Usage(prompt, completion, total);
    }

    static FinishReason mapFinishReason(String reason) {
        if (reason == null) return null;
        return switch (reason) {
            case "STOP"                                        -> FinishReason.STOP;
            case "MAX_TOKENS"                                  -> FinishReason.LENGTH;
            case "SAFETY", "RECITATION", "BLOCKLIST",
                 "PROHIBITED_CONTENT", "SPII"                  -> FinishReason.CONTENT_FILTER;
            case "MALFORMED_FUNCTION_CALL"                     -> FinishReason.ERROR;
            default                                            -> FinishReason.STOP;
        };
    }

    private static String modelPath(String model, String method) {
        return "/models/" + URLEncoder.encode(model, StandardCharsets.UTF_8) + method;
    }
}
