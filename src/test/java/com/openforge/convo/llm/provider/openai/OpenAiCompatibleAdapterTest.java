package com.openforge.convo.llm.provider.openai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openforge.convo.llm.exception.ApiException;
import com.openforge.convo.llm.exception.ConfigurationException;
import com.openforge.convo.llm.exception.QuotaExceededException;
import com.openforge.convo.llm.exception.QuotaKind;
import com.openforge.convo.llm.exception.TransportException;
import com.openforge.convo.llm.model.CanonicalMessage;
import com.openforge.convo.llm.model.ChatRequest;
import com.openforge.convo.llm.model.ChatResponse;
import com.openforge.convo.llm.model.FinishReason;
import com.openforge.convo.llm.model.FunctionCallPart;
import com.openforge.convo.llm.model.FunctionDeclaration;
import com.openforge.convo.llm.model.GenerationConfig;
import com.openforge.convo.llm.model.StreamChunk;
import com.openforge.convo.llm.model.ToolCallRequest;
import com.openforge.convo.llm.model.ToolCallResult;
import com.openforge.convo.llm.model.ToolErrorType;
import com.openforge.convo.llm.provider.ProviderConfig;
import com.openforge.convo.llm.provider.ProviderId;
import com.openforge.convo.llm.provider.StubProviderServer;
import com.openforge.convo.llm.stream.ChunkStream;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.RetryRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class OpenAiCompatibleAdapterTest {

    private static final String KEY = "sk-test-0123456789abcdef";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private StubProviderServer      server;
    private OpenAiCompatibleAdapter adapter;

    @BeforeEach
    void setUp() throws Exception {
        server  = StubProviderServer.start();
        adapter = newAdapter(ProviderId.OPENAI);
        adapter.initialize(new ProviderConfig(ProviderId.OPENAI, KEY, server.baseUrl(), 5_000, 0));
    }

    @AfterEach
    void tearDown() {
        adapter.close();
        server.close();
    }

    // ── Canonical → wire ─────────────────────────────────────────────────────

    @Test
    @DisplayName("History maps to system, user, assistant tool_calls and one tool message per result")
    void toWireMapsHistory() throws Exception {
        // Given
        ToolCallRequest call = new ToolCallRequest("call_1", "read_file", Map.of("path", "a.txt"));
        ToolCallRequest other = new ToolCallRequest("call_2", "list_directory", Map.of());
        ChatRequest request = ChatRequest.builder()
                .model("gpt-4o")
                .systemInstruction("Be brief.")
                .messages(List.of(
                        CanonicalMessage.user("Read a.txt"),
                        CanonicalMessage.model(List.of(new FunctionCallPart(call), new FunctionCallPart(other))),
                        CanonicalMessage.toolResults(List.of(
                                ToolCallResult.success(call, "hello"),
                                ToolCallResult.failure(other, ToolErrorType.EXECUTION_FAILED, "boom")))))
                .tools(List.of(new FunctionDeclaration("read_file", "Reads a file",
                        objectMapper.readTree("{\"type\":\"object\"}"))))
                .build();

        // When
        ObjectNode wire = adapter.toWire(request, false);

        // Then
        JsonNode messages = wire.get("messages");
        assertEquals("gpt-4o", wire.get("model").asText());
        assertEquals(5, messages.size());
        assertEquals("system", messages.get(0).get("role").asText());
        assertEquals("Be brief.", messages.get(0).get("content").asText());
        assertEquals("user", messages.get(1).get("role").asText());

        JsonNode assistant = messages.get(2);
        assertEquals("assistant", assistant.get("role").asText());
        assertTrue(assistant.get("content").isNull());
        assertEquals("call_1", assistant.at("/tool_calls/0/id").asText());
        assertEquals("read_file", assistant.at("/tool_calls/0/function/name").asText());
        assertEquals(Map.of("path", "a.txt"),
                objectMapper.readValue(assistant.at("/tool_calls/0/function/arguments").asText(), Map.class));

        assertEquals("tool", messages.get(3).get("role").asText());
        assertEquals("call_1", messages.get(3).get("tool_call_id").asText());
        assertEquals("hello", messages.get(3).get("content").asText());
        assertEquals("[ToolError:EXECUTION_FAILED] boom", messages.get(4).get("content").asText());

        assertEquals("read_file", wire.at("/tools/0/function/name").asText());
        assertEquals("auto", wire.get("tool_choice").asText());
        assertEquals(0.7, wire.get("temperature").asDouble());
        assertEquals(2048, wire.get("max_tokens").asInt());
        assertFalse(wire.has("stream"));
    }

    @Test
    @DisplayName("DeepSeek reasoner models get max_tokens only")
    void reasonerOmitsSamplingParameters() {
        OpenAiCompatibleAdapter deepseek = newAdapter(ProviderId.DEEPSEEK);
        ChatRequest request = ChatRequest.builder()
                .model("deepseek-reasoner")
                .messages(List.of(CanonicalMessage.user("hi")))
                .generationConfig(GenerationConfig.builder()
                        .temperature(0.2).topP(0.9).maxTokens(512).stopSequences(List.of("END")).build())
                .build();

        ObjectNode wire = deepseek.toWire(request, false);

        assertEquals(512, wire.get("max_tokens").asInt());
        assertFalse(wire.has("temperature"));
        assertFalse(wire.has("top_p"));
        assertFalse(wire.has("stop"));
    }

    @Test
    @DisplayName("Streaming requests ask for usage only where the provider supports it")
    void streamOptionsPerProvider() {
        ChatRequest request = ChatRequest.builder()
                .model("gpt-4o")
                .messages(List.of(CanonicalMessage.user("hi")))
                .build();

        ObjectNode openai = adapter.toWire(request, true);
        ObjectNode groq   = newAdapter(ProviderId.GROQ).toWire(request.withModel("llama-3.3-70b-versatile"), true);

        assertTrue(openai.get("stream").asBoolean());
        assertTrue(openai.at("/stream_options/include_usage").asBoolean());
        assertTrue(groq.get("stream").asBoolean());
        assertFalse(groq.has("stream_options"));
    }

    // ── Wire → canonical ─────────────────────────────────────────────────────

    @Test
    @DisplayName("chat() posts to /chat/completions with a bearer token and maps the reply")
    void chatRoundTrip() {
        // Given
        server.json("/chat/completions", 200, """
                {"id":"chatcmpl-1","model":"gpt-4o-2024-08-06",
                 "choices":[{"index":0,"message":{"role":"assistant","content":"Hi there"},"finish_reason":"stop"}],
                 "usage":{"prompt_tokens":9,"completion_tokens":3,"total_tokens":12}}
                """);

        // When
        ChatResponse response = adapter.chat(userRequest("hello"));

        // Then
        assertEquals("Hi there", response.text());
        assertEquals(FinishReason.STOP, response.finishReason());
        assertEquals(12, response.usage().totalTokens());
        assertEquals("gpt-4o-2024-08-06", response.model());
        assertEquals("chatcmpl-1", response.metadata().get("id"));

        StubProviderServer.Recorded sent = server.lastRequest();
        assertEquals("POST", sent.method());
        assertEquals("/chat/completions", sent.path());
        assertEquals("Bearer " + KEY, sent.header("Authorization"));
        assertTrue(sent.body().contains("\"hello\""));
    }

    @Test
    @DisplayName("Tool calls in a reply carry parsed arguments and the TOOL_CALLS finish reason")
    void parsesToolCalls() throws Exception {
        JsonNode root = objectMapper.readTree("""
                {"choices":[{"message":{"role":"assistant","content":null,
                  "tool_calls":[{"id":"call_9","type":"function",
                                 "function":{"name":"read_file","arguments":"{\\"path\\":\\"b.txt\\"}"}}]},
                  "finish_reason":"tool_calls"}]}
                """);

        ChatResponse response = adapter.parseResponse(root, "gpt-4o");

        assertEquals("", response.text());
        assertEquals(FinishReason.TOOL_CALLS, response.finishReason());
        assertEquals(List.of(new ToolCallRequest("call_9", "read_file", Map.of("path", "b.txt"))),
                response.functionCalls());
        assertNull(response.usage());
        assertEquals("gpt-4o", response.model());
    }

    @Test
    @DisplayName("Streaming assembles text deltas and fragmented tool-call arguments; nothing is sent before the first pull")
    void streamingAssemblesFragments() {
        // Given
        server.eventStream("/chat/completions", """
                data: {"choices":[{"delta":{"content":"Hel"}}]}

                data: {"choices":[{"delta":{"content":"lo"}}]}

                : keep-alive

                data: {"choices":[{"delta":{"tool_calls":[{"index":0,"id":"call_1","function":{"name":"read_file","arguments":"{\\"pa"}}]}}]}

                data: {"choices":[{"delta":{"tool_calls":[{"index":0,"function":{"arguments":"th\\":\\"a.txt\\"}"}}]}}]}

                data: {"choices":[{"delta":{},"finish_reason":"tool_calls"}]}

                data: {"choices":[],"usage":{"prompt_tokens":9,"completion_tokens":12,"total_tokens":21}}

                data: [DONE]

                """);

        // When
        List<StreamChunk> chunks = new ArrayList<>();
        try (ChunkStream stream = adapter.streamChat(userRequest("read a.txt"))) {
            assertTrue(server.requests().isEmpty());
            stream.forEachRemaining(chunks::add);
        }

        // Then
        StreamChunk last = chunks.get(chunks.size() - 1);
        assertTrue(last.done());
        assertEquals(1, chunks.stream().filter(StreamChunk::done).count());
        assertEquals("Hello", last.accumulatedText());
        assertEquals(FinishReason.TOOL_CALLS, last.finishReason());
        assertEquals(21, last.usage().totalTokens());

        List<ToolCallRequest> calls = chunks.stream().flatMap(c -> c.functionCalls().stream()).toList();
        assertEquals(List.of(new ToolCallRequest("call_1", "read_file", Map.of("path", "a.txt"))), calls);

        StubProviderServer.Recorded sent = server.lastRequest();
        assertEquals("text/event-stream", sent.header("Accept"));
        assertTrue(sent.body().contains("\"stream\":true"));
    }

    // ── Failures ─────────────────────────────────────────────────────────────

    @Test
    @DisplayName("HTTP 429 becomes a generic quota error with the Retry-After hint")
    void rateLimitIsQuota() {
        server.json("/chat/completions", 429, """
                {"error":{"message":"Rate limit reached for gpt-4o","type":"requests","code":"rate_limit_exceeded"}}
                """, Map.of("Retry-After", "7"));

        QuotaExceededException e = assertThrows(QuotaExceededException.class,
                () -> adapter.chat(userRequest("hello")));

        assertEquals(QuotaKind.GENERIC, e.getKind());
        assertEquals(429, e.getStatusCode());
        assertEquals(7, e.getRetryAfter().getSeconds());
        assertEquals(ProviderId.OPENAI, e.getProvider());
    }

    @Test
    @DisplayName("An error on a streaming request surfaces on the first pull")
    void streamingErrorStatus() {
        server.json("/chat/completions", 401, """
                {"error":{"message":"Incorrect API key provided","type":"invalid_request_error"}}
                """);

        ChunkStream stream = adapter.streamChat(userRequest("hello"));
        ApiException e = assertThrows(ApiException.class, stream::hasNext);

        assertTrue(e.isAuthenticationError());
        assertEquals("Incorrect API key provided", e.getMessage());
    }

    @Test
    @DisplayName("A refused connection is a transport failure")
    void connectionRefused() {
        OpenAiCompatibleAdapter offline = newAdapter(ProviderId.OPENAI);
        offline.initialize(new ProviderConfig(ProviderId.OPENAI, KEY, "http://127.0.0.1:1", 2_000, 0));

        assertThrows(TransportException.class, () -> offline.chat(userRequest("hello")));
    }

    // ── Lifecycle ────────────────────────────────────────────────────────────

    @Test
    @DisplayName("initialize() is idempotent for the same config and rejects a different one")
    void initializeIdempotent() {
        ProviderConfig same = new ProviderConfig(ProviderId.OPENAI, KEY, server.baseUrl(), 5_000, 0);
        ProviderConfig different = new ProviderConfig(ProviderId.OPENAI, KEY, server.baseUrl(), 9_000, 0);

        assertDoesNotThrow(() -> adapter.initialize(same));
        assertThrows(IllegalStateException.class, () -> adapter.initialize(different));
    }

    @Test
    @DisplayName("Missing key, relative base URL or a foreign provider's config are configuration errors")
    void invalidConfig() {
        assertThrows(ConfigurationException.class, () -> newAdapter(ProviderId.OPENAI)
                .initialize(new ProviderConfig(ProviderId.OPENAI, " ", server.baseUrl(), 5_000, 0)));
        assertThrows(ConfigurationException.class, () -> newAdapter(ProviderId.OPENAI)
                .initialize(new ProviderConfig(ProviderId.OPENAI, KEY, "/v1", 5_000, 0)));
        assertThrows(ConfigurationException.class, () -> newAdapter(ProviderId.OPENAI)
                .initialize(new ProviderConfig(ProviderId.GROQ, KEY, server.baseUrl(), 5_000, 0)));
    }

    @Test
    @DisplayName("Calls before initialize() or after close() are rejected; no token counting endpoint")
    void lifecycleGuards() {
        OpenAiCompatibleAdapter fresh = newAdapter(ProviderId.OPENAI);
        assertThrows(IllegalStateException.class, () -> fresh.chat(userRequest("x")));

        adapter.close();
        assertThrows(IllegalStateException.class, () -> adapter.streamChat(userRequest("x")));
        assertThrows(UnsupportedOperationException.class, () -> adapter.countTokens(userRequest("x")));
        assertFalse(adapter.interleavesTextWithCalls());
    }

    @Test
    @DisplayName("Concatenated stream deltas equal chat() content for the same request")
    void streamMatchesChat() {
        // Given
        server.json("/chat/completions", 200, """
                {"choices":[{"index":0,"message":{"role":"assistant","content":"The answer is 42."},"finish_reason":"stop"}]}
                """);
        String chatText = adapter.chat(userRequest("question")).text();

        server.eventStream("/chat/completions", """
                data: {"choices":[{"delta":{"role":"assistant","content":""}}]}

                data: {"choices":[{"delta":{"content":"The answer"}}]}

                data: {"choices":[{"delta":{"content":" is 42."}}]}

                data: {"choices":[{"delta":{},"finish_reason":"stop"}]}

                data: [DONE]

                """);

        // When
        String streamed = StubProviderServer.streamedText(adapter.streamChat(userRequest("question")));

        // Then
        assertEquals("The answer is 42.", chatText);
        assertEquals(chatText, streamed);
        List<StubProviderServer.Recorded> sent = server.requests();
        assertEquals(sent.get(0).bodyWithoutStreamFlags(), sent.get(1).bodyWithoutStreamFlags());
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private OpenAiCompatibleAdapter newAdapter(ProviderId id) {
        return new OpenAiCompatibleAdapter(id, StubProviderServer.client(), objectMapper,
                RetryRegistry.ofDefaults(), CircuitBreakerRegistry.ofDefaults());
    }

    private static ChatRequest userRequest(String prompt) {
        return ChatRequest.builder()
                .model("gpt-4o")
                .messages(List.of(CanonicalMessage.user(prompt)))
                .build();
    }
}
