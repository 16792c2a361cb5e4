package com.openforge.convo.agent;

import com.openforge.convo.agent.event.EventType;
import com.openforge.convo.agent.event.SessionEvent;
import com.openforge.convo.llm.exception.ApiException;
import com.openforge.convo.llm.exception.QuotaExceededException;
import com.openforge.convo.llm.exception.QuotaKind;
import com.openforge.convo.llm.fallback.FallbackPolicy;
import com.openforge.convo.llm.model.CanonicalMessage;
import com.openforge.convo.llm.model.ChatRequest;
import com.openforge.convo.llm.model.ChatResponse;
import com.openforge.convo.llm.model.FinishReason;
import com.openforge.convo.llm.model.FunctionCallPart;
import com.openforge.convo.llm.model.FunctionDeclaration;
import com.openforge.convo.llm.model.Role;
import com.openforge.convo.llm.model.StreamChunk;
import com.openforge.convo.llm.model.TextPart;
import com.openforge.convo.llm.model.ToolCallRequest;
import com.openforge.convo.llm.model.ToolCallResult;
import com.openforge.convo.llm.model.ToolErrorType;
import com.openforge.convo.llm.model.Usage;
import com.openforge.convo.llm.provider.ProviderAdapter;
import com.openforge.convo.llm.provider.ProviderAdapters;
import com.openforge.convo.llm.provider.ProviderConfig;
import com.openforge.convo.llm.provider.ProviderId;
import com.openforge.convo.llm.stream.ChunkStream;
import com.openforge.convo.llm.token.TokenCounter;
import com.openforge.convo.tool.DefaultToolRegistry;
import com.openforge.convo.tool.Tool;
import com.openforge.convo.tool.ToolExecutor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class TurnOrchestratorTest {

    private ExecutorService    pool;
    private TurnOrchestrator   orchestrator;
    private ProviderAdapter    gemini;
    private ProviderAdapter    openai;
    private final List<SessionEvent> events = new ArrayList<>();

    @BeforeEach
    void setUp() {
        pool = Executors.newFixedThreadPool(2);
        DefaultToolRegistry registry = new DefaultToolRegistry(List.of(new ReadFileStub(), new EchoStub()));
        orchestrator = new TurnOrchestrator(registry, new ToolExecutor(pool), new FallbackPolicy(), new TokenCounter());

        gemini = mockAdapter(ProviderId.GEMINI, true);
        openai = mockAdapter(ProviderId.OPENAI, false);
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    // ── Plain answer ─────────────────────────────────────────────────────────

    @Test
    @DisplayName("A reply without calls completes in one turn with the answer as final text")
    void plainAnswer() {
        // Given
        when(openai.chat(any())).thenReturn(textResponse("Paris."));
        Session session = session("gpt-4o", null, 30, false);

        // When
        SessionOutcome outcome = orchestrator.run(session, "Capital of France?", events::add);

        // Then
        assertEquals(SessionStatus.COMPLETED, outcome.status());
        assertEquals("Paris.", outcome.finalText());
        assertEquals(1, outcome.turns());
        assertEquals(List.of(EventType.TURN_STARTED, EventType.TEXT_DELTA, EventType.COMPLETED), types());
        assertEquals(List.of(Role.USER, Role.MODEL), roles(session));
        assertEquals(TurnState.DONE, session.getState());

        ArgumentCaptor<ChatRequest> sent = ArgumentCaptor.forClass(ChatRequest.class);
        verify(openai).chat(sent.capture());
        assertEquals("Be terse.", sent.getValue().systemInstruction());
        assertEquals(List.of("read_file", "echo"), sent.getValue().tools().stream().map(FunctionDeclaration::name).toList());
    }

    // ── Tool round trips ─────────────────────────────────────────────────────

    @Test
    @DisplayName("Streamed calls run, one tool message is appended, and the next turn answers")
    void toolRoundTrip() {
        // Given
        when(gemini.streamChat(any())).thenReturn(
                stream(chunk("Let me look."), calls(new ToolCallRequest(null, "read_file", Map.of("path", "a.txt")))),
                stream(chunk("It says "), chunk("hello."), done()));
        Session session = session("gemini-2.5-pro", null, 30, true);

        // When
        SessionOutcome outcome = orchestrator.run(session, "What is in a.txt?", events::add);

        // Then
        assertEquals(SessionStatus.COMPLETED, outcome.status());
        assertEquals("It says hello.", outcome.finalText());
        assertEquals(2, outcome.turns());
        assertEquals(List.of(
                EventType.TURN_STARTED, EventType.TEXT_DELTA, EventType.TOOL_EXECUTING, EventType.TOOL_RESULT,
                EventType.TURN_STARTED, EventType.TEXT_DELTA, EventType.TEXT_DELTA, EventType.COMPLETED), types());

        List<CanonicalMessage> history = session.getHistory();
        assertEquals(List.of(Role.USER, Role.MODEL, Role.TOOL, Role.MODEL), roles(session));
        assertEquals("Let me look.", history.get(1).text(), "interleaving provider keeps text next to calls");
        ToolCallRequest recorded = history.get(1).functionCalls().get(0);
        assertEquals("read_file-0", recorded.id());
        assertEquals("read_file-0", history.get(2).functionResponses().get(0).id());
        assertEquals("contents of a.txt", history.get(2).functionResponses().get(0).output());

        assertEquals(2, session.getTurns().size());
        assertEquals(0, session.getTurns().get(0).getIndex());
        assertEquals(1, session.getTurns().get(1).getIndex());
        assertEquals(0, events.get(0).turn());
        assertEquals(List.of(recorded), session.getTurns().get(0).getPendingCalls());
        assertEquals(3, session.getTurns().get(1).getHistorySnapshot().size());
    }

    @Test
    @DisplayName("Two calls in one reply both run and come back as one tool message in request order")
    void twoCallsOneToolMessage() {
        // Given
        ToolCallRequest first  = new ToolCallRequest("call_1", "echo", Map.of("x", 1));
        ToolCallRequest second = new ToolCallRequest("call_2", "echo", Map.of("x", 2));
        when(openai.chat(any())).thenReturn(
                new ChatResponse(CanonicalMessage.model(List.of(new FunctionCallPart(first), new FunctionCallPart(second))),
                        FinishReason.TOOL_CALLS, null, "gpt-4o", Map.of()),
                textResponse("Both done."));
        Session session = session("gpt-4o", null, 30, false);

        // When
        SessionOutcome outcome = orchestrator.run(session, "echo twice", events::add);

        // Then
        assertEquals(SessionStatus.COMPLETED, outcome.status());
        assertEquals("Both done.", outcome.finalText());
        assertEquals(TurnState.DONE, session.getState());
        assertEquals(List.of(Role.USER, Role.MODEL, Role.TOOL, Role.MODEL), roles(session));

        List<ToolCallResult> results = session.getHistory().get(2).functionResponses();
        assertEquals(List.of("call_1", "call_2"), results.stream().map(ToolCallResult::id).toList());
        assertEquals(List.of("x=1", "x=2"), results.stream().map(ToolCallResult::output).toList());
        assertEquals(2, events.stream().filter(e -> e.type() == EventType.TOOL_RESULT).count());
    }

    @Test
    @DisplayName("Providers that cannot interleave keep only the calls in history")
    void callsOnlyHistory() {
        when(openai.chat(any())).thenReturn(
                new ChatResponse(CanonicalMessage.model(List.of(new TextPart("Checking."),
                        new FunctionCallPart(new ToolCallRequest("call_1", "read_file", Map.of("path", "a.txt"))))),
                        FinishReason.TOOL_CALLS, null, "gpt-4o", Map.of()),
                textResponse("Done."));
        Session session = session("gpt-4o", null, 30, false);

        SessionOutcome outcome = orchestrator.run(session, "read it", events::add);

        assertTrue(outcome.isCompleted());
        CanonicalMessage modelTurn = session.getHistory().get(1);
        assertEquals("", modelTurn.text());
        assertEquals("call_1", modelTurn.functionCalls().get(0).id());
        assertTrue(events.stream().anyMatch(e -> e.type() == EventType.TEXT_DELTA && "Checking.".equals(e.content())),
                "the dropped text was still shown");
    }

    @Test
    @DisplayName("A failed tool is reported to the model and the session goes on")
    void toolFailureFedBack() {
        when(openai.chat(any())).thenReturn(
                callResponse(new ToolCallRequest("call_1", "rm_rf", Map.of())),
                textResponse("That tool does not exist."));
        Session session = session("gpt-4o", null, 30, false);

        SessionOutcome outcome = orchestrator.run(session, "clean up", events::add);

        assertTrue(outcome.isCompleted());
        assertEquals(ToolErrorType.TOOL_NOT_FOUND,
                session.getHistory().get(2).functionResponses().get(0).error().type());
    }

    // ── Cancellation ─────────────────────────────────────────────────────────

    @Test
    @DisplayName("Cancelling during a stream stops consumption and aborts without running tools")
    void cancelMidStream() {
        // Given
        CountingStream counting = new CountingStream(List.of(
                chunk("one "), chunk("two "), chunk("three "), chunk("four "), done()));
        when(gemini.streamChat(any())).thenReturn(counting);
        Session session = session("gemini-2.5-pro", null, 30, true);
        int[] deltas = {0};

        // When
        SessionOutcome outcome = orchestrator.run(session, "count", event -> {
            events.add(event);
            if (event.type() == EventType.TEXT_DELTA && ++deltas[0] == 2) {
                session.getCancellation().cancel("timeout");
            }
        });

        // Then
        assertEquals(SessionStatus.ABORTED, outcome.status());
        assertEquals("timeout", outcome.message());
        assertEquals(2, counting.consumed);
        assertTrue(counting.closed);
        assertEquals(EventType.ABORTED, events.get(events.size() - 1).type());
        assertEquals(1, events.stream().filter(e -> e.type().isTerminal()).count());
        assertEquals(TurnState.ABORTED, session.getState());
    }

    @Test
    @DisplayName("A session cancelled before it starts never calls the model")
    void cancelledBeforeStart() {
        Session session = session("gpt-4o", null, 30, false);
        session.getCancellation().cancel("interrupted");

        SessionOutcome outcome = orchestrator.run(session, "hi", events::add);

        assertEquals(SessionStatus.ABORTED, outcome.status());
        assertEquals(0, outcome.turns());
        verify(openai, never()).chat(any());
    }

    // ── Quota fallback ───────────────────────────────────────────────────────

    @Test
    @DisplayName("A Pro quota error switches to the fallback model, emits a notice and retries the turn")
    void quotaFallback() {
        // Given
        List<String> models = new ArrayList<>();
        when(gemini.chat(any())).thenAnswer(invocation -> {
            ChatRequest request = invocation.getArgument(0);
            models.add(request.model());
            if (models.size() == 1) throw proQuota();
            return textResponse("Hi from flash.");
        });
        Session session = session("gemini-2.5-pro", "gemini-2.5-flash", 30, false);

        // When
        SessionOutcome outcome = orchestrator.run(session, "hello", events::add);

        // Then
        assertEquals(SessionStatus.COMPLETED, outcome.status());
        assertEquals(List.of("gemini-2.5-pro", "gemini-2.5-flash"), models);
        assertEquals("gemini-2.5-flash", outcome.model());
        assertEquals(1, outcome.turns());
        assertEquals(List.of(EventType.TURN_STARTED, EventType.NOTICE, EventType.TEXT_DELTA, EventType.COMPLETED),
                types());
        assertTrue(events.get(1).content().contains("gemini-2.5-flash"));
    }

    @Test
    @DisplayName("A second quota error in the same turn ends the session")
    void secondQuotaFails() {
        when(gemini.chat(any())).thenThrow(proQuota());
        Session session = session("gemini-2.5-pro", "gemini-2.5-flash", 30, false);

        SessionOutcome outcome = orchestrator.run(session, "hello", events::add);

        assertEquals(SessionStatus.ERROR, outcome.status());
        assertTrue(outcome.message().startsWith("[API Error:"));
        verify(gemini, times(2)).chat(any());
    }

    @Test
    @DisplayName("Non-quota API errors are not retried")
    void apiErrorNotRetried() {
        when(openai.chat(any())).thenThrow(new ApiException(ProviderId.OPENAI, 400, "invalid_request_error",
                "Invalid schema for function", null));
        Session session = session("gpt-4o", "gpt-4o-mini", 30, false);

        SessionOutcome outcome = orchestrator.run(session, "hello", events::add);

        assertEquals(SessionStatus.ERROR, outcome.status());
        assertEquals("[API Error: Invalid schema for function (Status: invalid_request_error)]", outcome.message());
        verify(openai, times(1)).chat(any());
        assertEquals("gpt-4o", outcome.model());
    }

    // ── Turn ceiling ─────────────────────────────────────────────────────────

    @Test
    @DisplayName("A model that never stops calling tools hits the turn ceiling")
    void turnCeiling() {
        when(openai.chat(any())).thenAnswer(invocation ->
                callResponse(new ToolCallRequest(null, "read_file", Map.of("path", "a.txt"))));
        Session session = session("gpt-4o", null, 3, false);

        SessionOutcome outcome = orchestrator.run(session, "loop forever", events::add);

        assertEquals(SessionStatus.ERROR, outcome.status());
        assertEquals("Reached max session turns (3) without a final answer.", outcome.message());
        assertEquals(3, outcome.turns());
        verify(openai, times(3)).chat(any());
        List<String> ids = session.getHistory().stream()
                .filter(m -> m.role() == Role.MODEL)
                .map(m -> m.functionCalls().get(0).id())
                .toList();
        assertEquals(List.of("read_file-0", "read_file-1", "read_file-2"), ids);
    }

    @Test
    @DisplayName("A failing listener does not break the session")
    void listenerFailureIgnored() {
        when(openai.chat(any())).thenReturn(textResponse("ok"));
        Session session = session("gpt-4o", null, 30, false);

        SessionOutcome outcome = orchestrator.run(session, "hi", event -> {
            throw new IllegalStateException("console closed");
        });

        assertTrue(outcome.isCompleted());
    }

    // ── Fixtures ─────────────────────────────────────────────────────────────

    private Session session(String model, String fallback, int maxTurns, boolean streaming) {
        ProviderAdapters adapters = new ProviderAdapters(
                id -> id == ProviderId.GEMINI ? gemini : openai,
                id -> new ProviderConfig(id, "key-0123456789", "http://localhost:1", 1_000, 0));
        return new Session(model, fallback, maxTurns, streaming, "Be terse.", null, new CancellationToken(), adapters);
    }

    private static ProviderAdapter mockAdapter(ProviderId id, boolean interleaves) {
        ProviderAdapter adapter = mock(ProviderAdapter.class);
        when(adapter.providerId()).thenReturn(id);
        when(adapter.interleavesTextWithCalls()).thenReturn(interleaves);
        when(adapter.countTokens(any())).thenReturn(10);
        return adapter;
    }

    private static ChatResponse textResponse(String text) {
        return new ChatResponse(CanonicalMessage.modelText(text), FinishReason.STOP, Usage.of(5, 5), "m", Map.of());
    }

    private static ChatResponse callResponse(ToolCallRequest call) {
        return new ChatResponse(CanonicalMessage.model(List.of(new FunctionCallPart(call))),
                FinishReason.TOOL_CALLS, null, "m", Map.of());
    }

    private static QuotaExceededException proQuota() {
        return new QuotaExceededException(ProviderId.GEMINI, 429, "RESOURCE_EXHAUSTED",
                "Quota exceeded for quota metric 'Gemini 2.5 Pro Requests'", null, QuotaKind.PRO, null);
    }

    private static StreamChunk chunk(String delta) {
        return new StreamChunk(delta, null, List.of(), null, null, false);
    }

    private static StreamChunk calls(ToolCallRequest... calls) {
        return new StreamChunk("", null, List.of(calls), null, FinishReason.TOOL_CALLS, true);
    }

    private static StreamChunk done() {
        return new StreamChunk("", null, List.of(), null, FinishReason.STOP, true);
    }

    private static ChunkStream stream(StreamChunk... chunks) {
        return ChunkStream.of(List.of(chunks));
    }

    private List<EventType> types() {
        return events.stream().map(SessionEvent::type).toList();
    }

    private static List<Role> roles(Session session) {
        return session.getHistory().stream().map(CanonicalMessage::role).toList();
    }

    private static class ReadFileStub implements Tool {

        @Override
        public FunctionDeclaration declaration() {
            return new FunctionDeclaration("read_file", "Reads a file", null);
        }

        @Override
        public String execute(Map<String, Object> args, CancellationToken cancellation) {
            return "contents of " + args.get("path");
        }
    }

    /** Echoes "x=<value>"; x=1 finishes last so completion order differs from request order. */
    private static class EchoStub implements Tool {

        @Override
        public FunctionDeclaration declaration() {
            return new FunctionDeclaration("echo", "Echoes x", null);
        }

        @Override
        public String execute(Map<String, Object> args, CancellationToken cancellation) {
            if (Integer.valueOf(1).equals(args.get("x"))) {
                try {
                    Thread.sleep(100);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return "x=" + args.get("x");
        }
    }

    /** Records how many chunks the consumer actually pulled. */
    private static class CountingStream implements ChunkStream {

        private final Iterator<StreamChunk> chunks;
        int     consumed;
        boolean closed;

        CountingStream(List<StreamChunk> chunks) {
            this.chunks = chunks.iterator();
        }

        @Override
        public boolean hasNext() {
            return !closed && chunks.hasNext();
        }

        @Override
        public StreamChunk next() {
            if (!hasNext()) throw new NoSuchElementException();
            consumed++;
            return chunks.next();
        }

        @Override
        public void close() {
            closed = true;
        }
    }
}
