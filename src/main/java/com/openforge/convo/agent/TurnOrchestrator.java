package com.openforge.convo.agent;

import com.openforge.convo.agent.event.SessionEvent;
import com.openforge.convo.agent.event.SessionEventListener;
import com.openforge.convo.llm.exception.AbortedException;
import com.openforge.convo.llm.exception.LlmException;
import com.openforge.convo.llm.exception.MaxTurnsExceededException;
import com.openforge.convo.llm.fallback.ApiErrorFormatter;
import com.openforge.convo.llm.fallback.FallbackDecision;
import com.openforge.convo.llm.fallback.FallbackPolicy;
import com.openforge.convo.llm.model.CanonicalMessage;
import com.openforge.convo.llm.model.ChatRequest;
import com.openforge.convo.llm.model.ChatResponse;
import com.openforge.convo.llm.model.FinishReason;
import com.openforge.convo.llm.model.FunctionCallPart;
import com.openforge.convo.llm.model.Part;
import com.openforge.convo.llm.model.StreamChunk;
import com.openforge.convo.llm.model.TextPart;
import com.openforge.convo.llm.model.ToolCallRequest;
import com.openforge.convo.llm.model.ToolCallResult;
import com.openforge.convo.llm.provider.ProviderAdapter;
import com.openforge.convo.llm.provider.ProviderClassifier;
import com.openforge.convo.llm.provider.ProviderId;
import com.openforge.convo.llm.stream.ChunkStream;
import com.openforge.convo.llm.token.TokenCounter;
import com.openforge.convo.tool.ToolExecutor;
import com.openforge.convo.tool.ToolRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * The turn loop: ask the model, run the tools it asks for, repeat.
 *
 * Loop shape:
 *   append user prompt
 *   while true:
 *     1. CHECK     cancelled? → ABORTED
 *     2. COUNT     turn++; above the ceiling → ERROR
 *     3. ASK       classify active model, get the session's adapter,
 *                  stream (or chat) the whole history, forward deltas
 *     4. RECOVER   provider failure → fallback policy (SWITCH re-asks once)
 *     5. DECIDE    no calls → DONE; calls → run them all, append ONE tool
 *                  message with results in request order, loop
 *
 * Exactly one terminal event (COMPLETED, ERROR or ABORTED) is emitted per
 * run and nothing escapes {@link #run}: every failure ends up in the
 * returned {@link SessionOutcome}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TurnOrchestrator {

    private final ToolRegistry   toolRegistry;
    private final ToolExecutor   toolExecutor;
    private final FallbackPolicy fallbackPolicy;
    private final TokenCounter   tokenCounter;

    // ── Entry point ──────────────────────────────────────────────────────────

    public SessionOutcome run(Session session, String prompt, SessionEventListener listener) {
        String sessionId = session.getId();
        log.info("[Agent:{}] Session started. model={} fallback={}",
                sessionId, session.activeModel(), session.fallbackModel());

        try {
            session.append(CanonicalMessage.user(prompt));
            String answer = loop(session, listener);

            session.transition(TurnState.DONE);
            emit(listener, SessionEvent.completed(sessionId, answer, session.turnCount()));
            log.info("[Agent:{}] Completed in {} turn(s).", sessionId, session.turnCount());
            return outcome(session, SessionStatus.COMPLETED, answer, null, null);

        } catch (AbortedException e) {
            session.transition(TurnState.ABORTED);
            String reason = session.getCancellation().isCancelled() ? session.getCancellation().reason() : e.getMessage();
            log.info("[Agent:{}] Aborted: {}", sessionId, reason);
            emit(listener, SessionEvent.aborted(sessionId, reason, session.turnCount()));
            return outcome(session, SessionStatus.ABORTED, null, reason, e);

        } catch (MaxTurnsExceededException e) {
            session.transition(TurnState.ERROR);
            log.warn("[Agent:{}] {}", sessionId, e.getMessage());
            emit(listener, SessionEvent.error(sessionId, e.getMessage(), session.turnCount()));
            return outcome(session, SessionStatus.ERROR, null, e.getMessage(), e);

        } catch (LlmException e) {
            session.transition(TurnState.ERROR);
            String message = ApiErrorFormatter.format(e);
            log.error("[Agent:{}] Session failed: {}", sessionId, e.getMessage(), e);
            emit(listener, SessionEvent.error(sessionId, message, session.turnCount()));
            return outcome(session, SessionStatus.ERROR, null, message, e);

        } catch (RuntimeException e) {
            session.transition(TurnState.ERROR);
            log.error("[Agent:{}] Unhandled exception in loop: {}", sessionId, e.getMessage(), e);
            String message = "Unexpected error: " + e.getMessage();
            emit(listener, SessionEvent.error(sessionId, message, session.turnCount()));
            return outcome(session, SessionStatus.ERROR, null, message, e);
        }
    }

    // ── Main loop ────────────────────────────────────────────────────────────

    private String loop(Session session, SessionEventListener listener) {
        String sessionId = session.getId();
        while (true) {
            session.getCancellation().throwIfCancelled();
            if (session.turnCount() >= session.getMaxTurns()) {
                throw new MaxTurnsExceededException(session.getMaxTurns());
            }

            Turn turn = session.beginTurn();
            session.transition(TurnState.AWAITING_MODEL);
            emit(listener, SessionEvent.turnStarted(sessionId, turn.getIndex(), session.activeModel()));
            log.debug("[Agent:{}] Turn {}", sessionId, turn.getIndex());

            ModelReply reply = askWithFallback(session, turn, listener);
            List<ToolCallRequest> calls = reply.calls();
            session.append(historyMessage(reply));
            if (reply.finishReason() == FinishReason.LENGTH) {
                log.warn("[Agent:{}] Turn {} hit the output token limit; answer may be truncated",
                        sessionId, turn.getIndex());
            }

            if (calls.isEmpty()) {
                turn.finish();
                return reply.text();
            }

            // ── ACT ──────────────────────────────────────────────────────────
            session.transition(TurnState.TOOL_CALLS_PENDING);
            turn.pendingCalls(calls);
            for (ToolCallRequest call : calls) {
                emit(listener, SessionEvent.toolExecuting(sessionId, call, turn.getIndex()));
            }

            session.transition(TurnState.EXECUTING_TOOLS);
            List<ToolCallResult> results = toolExecutor.executeAll(toolRegistry, calls, session.getCancellation());
            for (ToolCallResult result : results) {
                emit(listener, SessionEvent.toolResult(sessionId, result, turn.getIndex()));
            }
            session.append(CanonicalMessage.toolResults(results));
            turn.finish();
            log.debug("[Agent:{}] Turn {} ran {} tool call(s) in {} ms",
                    sessionId, turn.getIndex(), calls.size(), turn.elapsed().toMillis());
        }
    }

    // ── THINK ────────────────────────────────────────────────────────────────

    /**
     * One model request for the current turn.  A quota failure on the active
     * model may switch to the fallback model and re-issue the request once.
     */
    private ModelReply askWithFallback(Session session, Turn turn, SessionEventListener listener) {
        boolean retried = false;
        while (true) {
            String          model    = session.activeModel();
            ProviderId      provider = ProviderClassifier.classify(model);
            ProviderAdapter adapter  = session.getAdapters().adapterFor(provider);
            ChatRequest     request  = buildRequest(session, model);

            guardContextWindow(session, adapter, request);
            try {
                return session.isStreaming()
                        ? consumeStream(session, turn, adapter, request, listener)
                        : callOnce(session, turn, adapter, request, listener);
            } catch (AbortedException e) {
                throw e;
            } catch (LlmException e) {
                if (session.getCancellation().isCancelled()) {
                    throw new AbortedException(session.getCancellation().reason());
                }
                FallbackDecision decision = fallbackPolicy.decide(session, e, retried);
                if (!decision.isSwitch()) throw e;
                retried = true;
                log.info("[Agent:{}] Retrying turn {} on {}", session.getId(), turn.getIndex(), decision.toModel());
                emit(listener, SessionEvent.notice(session.getId(), decision.notice(), turn.getIndex()));
            }
        }
    }

    private ModelReply callOnce(Session session, Turn turn, ProviderAdapter adapter,
                                ChatRequest request, SessionEventListener listener) {
        ChatResponse response = adapter.chat(request);
        session.getCancellation().throwIfCancelled();

        String text = response.text();
        if (!text.isEmpty()) {
            emit(listener, SessionEvent.textDelta(session.getId(), text, turn.getIndex()));
        }
        List<Part> parts = response.message() == null ? List.of() : response.message().parts();
        return reply(session, adapter, text, parts, response.finishReason());
    }

    private ModelReply consumeStream(Session session, Turn turn, ProviderAdapter adapter,
                                     ChatRequest request, SessionEventListener listener) {
        StringBuilder         text   = new StringBuilder();
        List<ToolCallRequest> calls  = new ArrayList<>();
        FinishReason          reason = null;

        try (ChunkStream stream = adapter.streamChat(request)) {
            while (true) {
                session.getCancellation().throwIfCancelled();
                if (!stream.hasNext()) break;
                StreamChunk chunk = stream.next();

                if (!chunk.delta().isEmpty()) {
                    text.append(chunk.delta());
                    emit(listener, SessionEvent.textDelta(session.getId(), chunk.delta(), turn.getIndex()));
                }
                calls.addAll(chunk.functionCalls());
                if (chunk.done()) {
                    reason = chunk.finishReason();
                    break;
                }
            }
        }
        session.getCancellation().throwIfCancelled();

        List<Part> parts = new ArrayList<>();
        if (!text.isEmpty()) parts.add(new TextPart(text.toString()));
        for (ToolCallRequest call : calls) {
            parts.add(new FunctionCallPart(call));
        }
        return reply(session, adapter, text.toString(), parts, reason);
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private ChatRequest buildRequest(Session session, String model) {
        return ChatRequest.builder()
                .model(model)
                .messages(session.getHistory())
                .systemInstruction(session.getSystemInstruction())
                .generationConfig(session.getGenerationConfig())
                .tools(toolRegistry.getFunctionDeclarations())
                .build();
    }

    /** Gives every call an id ("name-n" when the provider sent none) and applies the history rule. */
    private ModelReply reply(Session session, ProviderAdapter adapter, String text,
                             List<Part> rawParts, FinishReason reason) {
        List<Part>            parts = new ArrayList<>(rawParts.size());
        List<ToolCallRequest> calls = new ArrayList<>();
        for (Part part : rawParts) {
            if (part instanceof FunctionCallPart callPart) {
                ToolCallRequest call = callPart.call();
                if (call.id() == null || call.id().isBlank()) {
                    call = call.withId(call.name() + "-" + session.nextCallSequence());
                }
                calls.add(call);
                parts.add(new FunctionCallPart(call));
            } else {
                parts.add(part);
            }
        }
        return new ModelReply(text, parts, calls, reason, adapter.interleavesTextWithCalls());
    }

    /**
     * The MODEL message recorded in history.  Providers that cannot carry
     * text next to calls get the calls alone; the text was still streamed.
     */
    private static CanonicalMessage historyMessage(ModelReply reply) {
        if (reply.calls().isEmpty()) {
            return CanonicalMessage.modelText(reply.text());
        }
        if (reply.interleaves()) {
            return CanonicalMessage.model(reply.parts());
        }
        List<Part> callsOnly = new ArrayList<>(reply.calls().size());
        for (ToolCallRequest call : reply.calls()) {
            callsOnly.add(new FunctionCallPart(call));
        }
        return CanonicalMessage.model(callsOnly);
    }

    private void guardContextWindow(Session session, ProviderAdapter adapter, ChatRequest request) {
        int limit  = ProviderClassifier.approximateContextLimit(request.model());
        int tokens = tokenCounter.count(adapter, request);
        if (tokens > limit) {
            log.warn("[Agent:{}] Prompt is ~{} tokens, above the ~{} token context of {}",
                    session.getId(), tokens, limit, request.model());
        }
    }

    private static void emit(SessionEventListener listener, SessionEvent event) {
        try {
            listener.onEvent(event);
        } catch (RuntimeException e) {
            log.warn("[Agent:{}] Listener failed on {} event: {}", event.sessionId(), event.type(), e.getMessage());
        }
    }

    private static SessionOutcome outcome(Session session, SessionStatus status, String text,
                                          String message, Throwable error) {
        return new SessionOutcome(session.getId(), status, text, message, error,
                session.turnCount(), session.activeModel());
    }

    private record ModelReply(
            String                text,
            List<Part>            parts,
            List<ToolCallRequest> calls,
            FinishReason          finishReason,
            boolean               interleaves
    ) {}
}
