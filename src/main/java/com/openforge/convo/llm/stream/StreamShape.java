package com.openforge.convo.llm.stream;

import com.openforge.convo.llm.model.ToolCallRequest;

import java.util.List;

/**
 * Provider-specific reading of a raw stream.
 *
 * One instance per stream: shapes may hold assembly state (OpenAI and
 * Anthropic stream tool-call arguments as JSON fragments).
 *
 * @param <E> raw event type produced by the transport reader
 */
public interface StreamShape<E> {

    /** Interpret one raw event: text delta, usage, finish reason, terminal flag. */
    ProviderDelta interpret(E event);

    /** Calls still being assembled when the source ran dry or went terminal. */
    default List<ToolCallRequest> drainPendingCalls() {
        return List.of();
    }
}
