package com.openforge.convo.llm.provider;

import com.openforge.convo.llm.model.ChatRequest;
import com.openforge.convo.llm.model.ChatResponse;
import com.openforge.convo.llm.stream.ChunkStream;

/**
 * Uniform capability surface over one provider family's wire format.
 *
 * Lifecycle: create → initialize(config) → any number of calls → close().
 * One instance per session; instances are not meant for concurrent use.
 * Provider-specific types never cross this boundary: failures surface as the
 * {@code llm.exception} taxonomy, results as canonical model records.
 */
public interface ProviderAdapter extends AutoCloseable {

    ProviderId providerId();

    /** Idempotent for the same config; a different config is rejected. */
    void initialize(ProviderConfig config);

    ChatResponse chat(ChatRequest request);

    /** Lazy and single-use.  Nothing is sent until the first hasNext(). */
    ChunkStream streamChat(ChatRequest request);

    /**
     * Native prompt token count.
     *
     * @throws UnsupportedOperationException when the provider has no counting endpoint
     */
    int countTokens(ChatRequest request);

    /**
     * Whether a model turn may carry text and function calls together.
     * When false the turn loop keeps only the calls in history.
     */
    boolean interleavesTextWithCalls();

    @Override
    void close();
}
