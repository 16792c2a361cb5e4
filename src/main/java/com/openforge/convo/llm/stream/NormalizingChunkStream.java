package com.openforge.convo.llm.stream;

import com.openforge.convo.llm.exception.StreamInterruptedException;
import com.openforge.convo.llm.model.FinishReason;
import com.openforge.convo.llm.model.StreamChunk;
import com.openforge.convo.llm.model.ToolCallRequest;
import com.openforge.convo.llm.model.Usage;
import lombok.extern.slf4j.Slf4j;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Wraps a raw provider event iterator into canonical {@link StreamChunk}s.
 *
 * Per event:
 *   raw event ──▶ StreamShape.interpret() ──▶ ProviderDelta
 *                                               │
 *        append text to the running total ◀────┘
 *        remember latest usage / finish reason
 *        emit a chunk (events that carry nothing are skipped)
 *
 * Termination: the shape's terminal flag, or exhaustion of the source,
 * whichever comes first.  Exactly one chunk has done=true; on exhaustion
 * it is synthesized.  At most one raw event is held at a time.
 *
 * An I/O failure from the source after the stream opened is rethrown as
 * {@link StreamInterruptedException}, never swallowed as an early end.
 */
@Slf4j
public class NormalizingChunkStream<E> implements ChunkStream {

    private final String         label;
    private final Iterator<E>    source;
    private final StreamShape<E> shape;
    private final Runnable       onClose;

    private final StringBuilder accumulated = new StringBuilder();
    private Usage        usage;
    private FinishReason finishReason;
    private StreamChunk  pending;
    private boolean      sawCalls;
    private boolean      finished;
    private boolean      closed;

    public NormalizingChunkStream(String label, Iterator<E> source, StreamShape<E> shape, Runnable onClose) {
        this.label   = label;
        this.source  = source;
        this.shape   = shape;
        this.onClose = onClose;
    }

    // ── Iterator ─────────────────────────────────────────────────────────────

    @Override
    public boolean hasNext() {
        if (pending != null) return true;
        if (finished || closed) return false;
        pending = advance();
        return pending != null;
    }

    @Override
    public StreamChunk next() {
        if (!hasNext()) throw new NoSuchElementException("Stream [%s] is exhausted".formatted(label));
        StreamChunk chunk = pending;
        pending = null;
        if (chunk.done()) close();
        return chunk;
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        try {
            onClose.run();
        } catch (RuntimeException e) {
            log.debug("[Stream:{}] Ignoring failure while releasing the response body: {}", label, e.getMessage());
        }
    }

    // ── Assembly ─────────────────────────────────────────────────────────────

    private StreamChunk advance() {
        while (true) {
            if (!sourceHasNext()) {
                finished = true;
                return terminalChunk("", shape.drainPendingCalls());
            }

            ProviderDelta delta = shape.interpret(sourceNext());
            if (delta == null || delta.isEmpty()) continue;

            if (delta.usage() != null)        usage        = delta.usage();
            if (delta.finishReason() != null) finishReason = delta.finishReason();
            if (!delta.completedCalls().isEmpty()) sawCalls = true;
            accumulated.append(delta.text());

            if (delta.terminal()) {
                finished = true;
                List<ToolCallRequest> calls = new ArrayList<>(delta.completedCalls());
                calls.addAll(shape.drainPendingCalls());
                return terminalChunk(delta.text(), calls);
            }

            if (delta.text().isEmpty() && delta.completedCalls().isEmpty()) {
                // usage or finish reason only; folded into the terminal chunk
                continue;
            }
            return new StreamChunk(delta.text(), accumulated.toString(), delta.completedCalls(),
                    usage, null, false);
        }
    }

    private StreamChunk terminalChunk(String delta, List<ToolCallRequest> calls) {
        boolean      anyCalls = sawCalls || !calls.isEmpty();
        FinishReason reason   = finishReason;
        if (reason == null || (reason == FinishReason.STOP && anyCalls)) {
            reason = anyCalls ? FinishReason.TOOL_CALLS : FinishReason.STOP;
        }
        log.debug("[Stream:{}] done chars={} finish={} usage={}", label, accumulated.length(), reason, usage);
        return new StreamChunk(delta, accumulated.toString(), calls, usage, reason, true);
    }

    private boolean sourceHasNext() {
        try {
            return source.hasNext();
        } catch (UncheckedIOException e) {
            throw new StreamInterruptedException(
                    "Stream [%s] broke after %d chars: %s".formatted(label, accumulated.length(), e.getMessage()), e);
        }
    }

    private E sourceNext() {
        try {
            return source.next();
        } catch (UncheckedIOException e) {
            throw new StreamInterruptedException(
                    "Stream [%s] broke after %d chars: %s".formatted(label, accumulated.length(), e.getMessage()), e);
        }
    }
}
