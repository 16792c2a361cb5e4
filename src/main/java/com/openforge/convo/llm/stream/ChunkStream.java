package com.openforge.convo.llm.stream;

import com.openforge.convo.llm.model.StreamChunk;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Pull-based, finite, single-use sequence of {@link StreamChunk}s.
 *
 * The consumer drives the network: nothing is read until {@link #hasNext()}
 * is called, and closing the stream releases the HTTP body even when the
 * consumer stops early (cancellation).  To retry, issue a fresh call.
 */
public interface ChunkStream extends Iterator<StreamChunk>, AutoCloseable {

    @Override
    void close();

    /** A stream over already-built chunks.  Used by stubs and tests. */
    static ChunkStream of(List<StreamChunk> chunks) {
        Iterator<StreamChunk> it = List.copyOf(chunks).iterator();
        return new ChunkStream() {
            private boolean closed;

            @Override
            public boolean hasNext() {
                return !closed && it.hasNext();
            }

            @Override
            public StreamChunk next() {
                if (!hasNext()) throw new NoSuchElementException();
                return it.next();
            }

            @Override
            public void close() {
                closed = true;
            }
        };
    }
}
