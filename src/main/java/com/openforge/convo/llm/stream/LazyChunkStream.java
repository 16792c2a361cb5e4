package com.openforge.convo.llm.stream;

import com.openforge.convo.llm.model.StreamChunk;

import java.util.NoSuchElementException;
import java.util.function.Supplier;

/**
 * Defers opening the underlying stream (the HTTP request) until the
 * consumer first pulls.  Closing before that point sends nothing.
 */
public class LazyChunkStream implements ChunkStream {

    private final Supplier<ChunkStream> opener;
    private ChunkStream delegate;
    private boolean     closed;

    public LazyChunkStream(Supplier<ChunkStream> opener) {
        this.opener = opener;
    }

    @Override
    public boolean hasNext() {
        if (closed) return false;
        if (delegate == null) delegate = opener.get();
        return delegate.hasNext();
    }

    @Override
    public StreamChunk next() {
        if (!hasNext()) throw new NoSuchElementException();
        return delegate.next();
    }

    @Override
    public void close() {
        closed = true;
        if (delegate != null) delegate.close();
    }
}
