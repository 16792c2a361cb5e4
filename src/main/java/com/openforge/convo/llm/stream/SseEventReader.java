package com.openforge.convo.llm.stream;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Groups raw SSE lines into {@link SseEvent}s.
 *
 * Framing:
 *   event: content_block_delta      ← optional
 *   data: {"type":"..."}            ← one or more
 *   (blank line)                    ← dispatch
 *
 * Lines starting with ':' are comments (keep-alives) and are dropped.
 * A trailing event without its blank line is still dispatched at end of input.
 * Reads lazily: one line at a time from the underlying iterator.
 */
public class SseEventReader implements Iterator<SseEvent> {

    private static final String DATA_FIELD  = "data:";
    private static final String EVENT_FIELD = "event:";

    private final Iterator<String> lines;
    private SseEvent next;

    public SseEventReader(Iterator<String> lines) {
        this.lines = lines;
    }

    @Override
    public boolean hasNext() {
        if (next == null) next = readEvent();
        return next != null;
    }

    @Override
    public SseEvent next() {
        if (!hasNext()) throw new NoSuchElementException();
        SseEvent event = next;
        next = null;
        return event;
    }

    private SseEvent readEvent() {
        String        eventName = null;
        StringBuilder data      = null;

        while (lines.hasNext()) {
            String line = lines.next();

            if (line.isEmpty()) {
                if (data != null) return new SseEvent(eventName, data.toString());
                eventName = null;
                continue;
            }
            if (line.startsWith(":")) continue;

            if (line.startsWith(DATA_FIELD)) {
                String value = fieldValue(line, DATA_FIELD);
                if (data == null) {
                    data = new StringBuilder(value);
                } else {
                    data.append('\n').append(value);
                }
            } else if (line.startsWith(EVENT_FIELD)) {
                eventName = fieldValue(line, EVENT_FIELD);
            }
            // id: and retry: are not used by any supported provider
        }
        return data == null ? null : new SseEvent(eventName, data.toString());
    }

    private static String fieldValue(String line, String field) {
        String value = line.substring(field.length());
        return value.startsWith(" ") ? value.substring(1) : value;
    }
}
