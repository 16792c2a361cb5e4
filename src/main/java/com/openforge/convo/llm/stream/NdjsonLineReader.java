package com.openforge.convo.llm.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Reads newline-delimited JSON (one object per line), skipping blank and
 * unparseable lines.
 */
@Slf4j
public class NdjsonLineReader implements Iterator<JsonNode> {

    private final Iterator<String> lines;
    private final ObjectMapper     objectMapper;
    private JsonNode next;

    public NdjsonLineReader(Iterator<String> lines, ObjectMapper objectMapper) {
        this.lines        = lines;
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean hasNext() {
        while (next == null && lines.hasNext()) {
            String line = lines.next();
            if (line.isBlank()) continue;
            try {
                next = objectMapper.readTree(line);
            } catch (JsonProcessingException e) {
                log.warn("[NdjsonLineReader] Failed to parse line: {}", line);
            }
        }
        return next != null;
    }

    @Override
    public JsonNode next() {
        if (!hasNext()) throw new NoSuchElementException();
        JsonNode node = next;
        next = null;
        return node;
    }
}
