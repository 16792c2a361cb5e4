package com.openforge.convo.llm.model;

import java.util.List;

/**
 * One canonical increment of a streaming response.
 *
 *   delta            - text produced by this chunk (never null, may be empty)
 *   accumulatedText  - all text so far, including this delta
 *   functionCalls    - calls that became complete with this chunk
 *   usage            - token usage once the provider reports it
 *   finishReason     - set on the terminal chunk when known
 *   done             - true on exactly one chunk, the last one
 */
public record StreamChunk(
        String                delta,
        String                accumulatedText,
        List<ToolCallRequest> functionCalls,
        Usage                 usage,
        FinishReason          finishReason,
        boolean               done
) {

    public StreamChunk {
        delta         = delta == null ? "" : delta;
        functionCalls = functionCalls == null ? List.of() : List.copyOf(functionCalls);
    }

    public boolean hasFunctionCalls() {
        return !functionCalls.isEmpty();
    }
}
