package com.openforge.convo.llm.stream;

/**
 * One server-sent event.  {@code event} is null when the server sent only
 * "data:" lines (OpenAI, Gemini); multi-line data is joined with '\n'.
 */
public record SseEvent(String event, String data) {

    public static final String DONE_SENTINEL = "[DONE]";

    public boolean isDoneSentinel() {
        return DONE_SENTINEL.equals(data);
    }
}
