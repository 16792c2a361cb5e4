package com.openforge.convo.llm.provider;

/**
 * Wire-format families.  Every {@link ProviderId} belongs to exactly one,
 * and {@link ProviderRegistry} keeps one adapter factory per family.
 */
public enum AdapterFamily {

    /** POST {base}/chat/completions, SSE "data:" frames ending with [DONE]. */
    OPENAI_COMPATIBLE,

    /** POST {base}/models/{m}:generateContent and :streamGenerateContent?alt=sse. */
    GEMINI,

    /** POST {base}/messages, typed SSE events ending with message_stop. */
    ANTHROPIC,

    /** POST {base}/api/chat, newline-delimited JSON with an explicit "done" flag. */
    OLLAMA
}
