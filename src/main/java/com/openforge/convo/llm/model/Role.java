package com.openforge.convo.llm.model;

/**
 * Speaker of a {@link CanonicalMessage}.
 *
 *   USER   - human turn (or the CLI prompt)
 *   MODEL  - reply from the backend; may carry function calls instead of text
 *   TOOL   - results returned after executing the model's function calls
 *
 * System instructions are not a role here; they travel on {@link ChatRequest#systemInstruction()}.
 */
public enum Role {
    USER,
    MODEL,
    TOOL
}
