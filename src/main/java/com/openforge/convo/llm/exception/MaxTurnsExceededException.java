package com.openforge.convo.llm.exception;

import lombok.Getter;

@Getter
public class MaxTurnsExceededException extends LlmException {

    private final int maxTurns;

    public MaxTurnsExceededException(int maxTurns) {
        super("Reached max session turns (%d) without a final answer.".formatted(maxTurns));
        this.maxTurns = maxTurns;
    }
}
