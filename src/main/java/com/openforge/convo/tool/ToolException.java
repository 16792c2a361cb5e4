package com.openforge.convo.tool;

import com.openforge.convo.llm.model.ToolErrorType;
import lombok.Getter;

/** An expected tool failure, reported back to the model as a failed result. */
@Getter
public class ToolException extends RuntimeException {

    private final ToolErrorType type;

    public ToolException(ToolErrorType type, String message) {
        super(message);
        this.type = type;
    }

    public static ToolException invalidArguments(String message) {
        return new ToolException(ToolErrorType.INVALID_ARGUMENTS, message);
    }

    public static ToolException failed(String message) {
        return new ToolException(ToolErrorType.EXECUTION_FAILED, message);
    }
}
