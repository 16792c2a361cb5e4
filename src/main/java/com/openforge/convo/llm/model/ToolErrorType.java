package com.openforge.convo.llm.model;

public enum ToolErrorType {

    /** No tool with the requested name is registered. */
    TOOL_NOT_FOUND,

    /** Arguments are missing or have the wrong shape. */
    INVALID_ARGUMENTS,

    /** The tool ran and failed. */
    EXECUTION_FAILED,

    /** The session was cancelled while the tool was running. */
    CANCELLED
}
