package com.openforge.convo.llm.model;

/**
 * Predicates the turn loop uses to tell "model asking to act" from
 * "tool reporting back".  Both are total: null or empty messages are neither.
 */
public final class MessageInspector {

    private MessageInspector() {
    }

    /** True iff every part of the message is a function call. */
    public static boolean isToolCall(CanonicalMessage message) {
        if (message == null || message.parts().isEmpty()) return false;
        return message.parts().stream().allMatch(p -> p instanceof FunctionCallPart);
    }

    /** True iff every part of the message is a function response. */
    public static boolean isToolResponse(CanonicalMessage message) {
        if (message == null || message.parts().isEmpty()) return false;
        return message.parts().stream().allMatch(p -> p instanceof FunctionResponsePart);
    }
}
