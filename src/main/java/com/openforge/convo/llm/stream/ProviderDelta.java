package com.openforge.convo.llm.stream;

import com.openforge.convo.llm.model.FinishReason;
import com.openforge.convo.llm.model.ToolCallRequest;
import com.openforge.convo.llm.model.Usage;

import java.util.List;

/**
 * What one raw provider event means, as read by a {@link StreamShape}.
 *
 *   text            - text delta carried by the event, may be empty
 *   completedCalls  - function calls that became complete with this event
 *   usage           - usage snapshot if the event reports one
 *   finishReason    - finish reason if the event reports one
 *   terminal        - the provider's end-of-stream signal
 */
public record ProviderDelta(
        String                text,
        List<ToolCallRequest> completedCalls,
        Usage                 usage,
        FinishReason          finishReason,
        boolean               terminal
) {

    public static final ProviderDelta EMPTY = new ProviderDelta("", List.of(), null, null, false);

    public ProviderDelta {
        text           = text == null ? "" : text;
        completedCalls = completedCalls == null ? List.of() : List.copyOf(completedCalls);
    }

    public static ProviderDelta text(String text) {
        return new ProviderDelta(text, List.of(), null, null, false);
    }

    public static ProviderDelta endOfStream() {
        return new ProviderDelta("", List.of(), null, null, true);
    }

    boolean isEmpty() {
        return text.isEmpty() && completedCalls.isEmpty() && usage == null
                && finishReason == null && !terminal;
    }
}
