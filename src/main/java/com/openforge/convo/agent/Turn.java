package com.openforge.convo.agent;

import com.openforge.convo.llm.model.CanonicalMessage;
import com.openforge.convo.llm.model.ToolCallRequest;
import lombok.Getter;

import java.time.Duration;
import java.util.List;

/**
 * One model round-trip plus the tool batch it requested, if any.
 * The history snapshot is the conversation as sent to the model.
 * Indices start at 0 and grow by one per turn within a session.
 */
@Getter
public class Turn {

    private final int                    index;
    private final List<CanonicalMessage> historySnapshot;
    private final long                   startedNanos = System.nanoTime();
    private       List<ToolCallRequest>  pendingCalls = List.of();
    private       long                   finishedNanos;

    Turn(int index, List<CanonicalMessage> historySnapshot) {
        this.index           = index;
        this.historySnapshot = List.copyOf(historySnapshot);
    }

    void pendingCalls(List<ToolCallRequest> calls) {
        this.pendingCalls = List.copyOf(calls);
    }

    void finish() {
        if (finishedNanos == 0) finishedNanos = System.nanoTime();
    }

    public Duration elapsed() {
        long end = finishedNanos == 0 ? System.nanoTime() : finishedNanos;
        return Duration.ofNanos(end - startedNanos);
    }
}
