package com.openforge.convo.cli;

import com.openforge.convo.agent.event.SessionEvent;
import com.openforge.convo.agent.event.SessionEventListener;
import com.openforge.convo.llm.model.ToolCallResult;
import lombok.extern.slf4j.Slf4j;

import java.io.PrintStream;

/**
 * Renders session events on the terminal.
 *
 *   stdout  the model's text, streamed as it arrives
 *   stderr  notices, tool activity, errors
 *
 * Keeping stdout to the answer alone lets the output be piped.
 */
@Slf4j
public class ConsoleEventPublisher implements SessionEventListener {

    private final PrintStream out;
    private final PrintStream err;
    private final boolean     verbose;
    private       boolean     midLine;

    public ConsoleEventPublisher(PrintStream out, PrintStream err, boolean verbose) {
        this.out     = out;
        this.err     = err;
        this.verbose = verbose;
    }

    @Override
    public void onEvent(SessionEvent event) {
        try {
            render(event);
        } catch (RuntimeException e) {
            log.warn("[Publisher] Failed to render {} event: {}", event.type(), e.getMessage());
        }
    }

    private void render(SessionEvent event) {
        switch (event.type()) {
            case TEXT_DELTA -> {
                out.print(event.content());
                out.flush();
                midLine = !event.content().endsWith("\n");
            }
            case NOTICE -> {
                endLine();
                err.println(event.content());
            }
            case TOOL_EXECUTING -> {
                endLine();
                err.println("[tool] " + event.content());
            }
            case TOOL_RESULT -> {
                ToolCallResult result = (ToolCallResult) event.payload();
                if (!result.success()) {
                    err.println("[tool] " + result.name() + " failed: " + result.error().message());
                } else if (verbose) {
                    err.println("[tool] " + result.name() + " ok");
                }
            }
            case COMPLETED -> endLine();
            case ERROR -> {
                endLine();
                err.println(event.content());
            }
            case ABORTED -> {
                endLine();
                err.println("[Aborted] " + event.content());
            }
            case TURN_STARTED -> {
                if (verbose) err.println("[turn " + event.turn() + "] " + event.content());
            }
        }
    }

    private void endLine() {
        if (midLine) {
            out.println();
            out.flush();
            midLine = false;
        }
    }
}
