package com.openforge.convo.tool;

import com.openforge.convo.agent.CancellationToken;
import com.openforge.convo.llm.model.ToolCallRequest;
import com.openforge.convo.llm.model.ToolCallResult;
import com.openforge.convo.llm.model.ToolErrorType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs all tool calls of one turn side by side and waits for every one of
 * them (full barrier) before returning.
 *
 * Results come back in request order regardless of completion order.  An
 * exception thrown by the registry for one call becomes a failed result for
 * that call only.  If the session is cancelled while waiting, outstanding
 * calls are interrupted and reported as CANCELLED.
 */
@Slf4j
@Component
public class ToolExecutor {

    private static final long POLL_MILLIS = 100;

    private final ExecutorService executor;

    public ToolExecutor(@Qualifier("toolExecutorService") ExecutorService executor) {
        this.executor = executor;
    }

    public List<ToolCallResult> executeAll(ToolRegistry registry,
                                           List<ToolCallRequest> requests,
                                           CancellationToken cancellation) {
        List<Future<ToolCallResult>> futures = new ArrayList<>(requests.size());
        for (ToolCallRequest request : requests) {
            futures.add(executor.submit(() -> registry.executeToolCall(request, cancellation)));
        }

        List<ToolCallResult> results = new ArrayList<>(requests.size());
        for (int i = 0; i < requests.size(); i++) {
            results.add(await(futures.get(i), requests.get(i), cancellation));
        }
        return results;
    }

    private ToolCallResult await(Future<ToolCallResult> future, ToolCallRequest request, CancellationToken cancellation) {
        while (true) {
            if (cancellation.isCancelled() && !future.isDone()) {
                future.cancel(true);
                return ToolCallResult.failure(request, ToolErrorType.CANCELLED, "Cancelled: " + cancellation.reason());
            }
            try {
                return future.get(POLL_MILLIS, TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                // still running; re-check cancellation
            } catch (CancellationException e) {
                return ToolCallResult.failure(request, ToolErrorType.CANCELLED, "Cancelled.");
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.error("[ToolExecutor] Tool {} id={} crashed: {}", request.name(), request.id(), cause.toString(), cause);
                return ToolCallResult.failure(request, ToolErrorType.EXECUTION_FAILED,
                        "Unexpected failure: " + cause.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                cancellation.cancel("interrupted");
                future.cancel(true);
                return ToolCallResult.failure(request, ToolErrorType.CANCELLED, "Interrupted.");
            }
        }
    }
}
