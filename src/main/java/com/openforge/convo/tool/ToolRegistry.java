package com.openforge.convo.tool;

import com.openforge.convo.agent.CancellationToken;
import com.openforge.convo.llm.model.FunctionDeclaration;
import com.openforge.convo.llm.model.ToolCallRequest;
import com.openforge.convo.llm.model.ToolCallResult;

import java.util.List;

/**
 * Enumerates and runs the tools a model may call.
 *
 * {@link #executeToolCall} returns a failed result for every expected
 * failure (unknown tool, bad arguments, tool error, cancellation) and throws
 * only for unexpected infrastructure failures.
 */
public interface ToolRegistry {

    List<FunctionDeclaration> getFunctionDeclarations();

    ToolCallResult executeToolCall(ToolCallRequest request, CancellationToken cancellation);
}
