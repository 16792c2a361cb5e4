package com.openforge.convo.tool;

import com.openforge.convo.agent.CancellationToken;
import com.openforge.convo.llm.model.FunctionDeclaration;

import java.util.Map;

/**
 * A local capability the model may invoke.
 *
 * Implementations throw {@link ToolException} for expected failures (bad
 * arguments, missing file); the registry turns those into failed results.
 * Long-running tools must poll the token and stop promptly.
 */
public interface Tool {

    FunctionDeclaration declaration();

    default String name() {
        return declaration().name();
    }

    String execute(Map<String, Object> args, CancellationToken cancellation);
}
