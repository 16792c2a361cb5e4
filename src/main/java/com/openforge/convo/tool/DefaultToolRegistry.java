package com.openforge.convo.tool;

import com.openforge.convo.agent.CancellationToken;
import com.openforge.convo.llm.exception.AbortedException;
import com.openforge.convo.llm.model.FunctionDeclaration;
import com.openforge.convo.llm.model.ToolCallRequest;
import com.openforge.convo.llm.model.ToolCallResult;
import com.openforge.convo.llm.model.ToolErrorType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Registry over every {@link Tool} bean in the context, keyed by tool name.
 */
@Slf4j
@Component
public class DefaultToolRegistry implements ToolRegistry {

    private final Map<String, Tool> tools = new LinkedHashMap<>();

    public DefaultToolRegistry(List<Tool> tools) {
        for (Tool tool : tools) {
            Tool previous = this.tools.put(tool.name(), tool);
            if (previous != null) {
                throw new IllegalStateException("Duplicate tool name: " + tool.name());
            }
        }
        log.debug("[ToolRegistry] Registered tools: {}", this.tools.keySet());
    }

    @Override
    public List<FunctionDeclaration> getFunctionDeclarations() {
        return tools.values().stream().map(Tool::declaration).toList();
    }

    @Override
    public ToolCallResult executeToolCall(ToolCallRequest request, CancellationToken cancellation) {
        Tool tool = tools.get(request.name());
        if (tool == null) {
            log.warn("[ToolRegistry] Tool \"{}\" not found in registry", request.name());
            return ToolCallResult.failure(request, ToolErrorType.TOOL_NOT_FOUND,
                    "Tool \"%s\" not found in registry.".formatted(request.name()));
        }
        if (cancellation.isCancelled()) {
            return ToolCallResult.failure(request, ToolErrorType.CANCELLED, "Cancelled before execution.");
        }

        log.info("[ToolRegistry] Executing tool: {} id={} args={}", request.name(), request.id(), request.args());
        try {
            String output = tool.execute(request.args(), cancellation);
            return ToolCallResult.success(request, output);
        } catch (ToolException e) {
            log.info("[ToolRegistry] Tool {} failed ({}): {}", request.name(), e.getType(), e.getMessage());
            return ToolCallResult.failure(request, e.getType(), e.getMessage());
        } catch (AbortedException e) {
            return ToolCallResult.failure(request, ToolErrorType.CANCELLED, e.getMessage());
        }
    }
}
