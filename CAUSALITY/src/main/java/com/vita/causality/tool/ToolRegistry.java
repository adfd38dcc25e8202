package com.vita.causality.tool;

import com.vita.causality.domain.model.AgentState;
import com.vita.causality.domain.model.DebtType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Ordered registry of analysis tools.
 * Selects the next tool for a session from the top hypothesis and the tools already run.
 */
@Component
@Slf4j
public class ToolRegistry {

    private final List<AnalysisTool> tools;

    public ToolRegistry(List<AnalysisTool> toolList) {
        this.tools = List.copyOf(toolList);
        for (AnalysisTool tool : tools) {
            log.info("Registered tool: {} (targets {})", tool.getName(), tool.getTargetDebtTypes());
        }
    }

    /**
     * Pick the first tool, in registration order, that targets the leading hypothesis
     * and has not yet been run. Falls back to any tool not yet run.
     *
     * @param state the session state
     * @return the next tool, or empty once every tool has been run
     */
    public Optional<AnalysisTool> selectTool(AgentState state) {
        Set<String> investigated = state.investigatedTools();
        Optional<DebtType> leading = state.topHypothesis().map(h -> h.getDebtType());

        if (leading.isPresent()) {
            Optional<AnalysisTool> targeted = tools.stream()
                    .filter(tool -> !investigated.contains(tool.getName()))
                    .filter(tool -> tool.getTargetDebtTypes().contains(leading.get()))
                    .findFirst();
            if (targeted.isPresent()) {
                return targeted;
            }
        }

        return tools.stream()
                .filter(tool -> !investigated.contains(tool.getName()))
                .findFirst();
    }

    public List<AnalysisTool> getAllTools() {
        return Collections.unmodifiableList(tools);
    }
}
