package com.vita.causality.tool;

import com.vita.causality.domain.model.DebtType;
import com.vita.causality.domain.model.Hypothesis;
import com.vita.causality.domain.model.TimeWindow;
import com.vita.causality.domain.model.ToolObservation;

import java.util.List;
import java.util.Set;

/**
 * Evidence-gathering step the agent can run against the health data store.
 */
public interface AnalysisTool {

    /**
     * Unique tool name, recorded on every observation it produces.
     */
    String getName();

    /**
     * Debt categories this tool is most informative about.
     */
    Set<DebtType> getTargetDebtTypes();

    /**
     * Inspect the window and score each category it has evidence for.
     *
     * @param hypotheses the current ranked hypotheses
     * @param window the session's analysis window
     * @return the observation; never null
     */
    ToolObservation analyze(List<Hypothesis> hypotheses, TimeWindow window);
}
