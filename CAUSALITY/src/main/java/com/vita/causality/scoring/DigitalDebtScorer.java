package com.vita.causality.scoring;

import com.vita.causality.domain.model.BehavioralEvent;
import com.vita.causality.domain.model.TimeWindow;
import com.vita.causality.domain.repository.HealthDataStore;
import com.vita.causality.tool.ScreenTimeSplit;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Digital debt score (0-100) from genuine passive screen minutes and peak dopamine debt.
 * Scrolling that follows a glucose crash is not counted.
 */
@Component
public class DigitalDebtScorer {

    private final HealthDataStore store;

    public DigitalDebtScorer(HealthDataStore store) {
        this.store = store;
    }

    public double score(TimeWindow window) {
        List<BehavioralEvent> passive = store.queryBehaviors(window).stream()
                .filter(BehavioralEvent::isPassive)
                .toList();
        if (passive.isEmpty()) {
            return 0.0;
        }

        ScreenTimeSplit split = ScreenTimeSplit.of(passive, store.queryGlucose(window));
        double maxDopamine = passive.stream()
                .filter(e -> e.getDopamineDebtScore() != null)
                .mapToDouble(BehavioralEvent::getDopamineDebtScore)
                .max()
                .orElse(0.0);

        return Math.min(Math.min(split.genuineMinutes() / 60.0, 1.0) * 60.0 + maxDopamine * 0.4, 100.0);
    }
}
