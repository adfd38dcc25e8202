package com.vita.causality.scoring;

import com.vita.causality.domain.model.EnvironmentalCondition;
import com.vita.causality.domain.model.PhysiologicalSample;
import com.vita.causality.domain.model.PhysiologicalSample.MetricType;
import com.vita.causality.domain.model.TimeWindow;
import com.vita.causality.domain.repository.HealthDataStore;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Somatic stress score (0-100) from the worst air-quality reading, overnight sleep and average HRV.
 */
@Component
public class SomaticStressScorer {

    private final HealthDataStore store;

    public SomaticStressScorer(HealthDataStore store) {
        this.store = store;
    }

    public double score(TimeWindow window) {
        double score = 0.0;

        List<EnvironmentalCondition> environment = store.queryEnvironment(window);
        EnvironmentalCondition worst = environment.stream()
                .max(Comparator.comparingInt(EnvironmentalCondition::getAqiUs))
                .orElse(null);
        if (worst != null) {
            score += environmentPoints(worst);
        }

        List<PhysiologicalSample> sleep = store.querySamples(MetricType.SLEEP_ANALYSIS,
                window.extendBackBy(Duration.ofHours(12)));
        if (!sleep.isEmpty()) {
            score += sleepPoints(PhysiologicalSample.sum(sleep));
        }

        OptionalDouble hrv = PhysiologicalSample.average(store.querySamples(MetricType.HRV_SDNN, window));
        if (hrv.isPresent()) {
            score += hrvPoints(hrv.getAsDouble());
        }

        return Math.min(score, 100.0);
    }

    static double environmentPoints(EnvironmentalCondition condition) {
        double points = 0.0;
        int aqi = condition.getAqiUs();
        if (aqi > 150) {
            points += 30;
        } else if (aqi > 100) {
            points += 20;
        } else if (aqi > 50) {
            points += 10;
        }

        int pollen = condition.getPollenIndex();
        if (pollen >= 10) {
            points += 15;
        } else if (pollen >= 8) {
            points += 10;
        }

        double temperature = condition.getTemperatureCelsius();
        if (temperature > 38) {
            points += 15;
        } else if (temperature > 33 || temperature < 5) {
            points += 10;
        }
        return points;
    }

    static double sleepPoints(double hours) {
        if (hours < 5) return 30;
        if (hours < 6) return 20;
        if (hours < 6.5) return 15;
        if (hours < 7) return 10;
        return 0;
    }

    static double hrvPoints(double averageHrv) {
        if (averageHrv < 30) return 20;
        if (averageHrv < 40) return 15;
        if (averageHrv < 50) return 10;
        return 0;
    }
}
