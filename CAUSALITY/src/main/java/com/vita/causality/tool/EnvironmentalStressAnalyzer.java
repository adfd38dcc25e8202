package com.vita.causality.tool;

import com.vita.causality.domain.model.DebtType;
import com.vita.causality.domain.model.EnvironmentalCondition;
import com.vita.causality.domain.model.Hypothesis;
import com.vita.causality.domain.model.PhysiologicalSample;
import com.vita.causality.domain.model.PhysiologicalSample.MetricType;
import com.vita.causality.domain.model.TimeWindow;
import com.vita.causality.domain.model.ToolObservation;
import com.vita.causality.domain.repository.HealthDataStore;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Scores air quality, pollen, heat and UV exposure, cross-checked against an HRV drop
 * from the seven-day baseline.
 */
@Component
@Order(5)
public class EnvironmentalStressAnalyzer implements AnalysisTool {

    public static final String NAME = "EnvironmentalStressAnalyzer";

    private final HealthDataStore store;

    public EnvironmentalStressAnalyzer(HealthDataStore store) {
        this.store = store;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public Set<DebtType> getTargetDebtTypes() {
        return Set.of(DebtType.SOMATIC);
    }

    @Override
    public ToolObservation analyze(List<Hypothesis> hypotheses, TimeWindow window) {
        List<EnvironmentalCondition> environment = store.queryEnvironment(window);

        if (environment.isEmpty()) {
            return ToolObservation.builder()
                    .toolName(NAME)
                    .evidence(Map.of(DebtType.SOMATIC, 0.0))
                    .confidence(0.3)
                    .detail("No environmental data available")
                    .build();
        }

        int maxAqi = environment.stream().mapToInt(EnvironmentalCondition::getAqiUs).max().orElse(0);
        int maxPollen = environment.stream().mapToInt(EnvironmentalCondition::getPollenIndex).max().orElse(0);
        double maxTemp = environment.stream().mapToDouble(EnvironmentalCondition::getTemperatureCelsius).max().orElse(20);
        double maxUv = environment.stream().mapToDouble(EnvironmentalCondition::getUvIndex).max().orElse(0);

        double aqiScore = aqiScore(maxAqi);
        double pollenScore = pollenScore(maxPollen);
        double heatScore = heatScore(maxTemp);
        double uvScore = maxUv > 7 ? 0.2 : 0.0;

        double environmentalScore = Math.max(aqiScore, Math.max(pollenScore, heatScore)) * 0.6
                + Math.min(aqiScore + pollenScore + heatScore + uvScore, 1.0) * 0.4;

        double hrvConfirmation = 0.0;
        OptionalDouble current = PhysiologicalSample.average(store.querySamples(MetricType.HRV_SDNN, window));
        OptionalDouble baseline = PhysiologicalSample.average(
                store.querySamples(MetricType.HRV_SDNN, window.precedingBy(Duration.ofDays(7))));
        if (current.isPresent() && baseline.isPresent() && baseline.getAsDouble() > 0) {
            double drop = (baseline.getAsDouble() - current.getAsDouble()) / baseline.getAsDouble();
            if (drop > 0.1) {
                hrvConfirmation = Math.min(drop, 0.3);
            }
        }

        return ToolObservation.builder()
                .toolName(NAME)
                .evidence(Map.of(DebtType.SOMATIC, Math.min(environmentalScore + hrvConfirmation, 1.0)))
                .confidence(0.7)
                .detail(String.format(Locale.ROOT, "AQI: %d (%.0f%%), Pollen: %d, Temp: %.0fC",
                        maxAqi, aqiScore * 100, maxPollen, maxTemp))
                .build();
    }

    static double aqiScore(int aqi) {
        if (aqi > 150) return 0.8;
        if (aqi > 100) return 0.5;
        if (aqi > 50) return 0.2;
        return 0.0;
    }

    static double pollenScore(int pollen) {
        if (pollen >= 10) return 0.7;
        if (pollen >= 8) return 0.5;
        if (pollen >= 5) return 0.2;
        return 0.0;
    }

    static double heatScore(double temperatureCelsius) {
        if (temperatureCelsius > 38) return 0.7;
        if (temperatureCelsius > 33) return 0.4;
        if (temperatureCelsius < 5) return 0.3;
        return 0.0;
    }
}
