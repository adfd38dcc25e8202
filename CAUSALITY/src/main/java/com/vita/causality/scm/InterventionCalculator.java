package com.vita.causality.scm;

import com.vita.causality.config.CausalityProperties;
import com.vita.causality.domain.model.CausalExplanation;
import com.vita.causality.domain.model.Counterfactual;
import com.vita.causality.domain.model.Counterfactual.Effort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Counterfactual generation from curated intervention templates.
 * <p>
 * Template families are picked by keyword: from a node identifier, or from the joined causal
 * chains of a set of explanations. Impact, effort and confidence are literal template values.
 */
@Slf4j
@Component
public class InterventionCalculator {

    static final List<Counterfactual> MEAL = List.of(
            new Counterfactual("Switch to whole wheat flour (-35% glucose spike)", 0.35, Effort.TRIVIAL, 0.85),
            new Counterfactual("Add 15g fat/protein before carbs to flatten curve", 0.25, Effort.TRIVIAL, 0.75),
            new Counterfactual("Pressure cook instead of slow cook (-95% lectins)", 0.40, Effort.TRIVIAL, 0.82),
            new Counterfactual("Take a 10-minute walk after meals", 0.25, Effort.MODERATE, 0.78)
    );

    static final List<Counterfactual> BEHAVIOR = List.of(
            new Counterfactual("Limit passive scrolling to 15-min blocks", 0.45, Effort.SIGNIFICANT, 0.70),
            new Counterfactual("Use Focus Mode during deep work blocks", 0.30, Effort.MODERATE, 0.65),
            new Counterfactual("Replace scrolling with a 5-min walk", 0.35, Effort.MODERATE, 0.72)
    );

    static final List<Counterfactual> SLEEP = List.of(
            new Counterfactual("Eat dinner 2 hours earlier (+25 min deep sleep)", 0.30, Effort.MODERATE, 0.75),
            new Counterfactual("Keep dinner GL below 20", 0.22, Effort.MODERATE, 0.68),
            new Counterfactual("Stop screens 1 hour before bed", 0.18, Effort.SIGNIFICANT, 0.60)
    );

    static final List<Counterfactual> ENVIRONMENT = List.of(
            new Counterfactual("Exercise indoors when AQI > 100", 0.30, Effort.TRIVIAL, 0.75),
            new Counterfactual("Use air purifier on high-AQI days", 0.25, Effort.MODERATE, 0.68),
            new Counterfactual("Take antihistamine on high-pollen days", 0.20, Effort.TRIVIAL, 0.62)
    );

    private final CausalityProperties properties;

    public InterventionCalculator(CausalityProperties properties) {
        this.properties = properties;
    }

    /**
     * Counterfactuals for a single event node. Falls back to the leading meal and sleep
     * templates when the identifier names no known family.
     */
    public List<Counterfactual> generateCounterfactuals(String nodeId) {
        List<Counterfactual> matches = new ArrayList<>();
        String id = nodeId == null ? "" : nodeId;

        if (id.contains("meal")) {
            matches.addAll(MEAL);
        }
        if (id.contains("behavioral") || id.contains("screen")) {
            matches.addAll(BEHAVIOR);
        }
        if (id.contains("glucose")) {
            matches.addAll(MEAL);
        }
        if (id.contains("environment")) {
            matches.addAll(ENVIRONMENT);
        }

        if (matches.isEmpty()) {
            log.debug("No template family for node {}, using general interventions", nodeId);
            return general();
        }
        return distinctByDescription(matches);
    }

    /**
     * Counterfactuals informed by a symptom's explanations, deduplicated and capped.
     * Returns an empty list when no chain names a known family.
     */
    public List<Counterfactual> generateCounterfactualsForSymptom(String symptom,
                                                                  List<CausalExplanation> explanations) {
        List<Counterfactual> matches = new ArrayList<>();

        for (CausalExplanation explanation : explanations) {
            String chain = String.join(" ", explanation.getCausalChain()).toLowerCase(Locale.ROOT);

            if (chain.contains("glucose") || chain.contains("meal") || chain.contains("roti") || chain.contains("gl")) {
                matches.addAll(MEAL);
            }
            if (chain.contains("screen") || chain.contains("scroll") || chain.contains("dopamine")) {
                matches.addAll(BEHAVIOR);
            }
            if (chain.contains("sleep")) {
                matches.addAll(SLEEP);
            }
            if (chain.contains("aqi") || chain.contains("pollen") || chain.contains("environment")) {
                matches.addAll(ENVIRONMENT);
            }
        }

        List<Counterfactual> distinct = distinctByDescription(matches);
        int cap = properties.getInterventions().getMaxSymptomCounterfactuals();
        log.debug("Symptom '{}' matched {} distinct interventions from {} explanations",
                symptom, distinct.size(), explanations.size());
        return distinct.size() > cap ? List.copyOf(distinct.subList(0, cap)) : distinct;
    }

    private static List<Counterfactual> general() {
        List<Counterfactual> general = new ArrayList<>(MEAL.subList(0, 2));
        general.add(SLEEP.get(0));
        return List.copyOf(general);
    }

    private static List<Counterfactual> distinctByDescription(List<Counterfactual> counterfactuals) {
        Map<String, Counterfactual> seen = new LinkedHashMap<>();
        for (Counterfactual counterfactual : counterfactuals) {
            seen.putIfAbsent(counterfactual.description(), counterfactual);
        }
        return List.copyOf(seen.values());
    }
}
