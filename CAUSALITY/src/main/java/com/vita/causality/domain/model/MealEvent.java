package com.vita.causality.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * A consumption event with the data needed to estimate its glycemic impact.
 */
@Value
@Builder(toBuilder = true)
public class MealEvent {

    /** Carbohydrate share assumed for ingredient weight */
    private static final double AVAILABLE_CARB_RATIO = 0.7;

    Long id;

    Instant timestamp;

    @Builder.Default
    MealSource source = MealSource.MANUAL;

    @Singular
    List<Ingredient> ingredients;

    String cookingMethod;

    /** Externally estimated glycemic load, preferred over the computed value when present */
    Double estimatedGlycemicLoad;

    /** Cooking bioavailability modifier; above 1.0 means better absorption */
    Double bioavailabilityModifier;

    /**
     * Glycemic load from ingredients: Σ GI × (grams × 0.7) / 100.
     */
    public double computedGlycemicLoad() {
        double total = 0.0;
        for (Ingredient ingredient : ingredients) {
            if (ingredient.getGlycemicIndex() == null || ingredient.getQuantityGrams() == null) {
                continue;
            }
            double carbGrams = ingredient.getQuantityGrams() * AVAILABLE_CARB_RATIO;
            total += ingredient.getGlycemicIndex() * carbGrams / 100.0;
        }
        return total;
    }

    public double effectiveGlycemicLoad() {
        return estimatedGlycemicLoad != null ? estimatedGlycemicLoad : computedGlycemicLoad();
    }

    /**
     * Short label: the first ingredient name, else the source.
     */
    public String displayName() {
        if (!ingredients.isEmpty() && ingredients.get(0).getName() != null) {
            return ingredients.get(0).getName();
        }
        return source.label();
    }

    public String nodeId() {
        return NodeType.MEAL.nodeId(id);
    }

    public enum MealSource {
        ROTIMATIC_NEXT("rotimatic_next"),
        INSTANT_POT("instant_pot"),
        INSTACART("instacart"),
        DOORDASH("doordash"),
        MANUAL("manual");

        private final String label;

        MealSource(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }

    @Value
    @Builder
    public static class Ingredient {
        String name;
        Double quantityGrams;
        Double glycemicIndex;
        /** Macro category, e.g. "protein" or "grain" */
        String type;
    }
}
