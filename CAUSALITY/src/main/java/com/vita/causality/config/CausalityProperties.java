package com.vita.causality.config;

import com.vita.causality.maturity.MaturityPhase;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import java.time.Duration;

/**
 * Configuration properties for the CAUSALITY service.
 * <p>
 * Provides centralized configuration for:
 * <ul>
 *     <li>ReAct agent loop bounds and thresholds</li>
 *     <li>Scheduled edge-weight learning</li>
 *     <li>Narrative generation through an optional language model</li>
 *     <li>Maturity phase overrides</li>
 * </ul>
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "causality")
public class CausalityProperties {

    /** Zone used for time-of-day rules such as late meals */
    @NotBlank
    private String zone = "UTC";

    private final Agent agent = new Agent();
    private final Learning learning = new Learning();
    private final Narrative narrative = new Narrative();
    private final Maturity maturity = new Maturity();
    private final Interventions interventions = new Interventions();

    /**
     * ReAct reasoning loop configuration.
     */
    @Data
    public static class Agent {
        /** Lookback of the analysis window computed at session start */
        private Duration analysisWindow = Duration.ofHours(6);

        /** Hard cap on Act/Observe iterations */
        @Positive
        private int maxIterations = 3;

        /** Top-hypothesis confidence that ends the loop early */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double resolutionThreshold = 0.7;

        /** Below this top confidence, non-empty rule results replace the agent's */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double ruleOverrideThreshold = 0.4;

        /** Hypotheses must exceed this confidence to become explanations */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double explanationFloor = 0.15;

        @Positive
        private int maxExplanations = 3;
    }

    /**
     * Edge-weight learning schedule.
     */
    @Data
    public static class Learning {
        private boolean enabled = true;

        /** Delay between scheduled batch updates */
        private Duration interval = Duration.ofHours(1);

        /** Window mined by each batch update */
        private Duration lookback = Duration.ofHours(24);
    }

    /**
     * Narrative generation configuration.
     */
    @Data
    public static class Narrative {
        /** Whether a registered language model may be used at all */
        private boolean llmEnabled = false;

        @Positive
        private int maxTokens = 120;

        private Duration timeout = Duration.ofSeconds(10);
    }

    /**
     * Maturity phase configuration.
     */
    @Data
    public static class Maturity {
        /** When set, overrides data-driven phase detection */
        private MaturityPhase forcedPhase;
    }

    /**
     * Counterfactual generation limits.
     */
    @Data
    public static class Interventions {
        @Positive
        private int maxSymptomCounterfactuals = 5;
    }
}
