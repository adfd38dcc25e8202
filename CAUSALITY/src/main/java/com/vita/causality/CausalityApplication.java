package com.vita.causality;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * CAUSALITY - explainable causal reasoning over personal health data.
 *
 * <p>CAUSALITY provides:
 * <ul>
 *   <li>Symptom explanation through a bounded ReAct agent with a bio-rule fallback</li>
 *   <li>Counterfactual interventions for explained symptoms</li>
 *   <li>Metabolic, digital and somatic debt scores</li>
 *   <li>Online meal to glucose edge learning and causal path tracing</li>
 * </ul>
 */
@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties
public class CausalityApplication {

    public static void main(String[] args) {
        SpringApplication.run(CausalityApplication.class, args);
    }
}
