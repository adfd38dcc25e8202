package com.vita.causality.api.v1;

import com.vita.causality.domain.model.CausalExplanation;
import com.vita.causality.domain.model.Counterfactual;
import com.vita.causality.domain.model.NodeType;
import com.vita.causality.domain.repository.HealthDataStore.HealthDataUnavailableException;
import com.vita.causality.engine.CausalPath;
import com.vita.causality.engine.CausalityEngine;
import com.vita.causality.engine.DebtScores;
import com.vita.causality.scm.EdgeWeightLearner.LearningSummary;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;

/**
 * REST API controller for causal reasoning operations.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/causal")
@Tag(name = "Causal", description = "Symptom explanation, counterfactuals and causal graph operations")
public class CausalController {

    private final CausalityEngine engine;

    public CausalController(CausalityEngine engine) {
        this.engine = engine;
    }

    @PostMapping("/query")
    @Operation(summary = "Explain symptom", description = "Explain a symptom from recent health data")
    public Mono<ResponseEntity<QueryResponse>> query(@RequestBody QueryRequest request) {
        if (request.getSymptom() == null || request.getSymptom().isBlank()) {
            return Mono.just(ResponseEntity.badRequest()
                    .body(QueryResponse.builder().error("symptom must not be blank").build()));
        }

        String symptom = request.getSymptom().trim();
        return engine.querySymptom(symptom)
                .map(explanations -> ResponseEntity.ok(QueryResponse.builder()
                        .symptom(symptom)
                        .explanations(explanations)
                        .counterfactuals(request.isIncludeCounterfactuals()
                                ? engine.generateCounterfactuals(symptom, explanations)
                                : List.of())
                        .maturityPhase(engine.currentPhase().name())
                        .timestamp(Instant.now())
                        .build()))
                .onErrorResume(HealthDataUnavailableException.class, error -> {
                    log.error("Symptom query failed: {}", error.getMessage());
                    return Mono.just(ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                            .body(QueryResponse.builder().symptom(symptom).error(error.getMessage()).build()));
                });
    }

    @GetMapping("/counterfactuals/{nodeId}")
    @Operation(summary = "Counterfactuals for node", description = "What-if interventions for a health event node")
    public Mono<ResponseEntity<List<Counterfactual>>> counterfactualsForNode(
            @Parameter(description = "Event node ID, e.g. meal_42") @PathVariable String nodeId) {
        return Mono.fromCallable(() -> ResponseEntity.ok(engine.generateCounterfactuals(nodeId)));
    }

    @PostMapping("/counterfactuals")
    @Operation(summary = "Counterfactuals for symptom",
            description = "What-if interventions matched against a set of explanations")
    public Mono<ResponseEntity<List<Counterfactual>>> counterfactualsForSymptom(
            @RequestBody CounterfactualRequest request) {
        if (request.getSymptom() == null || request.getSymptom().isBlank()) {
            return Mono.just(ResponseEntity.badRequest().build());
        }
        List<CausalExplanation> explanations = request.getExplanations() != null ? request.getExplanations() : List.of();
        return Mono.fromCallable(() -> ResponseEntity.ok(
                engine.generateCounterfactuals(request.getSymptom(), explanations)));
    }

    @GetMapping("/debt")
    @Operation(summary = "Debt scores", description = "Digestive, digital and somatic debt scores (0-100)")
    public Mono<ResponseEntity<DebtScores>> debt(
            @Parameter(description = "Trailing window in hours") @RequestParam(defaultValue = "24") int windowHours) {
        if (windowHours <= 0) {
            return Mono.just(ResponseEntity.badRequest().build());
        }
        return Mono.fromCallable(() -> ResponseEntity.ok(engine.debtScores(windowHours)))
                .onErrorResume(HealthDataUnavailableException.class,
                        error -> Mono.just(ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build()));
    }

    @GetMapping("/paths")
    @Operation(summary = "Causal paths", description = "Learned causal paths from a category to symptoms")
    public Mono<ResponseEntity<PathsResponse>> paths(
            @Parameter(description = "Source category") @RequestParam(defaultValue = "MEAL") NodeType from) {
        return Mono.fromCallable(() -> {
                    List<CausalPath> paths = engine.tracePaths(from);
                    return ResponseEntity.ok(PathsResponse.builder()
                            .from(from)
                            .paths(paths)
                            .total(paths.size())
                            .build());
                })
                .onErrorResume(HealthDataUnavailableException.class,
                        error -> Mono.just(ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build()));
    }

    @PostMapping("/learning/run")
    @Operation(summary = "Run edge learning", description = "Run one meal to glucose edge-learning batch now")
    public Mono<ResponseEntity<LearningSummary>> runLearning() {
        return Mono.fromCallable(() -> ResponseEntity.ok(engine.updateGraph()))
                .onErrorResume(HealthDataUnavailableException.class,
                        error -> Mono.just(ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build()));
    }

    // ========== DTOs ==========

    @lombok.Data
    public static class QueryRequest {
        private String symptom;
        private boolean includeCounterfactuals;
    }

    @lombok.Data
    @lombok.Builder
    public static class QueryResponse {
        private String symptom;
        private List<CausalExplanation> explanations;
        private List<Counterfactual> counterfactuals;
        private String maturityPhase;
        private Instant timestamp;
        private String error;
    }

    @lombok.Data
    public static class CounterfactualRequest {
        private String symptom;
        private List<CausalExplanation> explanations;
    }

    @lombok.Data
    @lombok.Builder
    public static class PathsResponse {
        private NodeType from;
        private List<CausalPath> paths;
        private int total;
    }
}
