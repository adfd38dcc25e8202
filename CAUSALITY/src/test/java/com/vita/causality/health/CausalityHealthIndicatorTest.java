package com.vita.causality.health;

import com.vita.causality.config.CausalityProperties;
import com.vita.causality.domain.repository.HealthDataStore.HealthDataUnavailableException;
import com.vita.causality.maturity.EngineMaturityTracker;
import com.vita.causality.maturity.MaturityPhase;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.actuate.health.Status;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CausalityHealthIndicatorTest {

    @Mock
    private EngineMaturityTracker maturityTracker;

    @Test
    void upWithPhaseDetails() {
        when(maturityTracker.currentPhase()).thenReturn(MaturityPhase.CORRELATION);
        CausalityHealthIndicator indicator = new CausalityHealthIndicator(maturityTracker, new CausalityProperties());

        StepVerifier.create(indicator.health())
                .assertNext(health -> {
                    assertThat(health.getStatus()).isEqualTo(Status.UP);
                    assertThat(health.getDetails())
                            .containsEntry("maturityPhase", "CORRELATION")
                            .containsEntry("useReAct", false)
                            .containsEntry("maxTools", 1);
                })
                .verifyComplete();
    }

    @Test
    void downWhenStoreUnavailable() {
        when(maturityTracker.currentPhase()).thenThrow(new HealthDataUnavailableException("connection refused"));
        CausalityHealthIndicator indicator = new CausalityHealthIndicator(maturityTracker, new CausalityProperties());

        StepVerifier.create(indicator.health())
                .assertNext(health -> {
                    assertThat(health.getStatus()).isEqualTo(Status.DOWN);
                    assertThat(health.getDetails()).containsEntry("store.error", "connection refused");
                })
                .verifyComplete();
    }
}
