package com.company.incidentrisk.service;

import com.company.incidentrisk.domain.FactorContribution;
import com.company.incidentrisk.domain.FeatureRow;
import com.company.incidentrisk.domain.ModelArtifact;
import com.company.incidentrisk.domain.PredictionResult;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.company.incidentrisk.support.TestFixtures.T0;
import static com.company.incidentrisk.support.TestFixtures.errorRateModel;
import static com.company.incidentrisk.support.TestFixtures.row;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class RiskScorerTest {

    private final RiskScorer scorer = new RiskScorer();

    @Test
    void scoreIsSigmoidOfBiasPlusContributions() {
        ModelArtifact model = errorRateModel(4L, 4.0, -2.0);

        PredictionResult result = scorer.score(row("checkout", "/pay", T0, 0.5), model, 3);

        assertThat(result.getRiskScore()).isCloseTo(0.5, within(1e-12));
        assertThat(result.getModelVersion()).isEqualTo(4L);
        assertThat(result.getService()).isEqualTo("checkout");
        assertThat(result.getBucketStart()).isEqualTo(T0);
    }

    @Test
    void topFactorsAreOrderedByMagnitudeWithSchemaOrderForTies() {
        ModelArtifact model = errorRateModel(1L, 4.0, -2.0).toBuilder()
                .weights(List.of(4.0, 0.0, 0.0, 0.0, -0.5, 0.0, 0.0))
                .build();

        PredictionResult result = scorer.score(row("checkout", "/pay", T0, 0.5), model, 3);

        // errorRate 4 * 0.5 = 2, avgCpuPct -0.5 * 55 = -27.5
        assertThat(result.getTopFactors())
                .extracting(FactorContribution::getFeature)
                .containsExactly("avgCpuPct", "errorRate", "p95LatencyMs");
        assertThat(result.getTopFactors().get(0).getContribution()).isEqualTo(-27.5);
    }

    @Test
    void scoringIsDeterministicAndMonotoneInPositiveWeight() {
        ModelArtifact model = errorRateModel(1L, 3.0, -1.0);
        FeatureRow calm = row("checkout", "/pay", T0, 0.01);
        FeatureRow degraded = row("checkout", "/pay", T0, 0.4);

        assertThat(scorer.score(calm, model, 2)).isEqualTo(scorer.score(calm, model, 2));
        assertThat(scorer.score(degraded, model, 2).getRiskScore())
                .isGreaterThan(scorer.score(calm, model, 2).getRiskScore())
                .isBetween(0.0, 1.0);
    }

    @Test
    void zeroTopFactorsReturnsEmptyList() {
        PredictionResult result = scorer.score(row("checkout", "/pay", T0, 0.1), errorRateModel(1L, 1.0, 0.0), 0);

        assertThat(result.getTopFactors()).isEmpty();
    }
}
