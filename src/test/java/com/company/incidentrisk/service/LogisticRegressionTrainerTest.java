package com.company.incidentrisk.service;

import com.company.incidentrisk.domain.Feature;
import com.company.incidentrisk.domain.FittedModel;
import com.company.incidentrisk.domain.TrainingRow;
import com.company.incidentrisk.domain.enums.StopReason;
import com.company.incidentrisk.exception.TrainingInterruptedException;
import com.company.incidentrisk.support.TestFixtures;
import com.company.incidentrisk.util.CancellationToken;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static com.company.incidentrisk.support.TestFixtures.T0;
import static com.company.incidentrisk.support.TestFixtures.row;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.assertj.core.api.Assertions.within;

class LogisticRegressionTrainerTest {

    private static final double[] ERROR_RATES = {0.05, 0.15, 0.35, 0.45};

    private final Clock clock = Clock.fixed(T0.plus(Duration.ofDays(1)), ZoneOffset.UTC);
    private final LogisticRegressionTrainer trainer = new LogisticRegressionTrainer(clock);
    private final List<Feature> features = Feature.schema(false);

    private static List<TrainingRow> separableRows(int n) {
        List<TrainingRow> rows = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            double errorRate = ERROR_RATES[i % ERROR_RATES.length];
            rows.add(new TrainingRow(row("checkout", "/pay", T0.plus(Duration.ofMinutes(5L * i)), errorRate),
                    errorRate > 0.25 ? 1 : 0));
        }
        return rows;
    }

    @Test
    void learnsPositiveWeightForErrorRate() {
        FittedModel model = trainer.fit(separableRows(100), features,
                TestFixtures.hyperparameters(), CancellationToken.none());

        assertThat(model.getFeatures()).hasSize(7).doesNotContain(Feature.TOTAL_REQUESTS);
        assertThat(model.getWeights().get(features.indexOf(Feature.ERROR_RATE))).isPositive();
        assertThat(model.getMetadata().getFitRows()).isEqualTo(80);
        assertThat(model.getMetadata().getValidationRows()).isEqualTo(20);
        assertThat(model.getMetadata().getPositiveRows()).isEqualTo(50);
        assertThat(model.getMetadata().getValidationAuc()).isEqualTo(1.0);
        assertThat(model.getMetadata().getValidationLoss()).isNotNull();
        assertThat(model.getMetadata().getTrainedAt()).isEqualTo(clock.instant());
        assertThat(model.getMetadata().getWindowStart()).isEqualTo(T0);
    }

    @Test
    void constantFeatureGetsUnitStdAndZeroWeight() {
        FittedModel model = trainer.fit(separableRows(40), features,
                TestFixtures.hyperparameters(), CancellationToken.none());

        int memory = features.indexOf(Feature.AVG_MEMORY_MB);
        assertThat(model.getMeans().get(memory)).isEqualTo(256.0);
        assertThat(model.getStdDevs().get(memory)).isEqualTo(1.0);
        assertThat(model.getWeights().get(memory)).isZero();
    }

    @Test
    void inputOrderDoesNotChangeTheModel() {
        List<TrainingRow> rows = separableRows(60);
        List<TrainingRow> shuffled = new ArrayList<>(rows);
        Collections.shuffle(shuffled, new Random(7));

        FittedModel a = trainer.fit(rows, features,
                TestFixtures.hyperparameters(), CancellationToken.none());
        FittedModel b = trainer.fit(shuffled, features,
                TestFixtures.hyperparameters(), CancellationToken.none());

        assertThat(b).isEqualTo(a);
    }

    @Test
    void stopsWhenLossImprovementFallsBelowTolerance() {
        FittedModel model = trainer.fit(separableRows(40), features,
                TestFixtures.hyperparameters().toBuilder().tolerance(1.0).build(), CancellationToken.none());

        assertThat(model.getMetadata().getStopReason()).isEqualTo(StopReason.CONVERGED);
        assertThat(model.getMetadata().getIterations()).isEqualTo(2);
    }

    @Test
    void runsToIterationCapWithoutConvergence() {
        FittedModel model = trainer.fit(separableRows(40), features,
                TestFixtures.hyperparameters().toBuilder().maxIterations(5).tolerance(0.0).build(),
                CancellationToken.none());

        assertThat(model.getMetadata().getStopReason()).isEqualTo(StopReason.MAX_ITERATIONS);
        assertThat(model.getMetadata().getIterations()).isEqualTo(5);
    }

    @Test
    void cancelledTokenStopsTrainingWithPartialMetadata() {
        CancellationToken token = CancellationToken.none();
        token.cancel();

        TrainingInterruptedException ex = catchThrowableOfType(
                () -> trainer.fit(separableRows(40), features, TestFixtures.hyperparameters(), token),
                TrainingInterruptedException.class);

        FittedModel partial = ex.getPartialResult();
        assertThat(partial.getMetadata().getStopReason()).isEqualTo(StopReason.CANCELLED);
        assertThat(partial.getMetadata().getIterations()).isZero();
        assertThat(partial.getMetadata().getFitLoss()).isZero();
        assertThat(partial.getMetadata().getTotalRows()).isEqualTo(40);
        assertThat(partial.getFeatures()).isEqualTo(features);
        assertThat(partial.getWeights()).hasSize(features.size()).containsOnly(0.0);
        assertThat(partial.getBias()).isZero();
        assertThat(partial.getMeans()).hasSize(features.size());
        assertThat(partial.getStdDevs()).hasSize(features.size());
    }

    @Test
    void timeBudgetKeepsWeightsReachedSoFar() {
        // each read of the clock moves it one second; the 10s budget trips on the 11th check
        CancellationToken token = CancellationToken.withBudget(new TickingClock(T0), Duration.ofSeconds(10));

        TrainingInterruptedException ex = catchThrowableOfType(
                () -> trainer.fit(separableRows(40), features,
                        TestFixtures.hyperparameters().toBuilder().tolerance(0.0).build(), token),
                TrainingInterruptedException.class);

        FittedModel partial = ex.getPartialResult();
        assertThat(ex).hasMessageContaining("time budget exceeded");
        assertThat(partial.getMetadata().getIterations()).isEqualTo(10);
        assertThat(partial.getMetadata().getFitLoss()).isPositive();
        assertThat(partial.getWeights().get(features.indexOf(Feature.ERROR_RATE))).isPositive();
        assertThat(partial.getMeans().get(features.indexOf(Feature.ERROR_RATE))).isEqualTo(0.25, within(1e-9));
    }

    @Test
    void validationMetricsAbsentWithoutHoldout() {
        FittedModel model = trainer.fit(separableRows(20), features,
                TestFixtures.hyperparameters().toBuilder().validationFraction(0.0).build(),
                CancellationToken.none());

        assertThat(model.getMetadata().getValidationRows()).isZero();
        assertThat(model.getMetadata().getValidationLoss()).isNull();
        assertThat(model.getMetadata().getValidationAuc()).isNull();
    }

    private static final class TickingClock extends Clock {

        private Instant now;

        TickingClock(Instant start) {
            this.now = start;
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            now = now.plusSeconds(1);
            return now;
        }
    }
}
