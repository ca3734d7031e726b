package com.company.incidentrisk.service;

import com.company.incidentrisk.domain.Alert;
import com.company.incidentrisk.domain.FactorContribution;
import com.company.incidentrisk.domain.PredictionResult;
import com.company.incidentrisk.domain.SeriesKey;
import com.company.incidentrisk.domain.enums.AlertStatus;
import com.company.incidentrisk.domain.enums.DeliveryStatus;
import com.company.incidentrisk.domain.enums.Severity;
import com.company.incidentrisk.event.AlertRaisedEvent;
import com.company.incidentrisk.exception.AlertNotFoundException;
import com.company.incidentrisk.exception.InvalidAlertTransitionException;
import com.company.incidentrisk.exception.StoreUnavailableException;
import com.company.incidentrisk.repository.AlertRepository;
import com.company.incidentrisk.repository.InMemoryAlertRepository;
import com.company.incidentrisk.support.MutableClock;
import com.company.incidentrisk.support.TestFixtures;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static com.company.incidentrisk.support.TestFixtures.T0;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AlertEvaluationServiceTest {

    @Mock
    private ApplicationEventPublisher eventPublisher;

    @Mock
    private AlertRepository failingRepository;

    private InMemoryAlertRepository alertRepository;
    private MutableClock clock;
    private SimpleMeterRegistry meterRegistry;
    private AlertEvaluationService evaluationService;

    @BeforeEach
    void setUp() {
        alertRepository = new InMemoryAlertRepository();
        clock = new MutableClock(T0.plus(Duration.ofHours(1)));
        meterRegistry = new SimpleMeterRegistry();
        evaluationService = serviceWith(alertRepository);
    }

    private AlertEvaluationService serviceWith(AlertRepository repository) {
        return new AlertEvaluationService(repository, eventPublisher, TestFixtures.properties(), meterRegistry, clock);
    }

    private static PredictionResult prediction(String service, Instant bucketStart, double riskScore) {
        return PredictionResult.builder()
                .service(service)
                .route("/pay")
                .bucketStart(bucketStart)
                .riskScore(riskScore)
                .modelVersion(3L)
                .topFactors(List.of(
                        FactorContribution.builder().feature("errorRate").contribution(1.23456).build(),
                        FactorContribution.builder().feature("avgCpuPct").contribution(-0.5).build()))
                .build();
    }

    @Test
    void severityBands() {
        assertThat(evaluationService.severityFor(0.49)).isEmpty();
        assertThat(evaluationService.severityFor(0.5)).contains(Severity.MEDIUM);
        assertThat(evaluationService.severityFor(0.7)).contains(Severity.HIGH);
        assertThat(evaluationService.severityFor(0.95)).contains(Severity.CRITICAL);
    }

    @Test
    void highRiskPredictionRaisesOpenAlert() {
        List<Alert> created = evaluationService.evaluate(List.of(prediction("checkout", T0, 0.82)));

        assertThat(created).singleElement().satisfies(alert -> {
            assertThat(alert.getAlertId()).isNotNull();
            assertThat(alert.getSeverity()).isEqualTo(Severity.HIGH);
            assertThat(alert.getStatus()).isEqualTo(AlertStatus.OPEN);
            assertThat(alert.getDeliveryStatus()).isEqualTo(DeliveryStatus.PENDING);
            assertThat(alert.getModelVersion()).isEqualTo(3L);
            assertThat(alert.getTopFactors()).isEqualTo("errorRate=+1.2346, avgCpuPct=-0.5000");
            assertThat(alert.getCreatedAt()).isEqualTo(clock.instant());
        });
        verify(eventPublisher).publishEvent(any(AlertRaisedEvent.class));
    }

    @Test
    void lowRiskPredictionRaisesNothing() {
        assertThat(evaluationService.evaluate(List.of(prediction("checkout", T0, 0.3)))).isEmpty();
        assertThat(alertRepository.countOpen()).isZero();
    }

    @Test
    void sameBucketNeverAlertsTwice() {
        evaluationService.evaluate(List.of(prediction("checkout", T0, 0.9)));
        clock.advance(Duration.ofHours(2));

        List<Alert> second = evaluationService.evaluate(List.of(prediction("checkout", T0, 0.95)));

        assertThat(second).isEmpty();
        assertThat(alertRepository.findByStatus(null, 10)).hasSize(1);
        assertThat(meterRegistry.counter("incident.alerts.suppressed", "reason", "duplicate_bucket").count())
                .isEqualTo(1.0);
    }

    @Test
    void cooldownSuppressesNewBucketsUntilItExpires() {
        Instant t0 = clock.instant();
        List<Alert> first = evaluationService.evaluate(List.of(prediction("checkout", T0, 0.95)));
        assertThat(first).singleElement()
                .extracting(Alert::getSeverity).isEqualTo(Severity.CRITICAL);

        clock.set(t0.plus(Duration.ofMinutes(10)));
        assertThat(evaluationService.evaluate(List.of(prediction("checkout", T0.plus(Duration.ofMinutes(5)), 0.95))))
                .isEmpty();
        assertThat(meterRegistry.counter("incident.alerts.suppressed", "reason", "cooldown").count())
                .isEqualTo(1.0);

        clock.set(t0.plus(Duration.ofMinutes(31)));
        List<Alert> afterCooldown = evaluationService.evaluate(
                List.of(prediction("checkout", T0.plus(Duration.ofMinutes(10)), 0.95)));
        assertThat(afterCooldown).singleElement()
                .extracting(Alert::getSeverity).isEqualTo(Severity.CRITICAL);
    }

    @Test
    void cooldownIsPerSeries() {
        List<Alert> created = evaluationService.evaluate(List.of(
                prediction("checkout", T0, 0.9),
                prediction("search", T0, 0.9)));

        assertThat(created).extracting(Alert::getService).containsExactly("checkout", "search");
    }

    @Test
    void resolvedAlertNoLongerHoldsCooldown() {
        Alert first = evaluationService.evaluate(List.of(prediction("checkout", T0, 0.9))).get(0);
        evaluationService.resolve(first.getAlertId());

        clock.advance(Duration.ofMinutes(5));
        assertThat(evaluationService.evaluate(List.of(prediction("checkout", T0.plus(Duration.ofMinutes(5)), 0.9))))
                .hasSize(1);
    }

    @Test
    void acknowledgeThenResolve() {
        Alert alert = evaluationService.evaluate(List.of(prediction("checkout", T0, 0.9))).get(0);

        clock.advance(Duration.ofMinutes(1));
        Alert acknowledged = evaluationService.acknowledge(alert.getAlertId());
        clock.advance(Duration.ofMinutes(1));
        Alert resolved = evaluationService.resolve(alert.getAlertId());

        assertThat(acknowledged.getStatus()).isEqualTo(AlertStatus.ACKNOWLEDGED);
        assertThat(resolved.getStatus()).isEqualTo(AlertStatus.RESOLVED);
        assertThat(resolved.getAcknowledgedAt()).isEqualTo(T0.plus(Duration.ofMinutes(61)));
        assertThat(resolved.getResolvedAt()).isEqualTo(T0.plus(Duration.ofMinutes(62)));
        assertThat(evaluationService.getAlert(alert.getAlertId()).getStatus()).isEqualTo(AlertStatus.RESOLVED);
    }

    @Test
    void resolvedAlertCannotBeAcknowledged() {
        Alert alert = evaluationService.evaluate(List.of(prediction("checkout", T0, 0.9))).get(0);
        evaluationService.resolve(alert.getAlertId());

        assertThatThrownBy(() -> evaluationService.acknowledge(alert.getAlertId()))
                .isInstanceOf(InvalidAlertTransitionException.class);
        assertThatThrownBy(() -> evaluationService.resolve(alert.getAlertId()))
                .isInstanceOf(InvalidAlertTransitionException.class);
    }

    @Test
    void unknownAlertIsNotFound() {
        assertThatThrownBy(() -> evaluationService.acknowledge(404L))
                .isInstanceOf(AlertNotFoundException.class);
    }

    @Test
    void failureForOneSeriesDoesNotBlockOthers() {
        SeriesKey broken = SeriesKey.of("checkout", "/pay");
        SeriesKey healthy = SeriesKey.of("search", "/pay");
        when(failingRepository.existsForBucket(eq(broken), any()))
                .thenThrow(new StoreUnavailableException("alert store down", null));
        when(failingRepository.existsForBucket(eq(healthy), any())).thenReturn(false);
        when(failingRepository.findLatestOpen(eq(healthy), any())).thenReturn(Optional.empty());
        when(failingRepository.save(any())).thenAnswer(invocation -> {
            Alert alert = invocation.getArgument(0);
            alert.setAlertId(7L);
            return alert;
        });

        List<Alert> created = serviceWith(failingRepository).evaluate(List.of(
                prediction("checkout", T0, 0.9),
                prediction("search", T0, 0.9)));

        assertThat(created).extracting(Alert::getService).containsExactly("search");
        assertThat(meterRegistry.counter("incident.alerts.failed").count()).isEqualTo(1.0);
        verify(failingRepository, times(1)).save(any());
    }
}
