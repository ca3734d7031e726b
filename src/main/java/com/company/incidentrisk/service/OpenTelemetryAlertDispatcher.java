package com.company.incidentrisk.service;

import com.company.incidentrisk.domain.Alert;
import com.company.incidentrisk.exception.AlertDispatchException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Publishes each alert as a trace span picked up by the monitoring backend.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class OpenTelemetryAlertDispatcher implements AlertDispatcher {

    private final Tracer tracer;

    @Override
    @Retry(name = "alertDelivery")
    @CircuitBreaker(name = "alertDelivery")
    public void dispatch(Alert alert) {
        Span span = tracer.spanBuilder("incident.risk.alert")
                .setSpanKind(SpanKind.PRODUCER)
                .startSpan();

        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("alert.id", alert.getAlertId());
            span.setAttribute("service.name", alert.getService());
            span.setAttribute("route", alert.getRoute());
            span.setAttribute("severity", alert.getSeverity().name());
            span.setAttribute("risk.score", alert.getRiskScore());
            span.setAttribute("model.version", alert.getModelVersion() != null ? alert.getModelVersion() : -1L);

            span.addEvent("Incident Risk Detected",
                    Attributes.of(
                            AttributeKey.stringKey("bucket_start"), String.valueOf(alert.getBucketStart()),
                            AttributeKey.stringKey("top_factors"), alert.getTopFactors() != null ? alert.getTopFactors() : ""
                    ));

            log.info("Risk alert {} dispatched for {} ({})", alert.getAlertId(), alert.seriesKey(), alert.getSeverity());

        } catch (Exception e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, "Failed to dispatch alert");
            throw new AlertDispatchException("Failed to dispatch alert " + alert.getAlertId(), e);
        } finally {
            span.end();
        }
    }
}
