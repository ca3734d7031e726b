package com.company.incidentrisk.config;

import com.company.incidentrisk.repository.AlertRepository;
import com.company.incidentrisk.repository.ModelArtifactRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Pipeline state gauges
 */
@Configuration
@Slf4j
@RequiredArgsConstructor
public class MetricsConfiguration {

    private final AlertRepository alertRepository;
    private final ModelArtifactRepository modelArtifactRepository;
    private final IncidentRiskProperties properties;

    @Bean
    public MeterBinder incidentRiskMetrics(MeterRegistry registry) {
        return (reg) -> {
            Gauge.builder("incident.alerts.open", alertRepository, repo -> {
                        try {
                            return repo.countOpen();
                        } catch (Exception e) {
                            log.warn("Failed to count open alerts", e);
                            return 0;
                        }
                    })
                    .description("Number of alerts currently open")
                    .register(reg);

            String family = properties.getTraining().getModelFamily();
            Gauge.builder("incident.model.active_version", modelArtifactRepository, repo -> {
                        try {
                            return repo.findActiveVersion(family).orElse(0L);
                        } catch (Exception e) {
                            log.warn("Failed to read active model version", e);
                            return 0;
                        }
                    })
                    .description("Active model version, 0 when none is active")
                    .tag("family", family)
                    .register(reg);

            log.info("Incident risk metrics registered");
        };
    }
}
