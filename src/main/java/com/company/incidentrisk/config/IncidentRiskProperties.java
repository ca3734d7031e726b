package com.company.incidentrisk.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Tunables for the incident-risk pipeline.
 * <p>
 * Groups:
 * <ul>
 *     <li>ingestion acceptance window</li>
 *     <li>ETL bucketing, watermark and late-event grace</li>
 *     <li>labeling horizon</li>
 *     <li>training hyperparameter defaults</li>
 *     <li>inference, alerting and backtest defaults</li>
 * </ul>
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "incident-risk")
public class IncidentRiskProperties {

    private final Ingestion ingestion = new Ingestion();
    private final Etl etl = new Etl();
    private final Labels labels = new Labels();
    private final Training training = new Training();
    private final Inference inference = new Inference();
    private final Alerting alerting = new Alerting();
    private final Backtest backtest = new Backtest();
    private final Store store = new Store();
    private final Scheduler scheduler = new Scheduler();

    @Data
    public static class Ingestion {
        /** How far in the future an event timestamp may be */
        private Duration clockSkewTolerance = Duration.ofMinutes(2);

        /** Events older than this are rejected */
        private Duration retentionHorizon = Duration.ofDays(7);
    }

    @Data
    public static class Etl {
        private Duration bucketWidth = Duration.ofMinutes(5);

        /** Delay after a bucket's end before it is closed */
        private Duration watermarkDelay = Duration.ofMinutes(5);

        /** Grace after close during which late events still trigger a recompute */
        private Duration allowedLateness = Duration.ofMinutes(10);

        @Min(1)
        private int maxAttempts = 3;

        private Duration retryBackoff = Duration.ofMillis(200);
    }

    @Data
    public static class Labels {
        @Min(1)
        private int lookaheadBuckets = 3;

        /** Treat future buckets above the threshold as incidents */
        private boolean deriveFromFeatures = true;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double incidentThreshold = 0.2;
    }

    @Data
    public static class Training {
        @NotBlank
        private String modelFamily = "incident-risk-logistic";

        @Min(2)
        private int minRows = 50;

        private double learningRate = 0.05;

        @Min(1)
        private int maxIterations = 500;

        private double tolerance = 1e-7;

        private double l2 = 0.001;

        @DecimalMin("0.0")
        @DecimalMax("0.9")
        private double validationFraction = 0.2;

        private boolean includeTotalRequests = false;

        private Duration timeBudget = Duration.ofMinutes(2);

        /** History used for a training run, ending at the labeling as-of instant */
        private Duration trainingWindow = Duration.ofDays(7);
    }

    @Data
    public static class Inference {
        @Min(1)
        private int topFactors = 3;
    }

    @Data
    public static class Alerting {
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double threshold = 0.5;

        private Duration cooldown = Duration.ofMinutes(30);

        private double criticalBand = 0.9;
        private double highBand = 0.7;
        private double mediumBand = 0.5;

        /** Redelivery gives up after this many attempts */
        private int maxDeliveryAttempts = 5;

        /** Periodic retry of undelivered alerts */
        private boolean redeliveryEnabled = true;
    }

    @Data
    public static class Backtest {
        @Min(1)
        private int defaultK = 20;

        private Duration timeBudget = Duration.ofMinutes(2);
    }

    @Data
    public static class Store {
        /** jdbc or memory */
        private String type = "jdbc";
    }

    @Data
    public static class Scheduler {
        private boolean enabled = false;

        /** How far back each scheduled ETL pass reaches */
        private Duration etlLookback = Duration.ofMinutes(30);

        private long pipelineIntervalMs = 60000;
    }
}
