package com.company.incidentrisk.dto.response;

import com.company.incidentrisk.domain.TrainingMetadata;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModelResponse {
    private long version;
    private String modelFamily;
    private boolean active;
    private List<String> featureNames;
    private List<Double> weights;
    private double bias;
    private List<Double> means;
    private List<Double> stdDevs;
    private TrainingMetadata metadata;
    private Instant createdAt;
}
