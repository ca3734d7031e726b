package com.company.incidentrisk.dto.request;

import com.company.incidentrisk.domain.PredictionResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Predictions to evaluate; when absent the current live predictions are used.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EvaluateAlertsRequest {
    private List<PredictionResult> predictions;
}
