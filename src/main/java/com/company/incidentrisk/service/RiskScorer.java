package com.company.incidentrisk.service;

import com.company.incidentrisk.domain.FactorContribution;
import com.company.incidentrisk.domain.Feature;
import com.company.incidentrisk.domain.FeatureRow;
import com.company.incidentrisk.domain.ModelArtifact;
import com.company.incidentrisk.domain.PredictionResult;
import com.company.incidentrisk.util.StatsUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Stateless scoring against an immutable model artifact; safe to call from many threads.
 */
@Component
public class RiskScorer {

    public PredictionResult score(FeatureRow row, ModelArtifact model, int topFactors) {
        List<Feature> features = model.features();
        List<FactorContribution> contributions = new ArrayList<>(features.size());

        double z = model.getBias();
        for (int i = 0; i < features.size(); i++) {
            double normalized = (features.get(i).valueOf(row) - model.getMeans().get(i)) / model.getStdDevs().get(i);
            double contribution = model.getWeights().get(i) * normalized;
            z += contribution;
            contributions.add(FactorContribution.builder()
                    .feature(features.get(i).getFieldName())
                    .contribution(contribution)
                    .build());
        }

        // List.sort is stable: equal magnitudes keep schema order
        contributions.sort(Comparator.comparingDouble((FactorContribution c) -> Math.abs(c.getContribution())).reversed());

        return PredictionResult.builder()
                .service(row.getService())
                .route(row.getRoute())
                .bucketStart(row.getBucketStart())
                .riskScore(StatsUtils.sigmoid(z))
                .modelVersion(model.getVersion())
                .topFactors(List.copyOf(contributions.subList(0, Math.min(topFactors, contributions.size()))))
                .build();
    }
}
