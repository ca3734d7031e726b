package com.company.incidentrisk.util;

import com.company.incidentrisk.domain.ScoredExample;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Ranking-quality metrics over scored, labeled examples.
 */
public final class RankingMetrics {

    /** Highest score first, earlier bucket first among equal scores. */
    public static final Comparator<ScoredExample> RANKING_ORDER =
            Comparator.comparingDouble(ScoredExample::getScore).reversed()
                    .thenComparing(ScoredExample::getBucketStart);

    private RankingMetrics() {
    }

    /**
     * Probability that a random positive outscores a random negative; tied pairs count 0.5.
     * Computed from average ranks, which equals counting concordant pairs.
     *
     * @throws IllegalArgumentException when either class is absent
     */
    public static double auc(List<ScoredExample> examples) {
        long positives = examples.stream().filter(ScoredExample::isPositive).count();
        long negatives = examples.size() - positives;
        if (positives == 0 || negatives == 0) {
            throw new IllegalArgumentException("AUC needs at least one positive and one negative example");
        }

        List<ScoredExample> ascending = new ArrayList<>(examples);
        ascending.sort(Comparator.comparingDouble(ScoredExample::getScore));

        double positiveRankSum = 0.0;
        int i = 0;
        while (i < ascending.size()) {
            int j = i;
            while (j + 1 < ascending.size() && ascending.get(j + 1).getScore() == ascending.get(i).getScore()) {
                j++;
            }
            // 1-based ranks i+1..j+1 share their average
            double averageRank = (i + j + 2) / 2.0;
            for (int t = i; t <= j; t++) {
                if (ascending.get(t).isPositive()) {
                    positiveRankSum += averageRank;
                }
            }
            i = j + 1;
        }

        double concordant = positiveRankSum - positives * (positives + 1) / 2.0;
        return concordant / ((double) positives * negatives);
    }

    public static List<ScoredExample> topK(List<ScoredExample> examples, int k) {
        List<ScoredExample> ranked = new ArrayList<>(examples);
        ranked.sort(RANKING_ORDER);
        return ranked.subList(0, Math.min(k, ranked.size()));
    }

    /**
     * Fraction of positives among the top K. When fewer than K rows exist, all of them are the top.
     */
    public static double precisionAtK(List<ScoredExample> examples, int k) {
        List<ScoredExample> top = topK(examples, k);
        if (top.isEmpty()) {
            return 0.0;
        }
        return StatsUtils.ratio(countPositives(top), top.size());
    }

    public static double recallAtK(List<ScoredExample> examples, int k) {
        long positives = countPositives(examples);
        return StatsUtils.ratio(countPositives(topK(examples, k)), positives);
    }

    public static long countPositives(List<ScoredExample> examples) {
        return examples.stream().filter(ScoredExample::isPositive).count();
    }
}
