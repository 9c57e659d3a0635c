package com.percussion.scoredb.service;

import com.percussion.scoredb.model.CaptionScore;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Weighted score of a performance, derived on demand from its caption scores.
 * <p>
 * For each caption: every judge's (comp + perf) / 2 is scaled by weight / 100, those values are
 * summed and then divided by the caption's judge count. The caption results are summed.
 * The order of operations matters when weights differ between judges of one caption.
 */
public final class WeightedScoreCalculator {

    private WeightedScoreCalculator() {}

    /**
     * @param scores  caption scores of one performance; each entry is one judge's sheet for a caption
     * @param weights season caption weights; a caption missing here falls back to the weight
     *                captured on the score, then to 0
     */
    public static double weightedScore(Collection<CaptionScore> scores, Map<String, Double> weights) {
        Map<String, List<CaptionScore>> byCaption = new LinkedHashMap<>();
        for (CaptionScore s : scores) {
            byCaption.computeIfAbsent(s.getCaption(), k -> new ArrayList<>()).add(s);
        }

        double total = 0.0;
        for (Map.Entry<String, List<CaptionScore>> e : byCaption.entrySet()) {
            List<CaptionScore> judges = e.getValue();
            double sum = 0.0;
            for (CaptionScore s : judges) {
                double avg = (value(s.getCompScore()) + value(s.getPerfScore())) / 2.0;
                sum += avg * weightFor(s, weights) / 100.0;
            }
            total += sum / judges.size();
        }
        return total;
    }

    private static double weightFor(CaptionScore score, Map<String, Double> weights) {
        Double w = weights != null ? weights.get(score.getCaption()) : null;
        if (w == null) w = score.getWeight();
        return w != null ? w : 0.0;
    }

    private static double value(Double d) {
        return d != null ? d : 0.0;
    }
}
