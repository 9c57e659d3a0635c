package com.percussion.scoredb.service;

import com.percussion.scoredb.model.CaptionScore;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class WeightedScoreCalculatorTest {

    @Test
    void sumsWeightedCaptionAverages() {
        List<CaptionScore> scores = List.of(
                new CaptionScore("Music", 30.0, 10.0, 8.0, 1),
                new CaptionScore("Visual", 20.0, 6.0, 4.0, 2));

        double weighted = WeightedScoreCalculator.weightedScore(scores, Map.of());

        // 9 * 0.3 + 5 * 0.2
        assertThat(weighted).isCloseTo(3.7, within(1e-9));
    }

    @Test
    void averagesAcrossJudgesOfOneCaption() {
        List<CaptionScore> scores = List.of(
                new CaptionScore("Music", 30.0, 10.0, 10.0, 1),
                new CaptionScore("Music", 30.0, 8.0, 8.0, 2));

        assertThat(WeightedScoreCalculator.weightedScore(scores, Map.of())).isCloseTo(2.7, within(1e-9));
    }

    @Test
    void seasonWeightTakesPrecedenceOverCapturedWeight() {
        List<CaptionScore> scores = List.of(new CaptionScore("Music", 30.0, 10.0, 8.0, 1));

        assertThat(WeightedScoreCalculator.weightedScore(scores, Map.of("Music", 50.0))).isCloseTo(4.5, within(1e-9));
    }

    @Test
    void missingWeightsAndScoresCountAsZero() {
        List<CaptionScore> scores = List.of(
                new CaptionScore("Music", null, 10.0, 8.0, 1),
                new CaptionScore("Visual", 40.0, null, 6.0, 1));

        // Music has no weight; Visual averages (0 + 6) / 2
        assertThat(WeightedScoreCalculator.weightedScore(scores, null)).isCloseTo(1.2, within(1e-9));
        assertThat(WeightedScoreCalculator.weightedScore(List.of(), Map.of())).isZero();
    }
}
