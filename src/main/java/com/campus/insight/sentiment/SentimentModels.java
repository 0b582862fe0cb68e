package com.campus.insight.sentiment;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

public class SentimentModels {
    public enum Sentiment {
        POSITIVE("Positive"), NEUTRAL("Neutral"), NEGATIVE("Negative");

        private final String label;

        Sentiment(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }

    public record SentimentResult(Sentiment sentiment,
                                  double polarity,
                                  double adjustedPolarity,
                                  double subjectivity,
                                  Set<String> stressIndicators,
                                  Set<String> positiveIndicators,
                                  double confidence) {
        public SentimentResult {
            stressIndicators = Collections.unmodifiableSet(new LinkedHashSet<>(stressIndicators));
            positiveIndicators = Collections.unmodifiableSet(new LinkedHashSet<>(positiveIndicators));
        }
    }

    public record BatchSentimentSummary(int totalAnalyzed,
                                        Map<Sentiment, Long> sentimentDistribution,
                                        double averagePolarity,
                                        Set<String> commonStressIndicators,
                                        Set<String> commonPositiveIndicators,
                                        List<SentimentResult> individualResults) {}

    public record SentimentAnalysis(SentimentResult result, int mentalHealthScore, String mentalHealthLabel) {}

    record Polarity(double polarity, double subjectivity) {}
}
