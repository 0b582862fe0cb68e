package com.campus.insight.recommendation;

import com.campus.insight.exception.InvalidInputException;

import java.util.List;
import java.util.Locale;

public class RecommendationModels {
    public record Recommendation(String type,
                                 Priority priority,
                                 String title,
                                 String description,
                                 List<String> actionItems) {
        public Recommendation {
            if (type == null || !RecommendationTypes.SUPPORTED.contains(type)) {
                throw new InvalidInputException("Unsupported recommendation type: " + type);
            }
            actionItems = List.copyOf(actionItems);
        }
    }

    public enum Priority {
        LOW, MEDIUM, HIGH, URGENT;

        public String code() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
