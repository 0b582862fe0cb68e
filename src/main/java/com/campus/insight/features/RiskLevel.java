package com.campus.insight.features;

/**
 * Ordinal risk classes. Ordinal order is the class index used by the classifier.
 */
public enum RiskLevel {
    LOW("Low"), MEDIUM("Medium"), HIGH("High");

    private final String label;

    RiskLevel(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static RiskLevel classify(double avgMarks, double avgMood) {
        if (avgMarks >= 75 && avgMood >= 4) return LOW;
        if (avgMarks < 50 || avgMood <= 2) return HIGH;
        return MEDIUM;
    }

    public static RiskLevel fromLabel(String label) {
        for (RiskLevel level : values()) {
            if (level.label.equalsIgnoreCase(label)) return level;
        }
        throw new IllegalArgumentException("Unknown risk level: " + label);
    }
}
