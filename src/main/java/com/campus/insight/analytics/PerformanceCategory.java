package com.campus.insight.analytics;

public enum PerformanceCategory {
    EXCELLENT("Excellent"), GOOD("Good"), AVERAGE("Average"), POOR("Poor");

    private final String label;

    PerformanceCategory(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static PerformanceCategory of(double avgMarks) {
        if (avgMarks >= 80) return EXCELLENT;
        if (avgMarks >= 60) return GOOD;
        if (avgMarks >= 40) return AVERAGE;
        return POOR;
    }
}
