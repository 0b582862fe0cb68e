package com.campus.insight.recommendation;

import java.util.Set;

public final class RecommendationTypes {
    public static final String ACADEMIC = "academic";
    public static final String ATTENDANCE = "attendance";
    public static final String MENTAL_HEALTH = "mental_health";
    public static final String WELLNESS = "wellness";
    public static final String HEALTH = "health";
    public static final String STUDY_HABITS = "study_habits";
    public static final String POSITIVE = "positive";

    public static final Set<String> SUPPORTED = Set.of(
            ACADEMIC,
            ATTENDANCE,
            MENTAL_HEALTH,
            WELLNESS,
            HEALTH,
            STUDY_HABITS,
            POSITIVE
    );

    private RecommendationTypes() {}
}
