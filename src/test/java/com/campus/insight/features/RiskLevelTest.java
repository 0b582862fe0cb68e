package com.campus.insight.features;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RiskLevelTest {
    @Test
    void classifiesByMarksAndMood() {
        assertEquals(RiskLevel.LOW, RiskLevel.classify(80, 4.5));
        assertEquals(RiskLevel.HIGH, RiskLevel.classify(40, 1.5));
        assertEquals(RiskLevel.MEDIUM, RiskLevel.classify(60, 3));
    }

    @Test
    void boundariesFollowRule() {
        assertEquals(RiskLevel.LOW, RiskLevel.classify(75, 4));
        assertEquals(RiskLevel.HIGH, RiskLevel.classify(90, 2));
        assertEquals(RiskLevel.MEDIUM, RiskLevel.classify(50, 3.5));
        assertEquals(RiskLevel.HIGH, RiskLevel.classify(49.99, 5));
    }

    @Test
    void parsesLabels() {
        assertEquals(RiskLevel.MEDIUM, RiskLevel.fromLabel("medium"));
        assertThrows(IllegalArgumentException.class, () -> RiskLevel.fromLabel("Severe"));
    }
}
