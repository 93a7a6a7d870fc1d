package com.eduanalytics.domain.service;

import com.eduanalytics.domain.exception.ValidationException;
import com.eduanalytics.domain.model.LetterGrade;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PerformanceScoringTest {

    @Test
    void testFinalScore_WeightedFromComponents() {
        // 0.4 * 80 + 0.6 * 90 = 86.0
        assertEquals(86.0, PerformanceScoring.finalScore(80.0, 90.0, null));
    }

    @Test
    void testFinalScore_ComponentsOverrideSuppliedScore() {
        assertEquals(86.0, PerformanceScoring.finalScore(80.0, 90.0, 12.0));
    }

    @Test
    void testFinalScore_RoundedToOneDecimal() {
        // 0.4 * 77 + 0.6 * 64.3 = 69.38
        assertEquals(69.4, PerformanceScoring.finalScore(77.0, 64.3, null));
    }

    @Test
    void testFinalScore_SuppliedWhenComponentMissing() {
        assertEquals(72.5, PerformanceScoring.finalScore(80.0, null, 72.5));
        assertNull(PerformanceScoring.finalScore(null, 90.0, null));
    }

    @Test
    void testRequireFinalScore_NoScoreRejected() {
        assertThrows(ValidationException.class, () -> PerformanceScoring.requireFinalScore(null, 50.0, null));
    }

    @Test
    void testIsPass_ThresholdInclusive() {
        assertFalse(PerformanceScoring.isPass(59.0));
        assertFalse(PerformanceScoring.isPass(59.9));
        assertTrue(PerformanceScoring.isPass(60.0));
        assertTrue(PerformanceScoring.isPass(85.0));
    }

    @Test
    void testLetterGrade_SuppliedKept() {
        assertEquals(LetterGrade.A_PLUS, PerformanceScoring.letterGrade(LetterGrade.A_PLUS, 2.0));
    }

    @Test
    void testLetterGrade_DerivedFromGradePoints() {
        assertEquals(LetterGrade.A, PerformanceScoring.letterGrade(null, 4.0));
        assertEquals(LetterGrade.B, PerformanceScoring.letterGrade(null, 2.8));
        assertEquals(LetterGrade.F, PerformanceScoring.letterGrade(null, 0.0));
    }
}
