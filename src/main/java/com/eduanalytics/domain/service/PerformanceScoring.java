package com.eduanalytics.domain.service;

import com.eduanalytics.domain.exception.ValidationException;
import com.eduanalytics.domain.model.LetterGrade;

/**
 * Scoring rules for performance facts.
 *
 * final = 0.4 * assignment + 0.6 * exam, rounded to one decimal, whenever both component
 * scores exist. A row passes when its final score reaches 60. Pass flags supplied by
 * callers are never used.
 */
public final class PerformanceScoring {

    public static final double ASSIGNMENT_WEIGHT = 0.4;
    public static final double EXAM_WEIGHT = 0.6;
    public static final double PASS_THRESHOLD = 60.0;

    private PerformanceScoring() {
    }

    public static Double finalScore(Double assignmentScore, Double examScore, Double suppliedFinalScore) {
        if (assignmentScore != null && examScore != null) {
            return round1(ASSIGNMENT_WEIGHT * assignmentScore + EXAM_WEIGHT * examScore);
        }
        return suppliedFinalScore;
    }

    /**
     * Final score for a row that is about to be stored.
     *
     * @throws ValidationException when the row carries no usable score
     */
    public static double requireFinalScore(Double assignmentScore, Double examScore, Double suppliedFinalScore) {
        Double score = finalScore(assignmentScore, examScore, suppliedFinalScore);
        if (score == null) {
            throw new ValidationException("A final score or both assignment and exam scores are required");
        }
        return score;
    }

    public static boolean isPass(double finalScore) {
        return finalScore >= PASS_THRESHOLD;
    }

    public static LetterGrade letterGrade(LetterGrade supplied, double gradePoints) {
        return supplied != null ? supplied : LetterGrade.fromGradePoints(gradePoints);
    }

    static double round1(double value) {
        return Math.round(value * 10.0) / 10.0;
    }
}
