package com.intervue.evaluation.model;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.Objects;

/**
 * Normalized judge verdict for one submission.
 * <p>
 * Score is always within [0, 100] and the three list fields are never null. {@code debug} is an
 * operator-only diagnostic bag; it is persisted with the grade and dropped when the result leaves
 * a debugging context.
 */
public record JudgeResult(
        JudgeOutcome outcome,
        double score,
        String verdict,
        List<String> mistakes,
        List<String> improvements,
        List<String> citations,
        ObjectNode debug
) {
    public static final double MIN_SCORE = 0.0;
    public static final double MAX_SCORE = 100.0;

    public JudgeResult {
        Objects.requireNonNull(outcome, "outcome is required");
        score = clampScore(score);
        verdict = verdict == null ? "" : verdict;
        mistakes = mistakes == null ? List.of() : List.copyOf(mistakes);
        improvements = improvements == null ? List.of() : List.copyOf(improvements);
        citations = citations == null ? List.of() : List.copyOf(citations);
        debug = debug == null ? null : debug.deepCopy();
    }

    public static JudgeResult degraded(
            JudgeOutcome outcome,
            String verdict,
            List<String> improvements,
            ObjectNode debug
    ) {
        if (!outcome.isDegraded()) {
            throw new IllegalArgumentException("Degraded result requires a degraded outcome");
        }
        return new JudgeResult(outcome, MIN_SCORE, verdict, List.of(), improvements, List.of(), debug);
    }

    public boolean degraded() {
        return outcome.isDegraded();
    }

    static double clampScore(double value) {
        if (Double.isNaN(value)) {
            return MIN_SCORE;
        }
        return Math.max(MIN_SCORE, Math.min(MAX_SCORE, value));
    }
}
