package com.intervue.evaluation.model;

import java.util.List;

/**
 * Outcome of the deterministic checks for one answer.
 */
public record RunnerResult(
        boolean passed,
        List<RunnerCheck> checks,
        double scoreRunner
) {
    public static final double FULL_SCORE = 100.0;

    public RunnerResult {
        checks = checks == null ? List.of() : List.copyOf(checks);
    }

    public static RunnerResult of(List<RunnerCheck> checks) {
        boolean passed = !checks.isEmpty() && checks.stream().allMatch(RunnerCheck::passed);
        return new RunnerResult(passed, checks, passed ? FULL_SCORE : 0.0);
    }

    public static RunnerResult failed(RunnerCheck check) {
        return new RunnerResult(false, List.of(check), 0.0);
    }
}
