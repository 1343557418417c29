package com.vidnyan.hdlint.domain.rule;

import java.time.Duration;
import java.util.List;

/**
 * Result of checking one rule against one instance.
 */
public record EvaluationResult(
    String ruleId,
    List<Finding> findings,
    Duration executionTime,
    int processesAnalyzed,
    EvaluationStatus status,
    String errorMessage
) {

    public enum EvaluationStatus {
        SUCCESS,
        ERROR,
        SKIPPED
    }

    /**
     * Create a successful result.
     */
    public static EvaluationResult success(String ruleId, List<Finding> findings,
                                           Duration duration, int processes) {
        return new EvaluationResult(ruleId, List.copyOf(findings), duration, processes,
                EvaluationStatus.SUCCESS, null);
    }

    /**
     * Create an error result that keeps the findings collected before and after the failure.
     */
    public static EvaluationResult error(String ruleId, String message, List<Finding> findings,
                                         Duration duration, int processes) {
        return new EvaluationResult(ruleId, List.copyOf(findings), duration, processes,
                EvaluationStatus.ERROR, message);
    }

    /**
     * Create a skipped result.
     */
    public static EvaluationResult skipped(String ruleId, String reason) {
        return new EvaluationResult(ruleId, List.of(), Duration.ZERO, 0,
                EvaluationStatus.SKIPPED, reason);
    }

    /**
     * Check if any findings were produced.
     */
    public boolean hasFindings() {
        return !findings.isEmpty();
    }

    public boolean isError() {
        return status == EvaluationStatus.ERROR;
    }

    public int findingCount() {
        return findings.size();
    }
}
