package com.vidnyan.hdlint.domain.report;

import com.vidnyan.hdlint.domain.rule.EvaluationResult;
import com.vidnyan.hdlint.domain.rule.Finding;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of analysing one top unit: either findings, or the elaboration error that aborted it.
 */
public record UnitAnalysis(
    String topUnit,
    List<Finding> findings,
    List<EvaluationResult> ruleResults,
    Optional<ElaborationError> error,
    int instancesAnalyzed,
    int processesAnalyzed
) {

    public UnitAnalysis {
        findings = List.copyOf(findings);
        ruleResults = List.copyOf(ruleResults);
    }

    public static UnitAnalysis completed(String topUnit, List<Finding> findings, List<EvaluationResult> ruleResults,
                                         int instances, int processes) {
        return new UnitAnalysis(topUnit, findings, ruleResults, Optional.empty(), instances, processes);
    }

    public static UnitAnalysis failed(String topUnit, ElaborationError error) {
        return new UnitAnalysis(topUnit, List.of(), List.of(), Optional.of(error), 0, 0);
    }

    public List<RuleError> ruleErrors() {
        return ruleResults.stream()
                .filter(EvaluationResult::isError)
                .map(r -> new RuleError(topUnit, r.ruleId(), r.errorMessage()))
                .toList();
    }

    public boolean isFailed() {
        return error.isPresent();
    }
}
