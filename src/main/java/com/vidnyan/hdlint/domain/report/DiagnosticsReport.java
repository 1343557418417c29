package com.vidnyan.hdlint.domain.report;

import com.vidnyan.hdlint.domain.rule.Finding;
import com.vidnyan.hdlint.domain.rule.RuleDefinition;

import java.util.List;
import java.util.Map;

/**
 * Diagnostics Report - final output of the analysis.
 * Ordered, deduplicated findings, elaboration errors, rule errors and summary counts.
 */
public record DiagnosticsReport(
    List<String> topUnits,
    List<Finding> findings,
    List<ElaborationError> elaborationErrors,
    List<RuleError> ruleErrors,
    Summary summary
) {

    public DiagnosticsReport {
        topUnits = List.copyOf(topUnits);
        findings = List.copyOf(findings);
        elaborationErrors = List.copyOf(elaborationErrors);
        ruleErrors = List.copyOf(ruleErrors);
    }

    public record Summary(
        int totalFindings,
        Map<String, Integer> findingsByRule,
        Map<RuleDefinition.Severity, Integer> findingsBySeverity,
        int elaborationErrorCount,
        int ruleErrorCount
    ) {

        public int count(RuleDefinition.Severity severity) {
            return findingsBySeverity.getOrDefault(severity, 0);
        }

        public int count(String ruleId) {
            return findingsByRule.getOrDefault(ruleId, 0);
        }
    }

    /**
     * True when an error-severity finding, an elaboration error or a rule error is present.
     * Warnings and infos never fail a run.
     */
    public boolean hasErrors() {
        return summary.count(RuleDefinition.Severity.BLOCKER) > 0
                || summary.count(RuleDefinition.Severity.ERROR) > 0
                || !elaborationErrors.isEmpty()
                || !ruleErrors.isEmpty();
    }

    /**
     * Process exit status for a wrapping command line tool.
     */
    public int exitCode() {
        return hasErrors() ? 1 : 0;
    }

    public List<Finding> findings(String ruleId) {
        return findings.stream()
                .filter(f -> f.ruleId().equals(ruleId))
                .toList();
    }
}
