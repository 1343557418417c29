package com.vidnyan.hdlint.adapter.in.cli;

import com.vidnyan.hdlint.domain.elaboration.ElaborationPath;
import com.vidnyan.hdlint.domain.report.DiagnosticsReport;
import com.vidnyan.hdlint.domain.report.ElaborationError;
import com.vidnyan.hdlint.domain.report.RuleError;
import com.vidnyan.hdlint.domain.rule.Finding;
import com.vidnyan.hdlint.domain.rule.RuleDefinition;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders report entries as single lines:
 * {@code <severity>: <rule-id>: <top-unit>[<elaboration-path>]: <process>: <message> (<location>)}.
 */
public final class FindingFormatter {

    private FindingFormatter() {
    }

    public static String format(Finding finding) {
        return String.format("%s: %s: %s: %s: %s (%s)",
                finding.severity(),
                finding.ruleId(),
                finding.path().format(finding.topUnit()),
                finding.subject(),
                finding.message(),
                finding.location().format());
    }

    public static String format(ElaborationError error) {
        return String.format("%s: ELABORATION_%s: %s: %s: %s (%s)",
                RuleDefinition.Severity.ERROR,
                error.kind(),
                ElaborationPath.ROOT.format(error.topUnit()),
                error.topUnit(),
                error.message(),
                error.location().format());
    }

    public static String format(RuleError error) {
        return String.format("%s: RULE_ERROR: %s: %s: %s",
                RuleDefinition.Severity.ERROR,
                error.ruleId(),
                ElaborationPath.ROOT.format(error.topUnit()),
                error.message());
    }

    /**
     * All lines of a report: errors first, then findings each followed by the other
     * elaboration paths it recurs at and the rule's quick fix, then the summary.
     */
    public static List<String> lines(DiagnosticsReport report) {
        List<String> lines = new ArrayList<>();
        report.elaborationErrors().forEach(e -> lines.add(format(e)));
        report.ruleErrors().forEach(e -> lines.add(format(e)));
        for (Finding finding : report.findings()) {
            lines.add(format(finding));
            if (finding.recurs()) {
                lines.add(String.format("    recurs at %d elaboration paths: %s",
                        finding.occurrences().size(),
                        finding.occurrences().stream()
                                .map(p -> p.format(finding.topUnit()))
                                .collect(Collectors.joining(", "))));
            }
            if (finding.remediation() != null && finding.remediation().quickFix() != null) {
                lines.add("    fix: " + finding.remediation().quickFix());
            }
        }
        lines.add(summary(report));
        return lines;
    }

    public static String summary(DiagnosticsReport report) {
        DiagnosticsReport.Summary summary = report.summary();
        String byRule = summary.findingsByRule().entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(", "));
        return String.format("%d findings (%d errors, %d warnings), %d elaboration errors, %d rule errors%s",
                summary.totalFindings(),
                summary.count(RuleDefinition.Severity.BLOCKER) + summary.count(RuleDefinition.Severity.ERROR),
                summary.count(RuleDefinition.Severity.WARN),
                summary.elaborationErrorCount(),
                summary.ruleErrorCount(),
                byRule.isEmpty() ? "" : " [" + byRule + "]");
    }
}
