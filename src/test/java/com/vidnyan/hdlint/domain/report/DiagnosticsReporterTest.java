package com.vidnyan.hdlint.domain.report;

import com.vidnyan.hdlint.domain.elaboration.ElaborationException;
import com.vidnyan.hdlint.domain.elaboration.ElaborationPath;
import com.vidnyan.hdlint.domain.elaboration.SourceProcessId;
import com.vidnyan.hdlint.domain.model.Location;
import com.vidnyan.hdlint.domain.rule.BuiltInRules;
import com.vidnyan.hdlint.domain.rule.EvaluationResult;
import com.vidnyan.hdlint.domain.rule.Finding;
import com.vidnyan.hdlint.domain.rule.RuleDefinition;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DiagnosticsReporterTest {

    private final DiagnosticsReporter reporter = new DiagnosticsReporter();

    private static final RuleDefinition SENSITIVITY = BuiltInRules.find(BuiltInRules.SENSITIVITY_INCOMPLETE).orElseThrow();
    private static final RuleDefinition IMPURE = BuiltInRules.find(BuiltInRules.CLOCKED_PROCESS_IMPURE).orElseThrow();

    private static final SourceProcessId CELL_P =
            new SourceProcessId("cell", "rtl", "p", Location.at("cell.vhd", 10, 1));

    private static ElaborationPath generated(long index) {
        return ElaborationPath.ROOT
                .child(ElaborationPath.Segment.generate("gen", index))
                .child("u");
    }

    private static Finding finding(RuleDefinition rule, String top, ElaborationPath path, String signal, int line) {
        return Finding.builder()
                .rule(rule)
                .topUnit(top)
                .path(path)
                .subject("p")
                .signal(signal)
                .message("signal '" + signal + "'")
                .location(Location.at("cell.vhd", line, 1))
                .sourceProcess(CELL_P)
                .build();
    }

    @Test
    void report_ShouldMergeCopiesOfTheSameSourceProcess() {
        // Arrange: the same violation in three generated copies, listed out of order
        List<Finding> findings = List.of(
                finding(SENSITIVITY, "array", generated(2), "b", 11),
                finding(SENSITIVITY, "array", generated(0), "b", 11),
                finding(SENSITIVITY, "array", generated(1), "b", 11));

        // Act
        DiagnosticsReport report = reporter.report(List.of(
                UnitAnalysis.completed("array", findings, List.of(), 4, 3)));

        // Assert
        assertEquals(1, report.findings().size());
        Finding merged = report.findings().get(0);
        assertEquals(generated(0), merged.path());
        assertEquals(List.of(generated(0), generated(1), generated(2)), merged.occurrences());
        assertTrue(merged.recurs());
        assertEquals(1, report.summary().totalFindings());
    }

    @Test
    void report_ShouldKeepDistinctSignalsApart() {
        List<Finding> findings = List.of(
                finding(SENSITIVITY, "cell", ElaborationPath.ROOT, "b", 11),
                finding(SENSITIVITY, "cell", ElaborationPath.ROOT, "a", 11));

        DiagnosticsReport report = reporter.report(List.of(
                UnitAnalysis.completed("cell", findings, List.of(), 1, 1)));

        assertEquals(2, report.findings().size());
        assertEquals("a", report.findings().get(0).signal());
        assertEquals("b", report.findings().get(1).signal());
    }

    @Test
    void report_ShouldNotMergeAcrossTopUnits() {
        DiagnosticsReport report = reporter.report(List.of(
                UnitAnalysis.completed("top_b", List.of(finding(SENSITIVITY, "top_b", ElaborationPath.ROOT, "b", 11)),
                        List.of(), 1, 1),
                UnitAnalysis.completed("top_a", List.of(finding(SENSITIVITY, "top_a", ElaborationPath.ROOT, "b", 11)),
                        List.of(), 1, 1)));

        assertEquals(List.of("top_a", "top_b"), report.findings().stream().map(Finding::topUnit).toList());
        assertEquals(List.of("top_b", "top_a"), report.topUnits());
    }

    @Test
    void report_ShouldOrderByLocationThenRule() {
        List<Finding> findings = List.of(
                finding(SENSITIVITY, "cell", ElaborationPath.ROOT, "b", 30),
                finding(IMPURE, "cell", ElaborationPath.ROOT, "b", 12),
                finding(SENSITIVITY, "cell", ElaborationPath.ROOT, "c", 12));

        DiagnosticsReport report = reporter.report(List.of(
                UnitAnalysis.completed("cell", findings, List.of(), 1, 1)));

        assertEquals(List.of(12, 12, 30), report.findings().stream().map(f -> f.location().line()).toList());
        assertEquals(BuiltInRules.CLOCKED_PROCESS_IMPURE, report.findings().get(0).ruleId());
        assertEquals(BuiltInRules.SENSITIVITY_INCOMPLETE, report.findings().get(1).ruleId());
    }

    @Test
    void report_ShouldCountBySeverityAndRule() {
        List<Finding> findings = List.of(
                finding(SENSITIVITY, "cell", ElaborationPath.ROOT, "a", 11),
                finding(SENSITIVITY, "cell", ElaborationPath.ROOT, "b", 11),
                finding(IMPURE, "cell", ElaborationPath.ROOT, "q", 20));

        DiagnosticsReport report = reporter.report(List.of(
                UnitAnalysis.completed("cell", findings, List.of(), 1, 1)));

        DiagnosticsReport.Summary summary = report.summary();
        assertEquals(3, summary.totalFindings());
        assertEquals(2, summary.count(BuiltInRules.SENSITIVITY_INCOMPLETE));
        assertEquals(1, summary.count(BuiltInRules.CLOCKED_PROCESS_IMPURE));
        assertEquals(0, summary.count(BuiltInRules.LATCH_INFERRED));
        assertEquals(2, summary.count(RuleDefinition.Severity.ERROR));
        assertEquals(1, summary.count(RuleDefinition.Severity.WARN));
        assertEquals(1, report.exitCode());
    }

    @Test
    void exitCode_ShouldIgnoreWarnings() {
        DiagnosticsReport report = reporter.report(List.of(UnitAnalysis.completed("cell",
                List.of(finding(IMPURE, "cell", ElaborationPath.ROOT, "q", 20)), List.of(), 1, 1)));

        assertFalse(report.hasErrors());
        assertEquals(0, report.exitCode());
    }

    @Test
    void exitCode_ShouldFailOnElaborationError() {
        // Arrange
        ElaborationError error = ElaborationError.from("broken", new ElaborationException(
                ElaborationException.ErrorKind.UNKNOWN_UNIT, "Unit 'ghost' is not defined", Location.UNKNOWN));

        // Act
        DiagnosticsReport report = reporter.report(List.of(
                UnitAnalysis.failed("broken", error),
                UnitAnalysis.completed("clean", List.of(), List.of(), 1, 0)));

        // Assert
        assertTrue(report.findings().isEmpty());
        assertEquals(List.of(error), report.elaborationErrors());
        assertEquals(1, report.summary().elaborationErrorCount());
        assertEquals(1, report.exitCode());
    }

    @Test
    void exitCode_ShouldFailOnRuleErrorEvenWithOnlyWarnings() {
        // Arrange: the impure-process rule found a warning, then failed on another instance
        Finding warning = finding(IMPURE, "core", generated(0), "busy", 14);
        EvaluationResult partial = EvaluationResult.error(IMPURE.id(), "core[gen(1).u]: boom",
                List.of(warning), Duration.ZERO, 1);
        EvaluationResult other = EvaluationResult.error(SENSITIVITY.id(), "alpha[]: boom", List.of(), Duration.ZERO, 0);

        // Act
        DiagnosticsReport report = reporter.report(List.of(
                UnitAnalysis.completed("core", List.of(warning), List.of(partial), 2, 2),
                UnitAnalysis.completed("alpha", List.of(), List.of(other), 1, 1)));

        // Assert
        assertEquals(List.of(warning), report.findings());
        assertEquals(List.of(
                        new RuleError("alpha", SENSITIVITY.id(), "alpha[]: boom"),
                        new RuleError("core", IMPURE.id(), "core[gen(1).u]: boom")),
                report.ruleErrors());
        assertEquals(2, report.summary().ruleErrorCount());
        assertEquals(1, report.exitCode());
    }

    @Test
    void report_ShouldBeEmptyForCleanDesign() {
        DiagnosticsReport report = reporter.report(List.of(
                UnitAnalysis.completed("clean", List.of(), List.of(), 1, 1)));

        assertEquals(0, report.summary().totalFindings());
        assertEquals(0, report.exitCode());
    }
}
