package com.vidnyan.hdlint.adapter.out.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.hdlint.application.port.out.ReportWriter;
import com.vidnyan.hdlint.domain.elaboration.ElaborationPath;
import com.vidnyan.hdlint.domain.report.DiagnosticsReport;
import com.vidnyan.hdlint.domain.report.ElaborationError;
import com.vidnyan.hdlint.domain.report.RuleError;
import com.vidnyan.hdlint.domain.rule.Finding;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes the diagnostics report as JSON for CI tooling.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JsonReportWriter implements ReportWriter {

    private final ObjectMapper objectMapper;

    @Override
    public void write(DiagnosticsReport report, Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        objectMapper.writeValue(target.toFile(), toDocument(report));
        log.info("Wrote JSON report with {} findings to {}", report.findings().size(), target);
    }

    Map<String, Object> toDocument(DiagnosticsReport report) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("totalFindings", report.summary().totalFindings());
        summary.put("byRule", report.summary().findingsByRule());
        summary.put("bySeverity", report.summary().findingsBySeverity());
        summary.put("elaborationErrors", report.summary().elaborationErrorCount());
        summary.put("ruleErrors", report.summary().ruleErrorCount());
        summary.put("exitCode", report.exitCode());

        Map<String, Object> document = new LinkedHashMap<>();
        document.put("topUnits", report.topUnits());
        document.put("summary", summary);
        document.put("findings", report.findings().stream().map(this::finding).toList());
        document.put("elaborationErrors", report.elaborationErrors().stream().map(this::error).toList());
        document.put("ruleErrors", report.ruleErrors().stream().map(this::ruleError).toList());
        return document;
    }

    private Map<String, Object> finding(Finding finding) {
        Map<String, Object> node = new LinkedHashMap<>();
        node.put("ruleId", finding.ruleId());
        node.put("severity", finding.severity().name());
        node.put("topUnit", finding.topUnit());
        node.put("path", finding.path().format(finding.topUnit()));
        node.put("process", finding.subject());
        node.put("signal", finding.signal());
        node.put("message", finding.message());
        node.put("location", finding.location().format());
        List<String> occurrences = finding.occurrences().stream()
                .map((ElaborationPath p) -> p.format(finding.topUnit()))
                .toList();
        node.put("occurrences", occurrences);
        node.put("context", finding.context());
        if (finding.remediation() != null) {
            Map<String, Object> remediation = new LinkedHashMap<>();
            remediation.put("quickFix", finding.remediation().quickFix());
            remediation.put("explanation", finding.remediation().explanation());
            remediation.put("references", finding.remediation().references());
            node.put("remediation", remediation);
        }
        return node;
    }

    private Map<String, Object> error(ElaborationError error) {
        Map<String, Object> node = new LinkedHashMap<>();
        node.put("topUnit", error.topUnit());
        node.put("kind", error.kind().name());
        node.put("message", error.message());
        node.put("location", error.location().format());
        return node;
    }

    private Map<String, Object> ruleError(RuleError error) {
        Map<String, Object> node = new LinkedHashMap<>();
        node.put("topUnit", error.topUnit());
        node.put("ruleId", error.ruleId());
        node.put("message", error.message());
        return node;
    }
}
