package com.vidnyan.hdlint.application.port.in;

import com.vidnyan.hdlint.domain.model.Design;
import com.vidnyan.hdlint.domain.report.DiagnosticsReport;
import com.vidnyan.hdlint.domain.report.UnitAnalysis;

import java.nio.file.Path;
import java.util.List;

/**
 * Primary use case: analyze an elaborated design for design-rule violations.
 * This is the main entry point to the application.
 */
public interface AnalyzeDesignUseCase {

    /**
     * Analyze the requested top units and return the diagnostics report.
     * @param request Analysis request parameters
     * @return Report plus per-unit outcomes and statistics
     */
    AnalysisResult analyze(AnalysisRequest request);

    /**
     * Analysis request parameters. Exactly one of {@code design} and {@code designPath} is set.
     */
    record AnalysisRequest(
        Design design,
        Path designPath,
        List<String> topUnits,   // Empty = every unit no other unit instantiates
        List<String> ruleIds     // Empty = all enabled rules
    ) {
        public AnalysisRequest {
            topUnits = topUnits == null ? List.of() : List.copyOf(topUnits);
            ruleIds = ruleIds == null ? List.of() : List.copyOf(ruleIds);
        }

        public static AnalysisRequest forDesign(Design design, String... topUnits) {
            return new AnalysisRequest(design, null, List.of(topUnits), List.of());
        }

        public static AnalysisRequest forPath(Path path) {
            return new AnalysisRequest(null, path, List.of(), List.of());
        }

        public AnalysisRequest withRules(String... ids) {
            return new AnalysisRequest(design, designPath, topUnits, List.of(ids));
        }
    }

    /**
     * Analysis result.
     */
    record AnalysisResult(
        DiagnosticsReport report,
        List<UnitAnalysis> units,
        AnalysisStats stats
    ) {
        public int exitCode() {
            return report.exitCode();
        }
    }

    /**
     * Analysis statistics.
     */
    record AnalysisStats(
        int topUnitsAnalyzed,
        int instancesAnalyzed,
        int processesAnalyzed,
        int rulesEvaluated,
        long totalDurationMs
    ) {}
}
