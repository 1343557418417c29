package com.vidnyan.hdlint.application.service;

import com.vidnyan.hdlint.domain.elaboration.ElaboratedDesign;
import com.vidnyan.hdlint.domain.elaboration.ElaborationException;
import com.vidnyan.hdlint.domain.elaboration.Elaborator;
import com.vidnyan.hdlint.domain.elaboration.Instance;
import com.vidnyan.hdlint.domain.flow.FlowExtractionException;
import com.vidnyan.hdlint.domain.flow.FlowExtractor;
import com.vidnyan.hdlint.domain.flow.FlowSummary;
import com.vidnyan.hdlint.domain.model.Location;
import com.vidnyan.hdlint.domain.report.ElaborationError;
import com.vidnyan.hdlint.domain.report.UnitAnalysis;
import com.vidnyan.hdlint.domain.rule.*;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.*;

/**
 * Runs the pipeline for a single top unit: elaborate, extract flows, check rules.
 * Holds no state between calls, so one analyzer may serve several top units concurrently.
 */
@Slf4j
class UnitAnalyzer {

    private final Elaborator elaborator;
    private final FlowExtractor flowExtractor;
    private final Map<RuleDefinition, Optional<RuleChecker>> checkers;

    UnitAnalyzer(Elaborator elaborator, FlowExtractor flowExtractor,
                 Map<RuleDefinition, Optional<RuleChecker>> checkers) {
        this.elaborator = elaborator;
        this.flowExtractor = flowExtractor;
        this.checkers = checkers;
    }

    UnitAnalysis analyze(String topUnit) {
        log.info("Analyzing top unit {}", topUnit);

        ElaboratedDesign elaborated;
        Map<Instance, List<FlowSummary>> flows = new LinkedHashMap<>();
        try {
            elaborated = elaborator.elaborate(topUnit);
            for (Instance instance : elaborated.instances()) {
                flows.put(instance, flowExtractor.extractAll(instance));
            }
        } catch (ElaborationException e) {
            log.error("Elaboration of {} failed: [{}] {}", topUnit, e.getKind(), e.getMessage());
            return UnitAnalysis.failed(topUnit, ElaborationError.from(topUnit, e));
        } catch (FlowExtractionException e) {
            log.error("Flow extraction for {} exceeded the analysis limit: {}", topUnit, e.getMessage());
            return UnitAnalysis.failed(topUnit, new ElaborationError(topUnit,
                    ElaborationException.ErrorKind.ANALYSIS_LIMIT, e.getMessage(), e.getLocation()));
        } catch (RuntimeException e) {
            log.error("Unexpected failure while elaborating {}: {}", topUnit, e.toString(), e);
            return UnitAnalysis.failed(topUnit, new ElaborationError(topUnit,
                    ElaborationException.ErrorKind.INTERNAL_ERROR, String.valueOf(e), Location.UNKNOWN));
        }

        log.info("Elaborated {}: {} instances, {} processes",
                topUnit, flows.size(), elaborated.processCount());

        List<Finding> findings = new ArrayList<>();
        List<EvaluationResult> ruleResults = new ArrayList<>();
        checkers.forEach((rule, checker) -> {
            EvaluationResult result = checker
                    .map(c -> check(topUnit, rule, c, flows))
                    .orElseGet(() -> {
                        log.warn("No checker found for rule: {}", rule.id());
                        return EvaluationResult.skipped(rule.id(), "No checker available");
                    });
            ruleResults.add(result);
            findings.addAll(result.findings());
        });

        return UnitAnalysis.completed(topUnit, findings, ruleResults, flows.size(), elaborated.processCount());
    }

    /**
     * Apply one rule to every instance. A checker failing on one instance marks the rule's result
     * as an error but keeps its findings and moves on to the remaining instances.
     */
    private EvaluationResult check(String topUnit, RuleDefinition rule, RuleChecker checker,
                                   Map<Instance, List<FlowSummary>> flows) {
        List<Finding> findings = new ArrayList<>();
        Duration duration = Duration.ZERO;
        int processes = 0;
        List<String> failures = new ArrayList<>();
        for (Map.Entry<Instance, List<FlowSummary>> entry : flows.entrySet()) {
            try {
                EvaluationResult result = checker.evaluate(CheckContext.of(rule, topUnit, entry.getKey(), entry.getValue()));
                findings.addAll(result.findings());
                duration = duration.plus(result.executionTime());
                processes += result.processesAnalyzed();
            } catch (RuntimeException e) {
                String at = entry.getKey().path().format(topUnit);
                log.error("Error checking rule {} at {}: {}", rule.id(), at, e.getMessage(), e);
                failures.add(at + ": " + e.getMessage());
            }
        }
        if (!findings.isEmpty()) {
            log.info("  {} found {} findings in {}", rule.id(), findings.size(), topUnit);
        }
        if (!failures.isEmpty()) {
            return EvaluationResult.error(rule.id(), String.join("; ", failures), findings, duration, processes);
        }
        return EvaluationResult.success(rule.id(), findings, duration, processes);
    }
}
