package com.vidnyan.hdlint.application.service;

import com.vidnyan.hdlint.AnalysisProperties;
import com.vidnyan.hdlint.application.port.in.AnalyzeDesignUseCase;
import com.vidnyan.hdlint.application.port.out.DesignLoader;
import com.vidnyan.hdlint.application.port.out.RuleRepository;
import com.vidnyan.hdlint.domain.elaboration.Elaborator;
import com.vidnyan.hdlint.domain.elaboration.InstantiationGraph;
import com.vidnyan.hdlint.domain.flow.FlowExtractor;
import com.vidnyan.hdlint.domain.model.Design;
import com.vidnyan.hdlint.domain.model.DesignUnit;
import com.vidnyan.hdlint.domain.report.DiagnosticsReport;
import com.vidnyan.hdlint.domain.report.DiagnosticsReporter;
import com.vidnyan.hdlint.domain.report.UnitAnalysis;
import com.vidnyan.hdlint.domain.rule.RuleChecker;
import com.vidnyan.hdlint.domain.rule.RuleDefinition;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Main application service that orchestrates the analysis workflow.
 * Implements the primary use case.
 *
 * Top units are independent: each one is analyzed by its own task, and an elaboration error
 * aborts only the task it occurs in.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnalysisApplicationService implements AnalyzeDesignUseCase {

    private final DesignLoader designLoader;
    private final RuleRepository ruleRepository;
    private final List<RuleChecker> ruleCheckers;
    private final AnalysisProperties properties;
    private final DiagnosticsReporter reporter = new DiagnosticsReporter();

    @Override
    public AnalysisResult analyze(AnalysisRequest request) {
        Instant startTime = Instant.now();

        // Step 1: Obtain the design
        Design design = request.design();
        if (design == null) {
            log.info("Step 1: Loading design from {}", request.designPath());
            design = designLoader.load(request.designPath());
        }
        log.info("Design: {} units, {} architectures", design.units().size(), design.architectures().size());

        // Step 2: Choose top units
        List<String> topUnits = topUnits(request, design);
        log.info("Step 2: Top units {}", topUnits);

        // Step 3: Load rules
        List<RuleDefinition> rules = rules(request);
        log.info("Step 3: Loaded {} rules", rules.size());
        Map<RuleDefinition, Optional<RuleChecker>> checkers = new LinkedHashMap<>();
        for (RuleDefinition rule : rules) {
            checkers.put(rule, findChecker(rule));
        }

        // Step 4: Analyze every top unit
        log.info("Step 4: Analyzing {} top units with parallelism {}", topUnits.size(), properties.getParallelism());
        UnitAnalyzer analyzer = new UnitAnalyzer(new Elaborator(design),
                new FlowExtractor(properties.getMaxPathsPerProcess()), checkers);
        List<UnitAnalysis> units = runAll(analyzer, topUnits);

        // Step 5: Report
        DiagnosticsReport report = reporter.report(units);

        Duration totalDuration = Duration.between(startTime, Instant.now());
        AnalysisStats stats = new AnalysisStats(
                units.size(),
                units.stream().mapToInt(UnitAnalysis::instancesAnalyzed).sum(),
                units.stream().mapToInt(UnitAnalysis::processesAnalyzed).sum(),
                rules.size(),
                totalDuration.toMillis());

        log.info("Analysis complete: {} findings, {} elaboration errors, {} rule errors in {}ms",
                report.summary().totalFindings(), report.summary().elaborationErrorCount(),
                report.summary().ruleErrorCount(), stats.totalDurationMs());
        return new AnalysisResult(report, units, stats);
    }

    private List<UnitAnalysis> runAll(UnitAnalyzer analyzer, List<String> topUnits) {
        if (topUnits.size() <= 1 || properties.getParallelism() <= 1) {
            return topUnits.stream().map(analyzer::analyze).toList();
        }

        ExecutorService executor = Executors.newFixedThreadPool(Math.min(properties.getParallelism(), topUnits.size()));
        try {
            List<Future<UnitAnalysis>> futures = new ArrayList<>();
            for (String topUnit : topUnits) {
                futures.add(executor.submit(() -> analyzer.analyze(topUnit)));
            }
            List<UnitAnalysis> units = new ArrayList<>();
            for (Future<UnitAnalysis> future : futures) {
                units.add(future.get());
            }
            return units;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Analysis interrupted", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Analysis task failed: " + e.getCause().getMessage(), e.getCause());
        } finally {
            executor.shutdownNow();
        }
    }

    /**
     * Requested top units, else configured ones, else every unit no other unit instantiates.
     * A design where every unit sits on a cycle has no roots; all units are analyzed then so
     * the cycle gets reported.
     */
    private List<String> topUnits(AnalysisRequest request, Design design) {
        if (!request.topUnits().isEmpty()) {
            return request.topUnits();
        }
        if (!properties.getTopUnits().isEmpty()) {
            return List.copyOf(properties.getTopUnits());
        }
        List<String> roots = InstantiationGraph.build(design).roots();
        if (roots.isEmpty()) {
            log.warn("No unit is free of instantiators; analyzing every unit");
            return design.units().stream().map(DesignUnit::name).toList();
        }
        return roots;
    }

    private List<RuleDefinition> rules(AnalysisRequest request) {
        List<RuleDefinition> rules = request.ruleIds().isEmpty()
                ? ruleRepository.findEnabled()
                : request.ruleIds().stream()
                        .map(id -> {
                            Optional<RuleDefinition> rule = ruleRepository.findById(id);
                            if (rule.isEmpty()) {
                                log.warn("Unknown rule requested: {}", id);
                            }
                            return rule;
                        })
                        .flatMap(Optional::stream)
                        .toList();
        return rules.stream()
                .sorted(Comparator.comparing(RuleDefinition::id))
                .toList();
    }

    private Optional<RuleChecker> findChecker(RuleDefinition rule) {
        return ruleCheckers.stream()
                .filter(c -> c.supports(rule))
                .findFirst();
    }
}
