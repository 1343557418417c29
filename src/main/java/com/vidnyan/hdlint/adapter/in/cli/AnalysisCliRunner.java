package com.vidnyan.hdlint.adapter.in.cli;

import com.vidnyan.hdlint.application.port.in.AnalyzeDesignUseCase;
import com.vidnyan.hdlint.application.port.in.AnalyzeDesignUseCase.AnalysisRequest;
import com.vidnyan.hdlint.application.port.in.AnalyzeDesignUseCase.AnalysisResult;
import com.vidnyan.hdlint.application.port.out.DesignLoader.DesignLoadException;
import com.vidnyan.hdlint.application.port.out.ReportWriter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;

/**
 * CLI Runner for standalone design analysis.
 * Runs analysis when hdlint.analyze.path property is set, prints one line per finding and
 * reports the exit status: 0 without error findings, 1 with, 2 when the design cannot be read.
 */
@Slf4j
@Component
public class AnalysisCliRunner implements CommandLineRunner, ExitCodeGenerator {

    static final int EXIT_UNREADABLE_DESIGN = 2;

    private final AnalyzeDesignUseCase analyzeDesignUseCase;
    private final ReportWriter reportWriter;
    private final String designPath;
    private final String jsonReportPath;
    private final PrintStream out;

    private int exitCode;

    @Autowired
    public AnalysisCliRunner(AnalyzeDesignUseCase analyzeDesignUseCase,
                             ReportWriter reportWriter,
                             @Value("${hdlint.analyze.path:}") String designPath,
                             @Value("${hdlint.report.json-path:}") String jsonReportPath) {
        this(analyzeDesignUseCase, reportWriter, designPath, jsonReportPath, System.out);
    }

    AnalysisCliRunner(AnalyzeDesignUseCase analyzeDesignUseCase, ReportWriter reportWriter,
                      String designPath, String jsonReportPath, PrintStream out) {
        this.analyzeDesignUseCase = analyzeDesignUseCase;
        this.reportWriter = reportWriter;
        this.designPath = designPath;
        this.jsonReportPath = jsonReportPath;
        this.out = out;
    }

    @Override
    public void run(String... args) {
        if (designPath == null || designPath.isBlank()) {
            log.info("No design specified. Set hdlint.analyze.path property.");
            return;
        }

        log.info("══════════════════════════════════════════════════════════════");
        log.info(" hdlint - analyzing {}", designPath);
        log.info("══════════════════════════════════════════════════════════════");

        AnalysisResult result;
        try {
            result = analyzeDesignUseCase.analyze(AnalysisRequest.forPath(Path.of(designPath)));
        } catch (DesignLoadException e) {
            log.error("Cannot analyze {}: {}", designPath, e.getMessage());
            exitCode = EXIT_UNREADABLE_DESIGN;
            return;
        }

        FindingFormatter.lines(result.report()).forEach(out::println);

        log.info("──────────────────────────────────────────────────────────────");
        log.info(" Top units:  {}", result.stats().topUnitsAnalyzed());
        log.info(" Instances:  {}", result.stats().instancesAnalyzed());
        log.info(" Processes:  {}", result.stats().processesAnalyzed());
        log.info(" Rules:      {}", result.stats().rulesEvaluated());
        log.info(" Duration:   {}ms", result.stats().totalDurationMs());

        if (jsonReportPath != null && !jsonReportPath.isBlank()) {
            try {
                reportWriter.write(result.report(), Path.of(jsonReportPath));
            } catch (IOException e) {
                log.warn("Could not write JSON report to {}: {}", jsonReportPath, e.getMessage());
            }
        }

        exitCode = result.exitCode();
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
