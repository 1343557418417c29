package com.vidnyan.hdlint;

import com.vidnyan.hdlint.adapter.out.checker.LatchInferenceChecker;
import com.vidnyan.hdlint.adapter.out.checker.RegisterDisciplineChecker;
import com.vidnyan.hdlint.adapter.out.checker.SensitivityListChecker;
import com.vidnyan.hdlint.application.port.in.AnalyzeDesignUseCase;
import com.vidnyan.hdlint.application.port.in.AnalyzeDesignUseCase.AnalysisRequest;
import com.vidnyan.hdlint.application.port.in.AnalyzeDesignUseCase.AnalysisResult;
import com.vidnyan.hdlint.application.port.out.RuleRepository;
import com.vidnyan.hdlint.domain.rule.BuiltInRules;
import com.vidnyan.hdlint.domain.rule.Finding;
import com.vidnyan.hdlint.domain.rule.RuleChecker;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = {"hdlint.analyze.path=", "hdlint.analysis.parallelism=2"})
class HdlintApplicationTests {

    private static final String ARRAY = """
            {
              "file": "array.vhd",
              "units": [
                { "name": "cell", "line": 1,
                  "ports": [ { "name": "a" }, { "name": "b" }, { "name": "c", "direction": "out" } ] },
                { "name": "soc", "line": 3 }
              ],
              "architectures": [
                { "entity": "cell", "statements": [
                    { "process": { "label": "p", "sensitivity": ["a"], "line": 10, "body": [
                        { "assign": { "target": "c", "value": "a or b", "line": 11, "column": 5 } }
                    ] } }
                ] },
                { "entity": "soc", "statements": [
                    { "generate": { "label": "gen", "variable": "i", "from": "0", "to": "3", "line": 5, "body": [
                        { "instance": { "label": "u", "unit": "cell", "line": 6 } }
                    ] } }
                ] }
              ]
            }
            """;

    @TempDir
    Path tempDir;

    @Autowired
    private AnalyzeDesignUseCase analyzeDesignUseCase;

    @Autowired
    private RuleRepository ruleRepository;

    @Autowired
    private List<RuleChecker> ruleCheckers;

    @Autowired
    private AnalysisProperties properties;

    @Test
    void contextLoads_ShouldWireCheckersInOrder() {
        assertEquals(List.of(SensitivityListChecker.class, LatchInferenceChecker.class, RegisterDisciplineChecker.class),
                ruleCheckers.stream().map(Object::getClass).toList());
        assertEquals(4, ruleRepository.findEnabled().size());
        assertEquals(2, properties.getParallelism());
        assertEquals(4096, properties.getMaxPathsPerProcess());
    }

    @Test
    void analyze_ShouldRunWholePipelineFromFile() throws IOException {
        // Arrange
        Path file = tempDir.resolve("array.json");
        Files.writeString(file, ARRAY);

        // Act
        AnalysisResult result = analyzeDesignUseCase.analyze(AnalysisRequest.forPath(file));

        // Assert
        assertEquals(List.of("soc"), result.report().topUnits());
        assertEquals(1, result.report().findings().size());
        Finding finding = result.report().findings().get(0);
        assertEquals(BuiltInRules.SENSITIVITY_INCOMPLETE, finding.ruleId());
        assertEquals("soc[gen(0).u]", finding.path().format("soc"));
        assertEquals(4, finding.occurrences().size());
        assertEquals("array.vhd:11:5", finding.location().format());
        assertEquals(1, result.exitCode());
    }
}
