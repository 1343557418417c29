package com.vidnyan.hdlint.application.service;

import com.vidnyan.hdlint.adapter.out.checker.SensitivityListChecker;
import com.vidnyan.hdlint.domain.elaboration.ElaboratedDesign;
import com.vidnyan.hdlint.domain.elaboration.ElaborationException;
import com.vidnyan.hdlint.domain.elaboration.Elaborator;
import com.vidnyan.hdlint.domain.flow.FlowExtractor;
import com.vidnyan.hdlint.domain.model.Location;
import com.vidnyan.hdlint.domain.report.ElaborationError;
import com.vidnyan.hdlint.domain.report.UnitAnalysis;
import com.vidnyan.hdlint.domain.rule.BuiltInRules;
import com.vidnyan.hdlint.domain.rule.RuleChecker;
import com.vidnyan.hdlint.domain.rule.RuleDefinition;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;

import static com.vidnyan.hdlint.DesignFixtures.incompleteSensitivity;
import static org.junit.jupiter.api.Assertions.*;

class UnitAnalyzerTest {

    private static final Map<RuleDefinition, Optional<RuleChecker>> CHECKERS = Map.of(
            BuiltInRules.find(BuiltInRules.SENSITIVITY_INCOMPLETE).orElseThrow(),
            Optional.of(new SensitivityListChecker()));

    /**
     * Elaborator that fails unexpectedly for one unit and works for the others.
     */
    private static Elaborator failingFor(String unit) {
        return new Elaborator(incompleteSensitivity()) {
            @Override
            public ElaboratedDesign elaborate(String topUnit) {
                if (topUnit.equals(unit)) {
                    throw new IndexOutOfBoundsException("Index 3 out of bounds for length 3");
                }
                return super.elaborate(topUnit);
            }
        };
    }

    @Test
    void analyze_ShouldTurnUnexpectedFailureIntoElaborationError() {
        // Arrange
        UnitAnalyzer analyzer = new UnitAnalyzer(failingFor("comb"), new FlowExtractor(), CHECKERS);

        // Act
        UnitAnalysis analysis = analyzer.analyze("comb");

        // Assert
        assertTrue(analysis.isFailed());
        ElaborationError error = analysis.error().orElseThrow();
        assertEquals(ElaborationException.ErrorKind.INTERNAL_ERROR, error.kind());
        assertTrue(error.message().contains("Index 3 out of bounds"));
        assertEquals(Location.UNKNOWN, error.location());
    }

    @Test
    void analyze_ShouldKeepWorkingAfterUnexpectedFailure() {
        UnitAnalyzer analyzer = new UnitAnalyzer(failingFor("ghost"), new FlowExtractor(), CHECKERS);

        assertTrue(analyzer.analyze("ghost").isFailed());
        UnitAnalysis healthy = analyzer.analyze("comb");

        assertFalse(healthy.isFailed());
        assertEquals(1, healthy.findings().size());
    }
}
