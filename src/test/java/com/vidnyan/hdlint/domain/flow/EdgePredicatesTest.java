package com.vidnyan.hdlint.domain.flow;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.Locale;
import java.util.Optional;

import static com.vidnyan.hdlint.DesignFixtures.expr;
import static org.junit.jupiter.api.Assertions.*;

class EdgePredicatesTest {

    private final Locale defaultLocale = Locale.getDefault();

    @AfterEach
    void restoreLocale() {
        Locale.setDefault(defaultLocale);
    }

    @Test
    void match_ShouldIgnoreCaseOfEdgeFunction() {
        assertEquals(Optional.of(new ClockGuard("clk", EdgeKind.RISING)), EdgePredicates.match(expr("RISING_EDGE(clk)")));
        assertEquals(Optional.of(new ClockGuard("clk", EdgeKind.FALLING)), EdgePredicates.match(expr("Falling_Edge(clk)")));
    }

    @Test
    void match_ShouldNotDependOnDefaultLocale() {
        // Arrange: lower-casing "I" under a Turkish locale yields a dotless i
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));

        // Act
        Optional<ClockGuard> guard = EdgePredicates.match(expr("RISING_EDGE(clk)"));

        // Assert
        assertEquals(Optional.of(new ClockGuard("clk", EdgeKind.RISING)), guard);
        assertEquals("rising", EdgeKind.RISING.label());
    }

    @Test
    void match_ShouldRejectOtherCalls() {
        assertTrue(EdgePredicates.match(expr("edge(clk)")).isEmpty());
        assertTrue(EdgePredicates.match(expr("rising_edge(clk, rst)")).isEmpty());
    }
}
