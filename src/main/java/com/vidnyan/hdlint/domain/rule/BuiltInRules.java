package com.vidnyan.hdlint.domain.rule;

import java.util.List;
import java.util.Optional;

/**
 * Identifiers and default definitions of the design rules shipped with the analyzer.
 * Rule files on the classpath may override name, severity and enablement.
 */
public final class BuiltInRules {

    public static final String SENSITIVITY_INCOMPLETE = "SENSITIVITY_INCOMPLETE";
    public static final String LATCH_INFERRED = "LATCH_INFERRED";
    public static final String CLOCKED_PROCESS_IMPURE = "CLOCKED_PROCESS_IMPURE";
    public static final String REGISTER_DUAL_DRIVEN = "REGISTER_DUAL_DRIVEN";

    private BuiltInRules() {
    }

    public static List<RuleDefinition> all() {
        return List.of(
                RuleDefinition.builder()
                        .id(SENSITIVITY_INCOMPLETE)
                        .name("Complete sensitivity list")
                        .description("Every signal read by a combinational process must be in its sensitivity list")
                        .severity(RuleDefinition.Severity.ERROR)
                        .category(RuleDefinition.Category.SENSITIVITY)
                        .build(),
                RuleDefinition.builder()
                        .id(LATCH_INFERRED)
                        .name("No inferred latches")
                        .description("A combinational process must assign each of its outputs on every path")
                        .severity(RuleDefinition.Severity.ERROR)
                        .category(RuleDefinition.Category.LATCH_INFERENCE)
                        .build(),
                RuleDefinition.builder()
                        .id(CLOCKED_PROCESS_IMPURE)
                        .name("Pure clocked processes")
                        .description("All assignments of a clocked process must be inside its edge guard")
                        .severity(RuleDefinition.Severity.WARN)
                        .category(RuleDefinition.Category.REGISTER_DISCIPLINE)
                        .build(),
                RuleDefinition.builder()
                        .id(REGISTER_DUAL_DRIVEN)
                        .name("Single driver for registers")
                        .description("A register must not also be assigned by a combinational process")
                        .severity(RuleDefinition.Severity.ERROR)
                        .category(RuleDefinition.Category.REGISTER_DISCIPLINE)
                        .build());
    }

    public static Optional<RuleDefinition> find(String ruleId) {
        return all().stream()
                .filter(r -> r.id().equals(ruleId))
                .findFirst();
    }
}
