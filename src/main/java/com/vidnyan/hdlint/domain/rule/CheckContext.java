package com.vidnyan.hdlint.domain.rule;

import com.vidnyan.hdlint.domain.elaboration.Instance;
import com.vidnyan.hdlint.domain.flow.FlowSummary;
import com.vidnyan.hdlint.domain.flow.RegisterClassification;

import java.util.List;

/**
 * Context provided to rule checkers: one elaborated instance with the flow summaries of its
 * processes and the register classification derived from them.
 */
public record CheckContext(
    RuleDefinition rule,
    String topUnit,
    Instance instance,
    List<FlowSummary> flows,
    RegisterClassification registers
) {

    /**
     * Create context.
     */
    public static CheckContext of(RuleDefinition rule, String topUnit, Instance instance, List<FlowSummary> flows) {
        return new CheckContext(rule, topUnit, instance, List.copyOf(flows), RegisterClassification.of(flows));
    }
}
