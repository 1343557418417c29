package com.vidnyan.hdlint.adapter.out.checker;

import com.vidnyan.hdlint.domain.flow.FlowSummary;
import com.vidnyan.hdlint.domain.flow.SignalUse;
import com.vidnyan.hdlint.domain.rule.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Detects combinational processes that read signals missing from their sensitivity list.
 * Simulation only re-evaluates such a process on listed events while the synthesized gates
 * react to every input, so the two disagree.
 */
@Slf4j
@Component
@Order(10)
public class SensitivityListChecker implements RuleChecker {

    @Override
    public boolean supports(RuleDefinition rule) {
        return BuiltInRules.SENSITIVITY_INCOMPLETE.equals(rule.id())
                || RuleDefinition.Category.SENSITIVITY == rule.category();
    }

    @Override
    public EvaluationResult evaluate(CheckContext context) {
        Instant start = Instant.now();
        RuleDefinition rule = context.rule();
        List<Finding> findings = new ArrayList<>();

        for (FlowSummary flow : context.flows()) {
            if (flow.isClocked()) {
                continue;
            }
            boolean emptyList = flow.process().sensitivity().isEmpty();
            for (SignalUse use : flow.missingFromSensitivity()) {
                String message = emptyList
                        ? String.format("process has an empty sensitivity list but reads signal '%s' (first read in %s)",
                                use.signal(), use.describe())
                        : String.format("signal '%s' is read but missing from the sensitivity list (first read in %s)",
                                use.signal(), use.describe());
                findings.add(Finding.builder()
                        .rule(rule)
                        .topUnit(context.topUnit())
                        .path(flow.process().path())
                        .subject(flow.process().label())
                        .signal(use.signal())
                        .message(message)
                        .location(use.location())
                        .sourceProcess(flow.process().sourceId())
                        .context(Map.of(
                                "statementPath", use.statementPath(),
                                "position", use.position(),
                                "sensitivity", flow.process().sensitivity()))
                        .build());
            }
        }

        log.debug("{} findings for {} at [{}]", findings.size(), rule.id(), context.instance().path());
        Duration duration = Duration.between(start, Instant.now());
        return EvaluationResult.success(rule.id(), findings, duration, context.flows().size());
    }
}
