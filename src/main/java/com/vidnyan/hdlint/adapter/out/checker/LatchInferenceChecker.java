package com.vidnyan.hdlint.adapter.out.checker;

import com.vidnyan.hdlint.domain.flow.ControlPath;
import com.vidnyan.hdlint.domain.flow.FlowSummary;
import com.vidnyan.hdlint.domain.flow.SignalWrite;
import com.vidnyan.hdlint.domain.rule.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Detects combinational processes that assign a signal on some control paths but not all.
 * The signal must then hold its value on the remaining paths, which only a latch can do.
 * Signals never written are dead, not latches, and are ignored.
 */
@Slf4j
@Component
@Order(20)
public class LatchInferenceChecker implements RuleChecker {

    @Override
    public boolean supports(RuleDefinition rule) {
        return BuiltInRules.LATCH_INFERRED.equals(rule.id())
                || RuleDefinition.Category.LATCH_INFERENCE == rule.category();
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
            for (String signal : flow.sometimesWritten()) {
                List<String> unassigned = flow.unassignedPaths(signal).stream()
                        .map(ControlPath::toString)
                        .toList();
                findings.add(Finding.builder()
                        .rule(rule)
                        .topUnit(context.topUnit())
                        .path(flow.process().path())
                        .subject(flow.process().label())
                        .signal(signal)
                        .message(String.format(
                                "signal '%s' is not assigned on every path and infers a latch; unassigned when %s",
                                signal, String.join(" | ", unassigned)))
                        .location(flow.firstAssignment(signal)
                                .map(SignalWrite::location)
                                .orElse(flow.process().location()))
                        .sourceProcess(flow.process().sourceId())
                        .context(Map.of(
                                "unassignedPaths", unassigned,
                                "pathCount", flow.writePaths().size()))
                        .build());
            }
        }

        if (!findings.isEmpty()) {
            log.debug("{} latch findings at [{}]: {}", findings.size(), context.instance().path(),
                    findings.stream().map(Finding::signal).collect(Collectors.joining(", ")));
        }
        Duration duration = Duration.between(start, Instant.now());
        return EvaluationResult.success(rule.id(), findings, duration, context.flows().size());
    }
}
