package com.vidnyan.hdlint.adapter.out.checker;

import com.vidnyan.hdlint.domain.flow.EdgeUse;
import com.vidnyan.hdlint.domain.flow.FlowSummary;
import com.vidnyan.hdlint.domain.flow.RegisterClassification;
import com.vidnyan.hdlint.domain.flow.SignalWrite;
import com.vidnyan.hdlint.domain.model.Location;
import com.vidnyan.hdlint.domain.rule.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.*;

/**
 * Separates registered from combinational logic. Two independent checks:
 * <ul>
 *   <li>{@code CLOCKED_PROCESS_IMPURE}: a clocked process assigns outside its edge guard, or a
 *   process uses an edge predicate without being a clean clocked process</li>
 *   <li>{@code REGISTER_DUAL_DRIVEN}: a signal assigned under a clock guard somewhere in the
 *   instance is also assigned by a process without one</li>
 * </ul>
 */
@Slf4j
@Component
@Order(30)
public class RegisterDisciplineChecker implements RuleChecker {

    @Override
    public boolean supports(RuleDefinition rule) {
        return BuiltInRules.CLOCKED_PROCESS_IMPURE.equals(rule.id())
                || BuiltInRules.REGISTER_DUAL_DRIVEN.equals(rule.id());
    }

    @Override
    public EvaluationResult evaluate(CheckContext context) {
        Instant start = Instant.now();
        RuleDefinition rule = context.rule();

        List<Finding> findings = BuiltInRules.REGISTER_DUAL_DRIVEN.equals(rule.id())
                ? dualDriven(context)
                : impureClockedProcesses(context);

        Duration duration = Duration.between(start, Instant.now());
        return EvaluationResult.success(rule.id(), findings, duration, context.flows().size());
    }

    private List<Finding> impureClockedProcesses(CheckContext context) {
        List<Finding> findings = new ArrayList<>();
        for (FlowSummary flow : context.flows()) {
            if (flow.isClocked()) {
                Map<String, List<SignalWrite>> outside = new TreeMap<>();
                for (SignalWrite write : flow.writesOutsideGuard()) {
                    outside.computeIfAbsent(write.signal(), k -> new ArrayList<>()).add(write);
                }
                String guard = flow.clockGuard().map(Object::toString).orElse("clock guard");
                outside.forEach((signal, writes) -> findings.add(finding(context, flow, signal,
                        String.format("signal '%s' is assigned outside the %s branch (%s); "
                                        + "the process mixes combinational and registered behaviour",
                                signal, guard, writes.get(0).statementPath()),
                        writes.get(0).location(),
                        Map.of("assignments", writes.stream().map(w -> w.location().format()).toList()))));
            } else {
                Map<String, EdgeUse> byClock = new TreeMap<>();
                for (EdgeUse use : flow.edgeUses()) {
                    byClock.putIfAbsent(use.predicate().signal(), use);
                }
                Set<String> sensitivity = new HashSet<>(flow.process().sensitivity());
                byClock.forEach((clock, use) -> {
                    String reason = sensitivity.contains(clock)
                            ? "is not the sole condition of a single top-level if"
                            : "tests a signal missing from the sensitivity list";
                    findings.add(finding(context, flow, clock,
                            String.format("edge predicate %s in %s %s; the process is neither purely "
                                    + "combinational nor cleanly clocked", use.predicate(), use.statementPath(), reason),
                            use.location(),
                            Map.of("edge", use.predicate().edge().name())));
                });
            }
        }
        return findings;
    }

    private List<Finding> dualDriven(CheckContext context) {
        RegisterClassification registers = context.registers();
        List<Finding> findings = new ArrayList<>();
        if (registers.registers().isEmpty()) {
            return findings;
        }
        for (FlowSummary flow : context.flows()) {
            if (flow.isClocked()) {
                continue;
            }
            Map<String, SignalWrite> firstWrite = new TreeMap<>();
            for (SignalWrite write : flow.assignments()) {
                if (registers.isRegister(write.signal())) {
                    firstWrite.putIfAbsent(write.signal(), write);
                }
            }
            firstWrite.forEach((signal, write) -> findings.add(finding(context, flow, signal,
                    String.format("register '%s' (clocked in %s) is also driven combinationally by this process",
                            signal, String.join(", ", registers.clockedBy(signal))),
                    write.location(),
                    Map.of("clockedBy", List.copyOf(registers.clockedBy(signal))))));
        }
        if (!findings.isEmpty()) {
            log.debug("{} dual-driven registers at [{}]", findings.size(), context.instance().path());
        }
        return findings;
    }

    private Finding finding(CheckContext context, FlowSummary flow, String signal, String message,
                            Location location, Map<String, Object> extra) {
        return Finding.builder()
                .rule(context.rule())
                .topUnit(context.topUnit())
                .path(flow.process().path())
                .subject(flow.process().label())
                .signal(signal)
                .message(message)
                .location(location)
                .sourceProcess(flow.process().sourceId())
                .context(extra)
                .build();
    }
}
