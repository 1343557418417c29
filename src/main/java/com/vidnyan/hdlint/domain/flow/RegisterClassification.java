package com.vidnyan.hdlint.domain.flow;

import java.util.*;

/**
 * Signals of one instance classified as registers: assigned under a clock guard in some
 * process. Built as a set union over all clocked processes, so the result does not depend
 * on process order.
 */
public final class RegisterClassification {

    private final Map<String, Set<String>> clockedBy; // register → labels of the processes clocking it

    private RegisterClassification(Map<String, Set<String>> clockedBy) {
        this.clockedBy = Collections.unmodifiableMap(clockedBy);
    }

    public static RegisterClassification of(Collection<FlowSummary> flows) {
        Map<String, Set<String>> registers = new TreeMap<>();
        for (FlowSummary flow : flows) {
            if (!flow.isClocked()) {
                continue;
            }
            for (String signal : flow.guardedWrites()) {
                registers.computeIfAbsent(signal, k -> new TreeSet<>()).add(flow.process().label());
            }
        }
        registers.replaceAll((k, v) -> Collections.unmodifiableSet(v));
        return new RegisterClassification(registers);
    }

    public boolean isRegister(String signal) {
        return clockedBy.containsKey(signal);
    }

    /**
     * Labels of the clocked processes assigning the register.
     */
    public Set<String> clockedBy(String signal) {
        return clockedBy.getOrDefault(signal, Set.of());
    }

    public Set<String> registers() {
        return clockedBy.keySet();
    }
}
