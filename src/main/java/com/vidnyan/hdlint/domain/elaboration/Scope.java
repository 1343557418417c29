package com.vidnyan.hdlint.domain.elaboration;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Names visible inside one architecture region: signals with their widths, and constants
 * (generics, loop variables, declared constants, enumeration literals).
 * Constants without an integer value are kept by name only.
 */
record Scope(
    Map<String, Integer> signalWidths,
    Map<String, Long> values,
    Set<String> symbolicConstants
) {

    Scope {
        signalWidths = Collections.unmodifiableMap(new LinkedHashMap<>(signalWidths));
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        symbolicConstants = Set.copyOf(symbolicConstants);
    }

    boolean isSignal(String name) {
        return signalWidths.containsKey(name);
    }

    boolean isConstant(String name) {
        return values.containsKey(name) || symbolicConstants.contains(name);
    }

    boolean isDeclared(String name) {
        return isSignal(name) || isConstant(name);
    }

    ConstantEvaluator evaluator() {
        return new ConstantEvaluator(values);
    }

    /**
     * Scope of one generate iteration.
     */
    Scope withLoopVariable(String name, long value) {
        Map<String, Long> extended = new LinkedHashMap<>(values);
        extended.put(name, value);
        return new Scope(signalWidths, extended, symbolicConstants);
    }
}
