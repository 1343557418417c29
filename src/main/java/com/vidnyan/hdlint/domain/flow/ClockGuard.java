package com.vidnyan.hdlint.domain.flow;

/**
 * Edge-detection predicate on one signal, e.g. {@code rising_edge(clk)}.
 */
public record ClockGuard(
    String signal,
    EdgeKind edge
) {

    @Override
    public String toString() {
        return edge.label() + "_edge(" + signal + ")";
    }
}
