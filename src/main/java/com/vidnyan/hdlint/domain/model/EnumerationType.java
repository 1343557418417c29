package com.vidnyan.hdlint.domain.model;

import java.util.List;

/**
 * Enumeration type declared in an architecture, e.g. the states of a state machine.
 * Its literals are constants, never signals.
 */
public record EnumerationType(
    String name,
    List<String> literals
) {

    public EnumerationType {
        literals = List.copyOf(literals);
    }
}
