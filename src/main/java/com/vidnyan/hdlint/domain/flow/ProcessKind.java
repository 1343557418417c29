package com.vidnyan.hdlint.domain.flow;

/**
 * Terminal classification of a process. A process starts {@link #UNCLASSIFIED}, becomes
 * {@link #CLOCKED} when its body is a single edge-guarded if, and otherwise
 * {@link #COMBINATIONAL_ONLY} at the first assignment seen. A process without any
 * assignment stays unclassified and is checked as combinational.
 */
public enum ProcessKind {
    UNCLASSIFIED,
    COMBINATIONAL_ONLY,
    CLOCKED
}
