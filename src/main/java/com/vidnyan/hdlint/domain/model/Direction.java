package com.vidnyan.hdlint.domain.model;

/**
 * Port mode. Architecture-local signals are {@link #INTERNAL}.
 */
public enum Direction {
    IN,
    OUT,
    INOUT,
    INTERNAL
}
