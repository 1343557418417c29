package com.vidnyan.hdlint.domain.model;

/**
 * Statement directly inside an architecture or a generate body.
 */
public sealed interface ConcurrentStatement
        permits ProcessStatement, Instantiation, GenerateFor, GenerateIf {

    enum Kind {
        PROCESS,
        INSTANTIATION,
        GENERATE_FOR,
        GENERATE_IF
    }

    Kind kind();

    String label();

    Location location();
}
