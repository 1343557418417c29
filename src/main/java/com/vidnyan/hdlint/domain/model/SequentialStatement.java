package com.vidnyan.hdlint.domain.model;

/**
 * Statement inside a process body. Traversals dispatch on {@link #kind()} so a new statement
 * kind only touches the traversals that care about it.
 */
public sealed interface SequentialStatement
        permits Assignment, IfStatement, CaseStatement, NullStatement {

    enum Kind {
        ASSIGNMENT,
        IF,
        CASE,
        NULL
    }

    Kind kind();

    Location location();
}
