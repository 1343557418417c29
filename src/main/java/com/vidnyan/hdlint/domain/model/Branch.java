package com.vidnyan.hdlint.domain.model;

import java.util.List;

/**
 * One {@code if}/{@code elsif} arm.
 */
public record Branch(
    Expression condition,
    List<SequentialStatement> body
) {

    public Branch {
        body = List.copyOf(body);
    }
}
