package com.vidnyan.hdlint.domain.model;

import java.util.List;

/**
 * {@code when a | b =>} arm of a case statement.
 */
public record CaseAlternative(
    List<Expression> choices,
    List<SequentialStatement> body
) {

    public CaseAlternative {
        if (choices.isEmpty()) {
            throw new IllegalArgumentException("Case alternative needs at least one choice");
        }
        choices = List.copyOf(choices);
        body = List.copyOf(body);
    }
}
