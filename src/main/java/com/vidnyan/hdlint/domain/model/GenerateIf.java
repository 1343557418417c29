package com.vidnyan.hdlint.domain.model;

import java.util.List;

/**
 * {@code label: if condition generate ... end generate}.
 */
public record GenerateIf(
    String label,
    Expression condition,
    List<ConcurrentStatement> body,
    Location location
) implements ConcurrentStatement {

    public GenerateIf {
        body = List.copyOf(body);
        location = location == null ? Location.UNKNOWN : location;
    }

    @Override
    public Kind kind() {
        return Kind.GENERATE_IF;
    }
}
