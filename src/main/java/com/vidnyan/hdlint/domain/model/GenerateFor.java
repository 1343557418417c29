package com.vidnyan.hdlint.domain.model;

import java.util.List;

/**
 * {@code label: for var in lo to hi generate ... end generate}. The bounds may depend on
 * generics and enclosing loop variables.
 */
public record GenerateFor(
    String label,
    String loopVariable,
    Expression low,
    Expression high,
    List<ConcurrentStatement> body,
    Location location
) implements ConcurrentStatement {

    public GenerateFor {
        body = List.copyOf(body);
        location = location == null ? Location.UNKNOWN : location;
    }

    @Override
    public Kind kind() {
        return Kind.GENERATE_FOR;
    }
}
