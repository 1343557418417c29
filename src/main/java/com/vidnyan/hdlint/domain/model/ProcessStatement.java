package com.vidnyan.hdlint.domain.model;

import java.util.List;

/**
 * Process with its declared sensitivity list and sequential body.
 * An empty sensitivity list is kept as given; it is never interpreted as "all signals".
 */
public record ProcessStatement(
    String label,
    List<String> sensitivity,
    List<SequentialStatement> body,
    Location location
) implements ConcurrentStatement {

    public ProcessStatement {
        sensitivity = List.copyOf(sensitivity);
        body = List.copyOf(body);
        location = location == null ? Location.UNKNOWN : location;
    }

    @Override
    public Kind kind() {
        return Kind.PROCESS;
    }
}
