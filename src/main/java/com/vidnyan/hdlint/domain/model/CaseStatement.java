package com.vidnyan.hdlint.domain.model;

import java.util.List;
import java.util.Optional;

/**
 * {@code case selector is ... when others => ...}. The others body is optional.
 */
public record CaseStatement(
    Expression selector,
    List<CaseAlternative> alternatives,
    Optional<List<SequentialStatement>> othersBody,
    Location location
) implements SequentialStatement {

    public CaseStatement {
        alternatives = List.copyOf(alternatives);
        othersBody = othersBody == null ? Optional.empty() : othersBody.map(List::copyOf);
        location = location == null ? Location.UNKNOWN : location;
    }

    @Override
    public Kind kind() {
        return Kind.CASE;
    }
}
