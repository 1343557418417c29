package com.vidnyan.hdlint.domain.model;

import java.util.List;
import java.util.Optional;

/**
 * {@code if / elsif / else}. Branches are ordered; the else body is optional.
 */
public record IfStatement(
    List<Branch> branches,
    Optional<List<SequentialStatement>> elseBody,
    Location location
) implements SequentialStatement {

    public IfStatement {
        if (branches.isEmpty()) {
            throw new IllegalArgumentException("If statement needs at least one branch");
        }
        branches = List.copyOf(branches);
        elseBody = elseBody == null ? Optional.empty() : elseBody.map(List::copyOf);
        location = location == null ? Location.UNKNOWN : location;
    }

    public static IfStatement of(Expression condition, List<SequentialStatement> then, Location location) {
        return new IfStatement(List.of(new Branch(condition, then)), Optional.empty(), location);
    }

    public static IfStatement of(Expression condition, List<SequentialStatement> then,
                                 List<SequentialStatement> otherwise, Location location) {
        return new IfStatement(List.of(new Branch(condition, then)), Optional.of(otherwise), location);
    }

    @Override
    public Kind kind() {
        return Kind.IF;
    }
}
