package com.vidnyan.hdlint.domain.model;

import java.util.List;

/**
 * Signal assignment {@code target <= value}. The target is a plain name or an indexed name
 * such as {@code q(i)}.
 */
public record Assignment(
    Expression target,
    Expression value,
    Location location
) implements SequentialStatement {

    public Assignment {
        if (target.kind() != Expression.Kind.NAME && target.kind() != Expression.Kind.CALL) {
            throw new IllegalArgumentException("Assignment target must be a name: " + target);
        }
        location = location == null ? Location.UNKNOWN : location;
    }

    public static Assignment of(String target, Expression value, Location location) {
        return new Assignment(Expression.name(target), value, location);
    }

    /**
     * Name of the signal written, without any index.
     */
    public String targetSignal() {
        return target instanceof Expression.Call call
                ? call.name()
                : ((Expression.Name) target).identifier();
    }

    /**
     * Index expressions of the target; these are read, not written.
     */
    public List<Expression> targetIndices() {
        return target instanceof Expression.Call call ? call.arguments() : List.of();
    }

    @Override
    public Kind kind() {
        return Kind.ASSIGNMENT;
    }
}
