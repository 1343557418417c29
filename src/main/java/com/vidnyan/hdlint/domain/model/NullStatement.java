package com.vidnyan.hdlint.domain.model;

/**
 * {@code null;}
 */
public record NullStatement(Location location) implements SequentialStatement {

    public NullStatement {
        location = location == null ? Location.UNKNOWN : location;
    }

    @Override
    public Kind kind() {
        return Kind.NULL;
    }
}
