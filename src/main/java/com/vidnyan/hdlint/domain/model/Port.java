package com.vidnyan.hdlint.domain.model;

/**
 * Port of a design unit. The width may depend on the unit's generics.
 */
public record Port(
    String name,
    Direction direction,
    Expression width
) {

    public Port {
        if (width == null) {
            width = Expression.integer(1);
        }
    }

    public static Port in(String name) {
        return new Port(name, Direction.IN, null);
    }

    public static Port out(String name) {
        return new Port(name, Direction.OUT, null);
    }
}
