package com.vidnyan.hdlint.domain.model;

import java.util.Optional;

/**
 * Compile-time parameter of a design unit. The default may reference generics declared
 * before it in the same unit.
 */
public record Generic(
    String name,
    String type,
    Optional<Expression> defaultValue
) {

    public Generic {
        defaultValue = defaultValue == null ? Optional.empty() : defaultValue;
    }

    public static Generic of(String name, Expression defaultValue) {
        return new Generic(name, "integer", Optional.ofNullable(defaultValue));
    }

    public static Generic required(String name) {
        return new Generic(name, "integer", Optional.empty());
    }
}
