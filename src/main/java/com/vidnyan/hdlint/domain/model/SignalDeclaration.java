package com.vidnyan.hdlint.domain.model;

/**
 * Architecture-local signal.
 */
public record SignalDeclaration(
    String name,
    Expression width
) {

    public SignalDeclaration {
        if (width == null) {
            width = Expression.integer(1);
        }
    }

    public static SignalDeclaration of(String name) {
        return new SignalDeclaration(name, null);
    }
}
