package com.vidnyan.hdlint.domain.model;

/**
 * Architecture-level constant. Its value may reference the unit's generics.
 */
public record ConstantDeclaration(
    String name,
    Expression value
) {}
