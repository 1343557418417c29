package com.vidnyan.hdlint.domain.model;

import java.util.List;
import java.util.Optional;

/**
 * The library of design units and architectures delivered by the front end.
 * Immutable aggregate root of the AST.
 */
public record Design(
    List<DesignUnit> units,
    List<Architecture> architectures
) {

    public Design {
        units = List.copyOf(units);
        architectures = List.copyOf(architectures);
    }

    /**
     * Get unit by name.
     */
    public Optional<DesignUnit> unit(String name) {
        return units.stream()
                .filter(u -> u.name().equals(name))
                .findFirst();
    }

    /**
     * Architecture bound to a unit. When several are present the last one wins,
     * the same default binding a simulator applies to the most recently analysed body.
     */
    public Optional<Architecture> architectureOf(String unitName) {
        Architecture bound = null;
        for (Architecture architecture : architectures) {
            if (architecture.entityName().equals(unitName)) {
                bound = architecture;
            }
        }
        return Optional.ofNullable(bound);
    }
}
