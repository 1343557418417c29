package com.vidnyan.hdlint.domain.model;

import java.util.List;
import java.util.Optional;

/**
 * Entity declaration: the externally visible interface of a design unit.
 * Immutable value object.
 */
public record DesignUnit(
    String name,
    List<Generic> generics,
    List<Port> ports,
    Location location
) {

    public DesignUnit {
        generics = List.copyOf(generics);
        ports = List.copyOf(ports);
        location = location == null ? Location.UNKNOWN : location;
    }

    public Optional<Port> port(String portName) {
        return ports.stream()
                .filter(p -> p.name().equals(portName))
                .findFirst();
    }

    public boolean hasGeneric(String genericName) {
        return generics.stream().anyMatch(g -> g.name().equals(genericName));
    }
}
