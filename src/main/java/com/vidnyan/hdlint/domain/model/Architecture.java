package com.vidnyan.hdlint.domain.model;

import java.util.List;

/**
 * Architecture body bound to one design unit by name.
 */
public record Architecture(
    String name,
    String entityName,
    List<SignalDeclaration> signals,
    List<ConstantDeclaration> constants,
    List<EnumerationType> types,
    List<ConcurrentStatement> statements
) {

    public Architecture {
        signals = List.copyOf(signals);
        constants = List.copyOf(constants);
        types = List.copyOf(types);
        statements = List.copyOf(statements);
    }

    public static Builder builder(String name, String entityName) {
        return new Builder(name, entityName);
    }

    public static class Builder {
        private final String name;
        private final String entityName;
        private List<SignalDeclaration> signals = List.of();
        private List<ConstantDeclaration> constants = List.of();
        private List<EnumerationType> types = List.of();
        private List<ConcurrentStatement> statements = List.of();

        private Builder(String name, String entityName) {
            this.name = name;
            this.entityName = entityName;
        }

        public Builder signals(List<SignalDeclaration> signals) { this.signals = signals; return this; }
        public Builder constants(List<ConstantDeclaration> constants) { this.constants = constants; return this; }
        public Builder types(List<EnumerationType> types) { this.types = types; return this; }
        public Builder statements(List<ConcurrentStatement> statements) { this.statements = statements; return this; }

        public Architecture build() {
            return new Architecture(name, entityName, signals, constants, types, statements);
        }
    }
}
