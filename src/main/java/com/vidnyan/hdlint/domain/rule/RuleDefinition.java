package com.vidnyan.hdlint.domain.rule;

import java.util.List;

/**
 * Rule definition - identifies a design rule and how its findings are reported.
 * Immutable value object loaded from JSON.
 */
public record RuleDefinition(
    String id,
    String name,
    String description,
    Severity severity,
    Category category,
    Remediation remediation,
    boolean isEnabled
) {

    public enum Severity {
        BLOCKER,    // Must fix before synthesis
        ERROR,      // Functional problem; fails the run
        WARN,       // Should fix but not failing
        INFO        // Informational
    }

    public enum Category {
        SENSITIVITY,
        LATCH_INFERENCE,
        REGISTER_DISCIPLINE,
        CUSTOM
    }

    /**
     * Remediation guidance.
     */
    public record Remediation(
        String quickFix,
        String explanation,
        List<String> references
    ) {}

    /**
     * Copy with another severity.
     */
    public RuleDefinition withSeverity(Severity newSeverity) {
        return new RuleDefinition(id, name, description, newSeverity, category, remediation, isEnabled);
    }

    /**
     * Builder for RuleDefinition.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String name;
        private String description;
        private Severity severity = Severity.ERROR;
        private Category category = Category.CUSTOM;
        private Remediation remediation;
        private boolean isEnabled = true;

        public Builder id(String id) { this.id = id; return this; }
        public Builder name(String name) { this.name = name; return this; }
        public Builder description(String desc) { this.description = desc; return this; }
        public Builder severity(Severity sev) { this.severity = sev; return this; }
        public Builder category(Category cat) { this.category = cat; return this; }
        public Builder remediation(Remediation rem) { this.remediation = rem; return this; }
        public Builder isEnabled(boolean enabled) { this.isEnabled = enabled; return this; }

        public RuleDefinition build() {
            return new RuleDefinition(id, name, description, severity, category, remediation, isEnabled);
        }
    }
}
