package com.vidnyan.hdlint.domain.rule;

import com.vidnyan.hdlint.domain.elaboration.ElaborationPath;
import com.vidnyan.hdlint.domain.elaboration.SourceProcessId;
import com.vidnyan.hdlint.domain.model.Location;

import java.util.List;
import java.util.Map;

/**
 * A rule violation found in one elaborated process.
 * Immutable value object; the reporter merges findings but never recomputes them.
 *
 * @param path        elaboration path where the process lives
 * @param subject     process label the finding is reported against
 * @param signal      offending signal
 * @param remediation guidance copied from the rule, or null when the rule carries none
 * @param occurrences every elaboration path where the same violation recurs, sorted; a
 *                    freshly checked finding carries only its own path
 */
public record Finding(
    String ruleId,
    String ruleName,
    RuleDefinition.Severity severity,
    String topUnit,
    ElaborationPath path,
    String subject,
    String signal,
    String message,
    RuleDefinition.Remediation remediation,
    Location location,
    SourceProcessId sourceProcess,
    List<ElaborationPath> occurrences,
    Map<String, Object> context
) {

    public Finding {
        occurrences = occurrences == null || occurrences.isEmpty() ? List.of(path) : List.copyOf(occurrences);
        context = context == null ? Map.of() : Map.copyOf(context);
    }

    /**
     * Key under which repeats of this finding across identical elaborated copies merge.
     */
    public DeduplicationKey deduplicationKey() {
        return new DeduplicationKey(topUnit, sourceProcess, ruleId, signal);
    }

    public record DeduplicationKey(String topUnit, SourceProcessId sourceProcess, String ruleId, String signal) {}

    /**
     * Copy annotated with the full set of recurrence paths; the first one becomes the primary path.
     */
    public Finding withOccurrences(List<ElaborationPath> paths) {
        return new Finding(ruleId, ruleName, severity, topUnit, paths.get(0), subject, signal, message,
                remediation, location, sourceProcess, paths, context);
    }

    public boolean recurs() {
        return occurrences.size() > 1;
    }

    /**
     * Get context value.
     */
    @SuppressWarnings("unchecked")
    public <T> T getContext(String key, Class<T> type) {
        return (T) context.get(key);
    }

    /**
     * Builder for Finding.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String ruleId;
        private String ruleName;
        private RuleDefinition.Severity severity = RuleDefinition.Severity.ERROR;
        private String topUnit;
        private ElaborationPath path = ElaborationPath.ROOT;
        private String subject;
        private String signal;
        private String message;
        private RuleDefinition.Remediation remediation;
        private Location location = Location.UNKNOWN;
        private SourceProcessId sourceProcess;
        private Map<String, Object> context = Map.of();

        public Builder rule(RuleDefinition rule) {
            this.ruleId = rule.id();
            this.ruleName = rule.name();
            this.severity = rule.severity();
            this.remediation = rule.remediation();
            return this;
        }

        public Builder ruleId(String id) { this.ruleId = id; return this; }
        public Builder severity(RuleDefinition.Severity sev) { this.severity = sev; return this; }
        public Builder topUnit(String topUnit) { this.topUnit = topUnit; return this; }
        public Builder path(ElaborationPath path) { this.path = path; return this; }
        public Builder subject(String subject) { this.subject = subject; return this; }
        public Builder signal(String signal) { this.signal = signal; return this; }
        public Builder message(String msg) { this.message = msg; return this; }
        public Builder location(Location loc) { this.location = loc; return this; }
        public Builder sourceProcess(SourceProcessId id) { this.sourceProcess = id; return this; }
        public Builder context(Map<String, Object> ctx) { this.context = ctx; return this; }

        public Finding build() {
            return new Finding(ruleId, ruleName, severity, topUnit, path, subject, signal, message, remediation,
                    location, sourceProcess, List.of(path), context);
        }
    }
}
