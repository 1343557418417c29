package com.vidnyan.hdlint.domain.report;

import com.vidnyan.hdlint.domain.elaboration.ElaborationPath;
import com.vidnyan.hdlint.domain.rule.Finding;
import com.vidnyan.hdlint.domain.rule.RuleDefinition;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Aggregates findings of all analysed top units into one ordered report.
 *
 * Findings that differ only by elaboration path, because they come from the same source
 * process expanded several times (generate loops, repeated instantiation), are reported once
 * with the recurrence paths attached. Distinct violations are never merged.
 */
public class DiagnosticsReporter {

    private static final Comparator<Finding> ORDER = Comparator
            .comparing(Finding::topUnit)
            .thenComparing(Finding::path)
            .thenComparing(Finding::location)
            .thenComparing(Finding::ruleId)
            .thenComparing(Finding::subject, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(Finding::signal, Comparator.nullsFirst(Comparator.naturalOrder()));

    public DiagnosticsReport report(List<UnitAnalysis> analyses) {
        List<Finding> all = new ArrayList<>();
        List<ElaborationError> errors = new ArrayList<>();
        List<RuleError> ruleErrors = new ArrayList<>();
        for (UnitAnalysis analysis : analyses) {
            all.addAll(analysis.findings());
            analysis.error().ifPresent(errors::add);
            ruleErrors.addAll(analysis.ruleErrors());
        }

        List<Finding> merged = deduplicate(all).stream()
                .sorted(ORDER)
                .toList();
        errors.sort(Comparator.comparing(ElaborationError::topUnit));
        ruleErrors.sort(Comparator.comparing(RuleError::topUnit).thenComparing(RuleError::ruleId));

        Map<String, Integer> byRule = merged.stream()
                .collect(Collectors.groupingBy(
                        Finding::ruleId,
                        TreeMap::new,
                        Collectors.collectingAndThen(Collectors.counting(), Long::intValue)));
        Map<RuleDefinition.Severity, Integer> bySeverity = merged.stream()
                .collect(Collectors.groupingBy(
                        Finding::severity,
                        () -> new EnumMap<>(RuleDefinition.Severity.class),
                        Collectors.collectingAndThen(Collectors.counting(), Long::intValue)));

        DiagnosticsReport.Summary summary = new DiagnosticsReport.Summary(
                merged.size(),
                Collections.unmodifiableMap(byRule),
                Collections.unmodifiableMap(bySeverity),
                errors.size(),
                ruleErrors.size());

        List<String> topUnits = analyses.stream().map(UnitAnalysis::topUnit).toList();
        return new DiagnosticsReport(topUnits, merged, errors, ruleErrors, summary);
    }

    /**
     * Merge findings sharing a deduplication key; the merged finding keeps the content of the
     * copy at the lowest elaboration path and lists every path where it recurs.
     */
    private List<Finding> deduplicate(List<Finding> findings) {
        Map<Finding.DeduplicationKey, List<Finding>> groups = new LinkedHashMap<>();
        for (Finding finding : findings) {
            groups.computeIfAbsent(finding.deduplicationKey(), k -> new ArrayList<>()).add(finding);
        }

        List<Finding> result = new ArrayList<>();
        for (List<Finding> group : groups.values()) {
            if (group.size() == 1) {
                result.add(group.get(0));
                continue;
            }
            group.sort(Comparator.comparing(Finding::path));
            List<ElaborationPath> paths = group.stream()
                    .flatMap(f -> f.occurrences().stream())
                    .distinct()
                    .sorted()
                    .toList();
            result.add(group.get(0).withOccurrences(paths));
        }
        return result;
    }
}
