package com.vidnyan.hdlint.domain.report;

/**
 * A rule checker failed on part of a top unit. Findings it produced elsewhere are still
 * reported, but the run counts as failed.
 */
public record RuleError(
    String topUnit,
    String ruleId,
    String message
) {
}
