package com.vidnyan.hdlint.domain.rule;

/**
 * Interface for rule checkers.
 * Each checker handles one or more rule ids and is applied once per elaborated instance.
 */
public interface RuleChecker {

    /**
     * Check if this checker can handle the given rule.
     */
    boolean supports(RuleDefinition rule);

    /**
     * Check the rule against one instance.
     */
    EvaluationResult evaluate(CheckContext context);

    /**
     * Get the checker name for logging.
     */
    default String getName() {
        return getClass().getSimpleName();
    }
}
