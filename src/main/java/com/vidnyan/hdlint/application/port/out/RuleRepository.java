package com.vidnyan.hdlint.application.port.out;

import com.vidnyan.hdlint.domain.rule.RuleDefinition;

import java.util.List;
import java.util.Optional;

/**
 * Port for loading rule definitions.
 */
public interface RuleRepository {

    Optional<RuleDefinition> findById(String ruleId);

    /**
     * Load enabled rules only.
     */
    List<RuleDefinition> findEnabled();
}
