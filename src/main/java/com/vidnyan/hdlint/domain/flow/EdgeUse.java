package com.vidnyan.hdlint.domain.flow;

import com.vidnyan.hdlint.domain.model.Location;

/**
 * Edge predicate used somewhere other than as the sole top-level guard of the process.
 */
public record EdgeUse(
    ClockGuard predicate,
    String statementPath,
    Location location
) {}
