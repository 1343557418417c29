package com.vidnyan.hdlint.domain.flow;

import com.vidnyan.hdlint.domain.model.Location;

/**
 * First point where a process reads a signal.
 *
 * @param statementPath position of the statement in the body, e.g. {@code #1/if(sel)/#1}
 * @param position      role of the expression: condition, right-hand side, case selector, target index
 */
public record SignalUse(
    String signal,
    String statementPath,
    String position,
    Location location
) {

    public String describe() {
        return position + " of " + statementPath;
    }
}
