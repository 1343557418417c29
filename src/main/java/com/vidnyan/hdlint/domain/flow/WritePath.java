package com.vidnyan.hdlint.domain.flow;

import java.util.Set;

/**
 * Signals written along one control path.
 */
public record WritePath(
    ControlPath path,
    Set<String> writes
) {

    public WritePath {
        writes = Set.copyOf(writes);
    }

    public boolean writes(String signal) {
        return writes.contains(signal);
    }
}
