package com.vidnyan.hdlint.domain.flow;

import com.vidnyan.hdlint.domain.model.Location;

/**
 * One assignment in a process body, with its position relative to the clock guard.
 */
public record SignalWrite(
    String signal,
    String statementPath,
    Location location,
    Region region
) {

    public enum Region {
        /** No clock guard in the process. */
        UNGUARDED_PROCESS,
        /** Inside the edge-guarded branch. */
        GUARDED,
        /** In a clocked process, but outside the edge-guarded branch. */
        OUTSIDE_GUARD
    }
}
