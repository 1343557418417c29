package com.vidnyan.hdlint.domain.flow;

import com.vidnyan.hdlint.domain.elaboration.ElaboratedProcess;

import java.util.*;

/**
 * Structural read/write summary of one elaborated process.
 *
 * @param readSet          signals read anywhere (conditions, right-hand sides, selectors, indices),
 *                         in first-use order
 * @param writePaths       one entry per leaf of the branch tree, including implicit empty branches
 * @param alwaysWritten    signals written on every path
 * @param sometimesWritten signals written on some paths but not all
 * @param assignments      every assignment in statement order
 * @param edgeUses         edge predicates other than the clock guard itself
 */
public record FlowSummary(
    ElaboratedProcess process,
    ProcessKind kind,
    Optional<ClockGuard> clockGuard,
    Map<String, SignalUse> readSet,
    List<WritePath> writePaths,
    Set<String> alwaysWritten,
    Set<String> sometimesWritten,
    List<SignalWrite> assignments,
    List<EdgeUse> edgeUses
) {

    public FlowSummary {
        readSet = Collections.unmodifiableMap(new LinkedHashMap<>(readSet));
        writePaths = List.copyOf(writePaths);
        alwaysWritten = Collections.unmodifiableSet(new TreeSet<>(alwaysWritten));
        sometimesWritten = Collections.unmodifiableSet(new TreeSet<>(sometimesWritten));
        assignments = List.copyOf(assignments);
        edgeUses = List.copyOf(edgeUses);
    }

    public boolean isClocked() {
        return kind == ProcessKind.CLOCKED;
    }

    /**
     * Signals read but absent from the sensitivity list, in first-use order.
     */
    public List<SignalUse> missingFromSensitivity() {
        Set<String> listed = new HashSet<>(process.sensitivity());
        return readSet.values().stream()
                .filter(use -> !listed.contains(use.signal()))
                .toList();
    }

    /**
     * Paths on which the signal is not assigned.
     */
    public List<ControlPath> unassignedPaths(String signal) {
        return writePaths.stream()
                .filter(p -> !p.writes(signal))
                .map(WritePath::path)
                .toList();
    }

    /**
     * Signals assigned inside the edge-guarded branch.
     */
    public Set<String> guardedWrites() {
        Set<String> guarded = new TreeSet<>();
        for (SignalWrite write : assignments) {
            if (write.region() == SignalWrite.Region.GUARDED) {
                guarded.add(write.signal());
            }
        }
        return guarded;
    }

    /**
     * Assignments of a clocked process that lie outside its guarded branch.
     */
    public List<SignalWrite> writesOutsideGuard() {
        return assignments.stream()
                .filter(w -> w.region() == SignalWrite.Region.OUTSIDE_GUARD)
                .toList();
    }

    /**
     * First assignment of a signal, if any.
     */
    public Optional<SignalWrite> firstAssignment(String signal) {
        return assignments.stream()
                .filter(w -> w.signal().equals(signal))
                .findFirst();
    }
}
