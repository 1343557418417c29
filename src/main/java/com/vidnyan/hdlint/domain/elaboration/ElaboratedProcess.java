package com.vidnyan.hdlint.domain.elaboration;

import com.vidnyan.hdlint.domain.model.Location;
import com.vidnyan.hdlint.domain.model.ProcessStatement;
import com.vidnyan.hdlint.domain.model.SequentialStatement;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A process placed at a concrete position in the instance graph.
 *
 * @param path      elaboration path of the process, including enclosing generate iterations
 * @param signals   names of the signals and ports visible to the process
 * @param constants resolved generics, loop variables and integer constants in scope
 */
public record ElaboratedProcess(
    SourceProcessId sourceId,
    ElaborationPath path,
    ElaborationPath instancePath,
    ProcessStatement statement,
    Set<String> signals,
    Map<String, Long> constants
) {

    public ElaboratedProcess {
        signals = Set.copyOf(signals);
        constants = Map.copyOf(constants);
    }

    public String label() {
        return statement.label();
    }

    public List<String> sensitivity() {
        return statement.sensitivity();
    }

    public List<SequentialStatement> body() {
        return statement.body();
    }

    public Location location() {
        return statement.location();
    }

    public boolean isSignal(String name) {
        return signals.contains(name);
    }
}
