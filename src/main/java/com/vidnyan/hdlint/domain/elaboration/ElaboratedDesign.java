package com.vidnyan.hdlint.domain.elaboration;

import java.util.List;

/**
 * Instance graph of one top unit.
 */
public record ElaboratedDesign(
    String topUnit,
    Instance root
) {

    /**
     * All instances, depth-first from the root.
     */
    public List<Instance> instances() {
        return root.flatten();
    }

    public int processCount() {
        return instances().stream().mapToInt(i -> i.processes().size()).sum();
    }
}
