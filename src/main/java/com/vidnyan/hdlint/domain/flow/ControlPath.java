package com.vidnyan.hdlint.domain.flow;

import java.util.ArrayList;
import java.util.List;

/**
 * Branch decisions taken along one path through a process body, e.g. {@code sel=false}.
 */
public record ControlPath(List<String> decisions) {

    public static final ControlPath ENTRY = new ControlPath(List.of());

    public ControlPath {
        decisions = List.copyOf(decisions);
    }

    ControlPath then(List<String> more) {
        List<String> extended = new ArrayList<>(decisions);
        extended.addAll(more);
        return new ControlPath(extended);
    }

    @Override
    public String toString() {
        return decisions.isEmpty() ? "<unconditional>" : String.join(", ", decisions);
    }
}
