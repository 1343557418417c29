package com.vidnyan.hdlint.domain.elaboration;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A design unit bound to resolved generic values and a concrete port map.
 * Created by the {@link Elaborator} and never mutated afterwards.
 *
 * @param generics     resolved generic values, in declaration order
 * @param signalWidths concrete width of every port and internal signal
 * @param portMap      formal port to rendered actual in the parent ({@code data(3)})
 */
public record Instance(
    ElaborationPath path,
    String unitName,
    String architectureName,
    Map<String, Long> generics,
    Map<String, Integer> signalWidths,
    Map<String, String> portMap,
    List<ElaboratedProcess> processes,
    List<Instance> children
) {

    public Instance {
        processes = List.copyOf(processes);
        children = List.copyOf(children);
    }

    public Optional<Long> generic(String name) {
        return Optional.ofNullable(generics.get(name));
    }

    /**
     * This instance followed by all instances below it, depth-first.
     */
    public List<Instance> flatten() {
        List<Instance> result = new ArrayList<>();
        collect(this, result);
        return result;
    }

    private static void collect(Instance instance, List<Instance> into) {
        into.add(instance);
        for (Instance child : instance.children()) {
            collect(child, into);
        }
    }
}
