package com.vidnyan.hdlint.domain.elaboration;

import com.vidnyan.hdlint.domain.model.Architecture;
import com.vidnyan.hdlint.domain.model.ConcurrentStatement;
import com.vidnyan.hdlint.domain.model.Design;
import com.vidnyan.hdlint.domain.model.DesignUnit;
import com.vidnyan.hdlint.domain.model.GenerateFor;
import com.vidnyan.hdlint.domain.model.GenerateIf;
import com.vidnyan.hdlint.domain.model.Instantiation;

import java.util.*;

/**
 * Unit-level instantiation graph: unit → units its architecture instantiates, including
 * instantiations nested in generate bodies.
 * Used for top-unit discovery, cycle detection and the elaboration order.
 */
public final class InstantiationGraph {

    private final Map<String, Set<String>> instantiates; // unit → units it instantiates
    private final Map<String, Set<String>> instantiatedBy; // unit → units that instantiate it
    private final Set<String> units;

    private InstantiationGraph(
            Map<String, Set<String>> instantiates,
            Map<String, Set<String>> instantiatedBy,
            Set<String> units
    ) {
        this.instantiates = Collections.unmodifiableMap(instantiates);
        this.instantiatedBy = Collections.unmodifiableMap(instantiatedBy);
        this.units = Collections.unmodifiableSet(units);
    }

    /**
     * Build the graph from every architecture of the design.
     */
    public static InstantiationGraph build(Design design) {
        Map<String, Set<String>> edges = new LinkedHashMap<>();
        Map<String, Set<String>> reverse = new LinkedHashMap<>();
        Set<String> names = new LinkedHashSet<>();

        for (DesignUnit unit : design.units()) {
            names.add(unit.name());
        }

        for (DesignUnit unit : design.units()) {
            Optional<Architecture> architecture = design.architectureOf(unit.name());
            if (architecture.isEmpty()) {
                continue;
            }
            List<String> children = new ArrayList<>();
            collectInstantiations(architecture.get().statements(), children);
            for (String child : children) {
                edges.computeIfAbsent(unit.name(), k -> new LinkedHashSet<>()).add(child);
                reverse.computeIfAbsent(child, k -> new LinkedHashSet<>()).add(unit.name());
            }
        }

        return new InstantiationGraph(edges, reverse, names);
    }

    private static void collectInstantiations(List<ConcurrentStatement> statements, List<String> into) {
        for (ConcurrentStatement statement : statements) {
            switch (statement.kind()) {
                case INSTANTIATION -> into.add(((Instantiation) statement).unitName());
                case GENERATE_FOR -> collectInstantiations(((GenerateFor) statement).body(), into);
                case GENERATE_IF -> collectInstantiations(((GenerateIf) statement).body(), into);
                case PROCESS -> { }
            }
        }
    }

    /**
     * Units instantiated directly by a unit.
     */
    public Set<String> getInstantiations(String unitName) {
        return instantiates.getOrDefault(unitName, Set.of());
    }

    /**
     * Units that directly instantiate a unit.
     */
    public Set<String> getInstantiators(String unitName) {
        return instantiatedBy.getOrDefault(unitName, Set.of());
    }

    /**
     * Units that no other unit instantiates, in declaration order. These are the natural
     * top units of a batch run.
     */
    public List<String> roots() {
        return units.stream()
                .filter(u -> getInstantiators(u).isEmpty())
                .toList();
    }

    /**
     * Find a cycle reachable from the given unit.
     * Returns the cycle as a list of unit names whose last element repeats the first.
     */
    public Optional<List<String>> findCycleFrom(String topUnit) {
        List<String> cycle = findCycleRecursive(topUnit, new HashSet<>(), new HashSet<>(), new ArrayList<>());
        return Optional.ofNullable(cycle);
    }

    private List<String> findCycleRecursive(String current, Set<String> visited, Set<String> inStack,
                                            List<String> path) {
        visited.add(current);
        inStack.add(current);
        path.add(current);

        for (String child : getInstantiations(current)) {
            if (inStack.contains(child)) {
                List<String> cycle = new ArrayList<>(path.subList(path.indexOf(child), path.size()));
                cycle.add(child);
                return cycle;
            }
            if (!visited.contains(child)) {
                List<String> found = findCycleRecursive(child, visited, inStack, path);
                if (found != null) {
                    return found;
                }
            }
        }

        path.remove(path.size() - 1);
        inStack.remove(current);
        return null;
    }

    /**
     * Units reachable from the top unit, every unit listed before the units it instantiates.
     * The graph below the top unit must be acyclic.
     */
    public List<String> topologicalOrder(String topUnit) {
        Deque<String> order = new ArrayDeque<>();
        visitPostOrder(topUnit, new HashSet<>(), order);
        return List.copyOf(order);
    }

    private void visitPostOrder(String unit, Set<String> visited, Deque<String> order) {
        if (!visited.add(unit)) {
            return;
        }
        for (String child : getInstantiations(unit)) {
            visitPostOrder(child, visited, order);
        }
        order.addFirst(unit);
    }
}
