package com.vidnyan.hdlint.domain.elaboration;

import com.vidnyan.hdlint.domain.elaboration.ElaborationException.ErrorKind;
import com.vidnyan.hdlint.domain.model.*;
import lombok.extern.slf4j.Slf4j;

import java.util.*;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Resolves generics and expands instantiations and generate constructs of one top unit into
 * an immutable instance graph.
 *
 * Flow:
 * 1. Reject unknown top units and instantiation cycles reachable from the top
 * 2. Walk the unit graph in topological order (parents before children)
 * 3. Per pending instance: resolve generics, evaluate widths, expand statements
 * 4. Freeze the instance tree
 *
 * Every name a process refers to must resolve in its architecture's scope; anything else
 * is a fatal {@link ElaborationException}.
 */
@Slf4j
public class Elaborator {

    private final Design design;
    private final InstantiationGraph graph;

    public Elaborator(Design design) {
        this.design = design;
        this.graph = InstantiationGraph.build(design);
    }

    /**
     * Elaborate a top unit with its own generic defaults.
     */
    public ElaboratedDesign elaborate(String topUnit) {
        DesignUnit top = design.unit(topUnit).orElseThrow(() -> new ElaborationException(
                ErrorKind.UNKNOWN_UNIT, "Unknown top unit '" + topUnit + "'", null));

        graph.findCycleFrom(topUnit).ifPresent(cycle -> {
            throw new ElaborationException(ErrorKind.INSTANTIATION_CYCLE,
                    "Instantiation cycle: " + String.join(" -> ", cycle), top.location());
        });

        List<String> order = graph.topologicalOrder(topUnit);
        log.debug("Elaboration order for {}: {}", topUnit, order);
        Map<String, Integer> rank = new HashMap<>();
        for (int i = 0; i < order.size(); i++) {
            rank.put(order.get(i), i);
        }

        // Units are expanded in topological rank, so every instance of a unit is created
        // only after all of its possible instantiators are expanded.
        PriorityQueue<InstanceNode> worklist = new PriorityQueue<>(Comparator
                .comparingInt((InstanceNode n) -> rank.getOrDefault(n.unitName, Integer.MAX_VALUE))
                .thenComparingLong(n -> n.sequence));

        InstanceNode root = new InstanceNode(0, ElaborationPath.ROOT, topUnit, Map.of(), Map.of(), top.location());
        worklist.add(root);
        long[] sequence = {1};

        int expanded = 0;
        while (!worklist.isEmpty()) {
            InstanceNode node = worklist.poll();
            expand(node, child -> {
                child.sequence = sequence[0]++;
                worklist.add(child);
            });
            expanded++;
        }

        log.debug("Elaborated {} instances for top unit {}", expanded, topUnit);
        return new ElaboratedDesign(topUnit, root.freeze());
    }

    private void expand(InstanceNode node, Consumer<InstanceNode> enqueue) {
        DesignUnit unit = design.unit(node.unitName).orElseThrow(() -> new ElaborationException(
                ErrorKind.UNKNOWN_UNIT, "Unknown design unit '" + node.unitName + "'", node.location));
        Architecture architecture = design.architectureOf(unit.name()).orElseThrow(() -> new ElaborationException(
                ErrorKind.MISSING_ARCHITECTURE, "Design unit '" + unit.name() + "' has no architecture",
                unit.location()));

        node.architectureName = architecture.name();
        node.generics = resolveGenerics(unit, node.genericActuals);
        Scope scope = buildScope(unit, architecture, node.generics);
        node.signalWidths = scope.signalWidths();

        log.debug("Expanding {} ({}) at [{}] with generics {}",
                unit.name(), architecture.name(), node.path, node.generics);
        expandStatements(architecture.statements(), node, unit, architecture, scope, node.path, enqueue);
    }

    /**
     * Overrides first, then defaults in declaration order; a default may use earlier generics.
     */
    private Map<String, Long> resolveGenerics(DesignUnit unit, Map<String, Long> actuals) {
        Map<String, Long> resolved = new LinkedHashMap<>();
        for (Generic generic : unit.generics()) {
            Long actual = actuals.get(generic.name());
            if (actual != null) {
                resolved.put(generic.name(), actual);
                continue;
            }
            Expression defaultValue = generic.defaultValue().orElseThrow(() -> new ElaborationException(
                    ErrorKind.UNRESOLVED_GENERIC,
                    "Generic '" + generic.name() + "' of unit '" + unit.name() + "' has no value and no default",
                    unit.location()));
            try {
                resolved.put(generic.name(), new ConstantEvaluator(resolved).genericValue(defaultValue));
            } catch (ConstantEvaluator.NotConstantException e) {
                throw translate(e, ErrorKind.NON_CONSTANT_EXPRESSION,
                        "Default of generic '" + generic.name() + "' in unit '" + unit.name() + "'",
                        unit.location(), null);
            }
        }
        return Collections.unmodifiableMap(resolved);
    }

    private Scope buildScope(DesignUnit unit, Architecture architecture, Map<String, Long> generics) {
        Map<String, Long> values = new LinkedHashMap<>(generics);
        Set<String> symbolic = new HashSet<>();
        for (EnumerationType type : architecture.types()) {
            symbolic.addAll(type.literals());
        }

        Map<String, Integer> widths = new LinkedHashMap<>();
        Set<String> signalNames = new HashSet<>();
        unit.ports().forEach(p -> signalNames.add(p.name()));
        architecture.signals().forEach(s -> signalNames.add(s.name()));

        for (ConstantDeclaration constant : architecture.constants()) {
            try {
                values.put(constant.name(), new ConstantEvaluator(values).genericValue(constant.value()));
            } catch (ConstantEvaluator.NotConstantException e) {
                if (e.isUnresolvedName() && !values.containsKey(e.getUnresolvedName())
                        && !symbolic.contains(e.getUnresolvedName())
                        && !signalNames.contains(e.getUnresolvedName())) {
                    throw new ElaborationException(ErrorKind.UNRESOLVED_REFERENCE,
                            "Constant '" + constant.name() + "' in " + unit.name() + "(" + architecture.name()
                                    + ") refers to undeclared name '" + e.getUnresolvedName() + "'",
                            unit.location());
                }
                symbolic.add(constant.name());
            }
        }

        ConstantEvaluator evaluator = new ConstantEvaluator(values);
        for (Port port : unit.ports()) {
            widths.put(port.name(), width(evaluator, port.width(), "port '" + port.name() + "'", unit));
        }
        for (SignalDeclaration signal : architecture.signals()) {
            widths.put(signal.name(), width(evaluator, signal.width(), "signal '" + signal.name() + "'", unit));
        }
        return new Scope(widths, values, symbolic);
    }

    private int width(ConstantEvaluator evaluator, Expression expression, String what, DesignUnit unit) {
        try {
            long value = evaluator.integerValue(expression);
            if (value < 0 || value > Integer.MAX_VALUE) {
                throw new ElaborationException(ErrorKind.NON_CONSTANT_EXPRESSION,
                        "Width of " + what + " in unit '" + unit.name() + "' evaluates to " + value,
                        unit.location());
            }
            return (int) value;
        } catch (ConstantEvaluator.NotConstantException e) {
            throw translate(e, ErrorKind.NON_CONSTANT_EXPRESSION,
                    "Width of " + what + " in unit '" + unit.name() + "'", unit.location(), null);
        }
    }

    private void expandStatements(List<ConcurrentStatement> statements, InstanceNode node, DesignUnit unit,
                                  Architecture architecture, Scope scope, ElaborationPath region,
                                  Consumer<InstanceNode> enqueue) {
        for (ConcurrentStatement statement : statements) {
            switch (statement.kind()) {
                case PROCESS -> {
                    ProcessStatement process = (ProcessStatement) statement;
                    new ReferenceValidator(scope, process).validate();
                    node.processes.add(new ElaboratedProcess(
                            new SourceProcessId(unit.name(), architecture.name(), process.label(), process.location()),
                            region,
                            node.path,
                            process,
                            scope.signalWidths().keySet(),
                            scope.values()));
                }
                case INSTANTIATION -> {
                    InstanceNode child = instantiate((Instantiation) statement, scope, region);
                    node.children.add(child);
                    enqueue.accept(child);
                }
                case GENERATE_FOR -> {
                    GenerateFor generate = (GenerateFor) statement;
                    long low = bound(generate, generate.low(), scope);
                    long high = bound(generate, generate.high(), scope);
                    log.debug("Generate {} at [{}]: {} to {}", generate.label(), region, low, high);
                    for (long i = low; i <= high; i++) {
                        expandStatements(generate.body(), node, unit, architecture,
                                scope.withLoopVariable(generate.loopVariable(), i),
                                region.child(ElaborationPath.Segment.generate(generate.label(), i)), enqueue);
                    }
                }
                case GENERATE_IF -> {
                    GenerateIf generate = (GenerateIf) statement;
                    boolean enabled;
                    try {
                        enabled = scope.evaluator().booleanValue(generate.condition());
                    } catch (ConstantEvaluator.NotConstantException e) {
                        throw translate(e, ErrorKind.NON_CONSTANT_EXPRESSION,
                                "Condition of generate '" + generate.label() + "'", generate.location(), scope);
                    }
                    if (enabled) {
                        expandStatements(generate.body(), node, unit, architecture, scope,
                                region.child(generate.label()), enqueue);
                    }
                }
            }
        }
    }

    private long bound(GenerateFor generate, Expression expression, Scope scope) {
        try {
            return scope.evaluator().integerValue(expression);
        } catch (ConstantEvaluator.NotConstantException e) {
            throw translate(e, ErrorKind.NON_INTEGER_GENERATE_BOUND,
                    "Bound '" + expression + "' of generate '" + generate.label() + "'",
                    generate.location(), scope);
        }
    }

    private InstanceNode instantiate(Instantiation instantiation, Scope parent, ElaborationPath region) {
        DesignUnit child = design.unit(instantiation.unitName()).orElseThrow(() -> new ElaborationException(
                ErrorKind.UNKNOWN_UNIT,
                "Instance '" + instantiation.label() + "' refers to unknown design unit '"
                        + instantiation.unitName() + "'",
                instantiation.location()));

        Map<String, Long> actuals = new LinkedHashMap<>();
        ConstantEvaluator evaluator = parent.evaluator();
        for (Map.Entry<String, Expression> entry : instantiation.genericMap().entrySet()) {
            if (!child.hasGeneric(entry.getKey())) {
                throw new ElaborationException(ErrorKind.UNRESOLVED_REFERENCE,
                        "Unit '" + child.name() + "' has no generic '" + entry.getKey() + "'",
                        instantiation.location());
            }
            try {
                actuals.put(entry.getKey(), evaluator.genericValue(entry.getValue()));
            } catch (ConstantEvaluator.NotConstantException e) {
                throw translate(e, ErrorKind.NON_CONSTANT_EXPRESSION,
                        "Generic actual '" + entry.getKey() + " => " + entry.getValue() + "' of instance '"
                                + instantiation.label() + "'",
                        instantiation.location(), parent);
            }
        }

        Map<String, String> ports = new LinkedHashMap<>();
        for (Map.Entry<String, Expression> entry : instantiation.portMap().entrySet()) {
            if (child.port(entry.getKey()).isEmpty()) {
                throw new ElaborationException(ErrorKind.UNRESOLVED_REFERENCE,
                        "Unit '" + child.name() + "' has no port '" + entry.getKey() + "'",
                        instantiation.location());
            }
            ReferenceValidator.validateActual(parent, entry.getValue(), instantiation);
            ports.put(entry.getKey(), renderActual(entry.getValue(), parent));
        }

        return new InstanceNode(0, region.child(instantiation.label()), child.name(), actuals, ports,
                instantiation.location());
    }

    /**
     * Render a port actual with constant indices substituted, e.g. {@code data(i)} as {@code data(3)}.
     */
    private String renderActual(Expression actual, Scope scope) {
        if (actual instanceof Expression.Call call && scope.isSignal(call.name())) {
            try {
                ConstantEvaluator evaluator = scope.evaluator();
                return call.name() + call.arguments().stream()
                        .map(a -> Long.toString(evaluator.integerValue(a)))
                        .collect(Collectors.joining(", ", "(", ")"));
            } catch (ConstantEvaluator.NotConstantException e) {
                log.debug("Keeping symbolic port actual {}: {}", actual, e.getMessage());
            }
        }
        return actual.toString();
    }

    private ElaborationException translate(ConstantEvaluator.NotConstantException e, ErrorKind fallback,
                                           String context, Location location, Scope scope) {
        if (e.isUnresolvedName() && (scope == null || !scope.isSignal(e.getUnresolvedName()))) {
            return new ElaborationException(ErrorKind.UNRESOLVED_GENERIC,
                    context + " refers to unresolved generic or constant '" + e.getUnresolvedName() + "'",
                    location);
        }
        if (e.isUnresolvedName()) {
            return new ElaborationException(fallback,
                    context + " refers to signal '" + e.getUnresolvedName() + "', which has no constant value",
                    location);
        }
        return new ElaborationException(fallback, context + ": " + e.getMessage(), location);
    }

    /**
     * Mutable instance under construction. Frozen into an {@link Instance} once the worklist drains.
     */
    private static final class InstanceNode {
        private long sequence;
        private final ElaborationPath path;
        private final String unitName;
        private final Map<String, Long> genericActuals;
        private final Map<String, String> portMap;
        private final Location location;
        private String architectureName;
        private Map<String, Long> generics = Map.of();
        private Map<String, Integer> signalWidths = Map.of();
        private final List<ElaboratedProcess> processes = new ArrayList<>();
        private final List<InstanceNode> children = new ArrayList<>();

        private InstanceNode(long sequence, ElaborationPath path, String unitName, Map<String, Long> genericActuals,
                             Map<String, String> portMap, Location location) {
            this.sequence = sequence;
            this.path = path;
            this.unitName = unitName;
            this.genericActuals = genericActuals;
            this.portMap = portMap;
            this.location = location;
        }

        private Instance freeze() {
            return new Instance(
                    path,
                    unitName,
                    architectureName,
                    generics,
                    signalWidths,
                    Collections.unmodifiableMap(new LinkedHashMap<>(portMap)),
                    processes,
                    children.stream().map(InstanceNode::freeze).toList());
        }
    }
}
