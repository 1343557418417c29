package com.vidnyan.hdlint.domain.flow;

import com.vidnyan.hdlint.domain.elaboration.ElaboratedProcess;
import com.vidnyan.hdlint.domain.elaboration.Instance;
import com.vidnyan.hdlint.domain.model.*;
import lombok.extern.slf4j.Slf4j;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Computes the {@link FlowSummary} of an elaborated process. Purely structural: it follows
 * the shape of branches and assignments and never evaluates signal values.
 * Sequenced statements compose by the cross product of their paths.
 */
@Slf4j
public class FlowExtractor {

    public static final int DEFAULT_MAX_PATHS = 4096;

    private static final String CONDITION = "condition";
    private static final String RIGHT_HAND_SIDE = "right-hand side";
    private static final String TARGET_INDEX = "target index";
    private static final String CASE_SELECTOR = "case selector";

    private final int maxPaths;

    public FlowExtractor() {
        this(DEFAULT_MAX_PATHS);
    }

    public FlowExtractor(int maxPaths) {
        this.maxPaths = maxPaths;
    }

    /**
     * Summaries for every process of an instance, in declaration order.
     * Each summary depends only on its own process.
     */
    public List<FlowSummary> extractAll(Instance instance) {
        return instance.processes().stream()
                .map(this::extract)
                .toList();
    }

    public FlowSummary extract(ElaboratedProcess process) {
        Optional<ClockGuard> guard = detectClockGuard(process);

        StructureWalk walk = new StructureWalk(process, guard.isPresent());
        walk.statements(process.body(), "", guard.isPresent() ? null : SignalWrite.Region.UNGUARDED_PROCESS);

        List<PathState> states = sequence(process, process.body(), List.of(PathState.ENTRY));
        List<WritePath> writePaths = states.stream()
                .map(s -> new WritePath(s.path, s.writes))
                .toList();

        Set<String> union = new TreeSet<>();
        writePaths.forEach(p -> union.addAll(p.writes()));
        Set<String> always = new TreeSet<>(union);
        writePaths.forEach(p -> always.retainAll(p.writes()));
        Set<String> sometimes = new TreeSet<>(union);
        sometimes.removeAll(always);

        ProcessKind kind = classify(guard.isPresent(), walk.assignments);
        log.debug("Process {} at [{}]: {} with {} paths, reads {}, sometimes written {}",
                process.label(), process.path(), kind, writePaths.size(), walk.reads.keySet(), sometimes);

        return new FlowSummary(process, kind, guard, walk.reads, writePaths, always, sometimes,
                walk.assignments, walk.edgeUses);
    }

    /**
     * The clock guard exists only when the entire body is one if with one conditional branch,
     * and that condition is an edge predicate on a signal of the sensitivity list.
     */
    private Optional<ClockGuard> detectClockGuard(ElaboratedProcess process) {
        List<SequentialStatement> body = process.body();
        if (body.size() != 1 || body.get(0).kind() != SequentialStatement.Kind.IF) {
            return Optional.empty();
        }
        IfStatement ifStatement = (IfStatement) body.get(0);
        if (ifStatement.branches().size() != 1) {
            return Optional.empty();
        }
        return EdgePredicates.match(ifStatement.branches().get(0).condition())
                .filter(g -> process.sensitivity().contains(g.signal()));
    }

    private ProcessKind classify(boolean guarded, List<SignalWrite> assignments) {
        if (guarded) {
            return ProcessKind.CLOCKED;
        }
        return assignments.isEmpty() ? ProcessKind.UNCLASSIFIED : ProcessKind.COMBINATIONAL_ONLY;
    }

    private List<PathState> sequence(ElaboratedProcess process, List<SequentialStatement> statements,
                                     List<PathState> states) {
        List<PathState> current = states;
        for (SequentialStatement statement : statements) {
            current = statement(process, statement, current);
            if (current.size() > maxPaths) {
                throw new FlowExtractionException(String.format(
                        "Process '%s' at [%s] has more than %d control paths",
                        process.label(), process.path(), maxPaths), process.location());
            }
        }
        return current;
    }

    private List<PathState> statement(ElaboratedProcess process, SequentialStatement statement,
                                      List<PathState> states) {
        switch (statement.kind()) {
            case ASSIGNMENT -> {
                String target = ((Assignment) statement).targetSignal();
                return states.stream().map(s -> s.write(target)).toList();
            }
            case IF -> {
                IfStatement ifStatement = (IfStatement) statement;
                List<PathState> result = new ArrayList<>();
                List<String> notTaken = new ArrayList<>();
                for (Branch branch : ifStatement.branches()) {
                    List<String> decisions = new ArrayList<>(notTaken);
                    decisions.add(decision(branch.condition(), "true"));
                    result.addAll(sequence(process, branch.body(), decide(states, decisions)));
                    notTaken.add(decision(branch.condition(), "false"));
                }
                List<PathState> fallThrough = decide(states, notTaken);
                result.addAll(ifStatement.elseBody()
                        .map(body -> sequence(process, body, fallThrough))
                        .orElse(fallThrough));
                return result;
            }
            case CASE -> {
                CaseStatement caseStatement = (CaseStatement) statement;
                String selector = caseStatement.selector().toString();
                List<PathState> result = new ArrayList<>();
                for (CaseAlternative alternative : caseStatement.alternatives()) {
                    String choices = alternative.choices().stream()
                            .map(Expression::toString)
                            .collect(Collectors.joining("|"));
                    result.addAll(sequence(process, alternative.body(),
                            decide(states, List.of(selector + "=" + choices))));
                }
                if (caseStatement.othersBody().isPresent()) {
                    result.addAll(sequence(process, caseStatement.othersBody().get(),
                            decide(states, List.of(selector + "=others"))));
                } else {
                    result.addAll(decide(states, List.of(selector + "=<no choice>")));
                }
                return result;
            }
            default -> {
                return states;
            }
        }
    }

    private static String decision(Expression condition, String outcome) {
        String text = condition.kind() == Expression.Kind.BINARY ? "(" + condition + ")" : condition.toString();
        return text + "=" + outcome;
    }

    private static List<PathState> decide(List<PathState> states, List<String> decisions) {
        return states.stream().map(s -> s.decide(decisions)).toList();
    }

    /**
     * Partial path: decisions so far and the signals written on the way.
     */
    private record PathState(ControlPath path, Set<String> writes) {

        static final PathState ENTRY = new PathState(ControlPath.ENTRY, Set.of());

        PathState write(String signal) {
            if (writes.contains(signal)) {
                return this;
            }
            Set<String> extended = new HashSet<>(writes);
            extended.add(signal);
            return new PathState(path, extended);
        }

        PathState decide(List<String> decisions) {
            return new PathState(path.then(decisions), writes);
        }
    }

    /**
     * Single pass over the statement tree collecting reads, assignments and stray edge predicates.
     */
    private static final class StructureWalk {
        private final ElaboratedProcess process;
        private final boolean clocked;
        private final Map<String, SignalUse> reads = new LinkedHashMap<>();
        private final List<SignalWrite> assignments = new ArrayList<>();
        private final List<EdgeUse> edgeUses = new ArrayList<>();

        private StructureWalk(ElaboratedProcess process, boolean clocked) {
            this.process = process;
            this.clocked = clocked;
        }

        /**
         * @param region region of the statements, or null at the top of a clocked process
         */
        private void statements(List<SequentialStatement> statements, String prefix, SignalWrite.Region region) {
            for (int i = 0; i < statements.size(); i++) {
                SequentialStatement statement = statements.get(i);
                String path = prefix + "#" + (i + 1);
                switch (statement.kind()) {
                    case ASSIGNMENT -> {
                        Assignment assignment = (Assignment) statement;
                        for (Expression index : assignment.targetIndices()) {
                            read(index, path, TARGET_INDEX, assignment.location());
                        }
                        read(assignment.value(), path, RIGHT_HAND_SIDE, assignment.location());
                        assignments.add(new SignalWrite(assignment.targetSignal(), path, assignment.location(),
                                region == null ? SignalWrite.Region.OUTSIDE_GUARD : region));
                    }
                    case IF -> ifStatement((IfStatement) statement, path, region);
                    case CASE -> {
                        CaseStatement caseStatement = (CaseStatement) statement;
                        read(caseStatement.selector(), path, CASE_SELECTOR, caseStatement.location());
                        for (CaseAlternative alternative : caseStatement.alternatives()) {
                            String choices = alternative.choices().stream()
                                    .map(Expression::toString)
                                    .collect(Collectors.joining("|"));
                            statements(alternative.body(), path + "/when " + choices + "/", inner(region));
                        }
                        caseStatement.othersBody().ifPresent(body ->
                                statements(body, path + "/when others/", inner(region)));
                    }
                    case NULL -> { }
                }
            }
        }

        private void ifStatement(IfStatement ifStatement, String path, SignalWrite.Region region) {
            boolean isGuard = clocked && region == null;
            for (int b = 0; b < ifStatement.branches().size(); b++) {
                Branch branch = ifStatement.branches().get(b);
                String label = (b == 0 ? "if(" : "elsif(") + branch.condition() + ")";
                read(branch.condition(), path, CONDITION, ifStatement.location());
                if (!(isGuard && b == 0)) {
                    for (ClockGuard edge : EdgePredicates.findAll(branch.condition())) {
                        edgeUses.add(new EdgeUse(edge, path, ifStatement.location()));
                    }
                }
                SignalWrite.Region branchRegion = isGuard
                        ? (b == 0 ? SignalWrite.Region.GUARDED : SignalWrite.Region.OUTSIDE_GUARD)
                        : inner(region);
                statements(branch.body(), path + "/" + label + "/", branchRegion);
            }
            ifStatement.elseBody().ifPresent(body -> statements(body, path + "/else/",
                    isGuard ? SignalWrite.Region.OUTSIDE_GUARD : inner(region)));
        }

        private SignalWrite.Region inner(SignalWrite.Region region) {
            return region == null ? SignalWrite.Region.OUTSIDE_GUARD : region;
        }

        private void read(Expression expression, String path, String position, Location location) {
            switch (expression.kind()) {
                case NAME -> use(((Expression.Name) expression).identifier(), path, position, location);
                case CALL -> {
                    Expression.Call call = (Expression.Call) expression;
                    use(call.name(), path, position, location);
                    call.arguments().forEach(a -> read(a, path, position, location));
                }
                case ATTRIBUTE -> use(((Expression.Attribute) expression).prefix(), path, position, location);
                case UNARY -> read(((Expression.Unary) expression).operand(), path, position, location);
                case BINARY -> {
                    Expression.Binary binary = (Expression.Binary) expression;
                    read(binary.left(), path, position, location);
                    read(binary.right(), path, position, location);
                }
                case AGGREGATE -> ((Expression.Aggregate) expression).elements()
                        .forEach(e -> read(e, path, position, location));
                case LITERAL -> { }
            }
        }

        private void use(String name, String path, String position, Location location) {
            if (process.isSignal(name)) {
                reads.putIfAbsent(name, new SignalUse(name, path, position, location));
            }
        }
    }
}
