package com.vidnyan.hdlint;

import com.vidnyan.hdlint.adapter.out.loader.ExpressionParser;
import com.vidnyan.hdlint.domain.elaboration.Elaborator;
import com.vidnyan.hdlint.domain.elaboration.Instance;
import com.vidnyan.hdlint.domain.flow.FlowExtractor;
import com.vidnyan.hdlint.domain.model.*;
import com.vidnyan.hdlint.domain.rule.BuiltInRules;
import com.vidnyan.hdlint.domain.rule.CheckContext;

import java.util.*;

/**
 * Small designs and builders shared by the tests.
 */
public final class DesignFixtures {

    public static final String FILE = "fixture.vhd";

    private DesignFixtures() {
    }

    public static Expression expr(String text) {
        return ExpressionParser.parse(text);
    }

    public static Location at(int line) {
        return Location.at(FILE, line, 1);
    }

    public static Assignment assign(String target, String value, int line) {
        return new Assignment(expr(target), expr(value), at(line));
    }

    public static IfStatement ifThen(String condition, int line, SequentialStatement... then) {
        return IfStatement.of(expr(condition), List.of(then), at(line));
    }

    public static IfStatement ifThenElse(String condition, int line, List<SequentialStatement> then,
                                         List<SequentialStatement> otherwise) {
        return IfStatement.of(expr(condition), then, otherwise, at(line));
    }

    public static ProcessStatement process(String label, List<String> sensitivity, int line,
                                           SequentialStatement... body) {
        return new ProcessStatement(label, sensitivity, List.of(body), at(line));
    }

    public static Instantiation instance(String label, String unit, Map<String, String> generics, int line) {
        Map<String, Expression> actuals = new LinkedHashMap<>();
        generics.forEach((k, v) -> actuals.put(k, expr(v)));
        return new Instantiation(label, unit, actuals, Map.of(), at(line));
    }

    public static GenerateFor generate(String label, String variable, String low, String high, int line,
                                       ConcurrentStatement... body) {
        return new GenerateFor(label, variable, expr(low), expr(high), List.of(body), at(line));
    }

    /**
     * Unit whose ports are all one bit wide, inputs first.
     */
    public static DesignUnit unit(String name, List<String> inputs, List<String> outputs, Generic... generics) {
        List<Port> ports = new ArrayList<>();
        inputs.forEach(p -> ports.add(Port.in(p)));
        outputs.forEach(p -> ports.add(Port.out(p)));
        return new DesignUnit(name, List.of(generics), ports, at(1));
    }

    public static Architecture architecture(String entity, List<String> signals, ConcurrentStatement... statements) {
        return Architecture.builder("rtl", entity)
                .signals(signals.stream().map(SignalDeclaration::of).toList())
                .statements(List.of(statements))
                .build();
    }

    public static Design design(List<DesignUnit> units, List<Architecture> architectures) {
        return new Design(units, architectures);
    }

    /**
     * Check context for the root instance of {@code top} under a built-in rule.
     */
    public static CheckContext context(Design design, String top, String ruleId) {
        Instance root = new Elaborator(design).elaborate(top).root();
        return CheckContext.of(BuiltInRules.find(ruleId).orElseThrow(), top, root,
                new FlowExtractor().extractAll(root));
    }

    /**
     * Process {@code (a)} computing {@code c <= a or b}: {@code b} is missing from the list.
     */
    public static Design incompleteSensitivity() {
        return design(
                List.of(unit("comb", List.of("a", "b"), List.of("c"))),
                List.of(architecture("comb", List.of(),
                        process("p", List.of("a"), 10, assign("c", "a or b", 11)))));
    }

    /**
     * {@code if sel then c <= a or b; end if;} without else.
     */
    public static Design missingElse() {
        return design(
                List.of(unit("mux", List.of("a", "b", "sel"), List.of("c"))),
                List.of(architecture("mux", List.of(),
                        process("p", List.of("a", "b", "sel"), 10,
                                ifThen("sel", 11, assign("c", "a or b", 12))))));
    }

    /**
     * Same as {@link #missingElse()} with {@code else c <= '0'}.
     */
    public static Design completeIf() {
        return design(
                List.of(unit("mux", List.of("a", "b", "sel"), List.of("c"))),
                List.of(architecture("mux", List.of(),
                        process("p", List.of("a", "b", "sel"), 10,
                                ifThenElse("sel", 11,
                                        List.of(assign("c", "a or b", 12)),
                                        List.of(assign("c", "'0'", 14)))))));
    }

    public static ProcessStatement clockedRegister() {
        return process("clocked", List.of("clock"), 20,
                ifThen("rising_edge(clock)", 21, assign("reg", "a", 22)));
    }

    /**
     * Clean register: {@code if rising_edge(clock) then reg <= a; end if;}.
     */
    public static Design register() {
        return design(
                List.of(unit("dff", List.of("clock", "a"), List.of("q"))),
                List.of(architecture("dff", List.of("reg"), clockedRegister())));
    }

    /**
     * The register of {@link #register()} also driven by a combinational process.
     */
    public static Design dualDrivenRegister() {
        return design(
                List.of(unit("dff", List.of("clock", "a"), List.of("q"))),
                List.of(architecture("dff", List.of("reg"),
                        clockedRegister(),
                        process("comb", List.of("a"), 30, assign("reg", "a", 31)))));
    }

    /**
     * {@code for i in 0 to N-1 generate} of a cell with an incomplete sensitivity list.
     */
    public static Design generatedArray(int count) {
        return design(
                List.of(unit("cell", List.of("a", "b"), List.of("c")),
                        unit("array", List.of(), List.of(), Generic.of("N", Expression.integer(count)))),
                List.of(architecture("cell", List.of(),
                                process("p", List.of("a"), 10, assign("c", "a or b", 11))),
                        architecture("array", List.of(),
                                generate("gen", "i", "0", "N - 1", 5,
                                        instance("u", "cell", Map.of(), 6)))));
    }
}
