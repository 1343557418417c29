package com.vidnyan.hdlint.domain.elaboration;

import com.vidnyan.hdlint.domain.elaboration.ElaborationException.ErrorKind;
import com.vidnyan.hdlint.domain.model.*;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.vidnyan.hdlint.DesignFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class ElaboratorTest {

    @Test
    void elaborate_ShouldExpandGenerateLoopIntoIndexedInstances() {
        ElaboratedDesign elaborated = new Elaborator(generatedArray(4)).elaborate("array");

        Instance root = elaborated.root();
        assertEquals(Map.of("N", 4L), root.generics());
        assertEquals(4, root.children().size());
        assertEquals("array[gen(2).u]", root.children().get(2).path().format("array"));
        assertEquals(5, elaborated.instances().size());
        assertEquals(4, elaborated.processCount());

        ElaboratedProcess process = root.children().get(3).processes().get(0);
        assertEquals("gen(3).u", process.path().toString());
        assertEquals(new SourceProcessId("cell", "rtl", "p", at(10)), process.sourceId());
    }

    @Test
    void elaborate_ShouldProduceNothingWhenUpperBoundIsBelowLowerBound() {
        ElaboratedDesign elaborated = new Elaborator(generatedArray(0)).elaborate("array");

        assertTrue(elaborated.root().children().isEmpty());
        assertEquals(0, elaborated.processCount());
    }

    @Test
    void elaborate_ShouldPreferGenericActualOverDefault() {
        Design design = design(
                List.of(unit("cell", List.of(), List.of(), Generic.of("W", Expression.integer(2))),
                        unit("top", List.of(), List.of())),
                List.of(architecture("cell", List.of()),
                        architecture("top", List.of(),
                                instance("wide", "cell", Map.of("W", "5"), 2),
                                instance("plain", "cell", Map.of(), 3))));

        Instance root = new Elaborator(design).elaborate("top").root();

        assertEquals(Long.valueOf(5), root.children().get(0).generic("W").orElseThrow());
        assertEquals(Long.valueOf(2), root.children().get(1).generic("W").orElseThrow());
    }

    @Test
    void elaborate_ShouldEvaluateDefaultsAgainstEarlierGenerics() {
        DesignUnit unit = new DesignUnit("fifo",
                List.of(Generic.of("DEPTH", Expression.integer(4)), Generic.of("BITS", expr("DEPTH * 2"))),
                List.of(new Port("data", Direction.OUT, expr("BITS"))), at(1));
        Design design = design(List.of(unit), List.of(architecture("fifo", List.of())));

        Instance root = new Elaborator(design).elaborate("fifo").root();

        assertEquals(Long.valueOf(8), root.generic("BITS").orElseThrow());
        assertEquals(Integer.valueOf(8), root.signalWidths().get("data"));
    }

    @Test
    void elaborate_ShouldExpandGenerateIfOnlyWhenConditionHolds() {
        Design design = design(
                List.of(unit("cell", List.of(), List.of()),
                        unit("top", List.of(), List.of(), Generic.of("FAST", expr("true")))),
                List.of(architecture("cell", List.of()),
                        architecture("top", List.of(),
                                new GenerateIf("fast", expr("FAST"),
                                        List.of(instance("u", "cell", Map.of(), 3)), at(2)),
                                new GenerateIf("slow", expr("not FAST"),
                                        List.of(instance("u", "cell", Map.of(), 5)), at(4)))));

        Instance root = new Elaborator(design).elaborate("top").root();

        assertEquals(1, root.children().size());
        assertEquals("fast.u", root.children().get(0).path().toString());
    }

    @Test
    void elaborate_ShouldRejectUnknownTopUnit() {
        ElaborationException e = assertThrows(ElaborationException.class,
                () -> new Elaborator(register()).elaborate("nowhere"));
        assertEquals(ErrorKind.UNKNOWN_UNIT, e.getKind());
    }

    @Test
    void elaborate_ShouldRejectUnknownInstantiatedUnit() {
        Design design = design(
                List.of(unit("top", List.of(), List.of())),
                List.of(architecture("top", List.of(), instance("u", "ghost", Map.of(), 7))));

        ElaborationException e = assertThrows(ElaborationException.class,
                () -> new Elaborator(design).elaborate("top"));

        assertEquals(ErrorKind.UNKNOWN_UNIT, e.getKind());
        assertEquals(at(7), e.getLocation());
    }

    @Test
    void elaborate_ShouldDetectInstantiationCycle() {
        Design design = design(
                List.of(unit("a", List.of(), List.of()), unit("b", List.of(), List.of())),
                List.of(architecture("a", List.of(), instance("u_b", "b", Map.of(), 2)),
                        architecture("b", List.of(), instance("u_a", "a", Map.of(), 2))));

        ElaborationException e = assertThrows(ElaborationException.class,
                () -> new Elaborator(design).elaborate("a"));

        assertEquals(ErrorKind.INSTANTIATION_CYCLE, e.getKind());
        assertTrue(e.getMessage().contains("a -> b -> a"));
    }

    @Test
    void elaborate_ShouldRejectGenericWithoutValue() {
        Design design = design(
                List.of(unit("cell", List.of(), List.of(), Generic.required("W"))),
                List.of(architecture("cell", List.of())));

        ElaborationException e = assertThrows(ElaborationException.class,
                () -> new Elaborator(design).elaborate("cell"));
        assertEquals(ErrorKind.UNRESOLVED_GENERIC, e.getKind());
    }

    @Test
    void elaborate_ShouldRejectBoundUsingUndeclaredName() {
        Design design = design(
                List.of(unit("top", List.of(), List.of())),
                List.of(architecture("top", List.of(), generate("gen", "i", "0", "SIZE - 1", 3))));

        ElaborationException e = assertThrows(ElaborationException.class,
                () -> new Elaborator(design).elaborate("top"));
        assertEquals(ErrorKind.UNRESOLVED_GENERIC, e.getKind());
        assertTrue(e.getMessage().contains("SIZE"));
    }

    @Test
    void elaborate_ShouldRejectNonIntegerGenerateBound() {
        Design literalBound = design(
                List.of(unit("top", List.of(), List.of())),
                List.of(architecture("top", List.of(), generate("gen", "i", "0", "'1'", 3))));
        Design signalBound = design(
                List.of(unit("top", List.of("count"), List.of())),
                List.of(architecture("top", List.of(), generate("gen", "i", "0", "count", 3))));

        assertEquals(ErrorKind.NON_INTEGER_GENERATE_BOUND, assertThrows(ElaborationException.class,
                () -> new Elaborator(literalBound).elaborate("top")).getKind());
        assertEquals(ErrorKind.NON_INTEGER_GENERATE_BOUND, assertThrows(ElaborationException.class,
                () -> new Elaborator(signalBound).elaborate("top")).getKind());
    }

    @Test
    void elaborate_ShouldRejectProcessReadingUndeclaredSignal() {
        Design design = design(
                List.of(unit("comb", List.of("a"), List.of("c"))),
                List.of(architecture("comb", List.of(),
                        process("p", List.of("a"), 10, assign("c", "a or ghost", 11)))));

        ElaborationException e = assertThrows(ElaborationException.class,
                () -> new Elaborator(design).elaborate("comb"));

        assertEquals(ErrorKind.UNRESOLVED_REFERENCE, e.getKind());
        assertTrue(e.getMessage().contains("ghost"));
    }

    @Test
    void elaborate_ShouldRejectCallOfUndeclaredName() {
        Design design = design(
                List.of(unit("comb", List.of("a"), List.of("c"))),
                List.of(architecture("comb", List.of(),
                        process("p", List.of("a"), 10, assign("c", "tpyo(0) or a", 11)))));

        ElaborationException e = assertThrows(ElaborationException.class,
                () -> new Elaborator(design).elaborate("comb"));

        assertEquals(ErrorKind.UNRESOLVED_REFERENCE, e.getKind());
        assertTrue(e.getMessage().contains("'tpyo'"));
    }

    @Test
    void elaborate_ShouldAcceptIndexedSignalsAndKnownFunctions() {
        Design design = design(
                List.of(unit("conv", List.of("a", "clk"), List.of("c"))),
                List.of(architecture("conv", List.of("data"),
                        process("p", List.of("clk"), 10,
                                ifThen("RISING_EDGE(clk)", 11,
                                        assign("c", "data(0)", 12),
                                        assign("data", "std_logic_vector(resize(unsigned(a), 1))", 13))))));

        assertEquals(1, new Elaborator(design).elaborate("conv").processCount());
    }

    @Test
    void elaborate_ShouldRejectUnitWithoutArchitecture() {
        Design design = design(List.of(unit("bare", List.of(), List.of())), List.of());

        ElaborationException e = assertThrows(ElaborationException.class,
                () -> new Elaborator(design).elaborate("bare"));
        assertEquals(ErrorKind.MISSING_ARCHITECTURE, e.getKind());
    }
}
