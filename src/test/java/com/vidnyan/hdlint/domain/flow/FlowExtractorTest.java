package com.vidnyan.hdlint.domain.flow;

import com.vidnyan.hdlint.domain.elaboration.Elaborator;
import com.vidnyan.hdlint.domain.model.*;
import org.junit.jupiter.api.Test;

import java.util.*;

import static com.vidnyan.hdlint.DesignFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class FlowExtractorTest {

    private final FlowExtractor extractor = new FlowExtractor();

    private static List<FlowSummary> flows(FlowExtractor extractor, Design design, String top) {
        return extractor.extractAll(new Elaborator(design).elaborate(top).root());
    }

    private List<FlowSummary> flows(Design design, String top) {
        return flows(extractor, design, top);
    }

    /**
     * Unit {@code dut} with the given one-bit inputs and outputs and a single process.
     */
    private static Design single(List<String> inputs, List<String> outputs, ProcessStatement process) {
        return design(List.of(unit("dut", inputs, outputs)), List.of(architecture("dut", List.of(), process)));
    }

    @Test
    void extract_ShouldReportPathWithoutAssignment() {
        FlowSummary flow = flows(missingElse(), "mux").get(0);

        assertEquals(ProcessKind.COMBINATIONAL_ONLY, flow.kind());
        assertEquals(2, flow.writePaths().size());
        assertEquals(Set.of(), flow.alwaysWritten());
        assertEquals(Set.of("c"), flow.sometimesWritten());
        assertEquals(List.of("sel=false"),
                flow.unassignedPaths("c").stream().map(ControlPath::toString).toList());
    }

    @Test
    void extract_ShouldTreatElseAsCompleting() {
        FlowSummary flow = flows(completeIf(), "mux").get(0);

        assertEquals(Set.of("c"), flow.alwaysWritten());
        assertTrue(flow.sometimesWritten().isEmpty());
    }

    @Test
    void extract_ShouldRecordFirstReadOfEverySignal() {
        FlowSummary flow = flows(missingElse(), "mux").get(0);

        assertEquals(List.of("sel", "a", "b"), new ArrayList<>(flow.readSet().keySet()));
        SignalUse sel = flow.readSet().get("sel");
        assertEquals("condition of #1", sel.describe());
        SignalUse b = flow.readSet().get("b");
        assertEquals("#1/if(sel)/#1", b.statementPath());
        assertEquals("right-hand side", b.position());
        assertEquals(at(12), b.location());
    }

    @Test
    void extract_ShouldRecognizeRisingEdgeGuard() {
        FlowSummary flow = flows(register(), "dff").get(0);

        assertEquals(ProcessKind.CLOCKED, flow.kind());
        assertEquals(Optional.of(new ClockGuard("clock", EdgeKind.RISING)), flow.clockGuard());
        assertEquals(Set.of("reg"), flow.guardedWrites());
        assertTrue(flow.writesOutsideGuard().isEmpty());
        assertTrue(flow.edgeUses().isEmpty());
    }

    @Test
    void extract_ShouldRecognizeEventAndLevelGuard() {
        Design design = single(List.of("clk", "d"), List.of("q"),
                process("p", List.of("clk"), 10,
                        ifThen("clk'event and clk = '0'", 11, assign("q", "d", 12))));

        FlowSummary flow = flows(design, "dut").get(0);

        assertEquals(Optional.of(new ClockGuard("clk", EdgeKind.FALLING)), flow.clockGuard());
    }

    @Test
    void extract_ShouldMarkElseOfClockedProcessAsOutsideGuard() {
        Design design = single(List.of("clk", "d"), List.of("q", "busy"),
                process("p", List.of("clk"), 10,
                        ifThenElse("rising_edge(clk)", 11,
                                List.of(assign("q", "d", 12)),
                                List.of(assign("busy", "'0'", 14)))));

        FlowSummary flow = flows(design, "dut").get(0);

        assertTrue(flow.isClocked());
        assertEquals(1, flow.writesOutsideGuard().size());
        SignalWrite stray = flow.writesOutsideGuard().get(0);
        assertEquals("busy", stray.signal());
        assertEquals("#1/else/#1", stray.statementPath());
    }

    @Test
    void extract_ShouldNotTreatAsyncResetAsClockGuard() {
        Design design = single(List.of("clk", "rst", "d"), List.of("q"),
                process("p", List.of("clk", "rst"), 10,
                        new IfStatement(List.of(
                                new Branch(expr("rst = '1'"), List.of(assign("q", "'0'", 12))),
                                new Branch(expr("rising_edge(clk)"), List.of(assign("q", "d", 14)))),
                                Optional.empty(), at(11))));

        FlowSummary flow = flows(design, "dut").get(0);

        assertEquals(ProcessKind.COMBINATIONAL_ONLY, flow.kind());
        assertEquals(1, flow.edgeUses().size());
        assertEquals(new ClockGuard("clk", EdgeKind.RISING), flow.edgeUses().get(0).predicate());
    }

    @Test
    void extract_ShouldNotTreatGuardOnUnlistedClockAsClocked() {
        Design design = single(List.of("clk", "d"), List.of("q"),
                process("p", List.of("d"), 10, ifThen("rising_edge(clk)", 11, assign("q", "d", 12))));

        FlowSummary flow = flows(design, "dut").get(0);

        assertFalse(flow.isClocked());
        assertEquals(1, flow.edgeUses().size());
    }

    @Test
    void extract_ShouldAddImplicitPathForCaseWithoutOthers() {
        Architecture architecture = Architecture.builder("rtl", "fsm")
                .signals(List.of(SignalDeclaration.of("state")))
                .types(List.of(new EnumerationType("state_t", List.of("IDLE", "RUN"))))
                .statements(List.of(process("p", List.of("state"), 10,
                        new CaseStatement(expr("state"), List.of(
                                new CaseAlternative(List.of(expr("IDLE")), List.of(assign("busy", "'0'", 12))),
                                new CaseAlternative(List.of(expr("RUN")), List.of(assign("busy", "'1'", 14)))),
                                Optional.empty(), at(11)))))
                .build();
        Design design = design(List.of(unit("fsm", List.of(), List.of("busy"))), List.of(architecture));

        FlowSummary flow = flows(design, "fsm").get(0);

        assertEquals(List.of("state=IDLE", "state=RUN", "state=<no choice>"),
                flow.writePaths().stream().map(p -> p.path().toString()).toList());
        assertEquals(Set.of("busy"), flow.sometimesWritten());
    }

    @Test
    void extract_ShouldLeaveProcessWithoutAssignmentsUnclassified() {
        Design design = single(List.of("a"), List.of(),
                process("p", List.of("a"), 10, new NullStatement(at(11))));

        FlowSummary flow = flows(design, "dut").get(0);

        assertEquals(ProcessKind.UNCLASSIFIED, flow.kind());
        assertEquals(List.of("<unconditional>"),
                flow.writePaths().stream().map(p -> p.path().toString()).toList());
    }

    @Test
    void extract_ShouldStopAtPathLimit() {
        SequentialStatement[] body = new SequentialStatement[5];
        for (int i = 0; i < body.length; i++) {
            body[i] = ifThen("a", 11 + i, assign("c", "'1'", 11 + i));
        }
        Design design = single(List.of("a"), List.of("c"), process("p", List.of("a"), 10, body));

        FlowExtractionException e = assertThrows(FlowExtractionException.class,
                () -> flows(new FlowExtractor(16), design, "dut"));
        assertEquals(at(10), e.getLocation());
        assertEquals(32, flows(design, "dut").get(0).writePaths().size());
    }

    @Test
    void registerClassification_ShouldNotDependOnProcessOrder() {
        List<FlowSummary> flows = flows(dualDrivenRegister(), "dff");
        List<FlowSummary> reversed = new ArrayList<>(flows);
        Collections.reverse(reversed);

        RegisterClassification forward = RegisterClassification.of(flows);
        RegisterClassification backward = RegisterClassification.of(reversed);

        assertEquals(Set.of("reg"), forward.registers());
        assertEquals(forward.registers(), backward.registers());
        assertEquals(Set.of("clocked"), forward.clockedBy("reg"));
        assertFalse(forward.isRegister("a"));
    }
}
