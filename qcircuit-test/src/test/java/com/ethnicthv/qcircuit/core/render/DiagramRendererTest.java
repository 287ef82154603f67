package com.ethnicthv.qcircuit.core.render;

import com.ethnicthv.qcircuit.core.circuit.Circuit;
import com.ethnicthv.qcircuit.core.gate.GateOperation;
import com.ethnicthv.qcircuit.core.layout.ColumnScheduler;
import com.ethnicthv.qcircuit.core.layout.LayoutMode;
import org.junit.jupiter.api.*;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Cell placement for every gate shape. Each case renders a single operation, so the gate
 * occupies column 0 and the expected tokens are listed wire 1 first.
 */
@DisplayName("DiagramRenderer Test Suite")
@TestMethodOrder(MethodOrderer.OrderAnnotation.class)
public class DiagramRendererTest {

    private final DiagramRenderer renderer = new DiagramRenderer();

    private DiagramGrid render(int wires, GateOperation... ops) {
        Circuit circuit = Circuit.builder(wires).addGates(List.of(ops)).build();
        return renderer.render(circuit, ColumnScheduler.schedule(circuit, LayoutMode.SERIAL));
    }

    private static List<String> column(DiagramGrid grid, int column) {
        List<String> tokens = new ArrayList<>();
        for (int w = 1; w <= grid.wireCount(); w++) {
            tokens.add(grid.cell(w, column).token());
        }
        return tokens;
    }

    // ========== SINGLE AND CONTROLLED ==========

    @Test
    @Order(1)
    @DisplayName("TC-DR-001: Single-wire gate is a box, other wires pass through")
    void testSingleWireBox() {
        DiagramGrid grid = render(2, GateOperation.single(1, "H"));

        assertEquals(List.of("\\gate{H}", "\\qw"), column(grid, 0));
        assertEquals(1, grid.columnCount());
        System.out.println("✓ H on wire 1: " + column(grid, 0));
    }

    @Test
    @Order(2)
    @DisplayName("TC-DR-002: Parametric single-wire gate shows its angle")
    void testParametricSingle() {
        DiagramGrid grid = render(1, GateOperation.parametricSingle(1, "Rx", Math.PI / 2));

        assertEquals(List.of("\\gate{R_x(\\pi/2)}"), column(grid, 0));
        System.out.println("✓ Rx(pi/2): " + column(grid, 0));
    }

    @Test
    @Order(3)
    @DisplayName("TC-DR-003: CNOT draws control dot and cross target")
    void testCnot() {
        assertEquals(List.of("\\ctrl{2}", "\\qw", "\\targ{}"),
                column(render(3, GateOperation.controlled(1, 3, "CNOT")), 0));
        assertEquals(List.of("\\targ{}", "\\qw", "\\ctrl{-2}"),
                column(render(3, GateOperation.controlled(3, 1, "CNOT")), 0));
        System.out.println("✓ CNOT in both directions");
    }

    @Test
    @Order(4)
    @DisplayName("TC-DR-004: Target cell depends on gate family")
    void testControlledTargets() {
        assertEquals(List.of("\\ctrl{1}", "\\ctrl{0}"), column(render(2, GateOperation.controlled(1, 2, "CZ")), 0));
        assertEquals(List.of("\\ctrl{1}", "\\gate{Y}"), column(render(2, GateOperation.controlled(1, 2, "CY")), 0));
        assertEquals(List.of("\\ctrl{1}", "\\gate{H}"), column(render(2, GateOperation.controlled(1, 2, "H")), 0));
        System.out.println("✓ CZ, CY, controlled-H targets");
    }

    @Test
    @Order(5)
    @DisplayName("TC-DR-005: Parametric controlled gate boxes the target with its angle")
    void testParametricControlled() {
        DiagramGrid grid = render(2, GateOperation.parametricControlled(2, 1, "CRz", Math.PI / 2));

        assertEquals(List.of("\\gate{R_z(\\pi/2)}", "\\ctrl{-1}"), column(grid, 0));
        System.out.println("✓ CRz(2 -> 1): " + column(grid, 0));
    }

    // ========== TWO-WIRE ==========

    @Test
    @Order(10)
    @DisplayName("TC-DR-010: SWAP draws the cross pair regardless of argument order")
    void testSwap() {
        List<String> expected = List.of("\\swap{2}", "\\qw", "\\targX{}");
        assertEquals(expected, column(render(3, GateOperation.twoWire(1, 3, "SWAP")), 0));
        assertEquals(expected, column(render(3, GateOperation.twoWire(3, 1, "SWAP")), 0));
        System.out.println("✓ SWAP(1,3) == SWAP(3,1)");
    }

    @Test
    @Order(11)
    @DisplayName("TC-DR-011: Other two-wire gates span their range")
    void testTwoWireSpanBox() {
        DiagramGrid adjacent = render(2, GateOperation.twoWire(1, 2, "iSWAP"));
        assertEquals(List.of("\\gate[2]{iSWAP}", ""), column(adjacent, 0));
        assertTrue(adjacent.cell(2, 0).suppressed());

        DiagramGrid apart = render(3, GateOperation.twoWire(1, 3, "iSWAP"));
        assertEquals(List.of("\\gate[3]{iSWAP}", "", ""), column(apart, 0));
        assertSame(DiagramCell.GHOST, apart.cell(2, 0));

        DiagramGrid rxx = render(2, GateOperation.parametricTwoWire(1, 2, "Rxx", Math.PI / 4));
        assertEquals(List.of("\\gate[2]{R_{xx}(\\pi/4)}", ""), column(rxx, 0));
        System.out.println("✓ iSWAP and Rxx span boxes");
    }

    // ========== THREE, FOUR AND N WIRES ==========

    @Test
    @Order(20)
    @DisplayName("TC-DR-020: Toffoli is a control chain ending at the target")
    void testToffoli() {
        assertEquals(List.of("\\ctrl{1}", "\\ctrl{1}", "\\targ{}"),
                column(render(3, GateOperation.threeWire(1, 2, 3, "Toffoli")), 0));
        // target in the middle: controls on both sides point towards it
        assertEquals(List.of("\\ctrl{1}", "\\targ{}", "\\ctrl{-1}"),
                column(render(3, GateOperation.threeWire(1, 3, 2, "CCNOT")), 0));
        System.out.println("✓ Toffoli chains");
    }

    @Test
    @Order(21)
    @DisplayName("TC-DR-021: Fredkin is a control on top of a swap pair")
    void testFredkin() {
        assertEquals(List.of("\\ctrl{1}", "\\swap{1}", "\\targX{}"),
                column(render(3, GateOperation.threeWire(1, 2, 3, "Fredkin")), 0));
        assertEquals(List.of("\\swap{1}", "\\targX{}", "\\ctrl{-1}"),
                column(render(3, GateOperation.threeWire(3, 1, 2, "CSWAP")), 0));
        System.out.println("✓ Fredkin with control above and below");
    }

    @Test
    @Order(22)
    @DisplayName("TC-DR-022: CCCNOT chains three controls")
    void testCccnot() {
        assertEquals(List.of("\\ctrl{1}", "\\ctrl{1}", "\\ctrl{1}", "\\targ{}"),
                column(render(4, GateOperation.fourWire(1, 2, 3, 4, "CCCNOT")), 0));
        System.out.println("✓ CCCNOT chain");
    }

    @Test
    @Order(23)
    @DisplayName("TC-DR-023: Unknown three- and four-wire gates span their range")
    void testFixedMultiWireSpanBox() {
        assertEquals(List.of("\\gate[3]{CCZ}", "", ""),
                column(render(3, GateOperation.threeWire(1, 2, 3, "CCZ")), 0));
        assertEquals(List.of("\\gate[4]{QFT4}", "", "", ""),
                column(render(4, GateOperation.fourWire(4, 2, 3, 1, "QFT4")), 0));
        System.out.println("✓ CCZ and QFT4 span boxes");
    }

    @Test
    @Order(24)
    @DisplayName("TC-DR-024: Generalized gate with declared roles draws a control chain")
    void testGeneralizedChain() {
        GateOperation ccx = GateOperation.generalized("CCX").control(1).control(2).target(4).build();

        assertEquals(List.of("\\ctrl{1}", "\\ctrl{2}", "\\qw", "\\targ{}", "\\qw"),
                column(render(5, ccx), 0));
        System.out.println("✓ Generalized CCX chain");
    }

    @Test
    @Order(25)
    @DisplayName("TC-DR-025: Generalized gate without a single target is one box")
    void testGeneralizedBox() {
        GateOperation qft = GateOperation.generalized("QFT").operand(2).operand(3).operand(4).build();
        assertEquals(List.of("\\qw", "\\gate[3]{QFT}", "", "", "\\qw"), column(render(5, qft), 0));

        GateOperation twoTargets = GateOperation.generalized("CXX").control(1).target(2).target(3).build();
        assertEquals(List.of("\\gate[3]{CXX}", "", ""), column(render(3, twoTargets), 0));

        GateOperation parametric = GateOperation.generalized("Rxx").operand(1).operand(2).params(Math.PI).build();
        assertEquals(List.of("\\gate[2]{R_{xx}(\\pi)}", ""), column(render(2, parametric), 0));
        System.out.println("✓ Generalized span boxes");
    }

    // ========== LAYOUT INDEPENDENCE ==========

    @Test
    @Order(30)
    @DisplayName("TC-DR-030: A gate looks the same in serial and packed layouts")
    void testCellsIndependentOfLayout() {
        Circuit circuit = Circuit.builder(4)
                .addGate(GateOperation.single(1, "H"))
                .addGate(GateOperation.single(3, "X"))
                .addGate(GateOperation.controlled(1, 2, "CNOT"))
                .addGate(GateOperation.twoWire(3, 4, "SWAP"))
                .addGate(GateOperation.threeWire(1, 2, 3, "Toffoli"))
                .build();

        var serialAssignment = ColumnScheduler.schedule(circuit, LayoutMode.SERIAL);
        var packedAssignment = ColumnScheduler.schedule(circuit, LayoutMode.PACKED);
        DiagramGrid serial = renderer.render(circuit, serialAssignment);
        DiagramGrid packed = renderer.render(circuit, packedAssignment);

        for (int i = 0; i < circuit.operationCount(); i++) {
            var span = circuit.operations().get(i).involvedRange();
            for (int w = span.lo(); w <= span.hi(); w++) {
                assertEquals(serial.cell(w, serialAssignment.columnOf(i)),
                        packed.cell(w, packedAssignment.columnOf(i)),
                        "operation " + i + " wire " + w);
            }
        }
        assertTrue(packed.columnCount() < serial.columnCount());
        System.out.println("✓ Serial " + serial.columnCount() + " columns, packed " + packed.columnCount());
    }

    @Test
    @Order(40)
    @DisplayName("TC-DR-040: Mismatched assignment is rejected")
    void testAssignmentMismatch() {
        Circuit one = Circuit.builder(1).addGate(GateOperation.single(1, "H")).build();
        Circuit two = Circuit.builder(1)
                .addGate(GateOperation.single(1, "H"))
                .addGate(GateOperation.single(1, "X"))
                .build();

        assertThrows(IllegalArgumentException.class,
                () -> renderer.render(two, ColumnScheduler.schedule(one, LayoutMode.SERIAL)));
        assertThrows(IllegalArgumentException.class, () -> renderer.render(one, null));
        assertThrows(IndexOutOfBoundsException.class,
                () -> renderer.render(one, ColumnScheduler.schedule(one, LayoutMode.SERIAL)).cell(2, 0));
        System.out.println("✓ Invalid render input rejected");
    }
}
