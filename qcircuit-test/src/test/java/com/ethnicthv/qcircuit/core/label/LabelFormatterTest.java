package com.ethnicthv.qcircuit.core.label;

import com.ethnicthv.qcircuit.core.gate.GateOperation;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Symbol lookup and label composition.
 */
public class LabelFormatterTest {

    private final LabelFormatter labels = new LabelFormatter();

    @Test
    void knownSymbols() {
        assertEquals("X", labels.symbol("X"));
        assertEquals("H", labels.symbol("H"));
        assertEquals("T", labels.symbol("π/8"));
        assertEquals("T^\\dagger", labels.symbol("Tdag"));
        assertEquals("\\sqrt{X}", labels.symbol("√NOT"));
        assertEquals("P_{\\uparrow}", labels.symbol("ProjUp"));
        assertEquals("\\sigma_x", labels.symbol("σx"));
        assertEquals("\\text{TOF}", labels.symbol("Toffoli"));
        assertEquals("\\times", labels.symbol("SWAP"));
    }

    @Test
    void unknownTypeShowsRawIdentifier() {
        assertEquals("MyGate", labels.symbol("MyGate"));
        assertFalse(GateSymbols.isKnown("MyGate"));
        assertTrue(GateSymbols.isKnown("iSWAP"));
        assertEquals("Custom(1.0, 2.0)", labels.parametricLabel("Custom", 1.0, 2.0));
    }

    @Test
    void parametricLabels() {
        assertEquals("R_x(\\pi)", labels.parametricLabel("Rx", Math.PI));
        assertEquals("R_y(\\pi/2)", labels.parametricLabel("Ry", Math.PI / 2));
        assertEquals("R_n(\\pi, \\pi/2, \\pi/4)",
                labels.parametricLabel("Rn", Math.PI, Math.PI / 2, Math.PI / 4));
        assertEquals("R_{zz}(0.123)", labels.parametricLabel("Rzz", 0.1234));
        assertEquals("P(\\pi/8)", labels.parametricLabel("Phase", Math.PI / 8));
        assertEquals("R_z(-\\pi/4)", labels.parametricLabel("CRz", -Math.PI / 4));
    }

    @Test
    void labelDependsOnParameters() {
        assertEquals("H", labels.label(GateOperation.single(1, "H")));
        assertEquals("X", labels.label(GateOperation.controlled(1, 2, "CNOT")));
        assertEquals("R_x(\\pi/2)", labels.label(GateOperation.parametricSingle(1, "Rx", Math.PI / 2)));
        assertEquals("R_{xx}(\\pi/4)", labels.label(GateOperation.parametricTwoWire(1, 2, "Rxx", Math.PI / 4)));
    }

    @Test
    void targetShapes() {
        assertEquals(TargetShape.CROSS, labels.targetShape("X"));
        assertEquals(TargetShape.CROSS, labels.targetShape("CNOT"));
        assertEquals(TargetShape.CROSS, labels.targetShape("CX"));
        assertEquals(TargetShape.DOT, labels.targetShape("Z"));
        assertEquals(TargetShape.DOT, labels.targetShape("CZ"));
        assertEquals(TargetShape.DOT, labels.targetShape("CPHASE"));
        assertEquals(TargetShape.BOX, labels.targetShape("CY"));
        assertEquals(TargetShape.BOX, labels.targetShape("H"));
        assertEquals(TargetShape.BOX, labels.targetShape("Rx"));
    }

    @Test
    void customReferenceFlowsIntoLabels() {
        LabelFormatter degrees = new LabelFormatter(new ParameterFormatter(Math.PI / 180, "^\\circ"));
        assertEquals("R_x(90^\\circ)", degrees.parametricLabel("Rx", Math.PI / 2));
        assertEquals("R_x(0)", degrees.parametricLabel("Rx", 0.0));
    }
}
