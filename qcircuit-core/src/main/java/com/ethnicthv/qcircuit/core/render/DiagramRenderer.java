package com.ethnicthv.qcircuit.core.render;

import com.ethnicthv.qcircuit.core.circuit.Circuit;
import com.ethnicthv.qcircuit.core.gate.GateFamily;
import com.ethnicthv.qcircuit.core.gate.GateOperation;
import com.ethnicthv.qcircuit.core.gate.WireRole;
import com.ethnicthv.qcircuit.core.gate.WireSpan;
import com.ethnicthv.qcircuit.core.label.LabelFormatter;
import com.ethnicthv.qcircuit.core.label.TargetShape;
import com.ethnicthv.qcircuit.core.layout.ColumnAssignment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;

/**
 * Places every operation of a circuit into a {@link DiagramGrid}, at the column chosen by
 * the scheduler.
 * <p>
 * Cell placement depends only on the operation, never on the layout mode, so a gate looks
 * the same whether the diagram is serial or packed:
 * <ul>
 *   <li>single-wire gates: a box</li>
 *   <li>controlled gates: control dot pointing at the target, target drawn by family
 *       (cross, dot or labelled box)</li>
 *   <li>exchange gates: swap cross pair</li>
 *   <li>multi-controlled gates: chain of control dots ending at the target</li>
 *   <li>anything else touching several wires: one box over the whole range</li>
 * </ul>
 */
public final class DiagramRenderer {

    private static final Logger LOG = LoggerFactory.getLogger(DiagramRenderer.class);

    private final LabelFormatter labels;

    public DiagramRenderer() {
        this(new LabelFormatter());
    }

    public DiagramRenderer(LabelFormatter labels) {
        if (labels == null) {
            throw new IllegalArgumentException("labels must not be null");
        }
        this.labels = labels;
    }

    public DiagramGrid render(Circuit circuit, ColumnAssignment assignment) {
        if (circuit == null) {
            throw new IllegalArgumentException("circuit must not be null");
        }
        if (assignment == null) {
            throw new IllegalArgumentException("assignment must not be null");
        }
        List<GateOperation> ops = circuit.operations();
        if (assignment.operationCount() != ops.size()) {
            throw new IllegalArgumentException("Assignment covers " + assignment.operationCount()
                    + " operation(s), circuit has " + ops.size());
        }

        DiagramGrid grid = new DiagramGrid(circuit.wireCount(), assignment.columnCount());
        for (int i = 0; i < ops.size(); i++) {
            place(grid, ops.get(i), assignment.columnOf(i));
        }
        LOG.debug("Rendered {} operation(s) into a {}x{} grid", ops.size(), grid.wireCount(), grid.columnCount());
        return grid;
    }

    private void place(DiagramGrid grid, GateOperation op, int column) {
        switch (op.shape()) {
            case SINGLE, PARAMETRIC_SINGLE -> grid.set(op.wire(0), column, new DiagramCell.Box(labels.label(op)));
            case CONTROLLED, PARAMETRIC_CONTROLLED -> placeControlled(grid, op, column);
            case TWO_WIRE -> {
                if (GateFamily.isExchange(op.gateType())) {
                    placeSwap(grid, op.wire(0), op.wire(1), column);
                } else {
                    placeSpanBox(grid, op, column);
                }
            }
            case PARAMETRIC_TWO_WIRE -> placeSpanBox(grid, op, column);
            case THREE_WIRE, FOUR_WIRE, GENERALIZED, PARAMETRIC_GENERALIZED -> placeMultiWire(grid, op, column);
        }
    }

    private void placeControlled(DiagramGrid grid, GateOperation op, int column) {
        int control = op.wire(0);
        int target = op.wire(1);
        grid.set(control, column, new DiagramCell.Control(target - control));
        grid.set(target, column, targetCell(op));
    }

    private DiagramCell targetCell(GateOperation op) {
        TargetShape shape = labels.targetShape(op.gateType());
        if (shape == TargetShape.BOX) {
            return new DiagramCell.Target(TargetShape.BOX, labels.label(op));
        }
        return new DiagramCell.Target(shape, null);
    }

    private void placeSwap(DiagramGrid grid, int wire1, int wire2, int column) {
        int lo = Math.min(wire1, wire2);
        int hi = Math.max(wire1, wire2);
        grid.set(lo, column, new DiagramCell.SwapAnchor(hi - lo));
        grid.set(hi, column, new DiagramCell.SwapPartner());
    }

    private void placeMultiWire(DiagramGrid grid, GateOperation op, int column) {
        int controls = op.countRole(WireRole.CONTROL);
        int targets = op.countRole(WireRole.TARGET);
        int operands = op.countRole(WireRole.OPERAND);

        if (op.shape().hasFixedWireCount() && controls == 1 && operands == 2
                && GateFamily.isControlledExchange(op.gateType())) {
            placeControlledSwap(grid, op, column);
        } else if (controls > 0 && targets == 1 && operands == 0) {
            placeControlChain(grid, op, column);
        } else {
            placeSpanBox(grid, op, column);
        }
    }

    private void placeControlledSwap(DiagramGrid grid, GateOperation op, int column) {
        int control = op.wire(0);
        int lo = Math.min(op.wire(1), op.wire(2));
        int hi = Math.max(op.wire(1), op.wire(2));
        placeSwap(grid, lo, hi, column);
        int anchor = control > hi ? hi : lo;
        grid.set(control, column, new DiagramCell.Control(anchor - control));
    }

    /**
     * Controls above the target point at the next touched wire below them, controls below
     * the target at the next touched wire above them, so the dots form one connected line.
     */
    private void placeControlChain(DiagramGrid grid, GateOperation op, int column) {
        int[] sorted = op.wires();
        Arrays.sort(sorted);
        int target = -1;
        for (int i = 0; i < op.wireCount(); i++) {
            if (op.role(i) == WireRole.TARGET) {
                target = op.wire(i);
            }
        }

        for (int i = 0; i < sorted.length; i++) {
            int wire = sorted[i];
            if (wire == target) {
                grid.set(wire, column, targetCell(op));
            } else if (wire < target) {
                grid.set(wire, column, new DiagramCell.Control(sorted[i + 1] - wire));
            } else {
                grid.set(wire, column, new DiagramCell.Control(sorted[i - 1] - wire));
            }
        }
    }

    private void placeSpanBox(DiagramGrid grid, GateOperation op, int column) {
        WireSpan span = op.involvedRange();
        grid.set(span.lo(), column, new DiagramCell.SpanBox(span.size(), labels.label(op)));
        for (int w = span.lo() + 1; w <= span.hi(); w++) {
            grid.set(w, column, DiagramCell.GHOST);
        }
    }
}
