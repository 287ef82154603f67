package com.ethnicthv.qcircuit.core.layout;

import com.ethnicthv.qcircuit.core.CircuitValidationException;
import com.ethnicthv.qcircuit.core.circuit.Circuit;
import com.ethnicthv.qcircuit.core.gate.GateOperation;
import com.ethnicthv.qcircuit.core.gate.WireSpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Assigns every operation of a circuit to a diagram column.
 * <p>
 * {@link LayoutMode#SERIAL} gives operation i column i. {@link LayoutMode#PACKED} runs a
 * greedy list schedule over a per-wire frontier:
 * <pre>
 *   frontier[w] = 0 for every wire
 *   for each op in program order:
 *       (lo, hi) = op.involvedRange()
 *       depth    = max(frontier[lo..hi]) + 1
 *       column   = depth - 1
 *       frontier[w] = depth for every w in [lo, hi]
 * </pre>
 * The whole range is marked, not only the touched wires: the vertical line of a controlled
 * gate crosses the intermediate wires, and a box drawn there in the same column would
 * overlap it.
 * <p>
 * Stateless; the frontier lives on the stack of one call.
 */
public final class ColumnScheduler {

    private static final Logger LOG = LoggerFactory.getLogger(ColumnScheduler.class);

    private ColumnScheduler() {
    }

    public static ColumnAssignment schedule(Circuit circuit, LayoutMode mode) {
        if (circuit == null) {
            throw new IllegalArgumentException("circuit must not be null");
        }
        return schedule(circuit.operations(), circuit.wireCount(), mode);
    }

    public static ColumnAssignment schedule(List<GateOperation> operations, int wireCount, LayoutMode mode) {
        if (operations == null) {
            throw new IllegalArgumentException("operations must not be null");
        }
        if (mode == null) {
            throw new IllegalArgumentException("mode must not be null");
        }
        checkWires(operations, wireCount);
        ColumnAssignment assignment = switch (mode) {
            case SERIAL -> serial(operations);
            case PACKED -> packed(operations, wireCount);
        };
        LOG.debug("Scheduled {} operation(s) on {} wire(s) into {} column(s) [{}]",
                operations.size(), wireCount, assignment.columnCount(), mode);
        return assignment;
    }

    private static void checkWires(List<GateOperation> operations, int wireCount) {
        if (wireCount < 1) {
            throw new CircuitValidationException("Wire count must be positive, got " + wireCount);
        }
        for (GateOperation op : operations) {
            if (op.involvedRange().hi() > wireCount) {
                throw new CircuitValidationException("Operation " + op + " exceeds wire count " + wireCount);
            }
        }
    }

    private static ColumnAssignment serial(List<GateOperation> operations) {
        int[] columns = new int[operations.size()];
        for (int i = 0; i < columns.length; i++) {
            columns[i] = i;
        }
        return new ColumnAssignment(LayoutMode.SERIAL, columns, columns.length);
    }

    private static ColumnAssignment packed(List<GateOperation> operations, int wireCount) {
        int[] frontier = new int[wireCount + 1]; // 1-based, slot 0 unused
        int[] columns = new int[operations.size()];
        int columnCount = 0;

        for (int i = 0; i < columns.length; i++) {
            WireSpan span = operations.get(i).involvedRange();
            int depth = 0;
            for (int w = span.lo(); w <= span.hi(); w++) {
                depth = Math.max(depth, frontier[w]);
            }
            depth++;
            for (int w = span.lo(); w <= span.hi(); w++) {
                frontier[w] = depth;
            }
            columns[i] = depth - 1;
            columnCount = Math.max(columnCount, depth);
        }
        return new ColumnAssignment(LayoutMode.PACKED, columns, columnCount);
    }
}
