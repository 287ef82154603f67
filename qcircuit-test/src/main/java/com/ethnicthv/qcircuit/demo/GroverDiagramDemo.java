package com.ethnicthv.qcircuit.demo;

import com.ethnicthv.qcircuit.Quantikz;
import com.ethnicthv.qcircuit.core.circuit.BasisState;
import com.ethnicthv.qcircuit.core.circuit.Circuit;
import com.ethnicthv.qcircuit.core.gate.GateOperation;
import com.ethnicthv.qcircuit.core.layout.LayoutMode;
import com.ethnicthv.qcircuit.core.render.GhostCellPolicy;
import com.ethnicthv.qcircuit.core.render.TikzPicture;

/**
 * Demo drawing one Grover iteration on three qubits.
 * <p>
 * This example demonstrates:
 * - Building a circuit from single, controlled and multi-controlled gates
 * - Serial vs Packed layout of the same circuit
 * - The TikZ picture form with escaped separators
 */
public class GroverDiagramDemo {

    public static void main(String[] args) {
        Circuit circuit = groverIteration();

        System.out.println("=== Serial layout ===");
        Quantikz serial = Quantikz.builder().layout(LayoutMode.SERIAL).build();
        System.out.println(serial.toQuantikz(circuit));
        System.out.println("Columns: " + serial.schedule(circuit).columnCount());

        System.out.println();
        System.out.println("=== Packed layout ===");
        Quantikz packed = Quantikz.builder()
                .layout(args.length > 0 ? args[0] : "packed")
                .ghostCells(GhostCellPolicy.FILTER)
                .build();
        System.out.println(packed.toQuantikz(circuit));
        System.out.println("Columns: " + packed.schedule(circuit).columnCount());

        System.out.println();
        System.out.println("=== TikZ picture ===");
        TikzPicture picture = packed.toTikzPicture(circuit);
        System.out.println(picture.preamble());
        System.out.println(picture.toLatex());
    }

    private static Circuit groverIteration() {
        Circuit.Builder builder = Circuit.builder(3).initialStates(BasisState.ZERO);
        // Superposition
        for (int w = 1; w <= 3; w++) {
            builder.addGate(GateOperation.single(w, "H"));
        }
        // Oracle marking |101>
        builder.addGate(GateOperation.single(2, "X"))
                .addGate(GateOperation.single(3, "H"))
                .addGate(GateOperation.threeWire(1, 2, 3, "Toffoli"))
                .addGate(GateOperation.single(3, "H"))
                .addGate(GateOperation.single(2, "X"));
        // Diffusion
        for (int w = 1; w <= 3; w++) {
            builder.addGate(GateOperation.single(w, "H"));
            builder.addGate(GateOperation.single(w, "X"));
        }
        builder.addGate(GateOperation.parametricControlled(1, 3, "CRz", Math.PI))
                .addGate(GateOperation.controlled(2, 3, "CZ"));
        for (int w = 1; w <= 3; w++) {
            builder.addGate(GateOperation.single(w, "X"));
            builder.addGate(GateOperation.single(w, "H"));
        }
        return builder.build();
    }
}
