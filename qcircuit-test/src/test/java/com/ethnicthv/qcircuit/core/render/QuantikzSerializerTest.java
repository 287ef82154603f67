package com.ethnicthv.qcircuit.core.render;

import com.ethnicthv.qcircuit.core.circuit.BasisState;
import com.ethnicthv.qcircuit.core.circuit.Circuit;
import com.ethnicthv.qcircuit.core.circuit.InitialStateLabeler;
import com.ethnicthv.qcircuit.core.gate.GateOperation;
import com.ethnicthv.qcircuit.core.layout.ColumnScheduler;
import com.ethnicthv.qcircuit.core.layout.LayoutMode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class QuantikzSerializerTest {

    private static DiagramGrid grid(Circuit circuit) {
        return new DiagramRenderer().render(circuit, ColumnScheduler.schedule(circuit, LayoutMode.PACKED));
    }

    @Test
    void rowsStartWithLabelAndEndWithWire() {
        Circuit circuit = Circuit.builder(2).addGate(GateOperation.single(1, "H")).build();

        String latex = new QuantikzSerializer().serialize(grid(circuit), InitialStateLabeler.of(circuit));

        assertEquals("\\begin{quantikz}\n"
                + "\\lstick{\\ket{0}} & \\gate{H} & \\qw \\\\\n"
                + "\\lstick{\\ket{0}} & \\qw & \\qw\n"
                + "\\end{quantikz}", latex);
    }

    @Test
    void emptyCircuitHasLabelAndWireOnly() {
        Circuit circuit = Circuit.builder(2).build();

        String latex = new QuantikzSerializer().serialize(grid(circuit), InitialStateLabeler.of(circuit));

        assertEquals("\\begin{quantikz}\n"
                + "\\lstick{\\ket{0}} & \\qw \\\\\n"
                + "\\lstick{\\ket{0}} & \\qw\n"
                + "\\end{quantikz}", latex);
    }

    @Test
    void ghostCellsAreFilteredByDefault() {
        Circuit circuit = Circuit.builder(2)
                .addGate(GateOperation.twoWire(1, 2, "iSWAP"))
                .addGate(GateOperation.single(2, "H"))
                .build();
        DiagramGrid grid = grid(circuit);
        InitialStateLabeler labels = InitialStateLabeler.of(circuit);

        QuantikzSerializer serializer = new QuantikzSerializer();
        assertEquals(GhostCellPolicy.FILTER, serializer.ghostCells());
        assertEquals("\\lstick{\\ket{0}} & \\gate[2]{iSWAP} & \\qw & \\qw \\\\\n"
                        + "\\lstick{\\ket{0}} & \\gate{H} & \\qw",
                serializer.body(grid, labels, QuantikzSerializer.CELL_SEPARATOR));
    }

    @Test
    void placeholderPolicyKeepsColumnsAligned() {
        Circuit circuit = Circuit.builder(2)
                .addGate(GateOperation.twoWire(1, 2, "iSWAP"))
                .addGate(GateOperation.single(2, "H"))
                .build();

        String body = new QuantikzSerializer(GhostCellPolicy.PLACEHOLDER)
                .body(grid(circuit), InitialStateLabeler.of(circuit), QuantikzSerializer.CELL_SEPARATOR);

        assertEquals("\\lstick{\\ket{0}} & \\gate[2]{iSWAP} & \\qw & \\qw \\\\\n"
                + "\\lstick{\\ket{0}} &  & \\gate{H} & \\qw", body);
    }

    @Test
    void escapedSeparatorForTikzBody() {
        Circuit circuit = Circuit.builder(1).addGate(GateOperation.single(1, "X")).build();

        String body = new QuantikzSerializer()
                .body(grid(circuit), InitialStateLabeler.of(circuit), QuantikzSerializer.ESCAPED_CELL_SEPARATOR);

        assertEquals("\\lstick{\\ket{0}} \\& \\gate{X} \\& \\qw", body);
    }

    @Test
    void labelCountMustMatchGrid() {
        Circuit circuit = Circuit.builder(2).build();
        InitialStateLabeler threeWires = new InitialStateLabeler(3, List.of(BasisState.ZERO));

        assertThrows(IllegalArgumentException.class,
                () -> new QuantikzSerializer().serialize(grid(circuit), threeWires));
        assertThrows(IllegalArgumentException.class, () -> new QuantikzSerializer(null));
    }

    @Test
    void tikzPictureWrapsData() {
        TikzPicture picture = TikzPicture.quantikz("\\lstick{\\ket{0}} \\& \\qw");

        assertEquals("ampersand replacement=\\&", picture.options());
        assertEquals("quantikz", picture.environment());
        assertEquals("\\usepackage{quantikz}", picture.preamble());
        assertEquals("\\begin{quantikz}[ampersand replacement=\\&]\n"
                + "\\lstick{\\ket{0}} \\& \\qw\n"
                + "\\end{quantikz}", picture.toLatex());
    }
}
