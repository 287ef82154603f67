package com.ethnicthv.qcircuit.core.render;

import com.ethnicthv.qcircuit.core.circuit.InitialStateLabeler;

import java.util.ArrayList;
import java.util.List;

/**
 * Writes a {@link DiagramGrid} as quantikz source.
 * <p>
 * Layout of the output:
 * <pre>
 * \begin{quantikz}
 * \lstick{\ket{0}} &amp; \gate{H} &amp; \ctrl{1} &amp; \qw \\
 * \lstick{\ket{0}} &amp; \qw &amp; \targ{} &amp; \qw
 * \end{quantikz}
 * </pre>
 * Every row starts with the wire label and ends with a trailing {@code \qw}.
 */
public final class QuantikzSerializer {

    public static final String BEGIN = "\\begin{quantikz}";
    public static final String END = "\\end{quantikz}";
    public static final String ROW_SEPARATOR = " \\\\\n";
    public static final String CELL_SEPARATOR = " & ";
    /** Cell separator used with {@code ampersand replacement=\&} (TikZ picture body). */
    public static final String ESCAPED_CELL_SEPARATOR = " \\& ";
    public static final String THROUGH = "\\qw";

    private final GhostCellPolicy ghostCells;

    public QuantikzSerializer() {
        this(GhostCellPolicy.FILTER);
    }

    public QuantikzSerializer(GhostCellPolicy ghostCells) {
        if (ghostCells == null) {
            throw new IllegalArgumentException("ghostCells must not be null");
        }
        this.ghostCells = ghostCells;
    }

    /**
     * Full quantikz environment.
     */
    public String serialize(DiagramGrid grid, InitialStateLabeler labels) {
        return BEGIN + "\n" + body(grid, labels, CELL_SEPARATOR) + "\n" + END;
    }

    /**
     * Rows only, joined by the row separator, with the given cell separator.
     */
    public String body(DiagramGrid grid, InitialStateLabeler labels, String cellSeparator) {
        if (grid.wireCount() != labels.wireCount()) {
            throw new IllegalArgumentException("Grid has " + grid.wireCount() + " wire(s) but "
                    + labels.wireCount() + " label(s) were resolved");
        }
        List<String> rows = new ArrayList<>(grid.wireCount());
        for (int wire = 1; wire <= grid.wireCount(); wire++) {
            rows.add(row(grid, wire, labels.label(wire), cellSeparator));
        }
        return String.join(ROW_SEPARATOR, rows);
    }

    String row(DiagramGrid grid, int wire, String label, String cellSeparator) {
        StringBuilder sb = new StringBuilder();
        sb.append("\\lstick{").append(label).append('}');
        for (DiagramCell cell : grid.row(wire)) {
            if (cell.suppressed() && ghostCells == GhostCellPolicy.FILTER) {
                continue;
            }
            sb.append(cellSeparator).append(cell.token());
        }
        return sb.append(cellSeparator).append(THROUGH).toString();
    }

    public GhostCellPolicy ghostCells() {
        return ghostCells;
    }
}
