package com.ethnicthv.qcircuit.core.render;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Wire-by-column grid of {@link DiagramCell}s. Wires are 1-based, columns 0-based.
 * Every cell starts as {@link DiagramCell#THROUGH}.
 */
public final class DiagramGrid {

    private final int wireCount;
    private final int columnCount;
    private final DiagramCell[][] cells;

    DiagramGrid(int wireCount, int columnCount) {
        this.wireCount = wireCount;
        this.columnCount = columnCount;
        this.cells = new DiagramCell[wireCount][columnCount];
        for (DiagramCell[] row : cells) {
            Arrays.fill(row, DiagramCell.THROUGH);
        }
    }

    void set(int wire, int column, DiagramCell cell) {
        cells[wire - 1][column] = cell;
    }

    public DiagramCell cell(int wire, int column) {
        if (wire < 1 || wire > wireCount) {
            throw new IndexOutOfBoundsException("wire " + wire + " outside [1, " + wireCount + "]");
        }
        if (column < 0 || column >= columnCount) {
            throw new IndexOutOfBoundsException("column " + column + " outside [0, " + columnCount + ")");
        }
        return cells[wire - 1][column];
    }

    /**
     * Cells of one wire, left to right.
     */
    public List<DiagramCell> row(int wire) {
        if (wire < 1 || wire > wireCount) {
            throw new IndexOutOfBoundsException("wire " + wire + " outside [1, " + wireCount + "]");
        }
        return Collections.unmodifiableList(new ArrayList<>(Arrays.asList(cells[wire - 1])));
    }

    public int wireCount() {
        return wireCount;
    }

    public int columnCount() {
        return columnCount;
    }
}
