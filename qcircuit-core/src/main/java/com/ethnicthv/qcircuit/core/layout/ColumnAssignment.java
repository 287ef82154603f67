package com.ethnicthv.qcircuit.core.layout;

import java.util.Arrays;

/**
 * Result of scheduling: the 0-based column of every operation, by program index, and the
 * number of columns in the diagram.
 */
public final class ColumnAssignment {

    private final LayoutMode mode;
    private final int[] columns;
    private final int columnCount;

    ColumnAssignment(LayoutMode mode, int[] columns, int columnCount) {
        this.mode = mode;
        this.columns = columns;
        this.columnCount = columnCount;
    }

    public LayoutMode mode() {
        return mode;
    }

    /**
     * Column of the operation at {@code operationIndex} in program order.
     */
    public int columnOf(int operationIndex) {
        return columns[operationIndex];
    }

    public int operationCount() {
        return columns.length;
    }

    public int columnCount() {
        return columnCount;
    }

    public int[] toArray() {
        return columns.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ColumnAssignment that = (ColumnAssignment) o;
        return columnCount == that.columnCount && mode == that.mode && Arrays.equals(columns, that.columns);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * mode.hashCode() + columnCount) + Arrays.hashCode(columns);
    }

    @Override
    public String toString() {
        return "ColumnAssignment{" + mode + ", columns=" + Arrays.toString(columns) + ", count=" + columnCount + '}';
    }
}
