package com.ethnicthv.qcircuit.core.render;

/**
 * How the wires covered by a multi-wire box are written out.
 */
public enum GhostCellPolicy {
    /**
     * Drop covered cells from the row. Output matches the classic converter token for token,
     * but a row with a covered cell has one cell less than its neighbours, which can shift
     * later gates on that wire one column to the left when the diagram is typeset.
     */
    FILTER,

    /**
     * Keep covered cells as empty cells ({@code  &  & }). Every row has the same number of
     * cells, so columns line up across wires.
     */
    PLACEHOLDER
}
