package com.ethnicthv.qcircuit.core.layout;

import com.ethnicthv.qcircuit.core.UnsupportedLayoutModeException;

import java.util.Locale;

/**
 * Defines how operations are assigned to diagram columns.
 * <p>
 * Both modes keep program order; they only differ in how many operations may share a column.
 *
 * @see ColumnScheduler
 */
public enum LayoutMode {
    /**
     * One operation per column, in program order.
     * <p>
     * Recommended when:
     * <ul>
     *   <li>the diagram should read as a step-by-step listing of the program</li>
     *   <li>gate count is small and width does not matter</li>
     * </ul>
     */
    SERIAL,

    /**
     * Greedy left-to-right compaction: an operation moves into the earliest column after
     * every earlier operation whose wire range overlaps its own.
     * <p>
     * Recommended when:
     * <ul>
     *   <li>the circuit has independent gates on disjoint wires</li>
     *   <li>the diagram should reflect circuit depth rather than gate count</li>
     * </ul>
     * Note: the packing is greedy and never reorders, so it is not guaranteed to be the
     * narrowest possible layout.
     */
    PACKED;

    /**
     * Resolve a layout selector. Accepted names (case-insensitive): {@code serial},
     * {@code horizontal}, {@code packed}, {@code parallel}, {@code vertical}.
     *
     * @throws UnsupportedLayoutModeException for any other value, including null
     */
    public static LayoutMode fromName(String name) {
        if (name == null) {
            throw new UnsupportedLayoutModeException(null);
        }
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "serial", "horizontal" -> SERIAL;
            case "packed", "parallel", "vertical" -> PACKED;
            default -> throw new UnsupportedLayoutModeException(name);
        };
    }
}
