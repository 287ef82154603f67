package com.ethnicthv.qcircuit.core.label;

/**
 * How the target wire of a controlled gate is drawn.
 */
public enum TargetShape {
    /** Circled plus, for controlled bit flips (CNOT, Toffoli, ...). */
    CROSS,
    /** A second control dot, for controlled phase gates (CZ, CPHASE). */
    DOT,
    /** A labelled box, for every other controlled kind. */
    BOX
}
