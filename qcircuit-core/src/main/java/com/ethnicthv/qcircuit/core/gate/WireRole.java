package com.ethnicthv.qcircuit.core.gate;

/**
 * Role a wire plays inside a generalized gate.
 */
public enum WireRole {
    /** Control point; drawn as a filled dot connected to the rest of the gate. */
    CONTROL,
    /** The wire the controlled operation acts on. */
    TARGET,
    /** Plain operand of a gate without control structure. */
    OPERAND
}
