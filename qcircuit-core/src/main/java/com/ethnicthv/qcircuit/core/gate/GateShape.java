package com.ethnicthv.qcircuit.core.gate;

/**
 * Closed set of gate shapes, used as the kind tag of a {@link GateOperation}.
 * <p>
 * The shape fixes how many wires an operation touches and how the wire order is read:
 * <ul>
 *   <li>controlled shapes list the control before the target</li>
 *   <li>two/three/four-wire shapes keep the order given by the caller; the renderer
 *       decides the role of each position from the gate family</li>
 *   <li>generalized shapes carry an explicit {@link WireRole} per wire</li>
 * </ul>
 * Scheduling and rendering switch exhaustively over this enum.
 */
public enum GateShape {
    /** One wire, no parameters (H, X, T, ...). */
    SINGLE(1, false),

    /** One wire with rotation parameters (Rx, Rn, Phase, ...). */
    PARAMETRIC_SINGLE(1, true),

    /** Control wire followed by target wire (CNOT, CZ, CY, ...). */
    CONTROLLED(2, false),

    /** Control wire followed by target wire, with parameters (CRx, CRn, ...). */
    PARAMETRIC_CONTROLLED(2, true),

    /** Two wires without control structure (SWAP, iSWAP, ...). */
    TWO_WIRE(2, false),

    /** Two-wire coupling with parameters (Rxx, Ryy, Rzz). */
    PARAMETRIC_TWO_WIRE(2, true),

    /** Three wires (Toffoli, Fredkin, ...). */
    THREE_WIRE(3, false),

    /** Four wires (CCCNOT, ...). */
    FOUR_WIRE(4, false),

    /** Any number of wires with explicit roles. */
    GENERALIZED(0, false),

    /** Any number of wires with explicit roles, with parameters. */
    PARAMETRIC_GENERALIZED(0, true);

    private final int wireCount;
    private final boolean parametric;

    GateShape(int wireCount, boolean parametric) {
        this.wireCount = wireCount;
        this.parametric = parametric;
    }

    /**
     * Number of wires the shape requires, or 0 when the count is variable.
     */
    public int wireCount() {
        return wireCount;
    }

    public boolean hasFixedWireCount() {
        return wireCount > 0;
    }

    public boolean isParametric() {
        return parametric;
    }
}
