package com.ethnicthv.qcircuit.core.gate;

/**
 * Inclusive range of wires [lo, hi] covered by an operation.
 * Only used for collision and rendering-span purposes; it carries no role information.
 */
public record WireSpan(int lo, int hi) {

    public WireSpan {
        if (lo <= 0 || hi < lo) {
            throw new IllegalArgumentException("Invalid wire span [" + lo + ", " + hi + "]");
        }
    }

    /**
     * Number of wires in the span, intermediate wires included.
     */
    public int size() {
        return hi - lo + 1;
    }

    public boolean contains(int wire) {
        return wire >= lo && wire <= hi;
    }

    public boolean overlaps(WireSpan other) {
        return lo <= other.hi && other.lo <= hi;
    }
}
