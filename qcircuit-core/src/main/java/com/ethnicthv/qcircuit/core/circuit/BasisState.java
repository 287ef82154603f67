package com.ethnicthv.qcircuit.core.circuit;

import com.ethnicthv.qcircuit.core.CircuitValidationException;

/**
 * Computational or named basis state ("0", "1", "+", "-", "Up", "Dn", ...).
 */
public record BasisState(String label) implements InitialState {

    public static final BasisState ZERO = new BasisState("0");

    public BasisState {
        if (label == null || label.isEmpty()) {
            throw new CircuitValidationException("Basis state label must not be empty");
        }
    }

    @Override
    public String displayLabel(int wire) {
        return label;
    }

    @Override
    public String stateName(int wire) {
        return label;
    }
}
