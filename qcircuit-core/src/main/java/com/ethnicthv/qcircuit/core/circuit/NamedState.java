package com.ethnicthv.qcircuit.core.circuit;

import com.ethnicthv.qcircuit.core.CircuitValidationException;

/**
 * State initialised as {@code name} by the backend but displayed with an arbitrary LaTeX label,
 * e.g. {@code new NamedState("0", "\\psi_0")}.
 */
public record NamedState(String name, String latex) implements InitialState {

    public NamedState {
        if (name == null || name.isEmpty()) {
            throw new CircuitValidationException("Named state name must not be empty");
        }
        if (latex == null || latex.isEmpty()) {
            throw new CircuitValidationException("Named state label must not be empty for state '" + name + "'");
        }
    }

    @Override
    public String displayLabel(int wire) {
        return latex;
    }

    @Override
    public String stateName(int wire) {
        return name;
    }
}
