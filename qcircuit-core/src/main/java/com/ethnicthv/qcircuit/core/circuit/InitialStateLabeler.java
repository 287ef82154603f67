package com.ethnicthv.qcircuit.core.circuit;

import com.ethnicthv.qcircuit.core.CircuitValidationException;

import java.util.ArrayList;
import java.util.List;

/**
 * Resolves the starting-state label of every wire.
 * <p>
 * A single descriptor is broadcast to all wires; N descriptors are looked up by position.
 * Any other count is rejected in the constructor, so a renderer never discovers an arity
 * problem halfway through a diagram.
 */
public final class InitialStateLabeler {

    private final int wireCount;
    private final List<InitialState> states;

    public InitialStateLabeler(int wireCount, List<InitialState> states) {
        if (wireCount < 1) {
            throw new CircuitValidationException("Wire count must be positive, got " + wireCount);
        }
        checkArity(wireCount, states);
        this.wireCount = wireCount;
        this.states = List.copyOf(states);
    }

    public static InitialStateLabeler of(Circuit circuit) {
        return new InitialStateLabeler(circuit.wireCount(), circuit.initialStates());
    }

    /**
     * Validate that {@code states} can describe {@code wireCount} wires.
     *
     * @throws CircuitValidationException on an arity mismatch
     */
    public static void checkArity(int wireCount, List<? extends InitialState> states) {
        if (states == null || states.isEmpty()) {
            throw new CircuitValidationException("At least one initial state is required");
        }
        for (InitialState state : states) {
            if (state == null) {
                throw new CircuitValidationException("Initial state list contains null: " + states);
            }
            if (state instanceof ProductState product) {
                if (states.size() != 1) {
                    throw new CircuitValidationException("A product state must be the only initial state, got "
                            + states.size() + " descriptors");
                }
                if (product.size() != wireCount) {
                    throw new CircuitValidationException("Product state has " + product.size()
                            + " labels but circuit has " + wireCount + " wire(s)");
                }
            }
        }
        if (states.size() != 1 && states.size() != wireCount) {
            throw new CircuitValidationException("Expected 1 or " + wireCount + " initial states, got " + states.size());
        }
    }

    private InitialState stateFor(int wire) {
        if (wire <= 0 || wire > wireCount) {
            throw new CircuitValidationException("Wire index " + wire + " is out of range [1, " + wireCount + "]");
        }
        return states.size() == 1 ? states.get(0) : states.get(wire - 1);
    }

    /**
     * Ket label of the wire, e.g. {@code \ket{0}}.
     */
    public String label(int wire) {
        return "\\ket{" + stateFor(wire).displayLabel(wire) + "}";
    }

    /**
     * Ket labels of all wires, wire 1 first.
     */
    public List<String> labels() {
        List<String> out = new ArrayList<>(wireCount);
        for (int w = 1; w <= wireCount; w++) {
            out.add(label(w));
        }
        return out;
    }

    /**
     * Per-wire state names for the numerical backend, wire 1 first.
     */
    public List<String> backendStateNames() {
        List<String> out = new ArrayList<>(wireCount);
        for (int w = 1; w <= wireCount; w++) {
            out.add(stateFor(w).stateName(w));
        }
        return out;
    }

    public int wireCount() {
        return wireCount;
    }
}
