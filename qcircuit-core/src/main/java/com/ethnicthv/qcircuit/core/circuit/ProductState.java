package com.ethnicthv.qcircuit.core.circuit;

import com.ethnicthv.qcircuit.core.CircuitValidationException;

import java.util.List;

/**
 * One label per wire, given as a single descriptor. Must be the only descriptor of a circuit
 * and must have exactly one label per wire.
 */
public record ProductState(List<String> labels) implements InitialState {

    public ProductState {
        if (labels == null || labels.isEmpty()) {
            throw new CircuitValidationException("Product state needs at least one label");
        }
        labels = List.copyOf(labels);
    }

    public static ProductState of(String... labels) {
        return new ProductState(List.of(labels));
    }

    public int size() {
        return labels.size();
    }

    @Override
    public String displayLabel(int wire) {
        return labelAt(wire);
    }

    @Override
    public String stateName(int wire) {
        return labelAt(wire);
    }

    private String labelAt(int wire) {
        if (wire <= 0) {
            throw new CircuitValidationException("Wire index must be positive, got " + wire);
        }
        if (wire > labels.size()) {
            throw new CircuitValidationException("Wire index " + wire + " exceeds product state size " + labels.size());
        }
        return labels.get(wire - 1);
    }
}
