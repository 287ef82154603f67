package com.ethnicthv.qcircuit.core.measure;

import com.ethnicthv.qcircuit.core.CircuitValidationException;

import java.util.Arrays;

/**
 * Expectation value of {@code operator} on the given wires. With several wires the backend
 * averages the single-wire expectation values.
 */
public record ExpectationValue(String operator, int[] wires) implements Measurement {

    public ExpectationValue {
        if (operator == null || operator.isBlank()) {
            throw new CircuitValidationException("Operator must not be blank, got '" + operator + "'");
        }
        if (wires == null || wires.length == 0) {
            throw new CircuitValidationException("ExpectationValue requires at least one wire");
        }
        wires = wires.clone();
        for (int w : wires) {
            if (w <= 0) {
                throw new CircuitValidationException("Wire index must be positive, got " + w);
            }
        }
    }

    public static ExpectationValue of(String operator, int... wires) {
        return new ExpectationValue(operator, wires);
    }

    @Override
    public int[] wires() {
        return wires.clone();
    }

    @Override
    public int highestWire() {
        return Arrays.stream(wires).max().orElse(0);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ExpectationValue that)) return false;
        return operator.equals(that.operator) && Arrays.equals(wires, that.wires);
    }

    @Override
    public int hashCode() {
        return 31 * operator.hashCode() + Arrays.hashCode(wires);
    }

    @Override
    public String toString() {
        return "ExpectationValue{" + operator + " on " + Arrays.toString(wires) + '}';
    }
}
