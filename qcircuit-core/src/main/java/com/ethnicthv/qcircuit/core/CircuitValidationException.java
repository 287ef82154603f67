package com.ethnicthv.qcircuit.core;

/**
 * Domain-specific unchecked exception for malformed circuit input.
 * Raised eagerly when a gate, circuit, initial state or measurement is constructed
 * with a bad wire index, duplicate wires, an empty operand set, a parameter-arity
 * mismatch or an initial-state arity mismatch. The message always carries the
 * offending value.
 */
public class CircuitValidationException extends RuntimeException {
    public CircuitValidationException(String message) {
        super(message);
    }
    public CircuitValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
