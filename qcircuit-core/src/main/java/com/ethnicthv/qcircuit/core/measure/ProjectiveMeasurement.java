package com.ethnicthv.qcircuit.core.measure;

import com.ethnicthv.qcircuit.core.CircuitValidationException;

/**
 * Computational-basis measurement of a single wire.
 */
public record ProjectiveMeasurement(int wire) implements Measurement {

    public ProjectiveMeasurement {
        if (wire <= 0) {
            throw new CircuitValidationException("Wire index must be positive, got " + wire);
        }
    }

    @Override
    public int highestWire() {
        return wire;
    }
}
