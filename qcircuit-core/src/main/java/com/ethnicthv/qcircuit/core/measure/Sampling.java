package com.ethnicthv.qcircuit.core.measure;

import com.ethnicthv.qcircuit.core.CircuitValidationException;

/**
 * Repeated computational-basis measurement of the whole register.
 */
public record Sampling(int shots) implements Measurement {

    public Sampling {
        if (shots <= 0) {
            throw new CircuitValidationException("Number of shots must be positive, got " + shots);
        }
    }

    @Override
    public int highestWire() {
        return 0;
    }
}
