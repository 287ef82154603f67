package com.ethnicthv.qcircuit.core.measure;

/**
 * Measurement performed on the backend state after a circuit has run.
 * Wire indices are 1-based; every record validates its arguments on construction.
 */
public sealed interface Measurement permits ExpectationValue, Sampling, ProjectiveMeasurement {

    /**
     * Highest wire the measurement reads, or 0 if it reads the whole register.
     */
    int highestWire();
}
