package com.ethnicthv.qcircuit.core.api;

import com.ethnicthv.qcircuit.core.measure.ProjectiveOutcome;

import java.util.Map;

/**
 * Measurement side of the numerical backend.
 *
 * @param <S> opaque state handle
 */
public interface IMeasurementBackend<S> {

    double expectationValue(S state, String operator, int[] wires);

    /**
     * Bit-string counts over {@code shots} samples, wire 1 as the leftmost character.
     */
    Map<String, Integer> sample(S state, int shots);

    ProjectiveOutcome<S> project(S state, int wire);
}
