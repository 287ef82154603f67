package com.ethnicthv.qcircuit.core.measure;

/**
 * Outcome (0 or 1) of a projective measurement and the state left behind.
 *
 * @param <S> backend state handle
 */
public record ProjectiveOutcome<S>(int outcome, S state) {
}
