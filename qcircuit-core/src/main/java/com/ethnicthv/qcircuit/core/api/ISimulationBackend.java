package com.ethnicthv.qcircuit.core.api;

import java.util.List;

/**
 * Numerical simulation library seen from the circuit side.
 * <p>
 * The backend receives gate-type identifiers and wire indices exactly as they appear on the
 * {@link com.ethnicthv.qcircuit.core.gate.GateOperation}; translating them into its own
 * operator constructors is the backend's business. Implementations throw their own
 * unchecked exception for unsupported gate types or wire counts.
 *
 * @param <S> opaque state handle
 */
public interface ISimulationBackend<S> {

    /**
     * Create the initial product state, one state name per wire (wire 1 first).
     */
    S prepare(List<String> stateNames);

    /**
     * Apply one gate and return the resulting state (which may be the same handle).
     *
     * @param wires  1-based wires in role order
     * @param params gate parameters, empty for non-parametric gates
     */
    S apply(S state, String gateType, int[] wires, double[] params);
}
