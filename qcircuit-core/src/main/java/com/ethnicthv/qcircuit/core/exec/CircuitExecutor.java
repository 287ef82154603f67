package com.ethnicthv.qcircuit.core.exec;

import com.ethnicthv.qcircuit.core.CircuitValidationException;
import com.ethnicthv.qcircuit.core.api.IMeasurementBackend;
import com.ethnicthv.qcircuit.core.api.ISimulationBackend;
import com.ethnicthv.qcircuit.core.circuit.Circuit;
import com.ethnicthv.qcircuit.core.circuit.InitialStateLabeler;
import com.ethnicthv.qcircuit.core.gate.GateOperation;
import com.ethnicthv.qcircuit.core.measure.ExpectationValue;
import com.ethnicthv.qcircuit.core.measure.Measurement;
import com.ethnicthv.qcircuit.core.measure.ProjectiveMeasurement;
import com.ethnicthv.qcircuit.core.measure.ProjectiveOutcome;
import com.ethnicthv.qcircuit.core.measure.Sampling;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Drives a numerical backend through a circuit.
 * <p>
 * The executor prepares the initial state from the circuit's descriptors, forwards every
 * operation in program order and validates measurement wires against the circuit before
 * the backend sees them. All numerical work is done by the backend.
 *
 * @param <S> backend state handle
 */
public final class CircuitExecutor<S> {

    private static final Logger LOG = LoggerFactory.getLogger(CircuitExecutor.class);

    private final ISimulationBackend<S> simulation;
    private final IMeasurementBackend<S> measurement;

    public CircuitExecutor(ISimulationBackend<S> simulation, IMeasurementBackend<S> measurement) {
        if (simulation == null) throw new IllegalArgumentException("simulation must not be null");
        if (measurement == null) throw new IllegalArgumentException("measurement must not be null");
        this.simulation = simulation;
        this.measurement = measurement;
    }

    /**
     * Run the whole circuit and return the final state.
     */
    public S execute(Circuit circuit) {
        if (circuit == null) {
            throw new IllegalArgumentException("circuit must not be null");
        }
        S state = simulation.prepare(InitialStateLabeler.of(circuit).backendStateNames());
        for (GateOperation op : circuit.operations()) {
            state = simulation.apply(state, op.gateType(), op.wires(), op.params());
        }
        LOG.debug("Executed {} operation(s) on {} wire(s)", circuit.operationCount(), circuit.wireCount());
        return state;
    }

    public double measure(Circuit circuit, S state, ExpectationValue m) {
        checkWires(circuit, m);
        return measurement.expectationValue(state, m.operator(), m.wires());
    }

    public Map<String, Integer> measure(Circuit circuit, S state, Sampling m) {
        checkWires(circuit, m);
        return measurement.sample(state, m.shots());
    }

    public ProjectiveOutcome<S> measure(Circuit circuit, S state, ProjectiveMeasurement m) {
        checkWires(circuit, m);
        return measurement.project(state, m.wire());
    }

    private static void checkWires(Circuit circuit, Measurement m) {
        if (m == null) {
            throw new IllegalArgumentException("measurement must not be null");
        }
        int hi = m.highestWire();
        if (hi > circuit.wireCount()) {
            throw new CircuitValidationException("Wire index " + hi + " is out of range [1, "
                    + circuit.wireCount() + "] for " + m);
        }
    }
}
