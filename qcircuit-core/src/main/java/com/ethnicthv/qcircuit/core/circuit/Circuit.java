package com.ethnicthv.qcircuit.core.circuit;

import com.ethnicthv.qcircuit.core.CircuitValidationException;
import com.ethnicthv.qcircuit.core.gate.GateOperation;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Immutable quantum circuit: a fixed number of wires, the gate sequence in program order and
 * the initial-state descriptors.
 * <p>
 * Use {@link #builder(int)} to assemble one:
 * <pre>{@code
 * Circuit bell = Circuit.builder(2)
 *         .addGate(GateOperation.single(1, "H"))
 *         .addGate(GateOperation.controlled(1, 2, "CNOT"))
 *         .build();
 * }</pre>
 * The program order is never changed after construction; layout only decides how far
 * right each operation is drawn.
 */
public final class Circuit {

    private final int wireCount;
    private final List<GateOperation> operations;
    private final List<InitialState> initialStates;

    private Circuit(int wireCount, List<GateOperation> operations, List<InitialState> initialStates) {
        this.wireCount = wireCount;
        this.operations = List.copyOf(operations);
        this.initialStates = List.copyOf(initialStates);
    }

    /**
     * Start a circuit with the given number of wires.
     *
     * @throws CircuitValidationException if {@code wireCount < 1}
     */
    public static Builder builder(int wireCount) {
        return new Builder(wireCount);
    }

    public int wireCount() {
        return wireCount;
    }

    /**
     * Operations in program order.
     */
    public List<GateOperation> operations() {
        return operations;
    }

    public int operationCount() {
        return operations.size();
    }

    public List<InitialState> initialStates() {
        return initialStates;
    }

    @Override
    public String toString() {
        return "Circuit{wires=" + wireCount + ", operations=" + operations.size()
                + ", initialStates=" + initialStates + '}';
    }

    public static final class Builder {
        private final int wireCount;
        private final List<GateOperation> operations = new ArrayList<>();
        private final List<InitialState> initialStates = new ArrayList<>();

        private Builder(int wireCount) {
            if (wireCount < 1) {
                throw new CircuitValidationException("Wire count must be positive, got " + wireCount);
            }
            this.wireCount = wireCount;
        }

        /**
         * Append a gate at the end of the program.
         *
         * @throws CircuitValidationException if the gate touches a wire beyond the wire count
         */
        public Builder addGate(GateOperation gate) {
            if (gate == null) {
                throw new IllegalArgumentException("gate must not be null");
            }
            if (gate.involvedRange().hi() > wireCount) {
                throw new CircuitValidationException("Gate " + gate.gateType() + " touches wires "
                        + Arrays.toString(gate.wires()) + " but the circuit has " + wireCount + " wire(s)");
            }
            operations.add(gate);
            return this;
        }

        public Builder addGates(List<GateOperation> gates) {
            if (gates == null) {
                throw new IllegalArgumentException("gates must not be null");
            }
            for (GateOperation gate : gates) {
                addGate(gate);
            }
            return this;
        }

        /**
         * Replace the initial-state descriptors. Either one descriptor for all wires or one per wire.
         */
        public Builder initialStates(List<? extends InitialState> states) {
            if (states == null) {
                throw new IllegalArgumentException("states must not be null");
            }
            initialStates.clear();
            initialStates.addAll(states);
            return this;
        }

        public Builder initialStates(InitialState... states) {
            if (states == null) {
                throw new IllegalArgumentException("states must not be null");
            }
            return initialStates(Arrays.asList(states));
        }

        /**
         * Build the circuit. Without explicit descriptors every wire starts in {@link BasisState#ZERO}.
         *
         * @throws CircuitValidationException if the initial-state descriptors do not fit the wire count
         */
        public Circuit build() {
            List<InitialState> states = initialStates.isEmpty() ? List.of(BasisState.ZERO) : initialStates;
            InitialStateLabeler.checkArity(wireCount, states);
            return new Circuit(wireCount, operations, states);
        }
    }
}
