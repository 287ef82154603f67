package com.ethnicthv.qcircuit.core.gate;

import com.ethnicthv.qcircuit.core.CircuitValidationException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.OptionalInt;

/**
 * A single gate application: the shape tag, an opaque gate-type identifier, the wires in
 * role order and the optional parameters.
 * <p>
 * Instances are immutable and validated on construction: wires must be positive and
 * pairwise distinct, the wire count must match the shape, and the parameter count must
 * match the shape and, for known gate types, the type's arity. Whether the wires fit into a
 * particular circuit is checked when the operation is added to a
 * {@link com.ethnicthv.qcircuit.core.circuit.Circuit}.
 * <p>
 * Example:
 * <pre>{@code
 * GateOperation h    = GateOperation.single(1, "H");
 * GateOperation cnot = GateOperation.controlled(1, 3, "CNOT");
 * GateOperation rz   = GateOperation.parametricSingle(2, "Rz", Math.PI / 2);
 * GateOperation c4x  = GateOperation.generalized("C4X")
 *         .control(1).control(2).control(4).control(5)
 *         .target(3)
 *         .build();
 * }</pre>
 */
public final class GateOperation {

    private static final double[] NO_PARAMS = new double[0];

    private final GateShape shape;
    private final String gateType;
    private final int[] wires;
    private final double[] params;
    private final WireRole[] roles;
    private final WireSpan span;

    private GateOperation(GateShape shape, String gateType, int[] wires, double[] params, WireRole[] roles) {
        if (gateType == null || gateType.isBlank()) {
            throw new CircuitValidationException("Gate type must not be blank, got '" + gateType + "'");
        }
        this.shape = shape;
        this.gateType = gateType;
        this.wires = wires.clone();
        this.params = params == null ? NO_PARAMS : params.clone();
        validateWires();
        validateParams();
        this.roles = roles != null ? roles.clone() : defaultRoles(shape, gateType, this.wires.length);
        this.span = computeSpan(this.wires);
    }

    // =================================================================
    // Factories
    // =================================================================

    public static GateOperation single(int wire, String gateType) {
        return new GateOperation(GateShape.SINGLE, gateType, new int[]{wire}, null, null);
    }

    public static GateOperation parametricSingle(int wire, String gateType, double... params) {
        return new GateOperation(GateShape.PARAMETRIC_SINGLE, gateType, new int[]{wire}, params, null);
    }

    public static GateOperation controlled(int control, int target, String gateType) {
        return new GateOperation(GateShape.CONTROLLED, gateType, new int[]{control, target}, null, null);
    }

    public static GateOperation parametricControlled(int control, int target, String gateType, double... params) {
        return new GateOperation(GateShape.PARAMETRIC_CONTROLLED, gateType, new int[]{control, target}, params, null);
    }

    public static GateOperation twoWire(int wire1, int wire2, String gateType) {
        return new GateOperation(GateShape.TWO_WIRE, gateType, new int[]{wire1, wire2}, null, null);
    }

    public static GateOperation parametricTwoWire(int wire1, int wire2, String gateType, double... params) {
        return new GateOperation(GateShape.PARAMETRIC_TWO_WIRE, gateType, new int[]{wire1, wire2}, params, null);
    }

    /**
     * Three-wire gate. For the Toffoli family the first two wires are the controls and the
     * third the target; for the Fredkin family the first wire is the control and the other
     * two are exchanged.
     */
    public static GateOperation threeWire(int wire1, int wire2, int wire3, String gateType) {
        return new GateOperation(GateShape.THREE_WIRE, gateType, new int[]{wire1, wire2, wire3}, null, null);
    }

    /**
     * Four-wire gate. For CCCNOT the first three wires are the controls and the fourth the target.
     */
    public static GateOperation fourWire(int wire1, int wire2, int wire3, int wire4, String gateType) {
        return new GateOperation(GateShape.FOUR_WIRE, gateType, new int[]{wire1, wire2, wire3, wire4}, null, null);
    }

    /**
     * Start a gate over any number of wires. Every wire is added together with its role.
     */
    public static Builder generalized(String gateType) {
        return new Builder(gateType);
    }

    // =================================================================
    // Validation
    // =================================================================

    private void validateWires() {
        if (wires.length == 0) {
            throw new CircuitValidationException("Gate " + gateType + " has an empty wire list");
        }
        if (shape.hasFixedWireCount() && wires.length != shape.wireCount()) {
            throw new CircuitValidationException("Gate " + gateType + " of shape " + shape
                    + " needs " + shape.wireCount() + " wire(s), got " + Arrays.toString(wires));
        }
        for (int i = 0; i < wires.length; i++) {
            if (wires[i] <= 0) {
                throw new CircuitValidationException("Wire index must be positive, got " + wires[i]
                        + " in gate " + gateType);
            }
            for (int j = 0; j < i; j++) {
                if (wires[j] == wires[i]) {
                    throw new CircuitValidationException("Duplicate wire " + wires[i] + " in gate "
                            + gateType + " " + Arrays.toString(wires));
                }
            }
        }
    }

    private void validateParams() {
        if (!shape.isParametric()) {
            if (params.length != 0) {
                throw new CircuitValidationException("Gate " + gateType + " of shape " + shape
                        + " takes no parameters, got " + Arrays.toString(params));
            }
            return;
        }
        if (params.length == 0) {
            throw new CircuitValidationException("Parametric gate " + gateType + " needs at least one parameter");
        }
        OptionalInt arity = GateFamily.parameterArity(gateType);
        if (arity.isPresent() && arity.getAsInt() != params.length) {
            throw new CircuitValidationException("Gate " + gateType + " expects " + arity.getAsInt()
                    + " parameter(s), got " + params.length);
        }
    }

    private static WireRole[] defaultRoles(GateShape shape, String gateType, int count) {
        WireRole[] roles = new WireRole[count];
        Arrays.fill(roles, WireRole.OPERAND);
        switch (shape) {
            case CONTROLLED, PARAMETRIC_CONTROLLED -> {
                roles[0] = WireRole.CONTROL;
                roles[1] = WireRole.TARGET;
            }
            case THREE_WIRE, FOUR_WIRE -> {
                int controls = GateFamily.controlCount(gateType, count);
                if (controls > 0) {
                    Arrays.fill(roles, 0, controls, WireRole.CONTROL);
                    roles[count - 1] = WireRole.TARGET;
                } else if (count == 3 && GateFamily.isControlledExchange(gateType)) {
                    roles[0] = WireRole.CONTROL;
                }
            }
            default -> {
                // single wires and plain multi-wire gates are operands only
            }
        }
        return roles;
    }

    private static WireSpan computeSpan(int[] wires) {
        int lo = Integer.MAX_VALUE;
        int hi = Integer.MIN_VALUE;
        for (int w : wires) {
            lo = Math.min(lo, w);
            hi = Math.max(hi, w);
        }
        return new WireSpan(lo, hi);
    }

    // =================================================================
    // Accessors
    // =================================================================

    public GateShape shape() {
        return shape;
    }

    public String gateType() {
        return gateType;
    }

    /**
     * Wires in role order (a copy).
     */
    public int[] wires() {
        return wires.clone();
    }

    public int wire(int index) {
        return wires[index];
    }

    public int wireCount() {
        return wires.length;
    }

    public double[] params() {
        return params.clone();
    }

    public boolean hasParams() {
        return params.length > 0;
    }

    public WireRole role(int index) {
        return roles[index];
    }

    /**
     * Number of wires with the given role.
     */
    public int countRole(WireRole role) {
        int n = 0;
        for (WireRole r : roles) {
            if (r == role) n++;
        }
        return n;
    }

    /**
     * Lowest and highest wire touched by this operation, whatever their roles.
     */
    public WireSpan involvedRange() {
        return span;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GateOperation that = (GateOperation) o;
        return shape == that.shape
                && gateType.equals(that.gateType)
                && Arrays.equals(wires, that.wires)
                && Arrays.equals(params, that.params)
                && Arrays.equals(roles, that.roles);
    }

    @Override
    public int hashCode() {
        int result = shape.hashCode();
        result = 31 * result + gateType.hashCode();
        result = 31 * result + Arrays.hashCode(wires);
        result = 31 * result + Arrays.hashCode(params);
        return result;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("GateOperation{")
                .append(shape).append(' ')
                .append(gateType)
                .append(" wires=").append(Arrays.toString(wires));
        if (params.length > 0) {
            sb.append(" params=").append(Arrays.toString(params));
        }
        return sb.append('}').toString();
    }

    // =================================================================
    // Builder for generalized gates
    // =================================================================

    public static final class Builder {
        private final String gateType;
        private final List<Integer> wires = new ArrayList<>();
        private final List<WireRole> roles = new ArrayList<>();
        private double[] params = NO_PARAMS;

        private Builder(String gateType) {
            this.gateType = gateType;
        }

        public Builder control(int wire) {
            return wire(wire, WireRole.CONTROL);
        }

        public Builder target(int wire) {
            return wire(wire, WireRole.TARGET);
        }

        public Builder operand(int wire) {
            return wire(wire, WireRole.OPERAND);
        }

        public Builder wire(int wire, WireRole role) {
            if (role == null) {
                throw new IllegalArgumentException("role must not be null");
            }
            wires.add(wire);
            roles.add(role);
            return this;
        }

        public Builder params(double... params) {
            this.params = params == null ? NO_PARAMS : params.clone();
            return this;
        }

        /**
         * Build the gate; the shape is {@link GateShape#PARAMETRIC_GENERALIZED} when parameters were given.
         */
        public GateOperation build() {
            int[] w = new int[wires.size()];
            for (int i = 0; i < w.length; i++) {
                w[i] = wires.get(i);
            }
            GateShape shape = params.length > 0 ? GateShape.PARAMETRIC_GENERALIZED : GateShape.GENERALIZED;
            return new GateOperation(shape, gateType, w, params, roles.toArray(new WireRole[0]));
        }
    }
}
