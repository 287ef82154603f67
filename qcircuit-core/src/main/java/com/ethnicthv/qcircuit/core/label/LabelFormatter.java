package com.ethnicthv.qcircuit.core.label;

import com.ethnicthv.qcircuit.core.gate.GateOperation;

import java.util.StringJoiner;

/**
 * Produces the text shown inside a gate box.
 * <p>
 * Plain gates show their symbol ({@code H}, {@code \text{TOF}}); parametric gates show the
 * parametric symbol followed by the formatted parameters ({@code R_x(\pi/2)},
 * {@code R_n(\pi, \pi/2, \pi/4)}). Numbers go through a {@link ParameterFormatter}.
 */
public final class LabelFormatter {

    private final ParameterFormatter parameters;

    public LabelFormatter() {
        this(ParameterFormatter.PI);
    }

    public LabelFormatter(ParameterFormatter parameters) {
        if (parameters == null) {
            throw new IllegalArgumentException("parameters must not be null");
        }
        this.parameters = parameters;
    }

    /**
     * Box label of an operation, parametric or not.
     */
    public String label(GateOperation op) {
        return op.hasParams() ? parametricLabel(op.gateType(), op.params()) : GateSymbols.symbol(op.gateType());
    }

    public String symbol(String gateType) {
        return GateSymbols.symbol(gateType);
    }

    public String parametricLabel(String gateType, double... params) {
        StringJoiner args = new StringJoiner(", ", "(", ")");
        for (double p : params) {
            args.add(parameters.format(p));
        }
        return GateSymbols.parametricSymbol(gateType) + args;
    }

    public TargetShape targetShape(String gateType) {
        return GateSymbols.targetShape(gateType);
    }
}
