package com.ethnicthv.qcircuit.core.gate;

import java.util.HashMap;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Static membership tables for the gate families that have a dedicated diagram shape,
 * and the parameter arity of the known parametric gate types.
 * <p>
 * The tables are built once in the static initializer and are never mutated, so they can be
 * read from any thread without locking.
 */
public final class GateFamily {

    private static final Set<String> BIT_FLIP = Set.of(
            "X", "CNOT", "CX",
            "Toffoli", "CCNOT", "CCX", "TOFF",
            "CCCNOT");

    private static final Set<String> PHASE = Set.of("Z", "CZ", "CPHASE", "Cphase");

    private static final Set<String> EXCHANGE = Set.of("SWAP", "Swap");

    private static final Set<String> CONTROLLED_EXCHANGE = Set.of("Fredkin", "CSWAP", "CSwap", "CS");

    private static final Set<String> DOUBLE_CONTROLLED_NOT = Set.of("Toffoli", "CCNOT", "CCX", "TOFF");

    private static final Set<String> TRIPLE_CONTROLLED_NOT = Set.of("CCCNOT");

    private static final Map<String, Integer> PARAMETER_ARITY;

    static {
        Map<String, Integer> arity = new HashMap<>();
        for (String id : new String[]{
                "Rx", "RX", "Ry", "RY", "Rz", "RZ",
                "CRx", "CRX", "CRy", "CRY", "CRz", "CRZ",
                "Rxx", "RXX", "Ryy", "RYY", "Rzz", "RZZ",
                "Phase", "P", "S"}) {
            arity.put(id, 1);
        }
        for (String id : new String[]{"Rn", "Rn̂", "CRn", "CRn̂"}) {
            arity.put(id, 3);
        }
        PARAMETER_ARITY = Map.copyOf(arity);
    }

    private GateFamily() {
    }

    /**
     * Controlled bit-flip kinds; their target renders as a cross.
     */
    public static boolean isBitFlip(String gateType) {
        return BIT_FLIP.contains(gateType);
    }

    /**
     * Controlled phase kinds; their target renders as a second control dot.
     */
    public static boolean isPhase(String gateType) {
        return PHASE.contains(gateType);
    }

    /**
     * Symmetric two-wire exchange.
     */
    public static boolean isExchange(String gateType) {
        return EXCHANGE.contains(gateType);
    }

    /**
     * One control followed by an exchanged wire pair.
     */
    public static boolean isControlledExchange(String gateType) {
        return CONTROLLED_EXCHANGE.contains(gateType);
    }

    /**
     * Number of leading control wires of a multi-controlled NOT with the given wire count,
     * or 0 if the type is not a multi-controlled NOT of that size.
     */
    public static int controlCount(String gateType, int wireCount) {
        if (wireCount == 3 && DOUBLE_CONTROLLED_NOT.contains(gateType)) return 2;
        if (wireCount == 4 && TRIPLE_CONTROLLED_NOT.contains(gateType)) return 3;
        return 0;
    }

    /**
     * Expected parameter count for a known parametric gate type.
     * Unknown types accept any non-empty parameter list.
     */
    public static OptionalInt parameterArity(String gateType) {
        Integer n = PARAMETER_ARITY.get(gateType);
        return n == null ? OptionalInt.empty() : OptionalInt.of(n);
    }
}
