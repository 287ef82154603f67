package com.ethnicthv.qcircuit.core.label;

import com.ethnicthv.qcircuit.core.gate.GateFamily;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;

/**
 * Read-only gate-type to LaTeX symbol tables.
 * <p>
 * Both tables are filled once in the static initializer and wrapped as unmodifiable maps;
 * lookups are safe from any number of threads. Unknown identifiers are not an error: the raw
 * identifier is displayed instead, so new gate types can be drawn before they get a symbol.
 */
public final class GateSymbols {

    private static final Logger LOG = LoggerFactory.getLogger(GateSymbols.class);

    private static final Map<String, String> SYMBOLS;
    private static final Map<String, String> PARAMETRIC_SYMBOLS;

    static {
        Map<String, String> m = new HashMap<>();
        // Pauli
        put(m, "X", "X", "Y", "Y", "Z", "Z", "iY", "iY");
        put(m, "σx", "\\sigma_x", "σ1", "\\sigma_1",
                "σy", "\\sigma_y", "σ2", "\\sigma_2",
                "σz", "\\sigma_z", "σ3", "\\sigma_3",
                "iσy", "i\\sigma_y", "iσ2", "i\\sigma_2");
        // Standard
        put(m, "H", "H", "T", "T", "π/8", "T", "Tdag", "T^\\dagger",
                "S", "S", "Phase", "S", "P", "S", "Sdag", "S^\\dagger",
                "√NOT", "\\sqrt{X}");
        // Projectors
        put(m, "Proj0", "P_0", "ProjUp", "P_{\\uparrow}", "projUp", "P_{\\uparrow}",
                "Proj1", "P_1", "ProjDn", "P_{\\downarrow}", "projDn", "P_{\\downarrow}");
        // Rotations without their angles
        put(m, "Rx", "R_x", "Ry", "R_y", "Rz", "R_z", "Rn", "R_n",
                "RX", "R_x", "RY", "R_y", "RZ", "R_z", "Rn̂", "R_n",
                "Rxx", "R_{xx}", "Ryy", "R_{yy}", "Rzz", "R_{zz}",
                "RXX", "R_{xx}", "RYY", "R_{yy}", "RZZ", "R_{zz}");
        // Spin
        put(m, "Sz", "S_z", "Sᶻ", "S_z", "Sx", "S_x", "Sˣ", "S_x",
                "Sy", "S_y", "Sʸ", "S_y", "iSy", "iS_y", "iSʸ", "iS_y",
                "S+", "S_+", "S⁺", "S_+", "Splus", "S_+",
                "S-", "S_-", "S⁻", "S_-", "Sminus", "S_-",
                "S2", "S^2", "S²", "S^2");
        // Controlled kinds show the operator applied to the target
        put(m, "CNOT", "X", "CX", "X", "CY", "Y", "CZ", "Z", "CPHASE", "P", "Cphase", "P");
        // Two-wire
        put(m, "SWAP", "\\times", "Swap", "\\times",
                "√SWAP", "\\sqrt{SWAP}", "√Swap", "\\sqrt{SWAP}",
                "iSWAP", "iSWAP", "iSwap", "iSWAP",
                "√iSWAP", "\\sqrt{iSWAP}", "√iSwap", "\\sqrt{iSWAP}");
        // Three- and four-wire
        put(m, "Toffoli", "\\text{TOF}", "CCNOT", "\\text{TOF}", "CCX", "\\text{TOF}", "TOFF", "\\text{TOF}",
                "Fredkin", "\\text{FRDKN}", "CSWAP", "\\text{CSWAP}", "CSwap", "\\text{CSWAP}", "CS", "\\text{CS}",
                "CCCNOT", "\\text{CCCNOT}");
        SYMBOLS = Map.copyOf(m);

        Map<String, String> p = new HashMap<>();
        put(p, "Rx", "R_x", "RX", "R_x", "Ry", "R_y", "RY", "R_y", "Rz", "R_z", "RZ", "R_z",
                "Rn", "R_n", "Rn̂", "R_n",
                "CRx", "R_x", "CRX", "R_x", "CRy", "R_y", "CRY", "R_y", "CRz", "R_z", "CRZ", "R_z",
                "CRn", "R_n", "CRn̂", "R_n",
                "Rxx", "R_{xx}", "RXX", "R_{xx}", "Ryy", "R_{yy}", "RYY", "R_{yy}", "Rzz", "R_{zz}", "RZZ", "R_{zz}",
                "Phase", "P", "P", "P", "S", "P");
        PARAMETRIC_SYMBOLS = Map.copyOf(p);
    }

    private GateSymbols() {
    }

    private static void put(Map<String, String> map, String... pairs) {
        for (int i = 0; i < pairs.length; i += 2) {
            map.put(pairs[i], pairs[i + 1]);
        }
    }

    /**
     * Display symbol of a gate type, or the raw identifier when the type is unknown.
     */
    public static String symbol(String gateType) {
        String s = SYMBOLS.get(gateType);
        if (s == null) {
            LOG.debug("No symbol for gate type '{}', displaying raw identifier", gateType);
            return gateType;
        }
        return s;
    }

    /**
     * Symbol placed in front of the parameter list of a parametric gate, or the raw
     * identifier when the type is unknown.
     */
    public static String parametricSymbol(String gateType) {
        String s = PARAMETRIC_SYMBOLS.get(gateType);
        if (s == null) {
            LOG.debug("No parametric symbol for gate type '{}', displaying raw identifier", gateType);
            return gateType;
        }
        return s;
    }

    public static boolean isKnown(String gateType) {
        return SYMBOLS.containsKey(gateType) || PARAMETRIC_SYMBOLS.containsKey(gateType);
    }

    /**
     * Target-cell shape for a controlled gate of the given type.
     */
    public static TargetShape targetShape(String gateType) {
        if (GateFamily.isBitFlip(gateType)) return TargetShape.CROSS;
        if (GateFamily.isPhase(gateType)) return TargetShape.DOT;
        return TargetShape.BOX;
    }
}
