package com.ethnicthv.qcircuit.core.label;

import java.math.BigDecimal;

/**
 * Turns a rotation angle into compact text relative to a reference constant (π by default).
 * <p>
 * Order of attempts:
 * <ol>
 *   <li>integer multiple of the constant: {@code 0}, {@code \pi}, {@code -\pi}, {@code 2\pi}</li>
 *   <li>rational multiple with denominator 2..16: {@code \pi/2}, {@code -\pi/4}, {@code 3\pi/4}</li>
 *   <li>plain decimal rounded to 3 fractional digits: {@code 1.235}, {@code 0.0}, {@code 15000000}</li>
 * </ol>
 * The method is total: every double, NaN and infinities included, produces a string.
 * Instances are immutable.
 */
public final class ParameterFormatter {

    public static final ParameterFormatter PI = new ParameterFormatter(Math.PI, "\\pi");

    static final double TOLERANCE = 1e-6;
    static final int MAX_DENOMINATOR = 16;
    // Largest magnitude below which every integer is exactly representable as a double
    static final double EXACT_INTEGER_LIMIT = 0x1p53;

    private final double reference;
    private final String symbol;

    public ParameterFormatter(double reference, String symbol) {
        if (!(reference > 0) || Double.isInfinite(reference)) {
            throw new IllegalArgumentException("reference constant must be positive and finite, got " + reference);
        }
        if (symbol == null || symbol.isEmpty()) {
            throw new IllegalArgumentException("symbol must not be empty");
        }
        this.reference = reference;
        this.symbol = symbol;
    }

    public String format(double theta) {
        double ratio = theta / reference;
        double whole = Math.rint(ratio);
        if (Math.abs(whole) < EXACT_INTEGER_LIMIT && Math.abs(ratio - whole) < TOLERANCE) {
            long k = (long) whole;
            if (k == 0) return "0";
            if (k == 1) return symbol;
            if (k == -1) return "-" + symbol;
            return k + symbol;
        }

        for (int n = 2; n <= MAX_DENOMINATOR; n++) {
            double scaled = theta * n;
            double num = Math.rint(scaled / reference);
            if (Math.abs(num) < EXACT_INTEGER_LIMIT && Math.abs(scaled - reference * num) < TOLERANCE) {
                long k = (long) num;
                if (k == 1) return symbol + "/" + n;
                if (k == -1) return "-" + symbol + "/" + n;
                return k + symbol + "/" + n;
            }
        }

        return decimal(theta);
    }

    /**
     * Plain positional decimal with at most 3 fractional digits, never in exponent form.
     */
    private static String decimal(double theta) {
        if (!Double.isFinite(theta)) {
            return Double.toString(theta);
        }
        double rounded = Math.abs(theta) < EXACT_INTEGER_LIMIT ? Math.rint(theta * 1000.0) / 1000.0 : theta;
        return BigDecimal.valueOf(rounded).toPlainString();
    }
}
