package io.synphot.core.spectrum;

import java.math.BigDecimal;
import java.math.MathContext;

/** Number rendering for spectrum tags. */
public final class Formats {

    private static final MathContext SIX_DIGITS = new MathContext(6);

    private Formats() {}

    /** Renders a number the way {@link Double#toString(double)} does: {@code 1} → {@code 1.0}. */
    public static String number(double value) {
        return Double.toString(value);
    }

    /**
     * Compact rendering with six significant digits and no trailing zeros: {@code 5000.0} →
     * {@code 5000}, {@code 0.5} → {@code 0.5}, {@code 1.0e7} → {@code 1e+07}.
     */
    public static String compact(double value) {
        if (value == 0.0) {
            return "0";
        }
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return Double.toString(value);
        }
        BigDecimal rounded = new BigDecimal(value).round(SIX_DIGITS).stripTrailingZeros();
        int exponent = rounded.precision() - rounded.scale() - 1;
        if (exponent >= -4 && exponent < 6) {
            return rounded.toPlainString();
        }
        BigDecimal mantissa = rounded.movePointLeft(exponent).stripTrailingZeros();
        return String.format("%se%s%02d", mantissa.toPlainString(), exponent < 0 ? "-" : "+", Math.abs(exponent));
    }
}
