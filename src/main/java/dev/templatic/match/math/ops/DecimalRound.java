package dev.templatic.match.math.ops;

import dev.templatic.match.math.PrecisionRoundingRule;

import java.util.Objects;

/**
 * Decimal rounding to a fixed number of fractional digits.
 * Halves round away from zero, so 2.5 becomes 3 and -2.5 becomes -3.
 */
public final class DecimalRound {
    
    private static final double[] POWERS_OF_TEN = {1.0, 10.0, 100.0, 1000.0, 10000.0, 100000.0, 1000000.0};
    
    /**
     * Round {@code value} to the number of digits selected by {@code rule}.
     * 
     * @param value value to round, NaN and infinities are returned unchanged
     * @param rule precision tier
     * @return rounded value
     */
    public static double compute(double value, PrecisionRoundingRule rule) {
        Objects.requireNonNull(rule, "rule");
        
        if (rule == PrecisionRoundingRule.ZEROS)
            return roundHalfAwayFromZero(value);
        
        double scale = POWERS_OF_TEN[rule.getDigits()];
        return roundHalfAwayFromZero(value * scale) / scale;
    }
    
    /**
     * Round to the nearest integer, ties away from zero.
     * {@link Math#round(double)} rounds ties towards positive infinity and
     * {@link Math#rint(double)} to even, so neither fits.
     */
    static double roundHalfAwayFromZero(double value) {
        double magnitude = Math.abs(value);
        double whole = Math.floor(magnitude);
        // exact for doubles: whole and magnitude share an exponent or whole is 0
        if (magnitude - whole >= 0.5)
            whole += 1.0;
        return Math.copySign(whole, value);
    }
    
    private DecimalRound() {}
}
