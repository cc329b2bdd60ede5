package dev.templatic.match.math;

/**
 * Precision tiers for {@link MatchMath#roundDecimal(double, PrecisionRoundingRule)}.
 * 
 * <p>Each tier keeps a fixed number of fractional digits, from none
 * ({@link #ZEROS}) to six ({@link #SIXES}). Rounding is for presentation
 * of scores only; it never touches matrix data.
 */
public enum PrecisionRoundingRule {
    
    ZEROS(0),
    ONES(1),
    TWOS(2),
    THREES(3),
    FOURS(4),
    FIVES(5),
    SIXES(6);
    
    private final int digits;
    
    PrecisionRoundingRule(int digits) {
        this.digits = digits;
    }
    
    /**
     * @return number of decimal digits kept after rounding
     */
    public int getDigits() {
        return digits;
    }
    
    /**
     * Look up the tier that keeps {@code digits} fractional digits.
     * 
     * @param digits number of digits, 0 to 6
     * @throws IllegalArgumentException if no tier keeps that many digits
     */
    public static PrecisionRoundingRule fromDigits(int digits) {
        for (PrecisionRoundingRule rule : values()) {
            if (rule.digits == digits) return rule;
        }
        throw new IllegalArgumentException("Precision must be between 0 and 6 digits: " + digits);
    }
}
