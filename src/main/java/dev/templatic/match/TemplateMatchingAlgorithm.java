package dev.templatic.match;

/**
 * The template matching scores offered by {@link TemplateMatching}, each with
 * a human-readable label.
 * 
 * <p>This is a naming aid for reports and UIs. It carries no behavior: call
 * the scoring methods on {@link TemplateMatching} directly.
 * 
 * <p>Score direction differs between the variants. For the two squared
 * difference scores lower means more similar (0 is a perfect match); for the
 * other four higher means more similar.
 */
public enum TemplateMatchingAlgorithm {
    
    /** Sum of squared element differences. Lower is better. */
    SQDIFF("Squared Difference", true),
    
    /** Squared difference divided by the product of both norms. Lower is better. */
    SQDIFF_NORMED("Normed Squared Difference", true),
    
    /** Sum of element-wise products. Higher is better, unbounded. */
    CCORR("Cross Correlation", false),
    
    /** Cross correlation divided by the product of both norms, in [-1, 1]. */
    CCORR_NORMED("Normed Cross Correlation", false),
    
    /** Cross correlation of the mean-centered operands. Higher is better, unbounded. */
    CCOEFF("Correlation Coefficient", false),
    
    /** Correlation coefficient divided by the norms of the mean-centered operands, in [-1, 1]. */
    CCOEFF_NORMED("Normed Correlation Coefficient", false);
    
    private final String label;
    private final boolean lowerIsBetter;
    
    TemplateMatchingAlgorithm(String label, boolean lowerIsBetter) {
        this.label = label;
        this.lowerIsBetter = lowerIsBetter;
    }
    
    public String getLabel() {
        return label;
    }
    
    /**
     * @return true if a smaller score means a closer match
     */
    public boolean isLowerBetter() {
        return lowerIsBetter;
    }
    
    /**
     * Find the algorithm carrying the given label.
     * 
     * @throws IllegalArgumentException if no algorithm uses that label
     */
    public static TemplateMatchingAlgorithm fromLabel(String label) {
        for (TemplateMatchingAlgorithm algorithm : values()) {
            if (algorithm.label.equals(label)) return algorithm;
        }
        throw new IllegalArgumentException("Unknown template matching algorithm: " + label);
    }
    
    @Override
    public String toString() {
        return label;
    }
}
