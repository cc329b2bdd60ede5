package dev.templatic.match.math;

import dev.templatic.match.math.ops.*;

/**
 * Central entry point for the matrix primitives behind template matching.
 * Methods are prefixed by operation type for intuitive autocomplete.
 * 
 * <p>Matrices are {@code double[][]} in row-major form. Every method here
 * returns a new matrix or a scalar and leaves its arguments untouched,
 * except {@link #autoNormalizeInPlace(double[][])} which exists to mutate.
 */
public final class MatchMath {
    
    // ========== ELEMENT-WISE OPERATIONS ==========
    
    /**
     * Element-wise multiplication: result[i][j] = a[i][j] * b[i][j]
     * 
     * @throws IllegalArgumentException if the shapes differ
     */
    public static double[][] multiplyElementwise(double[][] a, double[][] b) {
        return ElementwiseMultiply.compute(a, b);
    }
    
    /**
     * Sum of squared differences: sum((a[i][j] - b[i][j])^2)
     * 
     * @throws IllegalArgumentException if the shapes differ
     */
    public static double squaredDifference(double[][] a, double[][] b) {
        return SquaredDifference.compute(a, b);
    }
    
    // ========== REDUCTIONS ==========
    
    /**
     * Sum of all elements.
     */
    public static double sumAll(double[][] matrix) {
        return MatrixSum.compute(matrix);
    }
    
    /**
     * Sum of all elements, seeded with {@code initial}.
     */
    public static double sumAll(double[][] matrix, double initial) {
        return MatrixSum.compute(matrix, initial);
    }
    
    /**
     * Frobenius norm: sqrt(sumAll(m * m))
     */
    public static double norm(double[][] matrix) {
        return MatrixNorm.compute(matrix);
    }
    
    /**
     * Largest element, 0 for a matrix without elements.
     */
    public static double maxValue(double[][] matrix) {
        return MatrixMax.compute(matrix);
    }
    
    /**
     * Mean of all elements.
     */
    public static double mean(double[][] matrix) {
        return MatrixMean.compute(matrix);
    }
    
    // ========== TRANSFORMS ==========
    
    /**
     * New matrix with the mean subtracted from every element.
     */
    public static double[][] meanCentered(double[][] matrix) {
        return MatrixMean.computeCentered(matrix);
    }
    
    /**
     * New matrix with every element divided by 255.
     */
    public static double[][] rescaleTo01(double[][] matrix) {
        return IntensityScale.compute(matrix);
    }
    
    /**
     * Auto-normalization without side effects: a rescaled copy when the
     * maximum exceeds 1.0, otherwise a plain copy.
     */
    public static double[][] autoNormalized(double[][] matrix) {
        return IntensityScale.needsNormalization(matrix) ? IntensityScale.compute(matrix) : copyOf(matrix);
    }
    
    /**
     * Auto-normalization in place, as applied by the scoring functions.
     * 
     * @return true if the matrix was rescaled
     */
    public static boolean autoNormalizeInPlace(double[][] matrix) {
        return IntensityScale.autoNormalizeInPlace(matrix);
    }
    
    /**
     * Deep copy, for callers that must keep their data away from the
     * in-place normalization done while scoring.
     */
    public static double[][] copyOf(double[][] matrix) {
        double[][] copy = new double[matrix.length][];
        for (int i = 0; i < matrix.length; i++) {
            copy[i] = matrix[i].clone();
        }
        return copy;
    }
    
    // ========== ROUNDING ==========
    
    /**
     * Round to the nearest integer, halves away from zero.
     */
    public static double roundDecimal(double value) {
        return DecimalRound.compute(value, PrecisionRoundingRule.ZEROS);
    }
    
    /**
     * Round to the number of digits {@code precision} selects, halves away from zero.
     */
    public static double roundDecimal(double value, PrecisionRoundingRule precision) {
        return DecimalRound.compute(value, precision);
    }
    
    private MatchMath() {}
}
