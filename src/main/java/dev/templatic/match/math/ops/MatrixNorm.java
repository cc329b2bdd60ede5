package dev.templatic.match.math.ops;

/**
 * Frobenius norm of a matrix: sqrt of the sum of squared elements.
 * Used as the denominator of the normed matching scores.
 */
public final class MatrixNorm {
    
    /**
     * Compute the Frobenius norm.
     * 
     * @param matrix input matrix
     * @return norm, zero only for an all-zero (or empty) matrix
     */
    public static double compute(double[][] matrix) {
        return Math.sqrt(computeSquared(matrix));
    }
    
    /**
     * Sum of squares, computed as sum(m * m) so the result matches the
     * multiply-then-sum composition exactly.
     */
    public static double computeSquared(double[][] matrix) {
        return MatrixSum.compute(ElementwiseMultiply.compute(matrix, matrix));
    }
    
    private MatrixNorm() {}
}
