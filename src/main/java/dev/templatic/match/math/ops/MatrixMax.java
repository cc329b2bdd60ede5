package dev.templatic.match.math.ops;

/**
 * Maximum element of a matrix.
 */
public final class MatrixMax {
    
    /**
     * @param matrix input matrix
     * @return largest element, or 0 when the matrix holds no elements
     */
    public static double compute(double[][] matrix) {
        boolean seen = false;
        double max = 0.0;
        for (double[] row : matrix) {
            for (double value : row) {
                if (!seen || value > max) {
                    max = value;
                    seen = true;
                }
            }
        }
        return max;
    }
    
    private MatrixMax() {}
}
