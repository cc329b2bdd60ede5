package dev.templatic.match.math.ops;

/**
 * Rescales 8-bit intensity data into [0, 1]: output[i][j] = input[i][j] / 255
 */
public final class IntensityScale {
    
    /** Divisor applied when rescaling, the span of 8-bit intensities. */
    public static final double INTENSITY_RANGE = 255.0;
    
    /** A matrix whose maximum exceeds this value is treated as 8-bit data. */
    public static final double AUTO_NORMALIZE_THRESHOLD = 1.0;
    
    /**
     * Rescale into a new matrix.
     * 
     * @param input matrix with values in the 8-bit range
     * @return new matrix with every element divided by 255
     */
    public static double[][] compute(double[][] input) {
        double[][] output = new double[input.length][];
        for (int i = 0; i < input.length; i++) {
            double[] row = input[i];
            double[] out = new double[row.length];
            for (int j = 0; j < row.length; j++) {
                out[j] = row[j] / INTENSITY_RANGE;
            }
            output[i] = out;
        }
        return output;
    }
    
    /**
     * Rescale in-place: matrix[i][j] = matrix[i][j] / 255
     */
    public static void computeInPlace(double[][] matrix) {
        for (double[] row : matrix) {
            for (int j = 0; j < row.length; j++) {
                row[j] = row[j] / INTENSITY_RANGE;
            }
        }
    }
    
    /**
     * Whether the auto-normalization heuristic would rescale this matrix.
     */
    public static boolean needsNormalization(double[][] matrix) {
        return MatrixMax.compute(matrix) > AUTO_NORMALIZE_THRESHOLD;
    }
    
    /**
     * Apply the auto-normalization heuristic in place: when the maximum
     * element exceeds 1.0 the whole matrix is divided by 255.
     * 
     * @param matrix matrix to inspect and possibly rescale
     * @return true if the matrix was rescaled
     */
    public static boolean autoNormalizeInPlace(double[][] matrix) {
        if (!needsNormalization(matrix)) return false;
        
        computeInPlace(matrix);
        return true;
    }
    
    private IntensityScale() {}
}
