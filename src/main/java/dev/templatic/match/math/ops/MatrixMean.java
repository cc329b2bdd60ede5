package dev.templatic.match.math.ops;

/**
 * Matrix mean and mean-centering: output[i][j] = matrix[i][j] - mean(matrix)
 */
public final class MatrixMean {
    
    /**
     * Arithmetic mean over all elements.
     * An empty matrix yields NaN (0 / 0).
     */
    public static double compute(double[][] matrix) {
        return MatrixSum.compute(matrix) / MatrixShape.elementCount(matrix);
    }
    
    /**
     * Subtract the matrix mean from every element.
     * 
     * @param matrix input matrix, left untouched
     * @return new mean-centered matrix of the same shape
     */
    public static double[][] computeCentered(double[][] matrix) {
        double mean = compute(matrix);
        
        double[][] output = new double[matrix.length][];
        for (int i = 0; i < matrix.length; i++) {
            double[] row = matrix[i];
            double[] out = new double[row.length];
            for (int j = 0; j < row.length; j++) {
                out[j] = row[j] - mean;
            }
            output[i] = out;
        }
        return output;
    }
    
    private MatrixMean() {}
}
