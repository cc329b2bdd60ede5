package dev.templatic.match.math.ops;

/**
 * Sum of every element of a matrix, accumulated row by row.
 */
public final class MatrixSum {
    
    public static double compute(double[][] matrix) {
        return compute(matrix, 0.0);
    }
    
    /**
     * Sum all elements, seeding the accumulator with {@code initial}.
     * 
     * @param matrix input matrix
     * @param initial starting value of the sum
     * @return initial plus the sum of all elements
     */
    public static double compute(double[][] matrix, double initial) {
        double sum = initial;
        for (double[] row : matrix) {
            for (double value : row) {
                sum += value;
            }
        }
        return sum;
    }
    
    private MatrixSum() {}
}
