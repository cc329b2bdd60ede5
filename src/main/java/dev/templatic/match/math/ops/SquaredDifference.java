package dev.templatic.match.math.ops;

/**
 * Sum of squared differences: sum((a[i][j] - b[i][j])^2)
 * 
 * <p>Unlike mean squared error the total is not divided by the element count.
 */
public final class SquaredDifference {
    
    /**
     * @param a first matrix
     * @param b second matrix
     * @return non-negative sum of squared element differences
     * @throws IllegalArgumentException if matrices have different shapes
     */
    public static double compute(double[][] a, double[][] b) {
        MatrixShape.requireSameShape(a, b);
        
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            double[] rowA = a[i];
            double[] rowB = b[i];
            for (int j = 0; j < rowA.length; j++) {
                double diff = rowA[j] - rowB[j];
                sum += diff * diff;
            }
        }
        return sum;
    }
    
    private SquaredDifference() {}
}
