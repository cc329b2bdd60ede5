package dev.templatic.match.math.ops;

/**
 * Element-wise multiplication: output[i][j] = a[i][j] * b[i][j]
 */
public final class ElementwiseMultiply {
    
    /**
     * Compute the element-wise product of two matrices into a new matrix.
     * 
     * @param a first input matrix
     * @param b second input matrix
     * @return newly allocated product matrix
     * @throws IllegalArgumentException if matrices have different shapes
     */
    public static double[][] compute(double[][] a, double[][] b) {
        MatrixShape.requireSameShape(a, b);
        
        double[][] output = new double[a.length][];
        for (int i = 0; i < a.length; i++) {
            output[i] = new double[a[i].length];
            compute(a[i], b[i], output[i]);
        }
        return output;
    }
    
    /**
     * Row kernel: output[j] = a[j] * b[j]
     */
    static void compute(double[] a, double[] b, double[] output) {
        for (int j = 0; j < a.length; j++) {
            output[j] = a[j] * b[j];
        }
    }
    
    private ElementwiseMultiply() {}
}
