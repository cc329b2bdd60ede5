package dev.templatic.match.math.ops;

import java.util.Objects;

/**
 * Shape checks shared by the two-operand matrix operations.
 */
public final class MatrixShape {
    
    /**
     * Check that both matrices have the same number of rows and that every row
     * pair has the same length.
     * 
     * @param a first matrix
     * @param b second matrix
     * @throws IllegalArgumentException if the shapes differ
     */
    public static void requireSameShape(double[][] a, double[][] b) {
        Objects.requireNonNull(a, "a");
        Objects.requireNonNull(b, "b");
        
        if (!sameShape(a, b))
            throw new IllegalArgumentException("Search space and template must have same size: searchSpace=" +
                                             describe(a) + ", template=" + describe(b));
    }
    
    public static boolean sameShape(double[][] a, double[][] b) {
        if (a.length != b.length) return false;
        
        for (int i = 0; i < a.length; i++) {
            if (a[i].length != b[i].length) return false;
        }
        return true;
    }
    
    /**
     * Total number of elements across all rows.
     */
    public static int elementCount(double[][] matrix) {
        int count = 0;
        for (double[] row : matrix) {
            count += row.length;
        }
        return count;
    }
    
    /**
     * Render a shape as "rows x cols", or the per-row lengths for ragged input.
     */
    static String describe(double[][] matrix) {
        if (matrix.length == 0) return "0x0";
        
        int cols = matrix[0].length;
        for (double[] row : matrix) {
            if (row.length != cols) {
                StringBuilder sb = new StringBuilder().append(matrix.length).append("x[");
                for (int i = 0; i < matrix.length; i++) {
                    if (i > 0) sb.append(',');
                    sb.append(matrix[i].length);
                }
                return sb.append(']').toString();
            }
        }
        return matrix.length + "x" + cols;
    }
    
    private MatrixShape() {}
}
