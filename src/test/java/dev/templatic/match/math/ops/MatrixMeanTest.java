package dev.templatic.match.math.ops;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

class MatrixMeanTest {
    
    private static final double DELTA = 1e-12;
    
    @Test
    void testMean() {
        double[][] m = {{1.0, 2.0}, {3.0, 6.0}};
        
        assertEquals(3.0, MatrixMean.compute(m), DELTA);
    }
    
    @Test
    void testMeanOfRaggedMatrixUsesElementCount() {
        double[][] m = {{3.0}, {1.0, 2.0}};
        
        assertEquals(2.0, MatrixMean.compute(m), DELTA);
    }
    
    @Test
    void testEmptyMeanIsNaN() {
        assertTrue(Double.isNaN(MatrixMean.compute(new double[0][])));
    }
    
    @Test
    void testCentered() {
        double[][] m = {{1.0, 2.0}, {3.0, 6.0}};
        
        double[][] centered = MatrixMean.computeCentered(m);
        
        assertArrayEquals(new double[]{-2.0, -1.0}, centered[0], DELTA);
        assertArrayEquals(new double[]{0.0, 3.0}, centered[1], DELTA);
        assertEquals(0.0, MatrixSum.compute(centered), DELTA);
    }
    
    @Test
    void testCenteredLeavesInputUntouched() {
        double[][] m = {{1.0, 3.0}};
        
        MatrixMean.computeCentered(m);
        
        assertArrayEquals(new double[]{1.0, 3.0}, m[0]);
    }
    
    @Test
    void testConstantMatrixCentersToZero() {
        double[][] m = {{0.4, 0.4}, {0.4, 0.4}};
        
        double[][] centered = MatrixMean.computeCentered(m);
        
        assertEquals(0.0, MatrixNorm.compute(centered), DELTA);
    }
}
