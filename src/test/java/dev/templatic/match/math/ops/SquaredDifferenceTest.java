package dev.templatic.match.math.ops;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

class SquaredDifferenceTest {
    
    private static final double DELTA = 1e-12;
    
    @Test
    void testBasicDifference() {
        double[][] a = {{1.0, 2.0}, {3.0, 4.0}};
        double[][] b = {{0.0, 2.0}, {5.0, 1.0}};
        
        // 1 + 0 + 4 + 9
        assertEquals(14.0, SquaredDifference.compute(a, b), DELTA);
    }
    
    @Test
    void testIdenticalIsZero() {
        double[][] a = {{0.3, 0.7}, {0.1, 0.9}};
        
        assertEquals(0.0, SquaredDifference.compute(a, a));
    }
    
    @Test
    void testSymmetric() {
        double[][] a = {{0.25, 0.5}};
        double[][] b = {{0.75, -0.5}};
        
        assertEquals(SquaredDifference.compute(a, b), SquaredDifference.compute(b, a));
    }
    
    @Test
    void testNotAveraged() {
        double[][] a = {{1.0, 1.0, 1.0, 1.0}};
        double[][] b = {{0.0, 0.0, 0.0, 0.0}};
        
        assertEquals(4.0, SquaredDifference.compute(a, b), DELTA);
    }
    
    @Test
    void testDimensionMismatch() {
        double[][] a = {{1.0, 2.0}};
        double[][] b = {{1.0}, {2.0}};
        
        assertThrows(IllegalArgumentException.class, () -> SquaredDifference.compute(a, b));
    }
}
