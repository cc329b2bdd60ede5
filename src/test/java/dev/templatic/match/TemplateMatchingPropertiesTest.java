package dev.templatic.match;

import dev.templatic.match.math.MatchMath;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Randomized checks of the relations every score must satisfy.
 */
class TemplateMatchingPropertiesTest {
    
    private static final double DELTA = 1e-9;
    private static final int ITERATIONS = 200;
    
    private static double[][] randomMatrix(Random random, int rows, int cols, double min, double max) {
        double[][] m = new double[rows][cols];
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < cols; j++) {
                m[i][j] = min + random.nextDouble() * (max - min);
            }
        }
        return m;
    }
    
    @Test
    void testSelfCrossCorrelationIsOne() {
        Random random = new Random(42);
        for (int n = 0; n < ITERATIONS; n++) {
            int rows = 1 + random.nextInt(8);
            int cols = 1 + random.nextInt(8);
            double max = n % 2 == 0 ? 1.0 : 255.0;
            double[][] a = randomMatrix(random, rows, cols, 0.01, max);
            
            double score = TemplateMatching.normedCrossCorrelation(a, MatchMath.copyOf(a));
            
            assertEquals(1.0, score, DELTA, "iteration " + n);
        }
    }
    
    @Test
    void testSelfSqDiffIsZero() {
        Random random = new Random(7);
        for (int n = 0; n < ITERATIONS; n++) {
            double[][] a = randomMatrix(random, 1 + random.nextInt(8), 1 + random.nextInt(8), -1.0, 255.0);
            
            assertEquals(0.0, TemplateMatching.sqDiff(a, MatchMath.copyOf(a)), "iteration " + n);
        }
    }
    
    @Test
    void testNormedScoresBounded() {
        Random random = new Random(1234);
        for (int n = 0; n < ITERATIONS; n++) {
            int rows = 2 + random.nextInt(6);
            int cols = 2 + random.nextInt(6);
            double[][] a = randomMatrix(random, rows, cols, -1.0, 1.0);
            double[][] b = randomMatrix(random, rows, cols, -1.0, 1.0);
            
            double ccorr = TemplateMatching.normedCrossCorrelation(MatchMath.copyOf(a), MatchMath.copyOf(b));
            double ccoeff = TemplateMatching.normedCorrCoef(MatchMath.copyOf(a), MatchMath.copyOf(b));
            
            assertTrue(ccorr >= -1.0 - DELTA && ccorr <= 1.0 + DELTA, "normedCrossCorrelation=" + ccorr);
            assertTrue(ccoeff >= -1.0 - DELTA && ccoeff <= 1.0 + DELTA, "normedCorrCoef=" + ccoeff);
        }
    }
    
    @Test
    void testSqDiffSymmetric() {
        Random random = new Random(99);
        for (int n = 0; n < ITERATIONS; n++) {
            int rows = 1 + random.nextInt(8);
            int cols = 1 + random.nextInt(8);
            double[][] a = randomMatrix(random, rows, cols, 0.0, 255.0);
            double[][] b = randomMatrix(random, rows, cols, 0.0, 1.0);
            
            double forward = TemplateMatching.sqDiff(MatchMath.copyOf(a), MatchMath.copyOf(b));
            double backward = TemplateMatching.sqDiff(MatchMath.copyOf(b), MatchMath.copyOf(a));
            
            assertEquals(forward, backward, "iteration " + n);
            assertTrue(forward >= 0.0);
        }
    }
    
    @Test
    void testNormedSqDiffNonNegative() {
        Random random = new Random(5);
        for (int n = 0; n < ITERATIONS; n++) {
            int rows = 1 + random.nextInt(8);
            int cols = 1 + random.nextInt(8);
            double[][] a = randomMatrix(random, rows, cols, 0.01, 255.0);
            double[][] b = randomMatrix(random, rows, cols, 0.01, 255.0);
            
            assertTrue(TemplateMatching.normedSqDiff(a, b) >= 0.0);
        }
    }
}
