package semisup.core;

import static org.junit.Assert.*;

import org.apache.commons.math3.random.MersenneTwister;
import org.junit.Test;

public class MutualInformationTest {

    @Test
    public void testInformativeFeatureScoresHigher() {
        MersenneTwister random = new MersenneTwister(11);
        int n = 200;
        double[][] X = new double[n][2];
        int[] y = new int[n];
        for (int i = 0; i < n; ++i) {
            y[i] = i % 2;
            X[i][0] = y[i] * 4 + random.nextGaussian();
            X[i][1] = random.nextGaussian();
        }
        double[] relevance = MutualInformation.relevance(X, y, 3, new MersenneTwister(1));
        assertEquals(2, relevance.length);
        assertTrue(relevance[0] > relevance[1]);
        assertTrue(relevance[0] > 0.3);
        assertTrue(relevance[1] >= 0.0);
    }

    @Test
    public void testSingletonClassesAreIgnored() {
        double[] x = {0.0, 1.0, 2.0};
        assertEquals(0.0, MutualInformation.estimate(x, new int[]{0, 1, 2}, 3), 0.0);
    }

    @Test
    public void testSeededNoiseIsReproducible() {
        double[][] X = {{1, 1}, {1, 2}, {2, 1}, {2, 2}, {1, 1}, {2, 2}};
        int[] y = {0, 0, 1, 1, 0, 1};
        assertArrayEquals(MutualInformation.relevance(X, y, 3, new MersenneTwister(5)),
                MutualInformation.relevance(X, y, 3, new MersenneTwister(5)), 0.0);
    }
}
