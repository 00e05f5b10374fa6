package semisup.core;

import static org.junit.Assert.*;

import org.junit.Test;

public class ConfidenceMethodTest {

    private static final double DELTA = 1e-4;

    @Test
    public void testBernoulliIsClipped() {
        double[] interval = ConfidenceMethod.BERNOULLI.interval(8, 10, 0.95);
        assertEquals(0.55208, interval[0], DELTA);
        assertEquals(1.0, interval[1], 0.0);
    }

    @Test
    public void testWilson() {
        double[] interval = ConfidenceMethod.WILSON.interval(8, 10, 0.95);
        assertEquals(0.49016, interval[0], DELTA);
        assertEquals(0.94332, interval[1], DELTA);
    }

    @Test
    public void testAgrestiCoull() {
        double[] interval = ConfidenceMethod.AGRESTI_COULL.interval(8, 10, 0.95);
        assertEquals(0.47937, interval[0], DELTA);
        assertEquals(0.95411, interval[1], DELTA);
    }

    @Test
    public void testClopperPearsonEdges() {
        double[] all = ConfidenceMethod.BETA.interval(10, 10, 0.95);
        assertEquals(0.69150, all[0], DELTA);
        assertEquals(1.0, all[1], 0.0);

        double[] none = ConfidenceMethod.BETA.interval(0, 10, 0.95);
        assertEquals(0.0, none[0], 0.0);
        assertEquals(0.30850, none[1], DELTA);
    }

    @Test
    public void testJeffreysContainsEstimate() {
        double[] interval = ConfidenceMethod.JEFFREYS.interval(8, 10, 0.95);
        assertTrue(interval[0] < 0.8 && 0.8 < interval[1]);
        assertTrue(interval[0] > 0.0 && interval[1] < 1.0);
    }

    @Test
    public void testNoTrials() {
        for (ConfidenceMethod method : ConfidenceMethod.values()) {
            assertArrayEquals(method.name(), new double[]{0.0, 1.0}, method.interval(0, 0, 0.95), 0.0);
        }
    }

    @Test
    public void testWeightIsMidpoint() {
        MockLearners.Constant constant = new MockLearners.Constant(1);
        double[][] X = {{0}, {1}, {2}, {3}};
        int[] y = {1, 1, 1, 0};
        constant.fit(X, y);
        double[] interval = ConfidenceMethod.WILSON.interval(constant, X, y, 0.95);
        assertArrayEquals(ConfidenceMethod.WILSON.interval(3, 4, 0.95), interval, 0.0);
        assertEquals((interval[0] + interval[1]) / 2, ConfidenceMethod.WILSON.weight(constant, X, y, 0.95), 1e-12);
    }

    @Test
    public void testFromName() {
        assertEquals(ConfidenceMethod.AGRESTI_COULL, ConfidenceMethod.fromName("agresti_coull"));
        assertEquals(ConfidenceMethod.BERNOULLI, ConfidenceMethod.fromName("bernoulli"));
    }
}
