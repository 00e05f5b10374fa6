package semisup.classifiers.semisupervised;

import static org.junit.Assert.*;

import java.util.List;

import org.junit.Test;

import semisup.core.IterationEvent;
import semisup.core.ListIterationTrace;
import semisup.core.MockLearners;
import semisup.core.Statistics;

public class CoForestTest {

    // duplicated labelled points sit exactly on the centroids, so the members start error free
    private static final double[][] X = {
            {0, 0}, {0, 0}, {10, 10}, {10, 10},
            {1, 0}, {0, 1}, {1, 1}, {-1, 0},
            {9, 10}, {10, 9}, {11, 10}, {9, 9}};
    private static final int[] Y = {0, 0, 1, 1, -1, -1, -1, -1, -1, -1, -1, -1};
    private static final int[] TRUTH = {0, 0, 1, 1, 0, 0, 0, 0, 1, 1, 1, 1};

    private static CoForest coForest() {
        CoForest coForest = new CoForest();
        coForest.baseLearnerOption.setCurrentObject(new MockLearners.Seeded());
        coForest.ensembleSizeOption.setValue(3);
        return coForest;
    }

    @Test
    public void testConfidentPseudoLabels() {
        ListIterationTrace trace = new ListIterationTrace();
        CoForest coForest = coForest();
        coForest.fit(X, Y, trace);

        assertArrayEquals(TRUTH, coForest.getTransduction());
        assertArrayEquals(TRUTH, coForest.predict(X));
        List<IterationEvent> rounds = trace.getEvents(IterationEvent.Kind.ITERATION);
        assertEquals(2, rounds.size());
        assertEquals(24, rounds.get(0).getAccepted());
        assertEquals(0, rounds.get(1).getAccepted());
        assertEquals(6, trace.getEvents(IterationEvent.Kind.LEARNER_UPDATE).size());
    }

    @Test
    public void testMembersAreSeededDifferently() {
        CoForest coForest = coForest();
        coForest.fit(X, Y);
        assertEquals(3, coForest.getHypotheses().size());
        Integer first = ((MockLearners.Seeded) coForest.getHypotheses().get(0)).getSeed();
        Integer second = ((MockLearners.Seeded) coForest.getHypotheses().get(1)).getSeed();
        assertNotNull(first);
        assertNotEquals(first, second);
    }

    @Test
    public void testUnreachableThreshold() {
        ListIterationTrace trace = new ListIterationTrace();
        CoForest coForest = coForest();
        coForest.thresholdOption.setValue(1.0);
        coForest.fit(X, Y, trace);

        assertArrayEquals(Y, coForest.getTransduction());
        for (IterationEvent event : trace.getEvents(IterationEvent.Kind.ITERATION)) {
            assertEquals(0, event.getAccepted());
        }
    }

    @Test
    public void testMaxIterations() {
        ListIterationTrace trace = new ListIterationTrace();
        CoForest coForest = coForest();
        coForest.maxIterationsOption.setValue(1);
        coForest.fit(X, Y, trace);
        assertEquals(1, trace.getEvents(IterationEvent.Kind.ITERATION).size());
    }

    @Test
    public void testEstimateError() {
        double[][] features = {{0}, {1}, {2}, {3}};
        int[] labels = {0, 0, 1, 1};
        MockLearners.Constant constant = new MockLearners.Constant(0);
        constant.fit(features, labels);
        assertEquals(2.0, CoForest.estimateError(constant, features, labels), 0.0);
        assertEquals(Statistics.EPSILON, CoForest.estimateError(constant, features, new int[]{0, 0, 0, 0}), 0.0);
    }
}
