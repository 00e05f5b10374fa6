package semisup.core;

import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.apache.commons.math3.random.MersenneTwister;
import org.junit.Test;

public class LearnerPoolTest {

    private static final double[][] X = {{0, 0}, {0, 1}, {5, 5}, {5, 6}};
    private static final int[] Y = {0, 0, 1, 1};

    @Test
    public void testClonesAreIndependentAndSeededInOrder() {
        MockLearners.Seeded prototype = new MockLearners.Seeded();
        LearnerPool pool = LearnerPool.ofClones(prototype, 3, new MersenneTwister(7));

        MersenneTwister expected = new MersenneTwister(7);
        for (int i = 0; i < pool.size(); ++i) {
            assertNotSame(prototype, pool.get(i));
            assertEquals(Integer.valueOf(expected.nextInt()), ((MockLearners.Seeded) pool.get(i)).getSeed());
        }
        assertNull(prototype.getSeed());
        assertNotSame(pool.get(0), pool.get(1));
    }

    @Test
    public void testSameSeedSamePool() {
        LearnerPool first = LearnerPool.ofClones(new MockLearners.Seeded(), 4, new MersenneTwister(3));
        LearnerPool second = LearnerPool.ofClones(new MockLearners.Seeded(), 4, new MersenneTwister(3));
        for (int i = 0; i < 4; ++i) {
            assertEquals(((MockLearners.Seeded) first.get(i)).getSeed(), ((MockLearners.Seeded) second.get(i)).getSeed());
        }
    }

    @Test
    public void testOfCopiesEachClassifier() {
        List<MockLearners.Constant> learners = Arrays.asList(new MockLearners.Constant(0), new MockLearners.Constant(1));
        LearnerPool pool = LearnerPool.of(learners);
        assertEquals(2, pool.size());
        assertNotSame(learners.get(0), pool.get(0));
        pool.fitAll(X, Y, 1);
        assertArrayEquals(new int[]{1, 1}, pool.get(1).predict(new double[][]{{0, 0}, {5, 5}}));
        assertFalse(learners.get(1).isFitted());
    }

    @Test(expected = UnsupportedOperationException.class)
    public void testLearnersAreUnmodifiable() {
        LearnerPool pool = LearnerPool.of(Arrays.asList(new MockLearners.Constant(0)));
        pool.getLearners().clear();
    }

    @Test
    public void testParallelFitMatchesSequential() {
        LearnerPool sequential = LearnerPool.ofClones(new MockLearners.NearestCentroid(), 4, new MersenneTwister(1));
        LearnerPool parallel = LearnerPool.ofClones(new MockLearners.NearestCentroid(), 4, new MersenneTwister(1));
        sequential.fitAll(X, Y, 1);
        parallel.fitAll(X, Y, 4);
        parallel.close();
        assertFalse(sequential.hasRunningExecutor());

        double[][] probe = {{1, 1}, {4, 4}};
        for (int i = 0; i < 4; ++i) {
            double[][] expected = sequential.get(i).predictProba(probe);
            double[][] actual = parallel.get(i).predictProba(probe);
            for (int r = 0; r < probe.length; ++r) {
                assertArrayEquals(expected[r], actual[r], 0.0);
            }
        }
    }

    @Test
    public void testNullSlotsAreSkipped() {
        LearnerPool pool = LearnerPool.ofClones(new MockLearners.NearestCentroid(), 3, new MersenneTwister(1));
        List<double[][]> data = new ArrayList<>(Arrays.asList(X, null, X));
        List<int[]> labels = new ArrayList<>(Arrays.asList(Y, null, Y));
        pool.fitAll(data, labels, -1);
        pool.close();

        assertTrue(pool.get(0).isFitted());
        assertFalse(pool.get(1).isFitted());
        assertEquals(1, ((MockLearners.NearestCentroid) pool.get(2)).getFitCount());
    }

    @Test
    public void testFailingFitIsReported() {
        try (LearnerPool pool = LearnerPool.ofClones(new MockLearners.Failing(), 2, new MersenneTwister(1))) {
            pool.fitAll(X, Y, 2);
            fail("expected the failure of the worker to be reported");
        } catch (IllegalStateException e) {
            assertTrue(e.getCause() instanceof IllegalArgumentException);
        }
    }

    @Test
    public void testThreadsAreReusedUntilClosed() {
        Set<String> threads = ConcurrentHashMap.newKeySet();
        List<ThreadRecording> learners = Arrays.asList(new ThreadRecording(threads), new ThreadRecording(threads));
        LearnerPool pool = LearnerPool.of(learners);
        assertFalse(pool.hasRunningExecutor());
        for (int round = 0; round < 5; ++round) {
            pool.fitAll(X, Y, 2);
            assertTrue(pool.hasRunningExecutor());
        }
        assertEquals(5, ((ThreadRecording) pool.get(0)).getFitCount());
        assertTrue(threads.size() <= 2);
        assertFalse(threads.contains(Thread.currentThread().getName()));

        pool.close();
        assertFalse(pool.hasRunningExecutor());
        assertTrue(pool.get(1).isFitted());
        pool.fitAll(X, Y, 2);
        assertTrue(pool.hasRunningExecutor());
        pool.close();
    }

    /** Records the name of the thread each fit runs on. */
    private static class ThreadRecording extends MockLearners.NearestCentroid {

        private static final long serialVersionUID = 1L;

        private final transient Set<String> threads;

        ThreadRecording(Set<String> threads) {
            this.threads = threads;
        }

        @Override
        public MockLearners.NearestCentroid fit(double[][] X, int[] y) {
            this.threads.add(Thread.currentThread().getName());
            return super.fit(X, y);
        }

        @Override
        public ThreadRecording copy() {
            return new ThreadRecording(this.threads);
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testFailingFitOnCallingThread() {
        LearnerPool pool = LearnerPool.ofClones(new MockLearners.Failing(), 2, new MersenneTwister(1));
        pool.fitAll(X, Y, 1);
    }
}
