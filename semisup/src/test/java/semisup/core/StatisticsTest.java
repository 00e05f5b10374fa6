package semisup.core;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.SortedMap;

import org.junit.Test;

public class StatisticsTest {

    @Test
    public void testSafeDivision() {
        assertEquals(0.5, Statistics.safeDivision(1, 2, Statistics.EPSILON), 0.0);
        assertEquals(0.0, Statistics.safeDivision(0, 0, Statistics.EPSILON), 0.0);
        assertEquals(3 / Statistics.EPSILON, Statistics.safeDivision(3, 0, Statistics.EPSILON), 0.0);
    }

    @Test
    public void testPriorProbability() {
        SortedMap<Integer, Double> prior = Statistics.priorProbability(new int[]{2, 0, 2, 2});
        assertEquals(Arrays.asList(0, 2), Arrays.asList(prior.keySet().toArray()));
        assertEquals(0.25, prior.get(0), 1e-12);
        assertEquals(0.75, prior.get(2), 1e-12);
    }

    @Test
    public void testTopIndices() {
        double[] values = {0.3, 0.9, 0.1, 0.7};
        assertArrayEquals(new int[]{3, 1}, Statistics.topIndices(values, 2));
        assertArrayEquals(new int[]{2, 0, 3, 1}, Statistics.topIndices(values, 10));
        assertEquals(0, Statistics.topIndices(values, 0).length);
    }

    @Test
    public void testChoiceWithProportion() {
        double[] confidences = {0.9, 0.8, 0.7, 0.6, 0.95, 0.5};
        int[] predicted = {0, 0, 0, 0, 1, 1};
        SortedMap<Integer, Double> prior = Statistics.priorProbability(new int[]{0, 1});

        // six instances, half of them for each class: three of class 0, three of class 1 at most
        int[] chosen = Statistics.choiceWithProportion(confidences, predicted, prior, 0);
        assertArrayEquals(new int[]{0, 1, 2, 4, 5}, sorted(chosen));

        int[] withExtra = Statistics.choiceWithProportion(confidences, predicted, prior, 1);
        assertArrayEquals(new int[]{0, 1, 2, 3, 4, 5}, sorted(withExtra));
    }

    @Test
    public void testAlignColumns() {
        double[][] proba = {{0.2, 0.8}};
        double[][] aligned = Statistics.alignColumns(proba, new int[]{1, 5}, new int[]{0, 1, 5});
        assertArrayEquals(new double[]{0.0, 0.2, 0.8}, aligned[0], 0.0);
    }

    @Test
    public void testNormalizeVotes() {
        assertArrayEquals(new double[]{0.25, 0.75}, Statistics.normalizeVotes(new double[]{1, 3}, 2), 1e-12);
        assertArrayEquals(new double[]{0.5, 0.5}, Statistics.normalizeVotes(new double[0], 2), 1e-12);
        assertArrayEquals(new double[]{1.0 / 3, 1.0 / 3, 1.0 / 3}, Statistics.normalizeVotes(null, 3), 1e-12);
        // a learner that never saw the last class returns a shorter vote array
        assertArrayEquals(new double[]{1.0, 0.0, 0.0}, Statistics.normalizeVotes(new double[]{2}, 3), 1e-12);
    }

    @Test
    public void testSoftmax() {
        double[] result = Statistics.softmax(new double[]{0.5, 0.5, 1.5});
        assertEquals(1.0, result[0] + result[1] + result[2], 1e-12);
        assertEquals(result[0], result[1], 1e-12);
        assertEquals(Math.E, result[2] / result[0], 1e-9);
    }

    private static int[] sorted(int[] values) {
        int[] copy = values.clone();
        Arrays.sort(copy);
        return copy;
    }
}
