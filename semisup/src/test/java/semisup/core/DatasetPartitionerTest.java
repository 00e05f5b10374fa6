package semisup.core;

import static org.junit.Assert.*;

import org.junit.Test;

public class DatasetPartitionerTest {

    private static final double[][] X = {{0, 0}, {1, 1}, {2, 2}, {3, 3}, {4, 4}};

    @Test
    public void testSplit() {
        Dataset data = DatasetPartitioner.split(X, new int[]{1, -1, 0, -1, 1});

        assertEquals(3, data.numLabeled());
        assertEquals(2, data.numUnlabeled());
        assertEquals(2, data.numFeatures());
        assertArrayEquals(new int[]{1, 0, 1}, data.getLabeledY());
        assertArrayEquals(new int[]{0, 2, 4}, data.getLabeledIndices());
        assertArrayEquals(new int[]{1, 3}, data.getUnlabeledIndices());
        assertArrayEquals(X[3], data.getUnlabeledX()[1], 0.0);
        assertArrayEquals(X[2], data.getLabeledX()[1], 0.0);
    }

    @Test
    public void testCustomSentinel() {
        Dataset data = DatasetPartitioner.split(X, new int[]{1, 99, 0, 99, -1}, 99);
        assertArrayEquals(new int[]{1, 0, -1}, data.getLabeledY());
        assertEquals(2, data.numUnlabeled());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNoUnlabeledRow() {
        DatasetPartitioner.split(X, new int[]{1, 0, 0, 1, 1});
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNoLabeledRow() {
        DatasetPartitioner.split(X, new int[]{-1, -1, -1, -1, -1});
    }

    @Test(expected = IllegalArgumentException.class)
    public void testLengthMismatch() {
        DatasetPartitioner.split(X, new int[]{1, -1});
    }

    @Test
    public void testSecure() {
        int[] untouched = {0, 1, -1};
        assertSame(untouched, Dataset.secure(untouched, new boolean[]{false, false, true}));

        // a real class -1 collides with the sentinel, every real label moves up by two
        int[] secured = Dataset.secure(new int[]{-1, 0, 1, -1}, new boolean[]{false, false, false, true});
        assertArrayEquals(new int[]{1, 2, 3, -1}, secured);
    }
}
