package semisup.core;

import static org.junit.Assert.*;

import org.junit.Test;

public class LabeledSetTest {

    @Test
    public void testGrowAndProject() {
        LabeledSet labeled = new LabeledSet(new double[][]{{1, 2, 3}}, new int[]{4});
        labeled.add(new double[]{5, 6, 7}, 8);
        labeled.addAll(new double[][]{{9, 10, 11}}, new int[]{12});

        assertEquals(3, labeled.size());
        assertArrayEquals(new int[]{4, 8, 12}, labeled.labels());
        assertArrayEquals(new double[]{7, 5}, labeled.features(new int[]{2, 0})[1], 0.0);

        LabeledSet copy = new LabeledSet(labeled);
        copy.add(new double[]{0, 0, 0}, 0);
        assertEquals(3, labeled.size());
        assertEquals(4, copy.size());
    }
}
