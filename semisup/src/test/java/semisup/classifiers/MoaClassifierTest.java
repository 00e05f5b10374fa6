package semisup.classifiers;

import static org.junit.Assert.*;

import org.junit.Test;

import moa.classifiers.bayes.NaiveBayes;
import semisup.core.NotFittedException;

public class MoaClassifierTest {

    private static final double[][] X = {{0, 0}, {0.5, 0.2}, {0.1, 0.4}, {9, 9}, {9.5, 8.7}, {8.8, 9.2}};
    private static final int[] Y = {3, 3, 3, 7, 7, 7};

    @Test
    public void testFitAndPredict() {
        MoaClassifier classifier = new MoaClassifier(new NaiveBayes());
        assertFalse(classifier.isFitted());
        classifier.fit(X, Y);

        assertTrue(classifier.isFitted());
        assertArrayEquals(new int[]{3, 7}, classifier.getClasses());
        assertArrayEquals(new int[]{3, 7}, classifier.predict(new double[][]{{0.2, 0.1}, {9.1, 9.0}}));
        for (double[] row : classifier.predictProba(X)) {
            assertEquals(2, row.length);
            assertEquals(1.0, row[0] + row[1], 1e-9);
        }
    }

    @Test
    public void testDefaultLearnerFromOption() {
        MoaClassifier classifier = new MoaClassifier();
        classifier.learnerOption.setValueViaCLIString("lazy.kNN -k 1");
        classifier.fit(X, Y);
        assertArrayEquals(new int[]{7}, classifier.predict(new double[][]{{9.4, 8.8}}));
    }

    @Test
    public void testRefitForgetsPreviousData() {
        MoaClassifier classifier = new MoaClassifier(new NaiveBayes());
        classifier.fit(X, Y);
        classifier.fit(X, new int[]{1, 1, 1, 2, 2, 2});
        assertArrayEquals(new int[]{1, 2}, classifier.getClasses());
        assertArrayEquals(new int[]{1, 2}, classifier.predict(new double[][]{{0, 0}, {9, 9}}));
    }

    @Test
    public void testCopyKeepsModel() {
        MoaClassifier classifier = new MoaClassifier(new NaiveBayes()).fit(X, Y);
        MoaClassifier copy = classifier.copy();
        assertNotSame(classifier.getModel(), copy.getModel());
        double[][] expected = classifier.predictProba(X);
        double[][] actual = copy.predictProba(X);
        for (int i = 0; i < X.length; ++i) {
            assertArrayEquals(expected[i], actual[i], 1e-12);
        }
    }

    @Test
    public void testCopyOfUnfittedIsUnfitted() {
        MoaClassifier classifier = new MoaClassifier(new NaiveBayes());
        MoaClassifier clone = classifier.copy();
        classifier.fit(X, Y);
        assertFalse(clone.isFitted());
    }

    @Test(expected = NotFittedException.class)
    public void testPredictBeforeFit() {
        new MoaClassifier(new NaiveBayes()).predictProba(X);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMismatchedRows() {
        new MoaClassifier(new NaiveBayes()).fit(X, new int[]{1, 2});
    }

    @Test
    public void testRandomizableLearner() {
        MoaClassifier classifier = new MoaClassifier();
        classifier.learnerOption.setValueViaCLIString("trees.HoeffdingTree");
        assertFalse(classifier.isRandomizable());

        MoaClassifier forest = new MoaClassifier();
        forest.learnerOption.setValueViaCLIString("trees.ARFHoeffdingTree");
        assertTrue(forest.isRandomizable());
        forest.setRandomSeed(5);
        forest.fit(X, Y);
        assertTrue(forest.getModel().isRandomizable());
    }
}
