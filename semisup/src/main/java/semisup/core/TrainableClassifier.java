package semisup.core;

import moa.MOAObject;
import moa.core.Utils;

/**
 * Capability required from any classifier driven by a semi-supervised engine.
 *
 * <p>Implementations are trained in batch: every call to {@link #fit(double[][], int[])}
 * restarts learning from scratch, so {@link #copy()} doubles as a clone of the
 * configuration. Class labels are plain integers and {@link #getClasses()} lists them
 * in ascending order; the columns of {@link #predictProba(double[][])} follow that order.</p>
 */
public interface TrainableClassifier extends MOAObject {

    /**
     * Trains the classifier on the given rows, discarding any previous model.
     *
     * @param X feature rows
     * @param y class label of each row
     * @return this classifier, fitted
     */
    TrainableClassifier fit(double[][] X, int[] y);

    /**
     * Class membership probabilities, one row per instance and one column per
     * entry of {@link #getClasses()}. Each row sums to one.
     *
     * @throws NotFittedException if called before {@link #fit(double[][], int[])}
     */
    double[][] predictProba(double[][] X);

    /**
     * Sorted class labels seen by the last call to {@link #fit(double[][], int[])}.
     *
     * @throws NotFittedException if called before {@link #fit(double[][], int[])}
     */
    int[] getClasses();

    boolean isFitted();

    boolean isRandomizable();

    void setRandomSeed(int seed);

    @Override
    TrainableClassifier copy();

    /**
     * Most probable class of each instance.
     */
    default int[] predict(double[][] X) {
        double[][] proba = predictProba(X);
        int[] classes = getClasses();
        int[] predictions = new int[proba.length];
        for (int i = 0; i < proba.length; ++i) {
            predictions[i] = classes[Utils.maxIndex(proba[i])];
        }
        return predictions;
    }
}
