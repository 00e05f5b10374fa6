package semisup.core;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a combined (X, y) array into labeled rows and unlabeled rows using a sentinel label.
 */
public final class DatasetPartitioner {

    private DatasetPartitioner() {
    }

    public static Dataset split(double[][] X, int[] y) {
        return split(X, y, Dataset.UNLABELED);
    }

    /**
     * @throws IllegalArgumentException when X and y differ in length, when no row carries the
     *                                  sentinel (nothing to learn from) or when every row does
     */
    public static Dataset split(double[][] X, int[] y, int sentinel) {
        if (X == null || y == null || X.length != y.length) {
            throw new IllegalArgumentException("X and y must have the same number of rows");
        }
        List<Integer> labeled = new ArrayList<>();
        List<Integer> unlabeled = new ArrayList<>();
        for (int i = 0; i < y.length; ++i) {
            if (y[i] == sentinel) {
                unlabeled.add(i);
            } else {
                labeled.add(i);
            }
        }
        if (unlabeled.isEmpty()) {
            throw new IllegalArgumentException("y contains no unlabeled row (label " + sentinel + ")");
        }
        if (labeled.isEmpty()) {
            throw new IllegalArgumentException("y contains no labeled row");
        }

        double[][] labeledX = new double[labeled.size()][];
        int[] labeledY = new int[labeled.size()];
        int[] labeledIndices = new int[labeled.size()];
        for (int i = 0; i < labeled.size(); ++i) {
            int row = labeled.get(i);
            labeledX[i] = X[row];
            labeledY[i] = y[row];
            labeledIndices[i] = row;
        }
        double[][] unlabeledX = new double[unlabeled.size()][];
        int[] unlabeledIndices = new int[unlabeled.size()];
        for (int i = 0; i < unlabeled.size(); ++i) {
            int row = unlabeled.get(i);
            unlabeledX[i] = X[row];
            unlabeledIndices[i] = row;
        }
        int numFeatures = X.length == 0 ? 0 : X[0].length;
        return new Dataset(labeledX, labeledY, unlabeledX, labeledIndices, unlabeledIndices, numFeatures);
    }
}
