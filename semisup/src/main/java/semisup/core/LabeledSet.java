package semisup.core;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Growing set of (features, label) pairs. Rows are only ever appended.
 */
public class LabeledSet implements Serializable {

    private static final long serialVersionUID = 1L;

    private final List<double[]> features = new ArrayList<>();
    private final List<Integer> labels = new ArrayList<>();

    public LabeledSet(double[][] X, int[] y) {
        addAll(X, y);
    }

    public LabeledSet(LabeledSet other) {
        this.features.addAll(other.features);
        this.labels.addAll(other.labels);
    }

    public void add(double[] x, int y) {
        this.features.add(x);
        this.labels.add(y);
    }

    public void addAll(double[][] X, int[] y) {
        for (int i = 0; i < X.length; ++i) {
            add(X[i], y[i]);
        }
    }

    public int size() {
        return this.labels.size();
    }

    public double[][] features() {
        return this.features.toArray(new double[0][]);
    }

    public int[] labels() {
        int[] y = new int[this.labels.size()];
        for (int i = 0; i < y.length; ++i) {
            y[i] = this.labels.get(i);
        }
        return y;
    }

    /** Features of every row restricted to the given columns. */
    public double[][] features(int[] columns) {
        return Matrices.columns(features(), columns);
    }
}
