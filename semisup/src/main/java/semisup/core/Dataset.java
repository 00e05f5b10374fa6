package semisup.core;

import java.io.Serializable;

/**
 * Labeled / unlabeled view of a sentinel-labeled dataset, as produced by
 * {@link DatasetPartitioner}. Row indices into the original arrays are kept so that
 * pseudo-labels can be reported against the caller's rows.
 */
public class Dataset implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Label marking a row without class. */
    public static final int UNLABELED = -1;

    private final double[][] labeledX;
    private final int[] labeledY;
    private final double[][] unlabeledX;
    private final int[] labeledIndices;
    private final int[] unlabeledIndices;
    private final int numFeatures;

    public Dataset(double[][] labeledX, int[] labeledY, double[][] unlabeledX,
                   int[] labeledIndices, int[] unlabeledIndices, int numFeatures) {
        this.labeledX = labeledX;
        this.labeledY = labeledY;
        this.unlabeledX = unlabeledX;
        this.labeledIndices = labeledIndices;
        this.unlabeledIndices = unlabeledIndices;
        this.numFeatures = numFeatures;
    }

    public double[][] getLabeledX() {
        return labeledX;
    }

    public int[] getLabeledY() {
        return labeledY;
    }

    public double[][] getUnlabeledX() {
        return unlabeledX;
    }

    /** Position in the original arrays of each labeled row. */
    public int[] getLabeledIndices() {
        return labeledIndices;
    }

    /** Position in the original arrays of each unlabeled row; the unlabeled id is the index into this array. */
    public int[] getUnlabeledIndices() {
        return unlabeledIndices;
    }

    public int numLabeled() {
        return labeledY.length;
    }

    public int numUnlabeled() {
        return unlabeledX.length;
    }

    public int numFeatures() {
        return numFeatures;
    }

    /**
     * Makes sure no real class collides with {@link #UNLABELED}: when one does, every
     * real label is shifted by two. Rows already marked unlabeled are left untouched.
     *
     * @param y labels, unlabeled rows marked with {@link #UNLABELED}
     * @param unlabeled which rows are unlabeled, or {@code null} when no row is
     * @return the input array when nothing collides, a shifted copy otherwise
     */
    public static int[] secure(int[] y, boolean[] unlabeled) {
        boolean collides = false;
        for (int i = 0; i < y.length && !collides; ++i) {
            collides = y[i] == UNLABELED && (unlabeled == null || !unlabeled[i]);
        }
        if (!collides) {
            return y;
        }
        int[] secured = new int[y.length];
        for (int i = 0; i < y.length; ++i) {
            secured[i] = unlabeled != null && unlabeled[i] ? UNLABELED : y[i] + 2;
        }
        return secured;
    }
}
