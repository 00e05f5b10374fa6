package semisup.classifiers.semisupervised;

import java.util.ArrayList;
import java.util.List;

import semisup.core.MutualInformation;

/**
 * Co-training with relevant random subspaces (Rel-RASCO).
 *
 * <p>Yaslan, Y., and Cataltepe, Z. "Co-training with relevant random subspaces."
 * Neurocomputing 73 (2010).</p>
 *
 * <p>Same procedure as {@link Rasco}; each slot of a subspace is filled by drawing two features
 * at random and keeping the one with the higher mutual information with the class.</p>
 */
public class RelRasco extends Rasco {

    private static final long serialVersionUID = 1L;

    /** Neighbours of the kNN mutual information estimator. */
    public static final int RELEVANCE_NEIGHBOURS = 3;

    protected double[] relevance;

    @Override
    public String getPurposeString() {
        return "Co-training of an ensemble of classifiers built on relevance-biased random feature subspaces.";
    }

    @Override
    protected List<int[]> generateSubspaces(double[][] X, int[] y, int subspaceSize) {
        this.relevance = MutualInformation.relevance(X, y, RELEVANCE_NEIGHBOURS, this.random);
        int numFeatures = X[0].length;
        List<int[]> subspaces = new ArrayList<>(this.ensembleSizeOption.getValue());
        for (int k = 0; k < this.ensembleSizeOption.getValue(); ++k) {
            int[] subspace = new int[subspaceSize];
            for (int s = 0; s < subspaceSize; ++s) {
                int f1 = this.random.nextInt(numFeatures);
                int f2 = this.random.nextInt(numFeatures);
                subspace[s] = this.relevance[f1] > this.relevance[f2] ? f1 : f2;
            }
            subspaces.add(subspace);
        }
        return subspaces;
    }

    /** Relevance of each feature computed by the last fit. */
    public double[] getRelevance() {
        checkFitted();
        return this.relevance.clone();
    }
}
