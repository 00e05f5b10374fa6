package semisup.classifiers.semisupervised;

import java.util.ArrayList;
import java.util.List;

import com.github.javacliparser.FlagOption;
import com.github.javacliparser.IntOption;
import org.apache.commons.math3.util.MathArrays;

import moa.options.ClassOption;
import semisup.core.Dataset;
import semisup.core.IterationEvent;
import semisup.core.LabeledSet;
import semisup.core.LearnerPool;
import semisup.core.Matrices;
import semisup.core.Statistics;
import semisup.core.TrainableClassifier;
import semisup.core.UnlabeledPool;

/**
 * Co-training based on random subspaces (RASCO).
 *
 * <p>Wang, J., Luo, S. W., and Zeng, X. H. "A random subspace method for co-training."
 * IJCNN 2008.</p>
 *
 * <p>{@link #ensembleSizeOption} classifiers are each bound to a random subset of the features.
 * Their averaged probabilities pseudo-label the unlabelled pool; either the best instance of
 * every class (incremental mode) or the {@link #batchSizeOption} most confident instances are
 * moved to the labelled set, and every classifier is refit.</p>
 */
public class Rasco extends AbstractSemiSupervisedEngine {

    private static final long serialVersionUID = 1L;

    public ClassOption baseLearnerOption = new ClassOption("baseLearner", 'l',
            "Classifier trained on each subspace.", TrainableClassifier.class,
            "semisup.classifiers.MoaClassifier -l trees.HoeffdingTree");

    public IntOption maxIterationsOption = new IntOption("maxIterations", 'i',
            "Maximum number of iterations (-1 = until the unlabelled instances are exhausted).",
            10, -1, Integer.MAX_VALUE);

    public IntOption ensembleSizeOption = new IntOption("ensembleSize", 's',
            "Number of classifiers, one per subspace.", 30, 1, Integer.MAX_VALUE);

    public FlagOption batchModeOption = new FlagOption("batchMode", 'b',
            "Add the batchSize most confident instances per iteration instead of the best instance of each class.");

    public IntOption batchSizeOption = new IntOption("batchSize", 'c',
            "Instances added per iteration in batch mode (-1 = size of the current labelled set).",
            -1, -1, Integer.MAX_VALUE);

    public IntOption subspaceSizeOption = new IntOption("subspaceSize", 'm',
            "Number of features of each subspace (-1 = half of the features).", -1, -1, Integer.MAX_VALUE);

    public IntOption numberOfJobsOption = new IntOption("numberOfJobs", 'j',
            "Total number of concurrent jobs used for fitting (-1 = as much as possible, 0 = do not use multithreading)",
            1, -1, Integer.MAX_VALUE);

    @Override
    public String getPurposeString() {
        return "Co-training of an ensemble of classifiers built on random feature subspaces.";
    }

    @Override
    protected void fitImpl(Dataset dataset) {
        int maxIterations = this.maxIterationsOption.getValue();
        int ensembleSize = this.ensembleSizeOption.getValue();
        int numberOfJobs = this.numberOfJobsOption.getValue();
        boolean incremental = !this.batchModeOption.isSet();
        if (maxIterations == 0 || maxIterations < -1) {
            throw new IllegalArgumentException("maxIterations must be positive or -1, got " + maxIterations);
        }
        checkPositive("ensembleSize", ensembleSize);
        int batchSize = this.batchSizeOption.getValue();
        if (batchSize == 0) {
            throw new IllegalArgumentException("batchSize must be positive or -1");
        }
        int subspaceSize = this.subspaceSizeOption.getValue();
        if (subspaceSize == -1) {
            subspaceSize = Math.max(1, dataset.numFeatures() / 2);
        }
        if (subspaceSize <= 0 || subspaceSize > dataset.numFeatures()) {
            throw new IllegalArgumentException("subspaceSize must be in [1, " + dataset.numFeatures()
                    + "], got " + subspaceSize);
        }

        List<int[]> subspaces = generateSubspaces(dataset.getLabeledX(), dataset.getLabeledY(), subspaceSize);
        TrainableClassifier prototype = preparedLearner(this.baseLearnerOption);
        try (LearnerPool pool = LearnerPool.ofClones(prototype, ensembleSize, this.random)) {
            LabeledSet labeled = new LabeledSet(dataset.getLabeledX(), dataset.getLabeledY());
            UnlabeledPool unlabeled = new UnlabeledPool(dataset.getUnlabeledX());
            fitAll(pool, subspaces, labeled, numberOfJobs);

            int iteration = 0;
            while ((maxIterations == -1 || iteration < maxIterations) && !unlabeled.isEmpty()) {
                List<Integer> ids = unlabeled.ids();
                double[][] rows = unlabeled.rows(ids);
                double[][] proba = averageProba(pool, subspaces, rows);
                double[] confidences = Statistics.maxOfRows(proba);
                int[] predicted = Statistics.argMaxLabels(proba, this.classes);

                List<Integer> selected = new ArrayList<>();
                if (incremental) {
                    for (int c : this.classes) {
                        int best = -1;
                        for (int i = 0; i < predicted.length; ++i) {
                            if (predicted[i] == c && (best == -1 || confidences[i] > confidences[best])) {
                                best = i;
                            }
                        }
                        if (best == -1) {
                            record(IterationEvent.warning(engineName(), iteration,
                                    "convergence warning, the class " + c + " not predicted"));
                        } else {
                            selected.add(best);
                        }
                    }
                } else {
                    int size = batchSize == -1 ? labeled.size() : batchSize;
                    for (int i : Statistics.topIndices(confidences, size)) {
                        selected.add(i);
                    }
                }

                List<Integer> acceptedIds = new ArrayList<>(selected.size());
                for (int i : selected) {
                    int id = ids.get(i);
                    labeled.add(unlabeled.get(id), predicted[i]);
                    pseudoLabel(id, predicted[i]);
                    acceptedIds.add(id);
                }
                unlabeled.removeAll(acceptedIds);
                fitAll(pool, subspaces, labeled, numberOfJobs);
                record(IterationEvent.iteration(engineName(), iteration, labeled.size(), unlabeled.size(),
                        acceptedIds.size()));
                ++iteration;
            }

            record(IterationEvent.finished(engineName(), iteration, labeled.size(), unlabeled.size()));
            setHypotheses(pool.getLearners(), subspaces);
        }
    }

    /**
     * One feature subset per classifier: a prefix of a random permutation of the features.
     */
    protected List<int[]> generateSubspaces(double[][] X, int[] y, int subspaceSize) {
        int numFeatures = X[0].length;
        List<int[]> subspaces = new ArrayList<>(this.ensembleSizeOption.getValue());
        for (int k = 0; k < this.ensembleSizeOption.getValue(); ++k) {
            int[] features = MathArrays.natural(numFeatures);
            MathArrays.shuffle(features, this.random);
            int[] subspace = new int[subspaceSize];
            System.arraycopy(features, 0, subspace, 0, subspaceSize);
            subspaces.add(subspace);
        }
        return subspaces;
    }

    private static void fitAll(LearnerPool pool, List<int[]> subspaces, LabeledSet labeled, int numberOfJobs) {
        List<double[][]> X = new ArrayList<>(pool.size());
        List<int[]> y = new ArrayList<>(pool.size());
        int[] labels = labeled.labels();
        for (int k = 0; k < pool.size(); ++k) {
            X.add(labeled.features(subspaces.get(k)));
            y.add(labels);
        }
        pool.fitAll(X, y, numberOfJobs);
    }

    private double[][] averageProba(LearnerPool pool, List<int[]> subspaces, double[][] rows) {
        double[][] proba = new double[rows.length][this.classes.length];
        for (int k = 0; k < pool.size(); ++k) {
            TrainableClassifier learner = pool.get(k);
            double[][] p = Statistics.alignColumns(
                    learner.predictProba(Matrices.columns(rows, subspaces.get(k))),
                    learner.getClasses(), this.classes);
            for (int i = 0; i < rows.length; ++i) {
                for (int c = 0; c < this.classes.length; ++c) {
                    proba[i][c] += p[i][c] / pool.size();
                }
            }
        }
        return proba;
    }
}
