package semisup.classifiers.semisupervised;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.github.javacliparser.IntOption;
import org.apache.commons.math3.util.MathArrays;

import moa.core.Utils;
import moa.options.ClassOption;
import semisup.core.Dataset;
import semisup.core.IterationEvent;
import semisup.core.IterationTrace;
import semisup.core.LabeledSet;
import semisup.core.Matrices;
import semisup.core.Statistics;
import semisup.core.TrainableClassifier;

/**
 * Co-training of two classifiers on two views of a binary problem.
 *
 * <p>Blum, A., and Mitchell, T. "Combining labeled and unlabeled data with co-training."
 * COLT 1998.</p>
 *
 * <p>The views are either the same full feature set (default), a column split given by
 * {@link #setViews(int[], int[])}, or a second feature matrix passed to
 * {@link #fit(double[][], double[][], int[])}. The first sorted class is the negative class and
 * the second the positive one.</p>
 */
public class CoTraining extends AbstractSemiSupervisedEngine {

    private static final long serialVersionUID = 1L;

    public ClassOption baseLearnerOption = new ClassOption("baseLearner", 'l',
            "Classifier trained on each view.", TrainableClassifier.class,
            "semisup.classifiers.MoaClassifier -l bayes.NaiveBayes");

    public IntOption maxIterationsOption = new IntOption("maxIterations", 'i',
            "Maximum number of iterations.", 30, 1, Integer.MAX_VALUE);

    public IntOption poolSizeOption = new IntOption("poolSize", 'p',
            "Number of unlabelled instances offered to the classifiers at each iteration.", 75, 1, Integer.MAX_VALUE);

    public IntOption positivesOption = new IntOption("positives", 'o',
            "Positive instances each classifier may label per iteration (-1 = derived from the class ratio).",
            -1, -1, Integer.MAX_VALUE);

    public IntOption negativesOption = new IntOption("negatives", 'n',
            "Negative instances each classifier may label per iteration (-1 = derived from the class ratio).",
            -1, -1, Integer.MAX_VALUE);

    protected TrainableClassifier secondBaseLearner;

    protected int[][] views;

    protected transient double[][] secondViewInput;

    /** Whether the last fit used a second feature matrix. */
    protected boolean secondMatrix;

    protected int positives;

    protected int negatives;

    @Override
    public String getPurposeString() {
        return "Two-view co-training for binary problems.";
    }

    /** Classifier for the second view; by default both views use the base learner. */
    public void setSecondBaseLearner(TrainableClassifier learner) {
        this.secondBaseLearner = learner;
    }

    /**
     * Restricts each classifier to a subset of the columns of X.
     * Pass {@code null} to go back to two copies of the full view.
     */
    public void setViews(int[] first, int[] second) {
        if ((first == null) != (second == null)) {
            throw new IllegalArgumentException("Both views must be given");
        }
        this.views = first == null ? null : new int[][]{first.clone(), second.clone()};
    }

    public CoTraining fit(double[][] X, double[][] X2, int[] y) {
        return fit(X, X2, y, IterationTrace.NONE);
    }

    /**
     * Fits on two feature matrices describing the same rows.
     *
     * @throws IllegalArgumentException if a column split is also configured or the row counts differ
     */
    public CoTraining fit(double[][] X, double[][] X2, int[] y, IterationTrace trace) {
        if (X2 != null && this.views != null) {
            throw new IllegalArgumentException("A second view and a column split cannot be used at the same time");
        }
        if (X2 != null && X2.length != X.length) {
            throw new IllegalArgumentException("X and X2 must have the same number of rows");
        }
        this.secondViewInput = X2;
        try {
            fit(X, y, trace);
        } finally {
            this.secondViewInput = null;
        }
        return this;
    }

    /**
     * Runs until {@code maxIterations} or until both the reserve and the active pool are empty:
     * once the reserve is exhausted, the instances left in the active pool are still offered to
     * the two views.
     */
    @Override
    protected void fitImpl(Dataset dataset) {
        if (this.classes.length != 2) {
            throw new IllegalArgumentException("CoTraining needs exactly two classes, got "
                    + Arrays.toString(this.classes));
        }
        resolveCounts(dataset.getLabeledY());
        int maxIterations = this.maxIterationsOption.getValue();
        int poolSize = this.poolSizeOption.getValue();
        checkPositive("maxIterations", maxIterations);
        checkPositive("poolSize", poolSize);

        this.secondMatrix = this.secondViewInput != null;
        double[][][] unlabeledViews = new double[2][][];
        LabeledSet[] labeled = new LabeledSet[2];
        List<int[]> viewColumns = new ArrayList<>(2);
        for (int v = 0; v < 2; ++v) {
            int[] cols;
            double[][] labeledRows;
            if (this.secondMatrix && v == 1) {
                cols = Matrices.allColumns(this.secondViewInput[0].length);
                labeledRows = Matrices.rows(this.secondViewInput, dataset.getLabeledIndices());
                unlabeledViews[v] = Matrices.rows(this.secondViewInput, dataset.getUnlabeledIndices());
            } else {
                cols = this.views != null ? this.views[v] : Matrices.allColumns(dataset.numFeatures());
                labeledRows = Matrices.columns(dataset.getLabeledX(), cols);
                unlabeledViews[v] = Matrices.columns(dataset.getUnlabeledX(), cols);
            }
            labeled[v] = new LabeledSet(labeledRows, dataset.getLabeledY());
            viewColumns.add(cols);
        }

        TrainableClassifier prototype = preparedLearner(this.baseLearnerOption);
        TrainableClassifier[] h = new TrainableClassifier[]{prototype.copy(),
                this.secondBaseLearner != null ? this.secondBaseLearner.copy() : prototype.copy()};
        for (TrainableClassifier learner : h) {
            if (learner.isRandomizable()) {
                learner.setRandomSeed(this.random.nextInt());
            }
        }

        // U is consumed from its end, U_ is the active pool
        int[] order = MathArrays.natural(dataset.numUnlabeled());
        MathArrays.shuffle(order, this.random);
        List<Integer> remaining = new ArrayList<>(order.length);
        for (int id : order) {
            remaining.add(id);
        }
        List<Integer> active = new ArrayList<>();
        int initialPool = Math.min(poolSize, remaining.size());
        active.addAll(remaining.subList(remaining.size() - initialPool, remaining.size()));
        remaining.subList(remaining.size() - initialPool, remaining.size()).clear();

        int negativeClass = this.classes[0];
        int positiveClass = this.classes[1];
        int iteration = 0;
        while (iteration < maxIterations && (!remaining.isEmpty() || !active.isEmpty())) {
            fitViews(h, labeled);

            Map<Integer, Integer> proposed = new LinkedHashMap<>();
            List<Integer> proposedNegatives = new ArrayList<>();
            for (int v = 0; v < 2; ++v) {
                double[][] proba = Statistics.alignColumns(
                        h[v].predictProba(Matrices.rows(unlabeledViews[v], active)), h[v].getClasses(), this.classes);
                double[] negativeProba = column(proba, 0);
                double[] positiveProba = column(proba, 1);
                for (int i : Statistics.topIndices(positiveProba, this.positives)) {
                    if (positiveProba[i] > 0.5) {
                        proposed.put(active.get(i), positiveClass);
                    }
                }
                for (int i : Statistics.topIndices(negativeProba, this.negatives)) {
                    if (negativeProba[i] > 0.5) {
                        proposedNegatives.add(active.get(i));
                    }
                }
            }
            // negatives are applied last and win over a positive proposal for the same instance
            for (int id : proposedNegatives) {
                proposed.put(id, negativeClass);
            }

            for (Map.Entry<Integer, Integer> entry : proposed.entrySet()) {
                int id = entry.getKey();
                for (int v = 0; v < 2; ++v) {
                    labeled[v].add(unlabeledViews[v][id], entry.getValue());
                }
                pseudoLabel(id, entry.getValue());
            }
            active.removeAll(proposed.keySet());
            for (int added = 0; added < proposed.size() && !remaining.isEmpty(); ++added) {
                active.add(remaining.remove(remaining.size() - 1));
            }

            int positivesAdded = 0;
            for (int label : proposed.values()) {
                if (label == positiveClass) {
                    ++positivesAdded;
                }
            }
            record(IterationEvent.iteration(engineName(), iteration, labeled[0].size(),
                    remaining.size() + active.size(), proposed.size())
                    .with("positives", positivesAdded)
                    .with("negatives", proposed.size() - positivesAdded));
            ++iteration;
        }

        fitViews(h, labeled);
        record(IterationEvent.finished(engineName(), iteration, labeled[0].size(), remaining.size() + active.size()));
        setHypotheses(Arrays.asList(h), viewColumns);
    }

    /**
     * Resolves the number of positives and negatives labelled per classifier and iteration.
     * When neither is given, the smaller class gets one instance and the other class as many
     * as the rounded class ratio.
     */
    protected void resolveCounts(int[] labeledY) {
        int positivesValue = this.positivesOption.getValue();
        int negativesValue = this.negativesOption.getValue();
        if ((positivesValue == -1) != (negativesValue == -1)) {
            throw new IllegalArgumentException("positives and negatives must be both given or both left to -1");
        }
        if (positivesValue == -1) {
            int numNegatives = 0;
            int numPositives = 0;
            for (int label : labeledY) {
                if (label == this.classes[0]) {
                    ++numNegatives;
                } else {
                    ++numPositives;
                }
            }
            double ratio = Statistics.safeDivision(numNegatives, numPositives, Statistics.EPSILON);
            if (ratio > 1) {
                positivesValue = 1;
                negativesValue = (int) Math.round(ratio);
            } else {
                negativesValue = 1;
                positivesValue = (int) Math.round(1 / ratio);
            }
        }
        checkPositive("positives", positivesValue);
        checkPositive("negatives", negativesValue);
        this.positives = positivesValue;
        this.negatives = negativesValue;
    }

    private static void fitViews(TrainableClassifier[] h, LabeledSet[] labeled) {
        for (int v = 0; v < h.length; ++v) {
            h[v].fit(labeled[v].features(), labeled[v].labels());
        }
    }

    private static double[] column(double[][] matrix, int column) {
        double[] values = new double[matrix.length];
        for (int i = 0; i < matrix.length; ++i) {
            values[i] = matrix[i][column];
        }
        return values;
    }

    public int getPositives() {
        return this.positives;
    }

    public int getNegatives() {
        return this.negatives;
    }

    @Override
    public double[][] predictProba(double[][] X) {
        checkFitted();
        if (this.secondMatrix) {
            throw new IllegalStateException("Fitted on two feature matrices, use predictProba(X, X2)");
        }
        return super.predictProba(X);
    }

    /** Average of the probabilities of the first view on X and the second view on X2. */
    public double[][] predictProba(double[][] X, double[][] X2) {
        checkFitted();
        if (!this.secondMatrix) {
            return predictProba(X);
        }
        double[][] first = Statistics.alignColumns(this.hypotheses.get(0).predictProba(X),
                this.hypotheses.get(0).getClasses(), this.classes);
        double[][] second = Statistics.alignColumns(this.hypotheses.get(1).predictProba(X2),
                this.hypotheses.get(1).getClasses(), this.classes);
        double[][] proba = new double[X.length][this.classes.length];
        for (int i = 0; i < X.length; ++i) {
            for (int c = 0; c < this.classes.length; ++c) {
                proba[i][c] = (first[i][c] + second[i][c]) / 2;
            }
        }
        return proba;
    }

    public int[] predict(double[][] X, double[][] X2) {
        double[][] proba = predictProba(X, X2);
        int[] predictions = new int[proba.length];
        for (int i = 0; i < proba.length; ++i) {
            predictions[i] = this.classes[Utils.maxIndex(proba[i])];
        }
        return predictions;
    }
}
