package semisup.classifiers.semisupervised;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.github.javacliparser.IntOption;
import org.apache.commons.math3.util.MathArrays;

import moa.options.ClassOption;
import semisup.core.Dataset;
import semisup.core.IterationEvent;
import semisup.core.LearnerPool;
import semisup.core.Matrices;
import semisup.core.Statistics;
import semisup.core.TrainableClassifier;

/**
 * Tri-training.
 *
 * <p>Zhi-Hua Zhou and Ming Li, "Tri-training: exploiting unlabeled data using three classifiers,"
 * IEEE TKDE 17(11), 2005.</p>
 *
 * <p>Three classifiers start from bootstrap samples of the labelled set. In every round each one
 * is retrained on the unlabelled instances on which the other two agree, as long as the error
 * bound of that pair keeps improving. A round ends when no classifier changes.</p>
 */
public class TriTraining extends AbstractSemiSupervisedEngine {

    private static final long serialVersionUID = 1L;

    public static final int NUM_LEARNERS = 3;

    public ClassOption baseLearnerOption = new ClassOption("baseLearner", 'l',
            "Classifier cloned three times.", TrainableClassifier.class,
            "semisup.classifiers.MoaClassifier -l trees.HoeffdingTree");

    public IntOption numSamplesOption = new IntOption("numSamples", 'n',
            "Size of the bootstrap sample of each classifier (-1 = size of the labelled set).",
            -1, -1, Integer.MAX_VALUE);

    public IntOption numberOfJobsOption = new IntOption("numberOfJobs", 'j',
            "Total number of concurrent jobs used for fitting (-1 = as much as possible, 0 = do not use multithreading)",
            1, -1, Integer.MAX_VALUE);

    protected double[] errorEstimates;

    @Override
    public String getPurposeString() {
        return "Tri-training: three classifiers teach each other on the instances where two of them agree.";
    }

    @Override
    protected void fitImpl(Dataset dataset) {
        int numSamples = this.numSamplesOption.getValue();
        int numberOfJobs = this.numberOfJobsOption.getValue();
        if (numSamples == -1) {
            numSamples = dataset.numLabeled();
        }
        checkPositive("numSamples", numSamples);

        double[][] labeledX = dataset.getLabeledX();
        int[] labeledY = dataset.getLabeledY();
        double[][] unlabeledX = dataset.getUnlabeledX();
        TrainableClassifier prototype = preparedLearner(this.baseLearnerOption);
        try (LearnerPool pool = LearnerPool.ofClones(prototype, NUM_LEARNERS, this.random)) {
            // one instance of every class ahead of each bootstrap sample keeps the class list complete
            List<Integer> representatives = new ArrayList<>();
            Set<Integer> seen = new LinkedHashSet<>();
            for (int i = 0; i < labeledY.length && seen.size() < this.classes.length; ++i) {
                if (seen.add(labeledY[i])) {
                    representatives.add(i);
                }
            }
            List<double[][]> bootstrapX = new ArrayList<>(NUM_LEARNERS);
            List<int[]> bootstrapY = new ArrayList<>(NUM_LEARNERS);
            for (int h = 0; h < NUM_LEARNERS; ++h) {
                List<Integer> rows = new ArrayList<>(representatives);
                for (int s = 0; s < numSamples; ++s) {
                    rows.add(this.random.nextInt(labeledY.length));
                }
                bootstrapX.add(Matrices.rows(labeledX, rows));
                bootstrapY.add(Matrices.select(labeledY, rows));
            }
            pool.fitAll(bootstrapX, bootstrapY, numberOfJobs);

            double[] previousError = new double[NUM_LEARNERS];
            Arrays.fill(previousError, 0.5);
            int[] previousSize = new int[NUM_LEARNERS];
            int[][] pseudoLabels = new int[NUM_LEARNERS][];
            boolean changed = true;
            int round = 0;
            while (changed) {
                changed = false;
                double[] error = new double[NUM_LEARNERS];
                boolean[] update = new boolean[NUM_LEARNERS];
                List<List<Integer>> candidates = new ArrayList<>(NUM_LEARNERS);
                List<double[][]> refitX = new ArrayList<>(NUM_LEARNERS);
                List<int[]> refitY = new ArrayList<>(NUM_LEARNERS);

                for (int i = 0; i < NUM_LEARNERS; ++i) {
                    candidates.add(Collections.emptyList());
                    refitX.add(null);
                    refitY.add(null);
                    TrainableClassifier hj = pool.get((i + 1) % NUM_LEARNERS);
                    TrainableClassifier hk = pool.get((i + 2) % NUM_LEARNERS);
                    error[i] = measureError(hj.predict(labeledX), hk.predict(labeledX), labeledY);
                    if (previousError[i] <= error[i]) {
                        continue;
                    }
                    int[] yj = hj.predict(unlabeledX);
                    int[] yk = hk.predict(unlabeledX);
                    List<Integer> agreed = new ArrayList<>();
                    for (int u = 0; u < yj.length; ++u) {
                        if (yj[u] == yk[u]) {
                            agreed.add(u);
                        }
                    }
                    double bound = Statistics.safeDivision(error[i], previousError[i] - error[i], Statistics.EPSILON);
                    if (previousSize[i] == 0) {
                        previousSize[i] = (int) Math.floor(bound + 1);
                    }
                    if (previousSize[i] >= agreed.size()) {
                        continue;
                    }
                    if (error[i] * agreed.size() < previousError[i] * previousSize[i]) {
                        update[i] = true;
                    } else if (previousSize[i] > bound) {
                        int size = (int) Math.ceil(Statistics.safeDivision(previousError[i] * previousSize[i],
                                error[i], Statistics.EPSILON) - 1);
                        agreed = subsample(agreed, size);
                        update[i] = true;
                    }
                    if (update[i]) {
                        int[] labels = new int[agreed.size()];
                        for (int c = 0; c < labels.length; ++c) {
                            labels[c] = yj[agreed.get(c)];
                        }
                        candidates.set(i, agreed);
                        pseudoLabels[i] = labels;
                        refitX.set(i, Matrices.concat(labeledX, Matrices.rows(unlabeledX, agreed)));
                        refitY.set(i, Matrices.concat(labeledY, labels));
                    }
                }

                pool.fitAll(refitX, refitY, numberOfJobs);

                int accepted = 0;
                for (int i = 0; i < NUM_LEARNERS; ++i) {
                    record(IterationEvent.learner(engineName(), round, i, labeledY.length + candidates.get(i).size(),
                            unlabeledX.length, update[i] ? candidates.get(i).size() : 0)
                            .with("error", error[i])
                            .with("previousError", previousError[i]));
                    if (update[i]) {
                        previousError[i] = error[i];
                        previousSize[i] = candidates.get(i).size();
                        accepted += candidates.get(i).size();
                        for (int c = 0; c < pseudoLabels[i].length; ++c) {
                            pseudoLabel(candidates.get(i).get(c), pseudoLabels[i][c]);
                        }
                        changed = true;
                    }
                }
                record(IterationEvent.iteration(engineName(), round, labeledY.length, unlabeledX.length, accepted));
                ++round;
            }

            this.errorEstimates = previousError;
            record(IterationEvent.finished(engineName(), round, labeledY.length, unlabeledX.length));
            setHypotheses(pool.getLearners(),
                    Collections.nCopies(NUM_LEARNERS, Matrices.allColumns(dataset.numFeatures())));
        }
    }

    /**
     * Error of a pair of classifiers on labelled data: among the instances where both predict the
     * same label, the fraction where that label is wrong. A pair that never agrees has error 0.
     *
     * @param y1 predictions of the first classifier
     * @param y2 predictions of the second classifier
     * @param y  true labels
     */
    public static double measureError(int[] y1, int[] y2, int[] y) {
        int error = 0;
        int coincidence = 0;
        for (int i = 0; i < y.length; ++i) {
            if (y1[i] == y2[i]) {
                ++coincidence;
                if (y2[i] != y[i]) {
                    ++error;
                }
            }
        }
        return Statistics.safeDivision(error, coincidence, Statistics.EPSILON);
    }

    /** Random subset of {@code size} elements, without replacement. */
    private List<Integer> subsample(List<Integer> elements, int size) {
        int[] order = MathArrays.natural(elements.size());
        MathArrays.shuffle(order, this.random);
        int n = Math.max(0, Math.min(size, order.length));
        List<Integer> selected = new ArrayList<>(n);
        for (int i = 0; i < n; ++i) {
            selected.add(elements.get(order[i]));
        }
        return selected;
    }

    /** Error estimate of each classifier at the end of the last fit. */
    public double[] getErrorEstimates() {
        checkFitted();
        return this.errorEstimates.clone();
    }
}
