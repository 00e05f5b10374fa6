package semisup.classifiers.semisupervised;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.SortedMap;

import com.github.javacliparser.IntOption;
import org.apache.commons.math3.util.MathArrays;

import moa.options.ClassOption;
import semisup.core.Dataset;
import semisup.core.IterationEvent;
import semisup.core.LabeledSet;
import semisup.core.Matrices;
import semisup.core.Statistics;
import semisup.core.TrainableClassifier;

/**
 * Co-training by committee.
 *
 * <p>M. F. A. Hady and F. Schwenker, "Co-training by Committee: A New Semi-supervised Learning
 * Framework," ICDM Workshops 2008.</p>
 *
 * <p>A single ensemble proposes and accepts pseudo-labels. Unlabelled instances are visited
 * through a window over a fixed random permutation; from each window the most confident
 * predictions of every class are kept, in proportion to the class priors plus a floor of
 * {@link #minInstancesForClassOption} per class. Training stops early when a window yields no
 * pseudo-label.</p>
 */
public class CoTrainingByCommittee extends AbstractSemiSupervisedEngine {

    private static final long serialVersionUID = 1L;

    public ClassOption ensembleLearnerOption = new ClassOption("ensembleLearner", 'l',
            "Ensemble classifier of the committee.", TrainableClassifier.class,
            "semisup.classifiers.MoaClassifier -l (meta.OzaBag -l bayes.NaiveBayes -s 10)");

    public IntOption maxIterationsOption = new IntOption("maxIterations", 'i',
            "Maximum number of iterations (-1 = until the unlabelled instances are exhausted).",
            100, -1, Integer.MAX_VALUE);

    public IntOption poolSizeOption = new IntOption("poolSize", 'p',
            "Number of unlabelled instances evaluated at each iteration.", 100, 1, Integer.MAX_VALUE);

    public IntOption minInstancesForClassOption = new IntOption("minInstancesForClass", 'm',
            "Most confident instances of each class accepted at every iteration.", 3, 0, Integer.MAX_VALUE);

    @Override
    public String getPurposeString() {
        return "Co-training by committee: one ensemble pseudo-labels a sliding window of unlabelled instances.";
    }

    @Override
    protected void fitImpl(Dataset dataset) {
        int maxIterations = this.maxIterationsOption.getValue();
        int poolSize = this.poolSizeOption.getValue();
        int minInstancesForClass = this.minInstancesForClassOption.getValue();
        if (maxIterations == 0 || maxIterations < -1) {
            throw new IllegalArgumentException("maxIterations must be positive or -1, got " + maxIterations);
        }
        checkPositive("poolSize", poolSize);
        if (minInstancesForClass < 0) {
            throw new IllegalArgumentException("minInstancesForClass must not be negative");
        }

        TrainableClassifier ensemble = preparedLearner(this.ensembleLearnerOption).copy();
        if (ensemble.isRandomizable()) {
            ensemble.setRandomSeed(this.random.nextInt());
        }
        LabeledSet labeled = new LabeledSet(dataset.getLabeledX(), dataset.getLabeledY());
        SortedMap<Integer, Double> prior = Statistics.priorProbability(dataset.getLabeledY());
        int[] shuffled = MathArrays.natural(dataset.numUnlabeled());
        MathArrays.shuffle(shuffled, this.random);
        List<Integer> permutation = new ArrayList<>(shuffled.length);
        for (int id : shuffled) {
            permutation.add(id);
        }

        ensemble.fit(labeled.features(), labeled.labels());
        int iteration = 0;
        for (; maxIterations == -1 || iteration < maxIterations; ++iteration) {
            if (permutation.isEmpty()) {
                break;
            }
            List<Integer> window = new ArrayList<>(permutation.subList(0, Math.min(poolSize, permutation.size())));
            double[][] proba = ensemble.predictProba(Matrices.rows(dataset.getUnlabeledX(), window));
            double[] confidences = Statistics.maxOfRows(proba);
            int[] predicted = Statistics.argMaxLabels(proba, ensemble.getClasses());

            boolean[] added = new boolean[window.size()];
            for (int c : ensemble.getClasses()) {
                for (int position : mostConfidentOfClass(confidences, predicted, c, minInstancesForClass)) {
                    added[position] = true;
                }
            }
            for (int position : Statistics.choiceWithProportion(confidences, predicted, prior, minInstancesForClass)) {
                added[position] = true;
            }

            List<Integer> acceptedIds = new ArrayList<>();
            for (int i = 0; i < window.size(); ++i) {
                if (added[i]) {
                    int id = window.get(i);
                    labeled.add(dataset.getUnlabeledX()[id], predicted[i]);
                    pseudoLabel(id, predicted[i]);
                    acceptedIds.add(id);
                }
            }
            if (acceptedIds.isEmpty()) {
                // the window and the ensemble would be the same on the next iteration
                record(IterationEvent.warning(engineName(), iteration,
                        "convergence warning, no instance accepted from a window of " + window.size()));
                break;
            }
            permutation.removeAll(acceptedIds);
            ensemble.fit(labeled.features(), labeled.labels());
            record(IterationEvent.iteration(engineName(), iteration, labeled.size(), permutation.size(),
                    acceptedIds.size()));
        }

        record(IterationEvent.finished(engineName(), iteration, labeled.size(), permutation.size()));
        setHypotheses(Collections.singletonList(ensemble),
                Collections.singletonList(Matrices.allColumns(dataset.numFeatures())));
    }

    /** Positions of the {@code count} most confident predictions of class {@code label}. */
    private static int[] mostConfidentOfClass(double[] confidences, int[] predicted, int label, int count) {
        List<Integer> positions = new ArrayList<>();
        for (int i = 0; i < predicted.length; ++i) {
            if (predicted[i] == label) {
                positions.add(i);
            }
        }
        double[] subset = new double[positions.size()];
        for (int i = 0; i < subset.length; ++i) {
            subset[i] = confidences[positions.get(i)];
        }
        int[] top = Statistics.topIndices(subset, count);
        int[] selected = new int[top.length];
        for (int i = 0; i < top.length; ++i) {
            selected[i] = positions.get(top[i]);
        }
        return selected;
    }
}
