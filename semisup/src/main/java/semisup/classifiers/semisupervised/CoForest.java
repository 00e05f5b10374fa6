package semisup.classifiers.semisupervised;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.github.javacliparser.FloatOption;
import com.github.javacliparser.IntOption;
import org.apache.commons.math3.util.MathArrays;

import moa.core.Utils;
import moa.options.ClassOption;
import semisup.core.Dataset;
import semisup.core.IterationEvent;
import semisup.core.LearnerPool;
import semisup.core.Matrices;
import semisup.core.Statistics;
import semisup.core.TrainableClassifier;

/**
 * Co-Forest.
 *
 * <p>Li, M., and Zhou, Z.-H. "Improve Computer-Aided Diagnosis With Machine Learning Techniques
 * Using Undiagnosed Samples." IEEE TSMC-A 37(6), 2007.</p>
 *
 * <p>Every member of a randomised ensemble estimates its error on the labelled set; while it
 * improves, the member pseudo-labels a random subsample of the unlabelled instances and keeps
 * the confident ones, provided the weighted error of the new set is lower.</p>
 */
public class CoForest extends AbstractSemiSupervisedEngine {

    private static final long serialVersionUID = 1L;

    public ClassOption baseLearnerOption = new ClassOption("baseLearner", 'l',
            "Randomised classifier of the forest.", TrainableClassifier.class,
            "semisup.classifiers.MoaClassifier -l trees.ARFHoeffdingTree");

    public IntOption ensembleSizeOption = new IntOption("ensembleSize", 's',
            "Number of members of the forest.", 7, 1, Integer.MAX_VALUE);

    public FloatOption thresholdOption = new FloatOption("threshold", 't',
            "Minimum confidence of a pseudo-label.", 0.75, 0.0, 1.0);

    public IntOption maxIterationsOption = new IntOption("maxIterations", 'i',
            "Maximum number of rounds over the forest.", 100, 1, Integer.MAX_VALUE);

    @Override
    public String getPurposeString() {
        return "Co-Forest: members of a random forest pseudo-label unlabelled data for each other.";
    }

    @Override
    protected void fitImpl(Dataset dataset) {
        int ensembleSize = this.ensembleSizeOption.getValue();
        double threshold = this.thresholdOption.getValue();
        int maxIterations = this.maxIterationsOption.getValue();
        checkPositive("ensembleSize", ensembleSize);
        checkPositive("maxIterations", maxIterations);

        double[][] labeledX = dataset.getLabeledX();
        int[] labeledY = dataset.getLabeledY();
        double[][] unlabeledX = dataset.getUnlabeledX();
        LearnerPool pool = LearnerPool.ofClones(preparedLearner(this.baseLearnerOption), ensembleSize, this.random);
        pool.fitAll(labeledX, labeledY, 1);

        double[] errors = new double[ensembleSize];
        double[] weights = new double[ensembleSize];
        for (int i = 0; i < ensembleSize; ++i) {
            errors[i] = 0.5;
            weights[i] = Utils.sum(Statistics.maxOfRows(pool.get(i).predictProba(labeledX)));
        }

        boolean changing = true;
        int iteration = 0;
        while (changing && iteration < maxIterations) {
            changing = false;
            int accepted = 0;
            for (int i = 0; i < ensembleSize; ++i) {
                TrainableClassifier learner = pool.get(i);
                double error = estimateError(learner, labeledX, labeledY);
                double weight = weights[i];
                int refitSize = 0;
                if (error < errors[i]) {
                    int[] order = MathArrays.natural(unlabeledX.length);
                    MathArrays.shuffle(order, this.random);
                    int size = (int) Math.min(order.length, Math.floor(errors[i] * weights[i] / error));
                    List<Integer> subsample = new ArrayList<>(size);
                    for (int s = 0; s < size; ++s) {
                        subsample.add(order[s]);
                    }
                    double[][] proba = learner.predictProba(Matrices.rows(unlabeledX, subsample));
                    double[] confidences = Statistics.maxOfRows(proba);
                    int[] predicted = Statistics.argMaxLabels(proba, learner.getClasses());

                    List<Integer> confident = new ArrayList<>();
                    weight = 0;
                    for (int s = 0; s < subsample.size(); ++s) {
                        if (confidences[s] > threshold) {
                            confident.add(s);
                            weight += confidences[s];
                        }
                    }
                    if (error * weight < errors[i] * weights[i]) {
                        changing = true;
                        List<Integer> ids = new ArrayList<>(confident.size());
                        int[] labels = new int[confident.size()];
                        for (int c = 0; c < labels.length; ++c) {
                            ids.add(subsample.get(confident.get(c)));
                            labels[c] = predicted[confident.get(c)];
                            pseudoLabel(ids.get(c), labels[c]);
                        }
                        learner.fit(Matrices.concat(labeledX, Matrices.rows(unlabeledX, ids)),
                                Matrices.concat(labeledY, labels));
                        refitSize = labels.length;
                        accepted += labels.length;
                    }
                }
                record(IterationEvent.learner(engineName(), iteration, i, labeledX.length + refitSize,
                        unlabeledX.length, refitSize)
                        .with("error", error)
                        .with("weight", weight));
                errors[i] = error;
                weights[i] = weight;
            }
            record(IterationEvent.iteration(engineName(), iteration, labeledX.length, unlabeledX.length, accepted));
            ++iteration;
        }

        record(IterationEvent.finished(engineName(), iteration, labeledX.length, unlabeledX.length));
        setHypotheses(pool.getLearners(),
                Collections.nCopies(ensembleSize, Matrices.allColumns(dataset.numFeatures())));
    }

    /** Sum over the labelled set of one minus the probability of the true class; epsilon when 0. */
    protected static double estimateError(TrainableClassifier learner, double[][] X, int[] y) {
        double[][] proba = learner.predictProba(X);
        int[] classes = learner.getClasses();
        double error = 0;
        for (int j = 0; j < y.length; ++j) {
            int index = Statistics.indexOf(classes, y[j]);
            error += 1 - (index < 0 ? 0 : proba[j][index]);
        }
        return error == 0 ? Statistics.EPSILON : error;
    }
}
