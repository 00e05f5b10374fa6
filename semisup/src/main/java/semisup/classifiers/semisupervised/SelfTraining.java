package semisup.classifiers.semisupervised;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.github.javacliparser.FloatOption;
import com.github.javacliparser.IntOption;

import moa.options.ClassOption;
import semisup.core.Dataset;
import semisup.core.IterationEvent;
import semisup.core.LabeledSet;
import semisup.core.Matrices;
import semisup.core.Statistics;
import semisup.core.TrainableClassifier;
import semisup.core.UnlabeledPool;

/**
 * Threshold self-training: every unlabelled instance predicted with a probability of at least
 * {@link #thresholdOption} joins the labelled set with its predicted class.
 */
public class SelfTraining extends AbstractSemiSupervisedEngine {

    private static final long serialVersionUID = 1L;

    public ClassOption baseLearnerOption = new ClassOption("baseLearner", 'l',
            "Classifier to self-train.", TrainableClassifier.class,
            "semisup.classifiers.MoaClassifier -l bayes.NaiveBayes");

    public FloatOption thresholdOption = new FloatOption("threshold", 't',
            "Minimum probability of a pseudo-label.", 0.75, 0.0, 1.0);

    public IntOption maxIterationsOption = new IntOption("maxIterations", 'i',
            "Maximum number of iterations (-1 = until nothing is added).", 10, -1, Integer.MAX_VALUE);

    @Override
    public String getPurposeString() {
        return "Self-training with a fixed confidence threshold.";
    }

    @Override
    protected void fitImpl(Dataset dataset) {
        double threshold = this.thresholdOption.getValue();
        int maxIterations = this.maxIterationsOption.getValue();
        if (maxIterations == 0 || maxIterations < -1) {
            throw new IllegalArgumentException("maxIterations must be positive or -1, got " + maxIterations);
        }

        TrainableClassifier learner = preparedLearner(this.baseLearnerOption).copy();
        if (learner.isRandomizable()) {
            learner.setRandomSeed(this.random.nextInt());
        }
        LabeledSet labeled = new LabeledSet(dataset.getLabeledX(), dataset.getLabeledY());
        UnlabeledPool pool = new UnlabeledPool(dataset.getUnlabeledX());

        int iteration = 0;
        while ((maxIterations == -1 || iteration < maxIterations) && !pool.isEmpty()) {
            learner.fit(labeled.features(), labeled.labels());
            List<Integer> ids = pool.ids();
            double[][] proba = learner.predictProba(pool.rows(ids));
            double[] confidences = Statistics.maxOfRows(proba);
            int[] predicted = Statistics.argMaxLabels(proba, learner.getClasses());

            List<Integer> acceptedIds = new ArrayList<>();
            for (int i = 0; i < ids.size(); ++i) {
                if (confidences[i] >= threshold) {
                    labeled.add(pool.get(ids.get(i)), predicted[i]);
                    pseudoLabel(ids.get(i), predicted[i]);
                    acceptedIds.add(ids.get(i));
                }
            }
            pool.removeAll(acceptedIds);
            record(IterationEvent.iteration(engineName(), iteration, labeled.size(), pool.size(), acceptedIds.size()));
            ++iteration;
            if (acceptedIds.isEmpty()) {
                break;
            }
        }

        learner.fit(labeled.features(), labeled.labels());
        record(IterationEvent.finished(engineName(), iteration, labeled.size(), pool.size()));
        setHypotheses(Collections.singletonList(learner),
                Collections.singletonList(Matrices.allColumns(dataset.numFeatures())));
    }
}
