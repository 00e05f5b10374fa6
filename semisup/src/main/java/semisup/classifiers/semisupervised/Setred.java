package semisup.classifiers.semisupervised;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.SortedMap;

import com.github.javacliparser.FloatOption;
import com.github.javacliparser.IntOption;
import org.apache.commons.math3.distribution.NormalDistribution;

import moa.options.ClassOption;
import semisup.core.Dataset;
import semisup.core.IterationEvent;
import semisup.core.LabeledSet;
import semisup.core.Matrices;
import semisup.core.NeighborhoodGraph;
import semisup.core.Statistics;
import semisup.core.TrainableClassifier;
import semisup.core.UnlabeledPool;

/**
 * Self-training with editing (SETRED).
 *
 * <p>Li, Ming, and Zhi-Hua Zhou. "SETRED: Self-training with editing." PAKDD 2005.</p>
 *
 * <p>Every iteration the base classifier labels a random sample of the unlabelled pool. The
 * most confident predictions are checked against their neighbourhood in a kNN graph built over
 * the labelled set and the candidates: a candidate is kept only when the weighted number of
 * neighbours disagreeing with it is not significantly high.</p>
 */
public class Setred extends AbstractSemiSupervisedEngine {

    private static final long serialVersionUID = 1L;

    public ClassOption baseLearnerOption = new ClassOption("baseLearner", 'l',
            "Classifier to self-train.", TrainableClassifier.class,
            "semisup.classifiers.MoaClassifier -l (lazy.kNN -k 3)");

    public IntOption maxIterationsOption = new IntOption("maxIterations", 'i',
            "Number of iterations.", 40, 1, Integer.MAX_VALUE);

    public FloatOption poolSizeOption = new FloatOption("poolSize", 'p',
            "Fraction of the remaining unlabelled instances sampled as candidates at each iteration.",
            0.25, 0.0, 1.0);

    public FloatOption rejectionThresholdOption = new FloatOption("rejectionThreshold", 't',
            "Significance level of the neighbourhood test.", 0.05, 0.0, 1.0);

    public IntOption graphNeighborsOption = new IntOption("graphNeighbors", 'k',
            "Number of neighbours of each candidate in the kNN graph.", 1, 1, Integer.MAX_VALUE);

    @Override
    public String getPurposeString() {
        return "Self-training with editing of the pseudo-labels through a neighbourhood cut-edge test.";
    }

    @Override
    protected void fitImpl(Dataset dataset) {
        int maxIterations = this.maxIterationsOption.getValue();
        double poolSize = this.poolSizeOption.getValue();
        double rejectionThreshold = this.rejectionThresholdOption.getValue();
        int graphNeighbors = this.graphNeighborsOption.getValue();
        checkPositive("maxIterations", maxIterations);
        checkPositive("poolSize", poolSize);
        checkPositive("graphNeighbors", graphNeighbors);

        TrainableClassifier learner = preparedLearner(this.baseLearnerOption).copy();
        if (learner.isRandomizable()) {
            learner.setRandomSeed(this.random.nextInt());
        }
        LabeledSet labeled = new LabeledSet(dataset.getLabeledX(), dataset.getLabeledY());
        UnlabeledPool pool = new UnlabeledPool(dataset.getUnlabeledX());
        int candidatesPerIteration = dataset.numLabeled();
        SortedMap<Integer, Double> prior = Statistics.priorProbability(dataset.getLabeledY());

        int iteration = 0;
        for (; iteration < maxIterations; ++iteration) {
            learner.fit(labeled.features(), labeled.labels());

            int sampleSize = Math.min(pool.size(), (int) Math.floor(pool.size() * poolSize));
            if (sampleSize == 0) {
                break;
            }
            List<Integer> sample = pool.sample(sampleSize, this.random);
            double[][] proba = learner.predictProba(pool.rows(sample));
            double[] confidences = Statistics.maxOfRows(proba);
            int[] predicted = Statistics.argMaxLabels(proba, learner.getClasses());
            int[] top = Statistics.topIndices(confidences, candidatesPerIteration);

            List<Integer> candidateIds = new ArrayList<>(top.length);
            int[] candidateLabels = new int[top.length];
            for (int i = 0; i < top.length; ++i) {
                candidateIds.add(sample.get(top[i]));
                candidateLabels[i] = predicted[top[i]];
            }
            double[][] points = Matrices.concat(labeled.features(), pool.rows(candidateIds));
            double[][] weights = NeighborhoodGraph.inverseDistanceWeights(points, graphNeighbors, labeled.size());

            List<Integer> accepted = new ArrayList<>();
            int belowMean = 0;
            for (int r = 0; r < candidateIds.size(); ++r) {
                double pWrong = 1.0 - prior.getOrDefault(candidateLabels[r], 0.0);
                CutEdgeTest test = cutEdgeTest(weights[r], pWrong);
                if (test.z < test.mean) {
                    ++belowMean;
                }
                if (test.survival < rejectionThreshold && test.z < test.mean) {
                    accepted.add(r);
                }
            }

            List<Integer> acceptedIds = new ArrayList<>(accepted.size());
            for (int r : accepted) {
                int id = candidateIds.get(r);
                labeled.add(pool.get(id), candidateLabels[r]);
                pseudoLabel(id, candidateLabels[r]);
                acceptedIds.add(id);
            }
            pool.removeAll(acceptedIds);
            record(IterationEvent.iteration(engineName(), iteration, labeled.size(), pool.size(), acceptedIds.size())
                    .with("candidates", candidateIds.size())
                    .with("belowMean", belowMean));
        }

        learner.fit(labeled.features(), labeled.labels());
        record(IterationEvent.finished(engineName(), iteration, labeled.size(), pool.size()));
        setHypotheses(Collections.singletonList(learner),
                Collections.singletonList(Matrices.allColumns(dataset.numFeatures())));
    }

    /**
     * Observed weighted cut-edge statistic of one candidate against its expectation when the
     * labels of its neighbours are drawn independently with probability {@code pWrong} of
     * disagreeing.
     */
    protected CutEdgeTest cutEdgeTest(double[] weights, double pWrong) {
        double sum = 0;
        double squareSum = 0;
        double observed = 0;
        for (double w : weights) {
            if (w == 0) {
                continue;
            }
            sum += w;
            squareSum += w * w;
            if (this.random.nextDouble() < pWrong) {
                observed += w;
            }
        }
        double mean = pWrong * sum;
        double sd = Math.sqrt(pWrong * (1 - pWrong) * squareSum);
        CutEdgeTest test = new CutEdgeTest();
        test.mean = mean;
        if (sd == 0) {
            test.z = 0;
            test.survival = 0;
        } else {
            test.z = (observed - mean) / sd;
            test.survival = 1.0 - new NormalDistribution(null, mean, sd).cumulativeProbability(Math.abs(test.z));
        }
        return test;
    }

    protected static class CutEdgeTest {
        double mean;
        double z;
        double survival;
    }
}
