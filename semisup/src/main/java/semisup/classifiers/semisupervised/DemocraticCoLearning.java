package semisup.classifiers.semisupervised;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.github.javacliparser.FlagOption;
import com.github.javacliparser.FloatOption;
import com.github.javacliparser.IntOption;
import com.github.javacliparser.ListOption;
import com.github.javacliparser.MultiChoiceOption;
import com.github.javacliparser.Option;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import moa.core.ObjectRepository;
import moa.options.ClassOption;
import moa.options.OptionHandler;
import moa.tasks.TaskMonitor;
import semisup.core.ConfidenceMethod;
import semisup.core.Dataset;
import semisup.core.IterationEvent;
import semisup.core.LabeledSet;
import semisup.core.LearnerPool;
import semisup.core.Matrices;
import semisup.core.Statistics;
import semisup.core.TrainableClassifier;

/**
 * Democratic co-learning.
 *
 * <p>Y. Zhou and S. Goldman, "Democratic co-learning," ICTAI 2004.</p>
 *
 * <p>A committee of different classifiers votes on the unlabelled instances. When the plurality
 * vote and the vote weighted by each member's confidence agree, the members that disagree with
 * the committee are offered the instance with the committee's label. A member accepts its new
 * instances only if the estimated quality of its enlarged training set improves.</p>
 */
public class DemocraticCoLearning extends AbstractSemiSupervisedEngine {

    private static final long serialVersionUID = 1L;

    private static final Logger logger = LogManager.getLogger(DemocraticCoLearning.class);

    public ListOption baseLearnersOption = new ListOption("baseLearners", 'b',
            "Classifiers of the committee.",
            new ClassOption("learner", ' ', "", TrainableClassifier.class, "semisup.classifiers.MoaClassifier"),
            new Option[]{
                    new ClassOption("", ' ', "", TrainableClassifier.class,
                            "semisup.classifiers.MoaClassifier -l trees.HoeffdingTree"),
                    new ClassOption("", ' ', "", TrainableClassifier.class,
                            "semisup.classifiers.MoaClassifier -l bayes.NaiveBayes"),
                    new ClassOption("", ' ', "", TrainableClassifier.class,
                            "semisup.classifiers.MoaClassifier -l (lazy.kNN -k 3)")},
            ',');

    public ClassOption baseLearnerOption = new ClassOption("baseLearner", 'l',
            "Classifier cloned ensembleSize times when ensembleSize is set.", TrainableClassifier.class,
            "semisup.classifiers.MoaClassifier -l trees.HoeffdingTree");

    public IntOption ensembleSizeOption = new IntOption("ensembleSize", 's',
            "Number of clones of baseLearner forming the committee (-1 = use baseLearners).",
            -1, -1, Integer.MAX_VALUE);

    public FlagOption expandAgreementsOption = new FlagOption("expandAgreements", 'e',
            "Also offer instances on which every member agrees, not only the mislabelled ones.");

    public MultiChoiceOption confidenceMethodOption = new MultiChoiceOption("confidenceMethod", 'c',
            "Interval estimate of the accuracy of a member.",
            new String[]{"bernoulli", "wilson", "agresti_coull", "beta", "jeffreys"},
            new String[]{"Normal approximation", "Wilson score", "Agresti-Coull", "Clopper-Pearson", "Jeffreys"}, 0);

    public FloatOption alphaOption = new FloatOption("alpha", 'a',
            "Confidence level of the intervals.", 0.95, 0.0, 1.0);

    protected List<TrainableClassifier> committee;

    protected List<TrainableClassifier> providedLearners;

    protected double[] confidences;

    @Override
    public String getPurposeString() {
        return "Democratic co-learning of a committee of different classifiers.";
    }

    /**
     * Committee used by the next fits instead of {@link #baseLearnersOption}. Each fit works on
     * copies of these classifiers.
     */
    public void setBaseLearners(List<? extends TrainableClassifier> learners) {
        this.providedLearners = learners == null ? null : new ArrayList<>(learners);
    }

    @Override
    protected void prepareForUseImpl(TaskMonitor monitor, ObjectRepository repository) {
        if (this.providedLearners != null) {
            this.committee = new ArrayList<>(this.providedLearners);
            return;
        }
        Option[] learnerOptions = this.baseLearnersOption.getList();
        this.committee = new ArrayList<>(learnerOptions.length);
        for (Option option : learnerOptions) {
            Object learner = ((ClassOption) option).materializeObject(monitor, repository);
            if (learner instanceof OptionHandler) {
                ((OptionHandler) learner).prepareForUse(monitor, repository);
            }
            this.committee.add((TrainableClassifier) learner);
        }
    }

    protected ConfidenceMethod confidenceMethod() {
        return ConfidenceMethod.fromName(this.confidenceMethodOption.getChosenLabel());
    }

    @Override
    protected void fitImpl(Dataset dataset) {
        ConfidenceMethod method = confidenceMethod();
        double alpha = this.alphaOption.getValue();
        boolean expandOnlyMislabeled = !this.expandAgreementsOption.isSet();
        LearnerPool pool = buildCommittee();
        int n = pool.size();
        checkPositive("number of learners", n);

        double[][] labeledX = dataset.getLabeledX();
        int[] labeledY = dataset.getLabeledY();
        double[][] unlabeledX = dataset.getUnlabeledX();
        LabeledSet[] L = new LabeledSet[n];
        List<Set<Integer>> added = new ArrayList<>(n);
        double[] e = new double[n];
        for (int i = 0; i < n; ++i) {
            L[i] = new LabeledSet(labeledX, labeledY);
            added.add(new HashSet<>());
        }

        boolean changed = true;
        int iteration = 0;
        while (changed) {
            changed = false;
            for (int i = 0; i < n; ++i) {
                pool.get(i).fit(L[i].features(), L[i].labels());
            }

            int[][] predictions = new int[n][];
            double[] weights = new double[n];
            for (int i = 0; i < n; ++i) {
                predictions[i] = pool.get(i).predict(unlabeledX);
                weights[i] = method.weight(pool.get(i), labeledX, labeledY, alpha);
            }
            int[] majorityClass = majorityVote(predictions);
            int[] ponderateClass = weightedVote(predictions, weights);

            boolean[] allSame = new boolean[unlabeledX.length];
            for (int u = 0; u < unlabeledX.length; ++u) {
                allSame[u] = true;
                for (int i = 1; i < n && allSame[u]; ++i) {
                    allSame[u] = predictions[i][u] == predictions[i - 1][u];
                }
            }

            List<List<Integer>> proposals = new ArrayList<>(n);
            for (int i = 0; i < n; ++i) {
                List<Integer> proposal = new ArrayList<>();
                for (int u = 0; u < unlabeledX.length; ++u) {
                    boolean candidate = ponderateClass[u] == majorityClass[u] && predictions[i][u] != ponderateClass[u];
                    if (!expandOnlyMislabeled) {
                        candidate = candidate || allSame[u];
                    }
                    if (candidate && !added.get(i).contains(u)) {
                        proposal.add(u);
                    }
                }
                proposals.add(proposal);
            }

            // lower bounds are taken on each member's own training set, before it grows
            double lowerBoundSum = 0;
            for (int i = 0; i < n; ++i) {
                lowerBoundSum += method.interval(pool.get(i), L[i].features(), L[i].labels(), alpha)[0];
            }
            double errorFactor = 1 - lowerBoundSum / n;

            int accepted = 0;
            for (int i = 0; i < n; ++i) {
                List<Integer> proposal = proposals.get(i);
                if (proposal.isEmpty()) {
                    record(IterationEvent.learner(engineName(), iteration, i, L[i].size(), unlabeledX.length, 0));
                    continue;
                }
                int size = L[i].size();
                double q = quality(size, e[i]);
                double newError = errorFactor * proposal.size();
                double newQ = quality(size + proposal.size(), e[i] + newError);
                boolean accept = newQ > q;
                if (accept) {
                    for (int u : proposal) {
                        L[i].add(unlabeledX[u], ponderateClass[u]);
                        pseudoLabel(u, ponderateClass[u]);
                    }
                    added.get(i).addAll(proposal);
                    e[i] += newError;
                    accepted += proposal.size();
                    changed = true;
                }
                record(IterationEvent.learner(engineName(), iteration, i, L[i].size(), unlabeledX.length,
                        accept ? proposal.size() : 0)
                        .with("q", q)
                        .with("qNew", newQ)
                        .with("errorNew", newError)
                        .with("error", e[i]));
            }
            record(IterationEvent.iteration(engineName(), iteration, totalSize(L), unlabeledX.length, accepted));
            ++iteration;
        }

        double[] finalConfidences = new double[n];
        List<TrainableClassifier> kept = new ArrayList<>();
        List<Double> keptConfidences = new ArrayList<>();
        for (int i = 0; i < n; ++i) {
            finalConfidences[i] = method.weight(pool.get(i), labeledX, labeledY, alpha);
            if (finalConfidences[i] > 0.5) {
                kept.add(pool.get(i));
                keptConfidences.add(finalConfidences[i]);
            }
        }
        if (kept.isEmpty()) {
            record(IterationEvent.warning(engineName(), iteration,
                    "no learner has a confidence above 0.5, predictions will be uniform"));
        }
        this.confidences = new double[keptConfidences.size()];
        for (int i = 0; i < this.confidences.length; ++i) {
            this.confidences[i] = keptConfidences.get(i);
        }
        record(IterationEvent.finished(engineName(), iteration, totalSize(L), unlabeledX.length));
        setHypotheses(kept, Collections.nCopies(kept.size(), Matrices.allColumns(dataset.numFeatures())));
    }

    private LearnerPool buildCommittee() {
        int ensembleSize = this.ensembleSizeOption.getValue();
        if (ensembleSize > 0) {
            TrainableClassifier prototype = preparedLearner(this.baseLearnerOption);
            if (!prototype.isRandomizable()) {
                record(IterationEvent.warning(engineName(), 0, "the base learner is not randomizable,"
                        + " the " + ensembleSize + " clones will be identical"));
            }
            return LearnerPool.ofClones(prototype, ensembleSize, this.random);
        }
        if (this.committee == null || this.committee.isEmpty()) {
            throw new IllegalArgumentException("No base learners configured");
        }
        logger.debug("Committee of {} learners", this.committee.size());
        return LearnerPool.of(this.committee);
    }

    /** |L| (1 - 2 e / |L|)^2 */
    protected static double quality(int size, double error) {
        double factor = 1 - 2 * error / size;
        return size * factor * factor;
    }

    /** Plurality vote of the members; ties go to the smallest label. */
    protected static int[] majorityVote(int[][] predictions) {
        int numInstances = predictions.length == 0 ? 0 : predictions[0].length;
        int[] votes = new int[numInstances];
        for (int u = 0; u < numInstances; ++u) {
            int[] column = new int[predictions.length];
            for (int i = 0; i < predictions.length; ++i) {
                column[i] = predictions[i][u];
            }
            Arrays.sort(column);
            int best = column[0];
            int bestCount = 0;
            for (int start = 0; start < column.length; ) {
                int end = start;
                while (end < column.length && column[end] == column[start]) {
                    ++end;
                }
                if (end - start > bestCount) {
                    bestCount = end - start;
                    best = column[start];
                }
                start = end;
            }
            votes[u] = best;
        }
        return votes;
    }

    /** Label with the largest sum of member weights; ties go to the smallest label. */
    protected int[] weightedVote(int[][] predictions, double[] weights) {
        int numInstances = predictions.length == 0 ? 0 : predictions[0].length;
        int[] votes = new int[numInstances];
        for (int u = 0; u < numInstances; ++u) {
            double[] sums = new double[this.classes.length];
            for (int i = 0; i < predictions.length; ++i) {
                sums[Statistics.indexOf(this.classes, predictions[i][u])] += weights[i];
            }
            int best = 0;
            for (int c = 1; c < sums.length; ++c) {
                if (sums[c] > sums[best]) {
                    best = c;
                }
            }
            votes[u] = this.classes[best];
        }
        return votes;
    }

    private static int totalSize(LabeledSet[] sets) {
        int total = 0;
        for (LabeledSet set : sets) {
            total += set.size();
        }
        return total;
    }

    /**
     * Softmax over the classes of the continuity-corrected mean confidence of the members
     * predicting each class; a class nobody predicts scores 0.5.
     */
    @Override
    public double[][] predictProba(double[][] X) {
        checkFitted();
        double[][] proba = new double[X.length][];
        if (this.hypotheses.isEmpty()) {
            for (int i = 0; i < X.length; ++i) {
                proba[i] = Statistics.normalizeVotes(null, this.classes.length);
            }
            return proba;
        }
        int[][] predictions = new int[this.hypotheses.size()][];
        for (int h = 0; h < predictions.length; ++h) {
            predictions[h] = this.hypotheses.get(h).predict(X);
        }
        for (int i = 0; i < X.length; ++i) {
            double[] sums = new double[this.classes.length];
            int[] sizes = new int[this.classes.length];
            for (int h = 0; h < predictions.length; ++h) {
                int c = Statistics.indexOf(this.classes, predictions[h][i]);
                sums[c] += this.confidences[h];
                ++sizes[c];
            }
            double[] scores = new double[this.classes.length];
            for (int c = 0; c < scores.length; ++c) {
                scores[c] = sizes[c] == 0 ? 0.5 : (sizes[c] + 0.5) / (sizes[c] + 1) * sums[c] / sizes[c];
            }
            proba[i] = Statistics.softmax(scores);
        }
        return proba;
    }

    /** Confidence of each member kept in the final committee, in the order of the hypotheses. */
    public double[] getConfidences() {
        checkFitted();
        return this.confidences.clone();
    }
}
