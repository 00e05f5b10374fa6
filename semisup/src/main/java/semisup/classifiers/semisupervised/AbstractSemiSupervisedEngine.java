package semisup.classifiers.semisupervised;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.github.javacliparser.IntOption;
import org.apache.commons.math3.random.MersenneTwister;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import moa.core.ObjectRepository;
import moa.options.AbstractOptionHandler;
import moa.options.ClassOption;
import moa.tasks.TaskMonitor;
import semisup.core.Dataset;
import semisup.core.DatasetPartitioner;
import semisup.core.IterationEvent;
import semisup.core.IterationTrace;
import semisup.core.Matrices;
import semisup.core.NotFittedException;
import semisup.core.Statistics;
import semisup.core.TrainableClassifier;

/**
 * Base class of the batch semi-supervised engines.
 *
 * <p>An engine is configured through MOA options, fitted on a sentinel-labelled dataset
 * (rows labelled {@link Dataset#UNLABELED} are unlabelled) and then behaves as a
 * {@link TrainableClassifier} itself: by default its prediction averages the probabilities of
 * its hypotheses, each one applied to its own column view.</p>
 *
 * <p>All state is reset by every call to {@code fit}. The random stream is a single
 * {@link MersenneTwister} seeded with {@link #randomSeedOption}.</p>
 */
public abstract class AbstractSemiSupervisedEngine extends AbstractOptionHandler implements TrainableClassifier {

    private static final long serialVersionUID = 1L;

    private static final Logger logger = LogManager.getLogger(AbstractSemiSupervisedEngine.class);

    public IntOption randomSeedOption = new IntOption("randomSeed", 'r',
            "Seed for the random stream of the engine.", 1);

    protected List<TrainableClassifier> hypotheses;

    protected List<int[]> columns;

    protected int[] classes;

    /** Labels of the fitted rows: the original labels plus the accepted pseudo-labels. */
    protected int[] transduction;

    protected Dataset data;

    protected RandomGenerator random;

    protected transient IterationTrace trace = IterationTrace.NONE;

    @Override
    protected void prepareForUseImpl(TaskMonitor monitor, ObjectRepository repository) {
        // nothing to materialise besides the class options
    }

    @Override
    public AbstractSemiSupervisedEngine fit(double[][] X, int[] y) {
        return fit(X, y, IterationTrace.NONE);
    }

    /**
     * Fits the engine, reporting every iteration to {@code trace}.
     *
     * @param X features of labelled and unlabelled rows
     * @param y labels, {@link Dataset#UNLABELED} for unlabelled rows
     * @throws IllegalArgumentException on inconsistent configuration or data
     */
    public AbstractSemiSupervisedEngine fit(double[][] X, int[] y, IterationTrace trace) {
        Dataset dataset = DatasetPartitioner.split(X, y);
        prepareForUse();
        reset(dataset, y, trace);
        long start = System.nanoTime();
        fitImpl(dataset);
        logger.info("{} fitted in {} ms: {} labelled rows, {} unlabelled rows, {} hypotheses",
                getClass().getSimpleName(), (System.nanoTime() - start) / 1_000_000,
                dataset.numLabeled(), dataset.numUnlabeled(), this.hypotheses.size());
        return this;
    }

    /** Clears the previous fit and sets up the per-fit state. */
    protected void reset(Dataset dataset, int[] y, IterationTrace trace) {
        this.data = dataset;
        this.trace = trace == null ? IterationTrace.NONE : trace;
        this.random = new MersenneTwister(this.randomSeedOption.getValue());
        this.classes = Statistics.uniqueSorted(dataset.getLabeledY());
        this.transduction = y.clone();
        this.hypotheses = null;
        this.columns = null;
    }

    /**
     * Runs the engine on {@code dataset}. Implementations must call
     * {@link #setHypotheses(List, List)} before returning.
     */
    protected abstract void fitImpl(Dataset dataset);

    protected void setHypotheses(List<TrainableClassifier> hypotheses, List<int[]> columns) {
        this.hypotheses = new ArrayList<>(hypotheses);
        this.columns = new ArrayList<>(columns);
    }

    /** Records the pseudo-label given to the unlabelled row {@code unlabeledId}. */
    protected void pseudoLabel(int unlabeledId, int label) {
        this.transduction[this.data.getUnlabeledIndices()[unlabeledId]] = label;
    }

    protected void record(IterationEvent event) {
        if (event.getKind() == IterationEvent.Kind.CONVERGENCE_WARNING) {
            logger.warn("{}: {}", event.getEngine(), event.getMessage());
        } else if (logger.isDebugEnabled()) {
            logger.debug(event);
        }
        this.trace.record(event);
    }

    protected static void checkPositive(String name, double value) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive, got " + value);
        }
    }

    protected String engineName() {
        return getClass().getSimpleName();
    }

    /** The prepared object of a {@link ClassOption} holding a {@link TrainableClassifier}. */
    protected TrainableClassifier preparedLearner(ClassOption option) {
        return (TrainableClassifier) getPreparedClassOption(option);
    }

    @Override
    public double[][] predictProba(double[][] X) {
        checkFitted();
        double[][] proba = new double[X.length][this.classes.length];
        for (int h = 0; h < this.hypotheses.size(); ++h) {
            TrainableClassifier hypothesis = this.hypotheses.get(h);
            double[][] p = Statistics.alignColumns(hypothesis.predictProba(Matrices.columns(X, this.columns.get(h))),
                    hypothesis.getClasses(), this.classes);
            for (int i = 0; i < X.length; ++i) {
                for (int c = 0; c < this.classes.length; ++c) {
                    proba[i][c] += p[i][c];
                }
            }
        }
        for (double[] row : proba) {
            for (int c = 0; c < row.length; ++c) {
                row[c] /= this.hypotheses.size();
            }
        }
        return proba;
    }

    @Override
    public int[] getClasses() {
        checkFitted();
        return this.classes.clone();
    }

    @Override
    public boolean isFitted() {
        return this.hypotheses != null;
    }

    @Override
    public boolean isRandomizable() {
        return true;
    }

    @Override
    public void setRandomSeed(int seed) {
        this.randomSeedOption.setValue(seed);
    }

    public List<TrainableClassifier> getHypotheses() {
        checkFitted();
        return Collections.unmodifiableList(this.hypotheses);
    }

    /** Column view of each hypothesis, in the order of {@link #getHypotheses()}. */
    public List<int[]> getColumns() {
        checkFitted();
        return Collections.unmodifiableList(this.columns);
    }

    /**
     * Labels of the rows given to the last fit: original labels, pseudo-labels of the
     * unlabelled rows that were accepted, {@link Dataset#UNLABELED} for the others.
     */
    public int[] getTransduction() {
        checkFitted();
        return this.transduction.clone();
    }

    protected void checkFitted() {
        if (!isFitted()) {
            throw new NotFittedException("This " + engineName() + " instance is not fitted yet.");
        }
    }

    @Override
    public AbstractSemiSupervisedEngine copy() {
        return (AbstractSemiSupervisedEngine) super.copy();
    }

    @Override
    public void getDescription(StringBuilder sb, int indent) {
        sb.append(engineName());
        if (isFitted()) {
            sb.append(": ").append(this.hypotheses.size()).append(" hypotheses over ")
                    .append(this.classes.length).append(" classes");
        }
    }
}
