package semisup.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.apache.commons.math3.random.RandomGenerator;

/**
 * Fixed-size collection of independent classifiers. Each slot owns its classifier: pools built
 * from one prototype hold clones, never shared instances.
 *
 * <p>Parallel fits share one thread pool, started by the first parallel {@link #fitAll} and
 * stopped by {@link #close()}.</p>
 */
public class LearnerPool implements AutoCloseable {

    private final List<TrainableClassifier> learners;

    private ExecutorService executor;

    protected LearnerPool(List<TrainableClassifier> learners) {
        this.learners = learners;
    }

    /**
     * {@code size} clones of {@code prototype}. Randomizable clones get a seed drawn from
     * {@code random}, in slot order, so that the pool is reproducible for a given stream.
     */
    public static LearnerPool ofClones(TrainableClassifier prototype, int size, RandomGenerator random) {
        List<TrainableClassifier> learners = new ArrayList<>(size);
        for (int i = 0; i < size; ++i) {
            TrainableClassifier clone = prototype.copy();
            if (clone.isRandomizable()) {
                clone.setRandomSeed(random.nextInt());
            }
            learners.add(clone);
        }
        return new LearnerPool(learners);
    }

    /** Pool holding a copy of each of the given classifiers. */
    public static LearnerPool of(List<? extends TrainableClassifier> classifiers) {
        List<TrainableClassifier> learners = new ArrayList<>(classifiers.size());
        for (TrainableClassifier classifier : classifiers) {
            learners.add(classifier.copy());
        }
        return new LearnerPool(learners);
    }

    public TrainableClassifier get(int index) {
        return this.learners.get(index);
    }

    public int size() {
        return this.learners.size();
    }

    public List<TrainableClassifier> getLearners() {
        return Collections.unmodifiableList(this.learners);
    }

    /**
     * Fits learner {@code i} on {@code (X.get(i), y.get(i))}; slots whose data is {@code null}
     * are left untouched. With more than one job the fits run on the pool's thread pool, which
     * is kept for the following calls. Workers only touch their own classifier.
     *
     * @param numberOfJobs -1 for one job per available processor, 0 or 1 to fit on the calling thread
     * @throws IllegalStateException if a fit fails or the calling thread is interrupted
     */
    public void fitAll(List<double[][]> X, List<int[]> y, int numberOfJobs) {
        List<FitCallable> trainers = new ArrayList<>();
        for (int i = 0; i < this.learners.size(); ++i) {
            if (X.get(i) != null) {
                trainers.add(new FitCallable(this.learners.get(i), X.get(i), y.get(i)));
            }
        }
        int jobs = numberOfJobs == -1 ? Runtime.getRuntime().availableProcessors() : numberOfJobs;
        if (jobs == 0 || jobs == 1 || trainers.size() <= 1) {
            for (FitCallable trainer : trainers) {
                trainer.call();
            }
            return;
        }

        if (this.executor == null) {
            this.executor = Executors.newFixedThreadPool(Math.min(jobs, this.learners.size()));
        }
        try {
            for (Future<TrainableClassifier> future : this.executor.invokeAll(trainers)) {
                future.get();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Could not call invokeAll() on training threads.", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Could not fit learner.", e.getCause());
        }
    }

    /** Fits every learner on the same data. */
    public void fitAll(double[][] X, int[] y, int numberOfJobs) {
        fitAll(Collections.nCopies(this.learners.size(), X), Collections.nCopies(this.learners.size(), y),
                numberOfJobs);
    }

    /**
     * Stops the training threads. The learners stay usable; a later parallel fit starts a new
     * thread pool.
     */
    @Override
    public void close() {
        if (this.executor != null) {
            this.executor.shutdownNow();
            this.executor = null;
        }
    }

    /** Whether a thread pool is running. */
    public boolean hasRunningExecutor() {
        return this.executor != null;
    }

    /***
     * Fit of one slot, run on a worker thread.
     */
    protected static class FitCallable implements Callable<TrainableClassifier> {
        private final TrainableClassifier learner;
        private final double[][] X;
        private final int[] y;

        public FitCallable(TrainableClassifier learner, double[][] X, int[] y) {
            this.learner = learner;
            this.X = X;
            this.y = y;
        }

        @Override
        public TrainableClassifier call() {
            return this.learner.fit(this.X, this.y);
        }
    }
}
