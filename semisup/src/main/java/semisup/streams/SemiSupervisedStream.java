package semisup.streams;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import com.github.javacliparser.FloatOption;
import com.github.javacliparser.IntOption;
import com.yahoo.labs.samoa.instances.Instance;
import com.yahoo.labs.samoa.instances.InstancesHeader;
import org.apache.commons.math3.random.MersenneTwister;
import org.apache.commons.math3.random.RandomGenerator;

import moa.core.Example;
import moa.core.InstanceExample;
import moa.core.ObjectRepository;
import moa.options.AbstractOptionHandler;
import moa.options.ClassOption;
import moa.streams.InstanceStream;
import moa.tasks.TaskMonitor;
import semisup.core.Dataset;

/**
 * This stream is a wrapper that takes any stream generator and
 * removes the label of randomly selected instances.
 *
 * <p>{@link #collect(int)} turns a prefix of the stream into the sentinel-labelled arrays the
 * engines are fitted on, keeping the hidden labels aside for evaluation.</p>
 */
public class SemiSupervisedStream extends AbstractOptionHandler implements InstanceStream {

    private static final long serialVersionUID = 1L;

    /** The stream generator to be wrapped up */
    private InstanceStream stream;

    public ClassOption streamOption = new ClassOption("stream", 's',
            "Stream generator to simulate semi-supervised setting", InstanceStream.class,
            "generators.SEAGenerator");

    /** Option: Probability of having a label */
    public FloatOption thresholdOption = new FloatOption("threshold", 't',
            "Probability that an instance keeps its label", 0.5, 0.0, 1.0);

    public IntOption initialWindowSizeOption = new IntOption("initialTrainingWindow", 'p',
            "Number of instances at the beginning of the stream that always keep their label.",
            1000, 0, Integer.MAX_VALUE);

    public IntOption instanceRandomSeedOption = new IntOption(
            "instanceRandomSeed", 'i',
            "Seed for the random choice of the unlabelled instances.", 1);

    /** Decides which instances lose their label. MT19937, so results match across platforms. */
    private RandomGenerator random;

    private double threshold;

    private long instancesProcessed = 0;

    /** Class of the last instance returned, before masking. */
    private double lastClassValue;

    private boolean lastMasked;

    @Override
    public String getPurposeString() {
        return "A wrapper that takes any stream generator and " +
                "removes the label of randomly selected instances to simulate semi-supervised setting";
    }

    @Override
    protected void prepareForUseImpl(TaskMonitor monitor, ObjectRepository repository) {
        this.threshold = this.thresholdOption.getValue();
        this.instancesProcessed = 0;
        this.stream = (InstanceStream) getPreparedClassOption(this.streamOption);
        this.random = new MersenneTwister(this.instanceRandomSeedOption.getValue());
    }

    @Override
    public InstancesHeader getHeader() {
        Objects.requireNonNull(this.stream, "The stream must not be null");
        return this.stream.getHeader();
    }

    @Override
    public long estimatedRemainingInstances() {
        Objects.requireNonNull(this.stream, "The stream must not be null");
        return this.stream.estimatedRemainingInstances();
    }

    @Override
    public boolean hasMoreInstances() {
        Objects.requireNonNull(this.stream, "The stream must not be null");
        return this.stream.hasMoreInstances();
    }

    @Override
    public Example<Instance> nextInstance() {
        Objects.requireNonNull(this.stream, "The stream must not be null");
        ++this.instancesProcessed;

        Example<Instance> inst = this.stream.nextInstance();
        this.lastClassValue = inst.getData().classValue();
        this.lastMasked = false;

        // the first instances keep their label; afterwards a draw at or above the threshold
        // hides it, so the threshold is the ratio of labelled data
        if (this.instancesProcessed > this.initialWindowSizeOption.getValue()
                && this.random.nextDouble() >= this.threshold) {
            InstanceExample instEx = new InstanceExample(inst.getData().copy());
            instEx.instance.setMissing(instEx.instance.classIndex());
            this.lastMasked = true;
            return instEx;
        }
        return inst;
    }

    /** Whether the last instance returned by {@link #nextInstance()} had its label removed. */
    public boolean lastInstanceMasked() {
        return this.lastMasked;
    }

    /**
     * Reads up to {@code limit} instances (all remaining ones if negative). Features are the
     * non-class attribute values; the label is the index of the class value, or
     * {@link Dataset#UNLABELED} when it was removed.
     */
    public Sample collect(int limit) {
        Objects.requireNonNull(this.stream, "The stream must not be null");
        List<double[]> features = new ArrayList<>();
        List<Integer> labels = new ArrayList<>();
        List<Integer> trueLabels = new ArrayList<>();
        while (hasMoreInstances() && (limit < 0 || features.size() < limit)) {
            Instance instance = nextInstance().getData();
            double[] x = new double[instance.numAttributes() - 1];
            for (int j = 0, k = 0; j < instance.numAttributes(); ++j) {
                if (j != instance.classIndex()) {
                    x[k++] = instance.value(j);
                }
            }
            features.add(x);
            trueLabels.add((int) this.lastClassValue);
            labels.add(this.lastMasked ? Dataset.UNLABELED : (int) this.lastClassValue);
        }
        double[][] X = features.toArray(new double[0][]);
        int[] y = new int[labels.size()];
        int[] trueY = new int[labels.size()];
        for (int i = 0; i < y.length; ++i) {
            y[i] = labels.get(i);
            trueY[i] = trueLabels.get(i);
        }
        return new Sample(X, y, trueY);
    }

    @Override
    public boolean isRestartable() {
        Objects.requireNonNull(this.stream, "The stream must not be null");
        return this.stream.isRestartable();
    }

    @Override
    public void restart() {
        Objects.requireNonNull(this.stream, "The stream must not be null");
        this.stream.restart();
        this.instancesProcessed = 0;
        this.random = new MersenneTwister(this.instanceRandomSeedOption.getValue());
    }

    @Override
    public void getDescription(StringBuilder sb, int indent) {
        sb.append("SemiSupervisedStream(").append(this.streamOption.getValueAsCLIString())
                .append(", threshold=").append(this.thresholdOption.getValue()).append(')');
    }

    /**
     * Materialised prefix of the stream.
     */
    public static class Sample implements Serializable {

        private static final long serialVersionUID = 1L;

        private final double[][] X;
        private final int[] y;
        private final int[] trueY;

        public Sample(double[][] X, int[] y, int[] trueY) {
            this.X = X;
            this.y = y;
            this.trueY = trueY;
        }

        public double[][] getX() {
            return X;
        }

        /** Labels with {@link Dataset#UNLABELED} for the masked instances. */
        public int[] getY() {
            return y;
        }

        /** Labels before masking. */
        public int[] getTrueY() {
            return trueY;
        }

        public int numUnlabeled() {
            int count = 0;
            for (int label : y) {
                if (label == Dataset.UNLABELED) {
                    ++count;
                }
            }
            return count;
        }
    }
}
