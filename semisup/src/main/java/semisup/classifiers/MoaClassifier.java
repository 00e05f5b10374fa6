package semisup.classifiers;

import java.util.ArrayList;
import java.util.List;

import com.yahoo.labs.samoa.instances.Attribute;
import com.yahoo.labs.samoa.instances.DenseInstance;
import com.yahoo.labs.samoa.instances.Instance;
import com.yahoo.labs.samoa.instances.Instances;
import com.yahoo.labs.samoa.instances.InstancesHeader;

import moa.classifiers.Classifier;
import moa.core.ObjectRepository;
import moa.options.AbstractOptionHandler;
import moa.options.ClassOption;
import moa.tasks.TaskMonitor;
import semisup.core.NotFittedException;
import semisup.core.Statistics;
import semisup.core.TrainableClassifier;

/**
 * Batch {@link TrainableClassifier} backed by an incremental MOA {@link Classifier}.
 *
 * <p>Every call to {@link #fit(double[][], int[])} trains a fresh copy of the configured learner
 * instance by instance. Features become numeric attributes and the class becomes a nominal
 * attribute whose values are the sorted labels.</p>
 */
public class MoaClassifier extends AbstractOptionHandler implements TrainableClassifier {

    private static final long serialVersionUID = 1L;

    public ClassOption learnerOption = new ClassOption("learner", 'l',
            "Classifier to train.", Classifier.class, "bayes.NaiveBayes");

    protected Classifier model;

    protected InstancesHeader header;

    protected int[] classes;

    protected Integer randomSeed;

    public MoaClassifier() {
    }

    /** Adapter around a copy of an already configured learner. */
    public MoaClassifier(Classifier learner) {
        this.learnerOption.setCurrentObject(learner);
    }

    @Override
    public String getPurposeString() {
        return "Trains a MOA classifier in batch on feature arrays.";
    }

    @Override
    protected void prepareForUseImpl(TaskMonitor monitor, ObjectRepository repository) {
        // the learner option is materialised by prepareClassOptions, models are built by fit
    }

    @Override
    public MoaClassifier fit(double[][] X, int[] y) {
        if (X.length != y.length) {
            throw new IllegalArgumentException("X and y must have the same number of rows");
        }
        Classifier prototype = prototype();
        int[] labels = Statistics.uniqueSorted(y);
        int numFeatures = X.length == 0 ? 0 : X[0].length;
        InstancesHeader context = buildHeader(numFeatures, labels);

        Classifier learner = (Classifier) prototype.copy();
        if (this.randomSeed != null && learner.isRandomizable()) {
            learner.setRandomSeed(this.randomSeed);
        }
        learner.prepareForUse();
        learner.setModelContext(context);
        learner.resetLearning();
        for (int i = 0; i < X.length; ++i) {
            Instance instance = toInstance(X[i], context);
            instance.setClassValue(Statistics.indexOf(labels, y[i]));
            learner.trainOnInstance(instance);
        }

        this.model = learner;
        this.header = context;
        this.classes = labels;
        return this;
    }

    @Override
    public double[][] predictProba(double[][] X) {
        checkFitted();
        double[][] proba = new double[X.length][];
        for (int i = 0; i < X.length; ++i) {
            Instance instance = toInstance(X[i], this.header);
            instance.setMissing(instance.classIndex());
            proba[i] = Statistics.normalizeVotes(this.model.getVotesForInstance(instance), this.classes.length);
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
        return this.model != null;
    }

    @Override
    public boolean isRandomizable() {
        return prototype().isRandomizable();
    }

    @Override
    public void setRandomSeed(int seed) {
        this.randomSeed = seed;
    }

    /** The MOA model trained by the last fit, {@code null} before. */
    public Classifier getModel() {
        return this.model;
    }

    @Override
    public MoaClassifier copy() {
        return (MoaClassifier) super.copy();
    }

    @Override
    public void getDescription(StringBuilder sb, int indent) {
        sb.append("MoaClassifier(").append(this.learnerOption.getValueAsCLIString()).append(')');
        if (isFitted()) {
            sb.append(" classes=").append(this.classes.length)
                    .append(" features=").append(this.header.numAttributes() - 1);
        }
    }

    private Classifier prototype() {
        Classifier prototype = (Classifier) getPreparedClassOption(this.learnerOption);
        if (prototype == null) {
            prepareForUse();
            prototype = (Classifier) getPreparedClassOption(this.learnerOption);
        }
        return prototype;
    }

    private void checkFitted() {
        if (!isFitted()) {
            throw new NotFittedException("This MoaClassifier instance is not fitted yet.");
        }
    }

    private static InstancesHeader buildHeader(int numFeatures, int[] labels) {
        List<Attribute> attributes = new ArrayList<>(numFeatures + 1);
        for (int j = 0; j < numFeatures; ++j) {
            attributes.add(new Attribute("att" + (j + 1)));
        }
        List<String> classValues = new ArrayList<>(labels.length);
        for (int label : labels) {
            classValues.add(String.valueOf(label));
        }
        attributes.add(new Attribute("class", classValues));
        Instances dataset = new Instances("semisup", attributes, 0);
        dataset.setClassIndex(dataset.numAttributes() - 1);
        return new InstancesHeader(dataset);
    }

    private static Instance toInstance(double[] x, InstancesHeader context) {
        double[] values = new double[x.length + 1];
        System.arraycopy(x, 0, values, 0, x.length);
        DenseInstance instance = new DenseInstance(1.0, values);
        instance.setDataset(context);
        return instance;
    }
}
