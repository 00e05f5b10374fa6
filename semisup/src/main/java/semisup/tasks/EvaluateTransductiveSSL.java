package semisup.tasks;

import com.github.javacliparser.IntOption;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import moa.core.Measurement;
import moa.core.ObjectRepository;
import moa.core.TimingUtils;
import moa.evaluation.LearningEvaluation;
import moa.options.ClassOption;
import moa.tasks.MainTask;
import moa.tasks.TaskMonitor;
import semisup.classifiers.semisupervised.AbstractSemiSupervisedEngine;
import semisup.core.Dataset;
import semisup.streams.SemiSupervisedStream;

/**
 * An evaluation task that reads a prefix of a semi-supervised stream, fits a semi-supervised
 * engine on it and scores the pseudo-labels given to the instances whose label was removed.
 * The accuracy is measured over the pseudo-labelled instances only.
 */
public class EvaluateTransductiveSSL extends MainTask {

    private static final long serialVersionUID = 1L;

    private static final Logger logger = LogManager.getLogger(EvaluateTransductiveSSL.class);

    public static final String LABELED = "labeled instances";
    public static final String UNLABELED = "unlabeled instances";
    public static final String PSEUDO_LABELED = "pseudo-labeled instances";
    public static final String TRANSDUCTIVE_ACCURACY = "transductive accuracy";
    public static final String FIT_TIME = "fit time (seconds)";

    @Override
    public String getPurposeString() {
        return "Evaluates a semi-supervised engine by the accuracy of the labels it assigns " +
                "to the unlabeled part of a stream prefix.";
    }

    public ClassOption streamOption = new ClassOption("stream", 's',
            "Semi-supervised stream to read the instances from. Its initial training window must be "
                    + "shorter than the instance limit.", SemiSupervisedStream.class,
            "semisup.streams.SemiSupervisedStream -p 100");

    public ClassOption engineOption = new ClassOption("engine", 'l',
            "Semi-supervised engine to fit.", AbstractSemiSupervisedEngine.class,
            "semisup.classifiers.semisupervised.SelfTraining");

    public IntOption instanceLimitOption = new IntOption("instanceLimit", 'i',
            "Number of instances read from the stream (-1 = no limit).", 1000, -1, Integer.MAX_VALUE);

    @Override
    protected Object doMainTask(TaskMonitor monitor, ObjectRepository repository) {
        SemiSupervisedStream stream = (SemiSupervisedStream) getPreparedClassOption(this.streamOption);
        AbstractSemiSupervisedEngine engine = (AbstractSemiSupervisedEngine) getPreparedClassOption(this.engineOption);

        monitor.setCurrentActivity("Reading instances...", -1.0);
        SemiSupervisedStream.Sample sample = stream.collect(this.instanceLimitOption.getValue());
        if (monitor.taskShouldAbort()) {
            return null;
        }

        monitor.setCurrentActivity("Fitting " + this.engineOption.getValueAsCLIString() + "...", -1.0);
        TimingUtils.enablePreciseTiming();
        long start = TimingUtils.getNanoCPUTimeOfCurrentThread();
        engine.fit(sample.getX(), sample.getY());
        double fitTime = TimingUtils.nanoTimeToSeconds(TimingUtils.getNanoCPUTimeOfCurrentThread() - start);

        int[] y = sample.getY();
        int[] trueY = sample.getTrueY();
        int[] transduction = engine.getTransduction();
        int unlabeled = 0;
        int pseudoLabeled = 0;
        int correct = 0;
        for (int i = 0; i < y.length; ++i) {
            if (y[i] != Dataset.UNLABELED) {
                continue;
            }
            ++unlabeled;
            if (transduction[i] != Dataset.UNLABELED) {
                ++pseudoLabeled;
                if (transduction[i] == trueY[i]) {
                    ++correct;
                }
            }
        }
        double accuracy = pseudoLabeled == 0 ? 0.0 : (double) correct / pseudoLabeled;
        logger.info("{} on {} instances: {} pseudo-labels, accuracy {}", engine.getClass().getSimpleName(),
                y.length, pseudoLabeled, accuracy);

        return new LearningEvaluation(new Measurement[]{
                new Measurement(LABELED, y.length - unlabeled),
                new Measurement(UNLABELED, unlabeled),
                new Measurement(PSEUDO_LABELED, pseudoLabeled),
                new Measurement(TRANSDUCTIVE_ACCURACY, accuracy),
                new Measurement(FIT_TIME, fitTime)
        });
    }

    @Override
    public Class<?> getTaskResultType() {
        return LearningEvaluation.class;
    }
}
