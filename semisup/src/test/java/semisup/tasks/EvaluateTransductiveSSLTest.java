package semisup.tasks;

import static org.junit.Assert.*;

import java.util.HashMap;
import java.util.Map;

import org.junit.Test;

import moa.core.Measurement;
import moa.evaluation.LearningEvaluation;
import semisup.classifiers.semisupervised.SelfTraining;

public class EvaluateTransductiveSSLTest {

    private static Map<String, Double> measurements(LearningEvaluation evaluation) {
        Map<String, Double> values = new HashMap<>();
        for (Measurement measurement : evaluation.getMeasurements()) {
            values.put(measurement.getName(), measurement.getValue());
        }
        return values;
    }

    @Test
    public void testSelfTrainingOnSEA() {
        EvaluateTransductiveSSL task = new EvaluateTransductiveSSL();
        task.streamOption.setValueViaCLIString("semisup.streams.SemiSupervisedStream -s generators.SEAGenerator -t 0.3 -p 50");
        SelfTraining engine = new SelfTraining();
        engine.thresholdOption.setValue(0.9);
        task.engineOption.setCurrentObject(engine);
        task.instanceLimitOption.setValue(400);

        Object result = task.doTask();
        assertTrue(result instanceof LearningEvaluation);
        Map<String, Double> values = measurements((LearningEvaluation) result);

        double labeled = values.get(EvaluateTransductiveSSL.LABELED);
        double unlabeled = values.get(EvaluateTransductiveSSL.UNLABELED);
        assertEquals(400.0, labeled + unlabeled, 0.0);
        // the first 50 instances keep their label, then only 30% of them
        assertTrue(labeled >= 50);
        assertTrue(unlabeled > 150);
        assertTrue(values.get(EvaluateTransductiveSSL.PSEUDO_LABELED) <= unlabeled);
        double accuracy = values.get(EvaluateTransductiveSSL.TRANSDUCTIVE_ACCURACY);
        assertTrue(accuracy >= 0.0 && accuracy <= 1.0);
        assertTrue(values.get(EvaluateTransductiveSSL.FIT_TIME) >= 0.0);
    }

    @Test
    public void testDefaultOptions() {
        Object result = new EvaluateTransductiveSSL().doTask();
        assertTrue(result instanceof LearningEvaluation);
        Map<String, Double> values = measurements((LearningEvaluation) result);

        double labeled = values.get(EvaluateTransductiveSSL.LABELED);
        double unlabeled = values.get(EvaluateTransductiveSSL.UNLABELED);
        assertEquals(1000.0, labeled + unlabeled, 0.0);
        assertTrue(labeled >= 100);
        assertTrue(unlabeled > 0);
        assertTrue(values.get(EvaluateTransductiveSSL.PSEUDO_LABELED) <= unlabeled);
    }

    @Test
    public void testResultType() {
        assertEquals(LearningEvaluation.class, new EvaluateTransductiveSSL().getTaskResultType());
    }
}
