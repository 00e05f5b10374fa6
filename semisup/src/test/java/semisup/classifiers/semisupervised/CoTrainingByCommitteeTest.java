package semisup.classifiers.semisupervised;

import static org.junit.Assert.*;

import java.util.List;

import org.junit.Test;

import semisup.core.Dataset;
import semisup.core.IterationEvent;
import semisup.core.ListIterationTrace;
import semisup.core.MockLearners;
import semisup.core.ToyData;

public class CoTrainingByCommitteeTest {

    private static CoTrainingByCommittee committee() {
        CoTrainingByCommittee committee = new CoTrainingByCommittee();
        committee.ensembleLearnerOption.setCurrentObject(new MockLearners.NearestCentroid());
        committee.poolSizeOption.setValue(10);
        committee.minInstancesForClassOption.setValue(1);
        return committee;
    }

    @Test
    public void testUnlimitedIterationsLabelEverything() {
        ToyData.Data data = ToyData.blobs(3, 20, 2, 2, 8.0, 11);
        ListIterationTrace trace = new ListIterationTrace();
        CoTrainingByCommittee committee = committee();
        committee.maxIterationsOption.setValue(-1);
        committee.fit(data.X, data.y, trace);

        for (int label : committee.getTransduction()) {
            assertNotEquals(Dataset.UNLABELED, label);
        }
        assertTrue(ToyData.pseudoLabelAccuracy(data, committee.getTransduction()) >= 0.9);
        for (IterationEvent event : trace.getEvents(IterationEvent.Kind.ITERATION)) {
            assertTrue(event.getAccepted() > 0);
            assertTrue(event.getAccepted() <= 10);
        }
        List<IterationEvent> finished = trace.getEvents(IterationEvent.Kind.FINISHED);
        assertEquals(0, finished.get(0).getUnlabeledSize());
    }

    @Test
    public void testOneIteration() {
        ToyData.Data data = ToyData.blobs(3, 20, 2, 2, 8.0, 12);
        ListIterationTrace trace = new ListIterationTrace();
        CoTrainingByCommittee committee = committee();
        committee.maxIterationsOption.setValue(1);
        committee.minInstancesForClassOption.setValue(0);
        committee.fit(data.X, data.y, trace);

        List<IterationEvent> iterations = trace.getEvents(IterationEvent.Kind.ITERATION);
        assertEquals(1, iterations.size());
        // a third of the window for each of the three classes
        assertTrue(iterations.get(0).getAccepted() <= 9);
        assertTrue(iterations.get(0).getAccepted() > 0);
        assertEquals(iterations.get(0).getAccepted(), ToyData.countPseudoLabeled(data, committee.getTransduction()));
        assertEquals(6 + iterations.get(0).getAccepted(), iterations.get(0).getLabeledSize());
    }

    @Test
    public void testEnsembleIsRefitOnEveryIteration() {
        ToyData.Data data = ToyData.blobs(2, 20, 2, 2, 8.0, 13);
        CoTrainingByCommittee committee = committee();
        committee.maxIterationsOption.setValue(3);
        committee.fit(data.X, data.y);

        MockLearners.NearestCentroid ensemble = (MockLearners.NearestCentroid) committee.getHypotheses().get(0);
        assertEquals(4, ensemble.getFitCount());
    }

    @Test
    public void testSameSeedSameResult() {
        ToyData.Data data = ToyData.blobs(2, 30, 2, 2, 3.0, 14);
        CoTrainingByCommittee first = committee();
        CoTrainingByCommittee second = committee();
        first.fit(data.X, data.y);
        second.fit(data.X, data.y);
        assertArrayEquals(first.getTransduction(), second.getTransduction());
    }

    @Test(timeout = 10000)
    public void testStopsWhenNoInstanceIsAccepted() {
        // a window of one instance with two balanced classes gives a quota of zero to both
        ToyData.Data data = ToyData.blobs(2, 20, 2, 2, 8.0, 11);
        ListIterationTrace trace = new ListIterationTrace();
        CoTrainingByCommittee committee = committee();
        committee.poolSizeOption.setValue(1);
        committee.minInstancesForClassOption.setValue(0);
        committee.maxIterationsOption.setValue(-1);
        committee.fit(data.X, data.y, trace);

        assertEquals(0, ToyData.countPseudoLabeled(data, committee.getTransduction()));
        assertTrue(trace.getEvents(IterationEvent.Kind.ITERATION).isEmpty());
        assertEquals(1, trace.getEvents(IterationEvent.Kind.CONVERGENCE_WARNING).size());
        IterationEvent finished = trace.getEvents(IterationEvent.Kind.FINISHED).get(0);
        assertEquals(0, finished.getIteration());
        assertEquals(data.numUnlabeled(), finished.getUnlabeledSize());
        assertTrue(committee.isFitted());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testZeroIterations() {
        ToyData.Data data = ToyData.blobs(2, 5, 2, 2, 8.0, 15);
        CoTrainingByCommittee committee = committee();
        committee.maxIterationsOption.setValue(0);
        committee.fit(data.X, data.y);
    }
}
