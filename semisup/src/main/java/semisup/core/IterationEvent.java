package semisup.core;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One entry of an {@link IterationTrace}: what an engine did during one iteration, or to one
 * learner within an iteration.
 */
public class IterationEvent implements Serializable {

    private static final long serialVersionUID = 1L;

    public enum Kind {
        /** End of an iteration of the main loop. */
        ITERATION,
        /** Decision taken for a single learner within an iteration. */
        LEARNER_UPDATE,
        /** Non-fatal condition, the run continues. */
        CONVERGENCE_WARNING,
        /** End of the fit. */
        FINISHED
    }

    private final String engine;
    private final Kind kind;
    private final int iteration;
    private final int learner;
    private final int labeledSize;
    private final int unlabeledSize;
    private final int accepted;
    private final String message;
    private final Map<String, Double> values = new LinkedHashMap<>();

    public IterationEvent(String engine, Kind kind, int iteration, int learner,
                          int labeledSize, int unlabeledSize, int accepted, String message) {
        this.engine = engine;
        this.kind = kind;
        this.iteration = iteration;
        this.learner = learner;
        this.labeledSize = labeledSize;
        this.unlabeledSize = unlabeledSize;
        this.accepted = accepted;
        this.message = message;
    }

    public static IterationEvent iteration(String engine, int iteration, int labeledSize,
                                           int unlabeledSize, int accepted) {
        return new IterationEvent(engine, Kind.ITERATION, iteration, -1, labeledSize, unlabeledSize, accepted, null);
    }

    public static IterationEvent learner(String engine, int iteration, int learner, int labeledSize,
                                         int unlabeledSize, int accepted) {
        return new IterationEvent(engine, Kind.LEARNER_UPDATE, iteration, learner, labeledSize, unlabeledSize,
                accepted, null);
    }

    public static IterationEvent warning(String engine, int iteration, String message) {
        return new IterationEvent(engine, Kind.CONVERGENCE_WARNING, iteration, -1, -1, -1, 0, message);
    }

    public static IterationEvent finished(String engine, int iterations, int labeledSize, int unlabeledSize) {
        return new IterationEvent(engine, Kind.FINISHED, iterations, -1, labeledSize, unlabeledSize, 0, null);
    }

    /** Attaches a named value (error estimate, quality, weight...). */
    public IterationEvent with(String name, double value) {
        this.values.put(name, value);
        return this;
    }

    public String getEngine() {
        return engine;
    }

    public Kind getKind() {
        return kind;
    }

    public int getIteration() {
        return iteration;
    }

    /** Learner index, -1 for events about the whole engine. */
    public int getLearner() {
        return learner;
    }

    public int getLabeledSize() {
        return labeledSize;
    }

    public int getUnlabeledSize() {
        return unlabeledSize;
    }

    public int getAccepted() {
        return accepted;
    }

    public String getMessage() {
        return message;
    }

    public Map<String, Double> getValues() {
        return Collections.unmodifiableMap(values);
    }

    public Double getValue(String name) {
        return values.get(name);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(engine).append(' ').append(kind).append(" #").append(iteration);
        if (learner >= 0) {
            sb.append(" learner=").append(learner);
        }
        if (kind != Kind.CONVERGENCE_WARNING) {
            sb.append(" |L|=").append(labeledSize).append(" |U|=").append(unlabeledSize)
                    .append(" accepted=").append(accepted);
        }
        if (message != null) {
            sb.append(' ').append(message);
        }
        if (!values.isEmpty()) {
            sb.append(' ').append(values);
        }
        return sb.toString();
    }
}
