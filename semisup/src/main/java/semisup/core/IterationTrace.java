package semisup.core;

/**
 * Caller-supplied sink receiving the per-iteration events of a fit.
 */
@FunctionalInterface
public interface IterationTrace {

    IterationTrace NONE = event -> { };

    void record(IterationEvent event);
}
