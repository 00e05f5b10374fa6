package semisup.core;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.util.MathArrays;

/**
 * Unlabeled instances addressed by stable identifiers (their row in the original unlabeled
 * matrix). Removing instances never renumbers the others.
 */
public class UnlabeledPool implements Serializable {

    private static final long serialVersionUID = 1L;

    private final double[][] instances;
    private final List<Integer> remaining;

    public UnlabeledPool(double[][] instances) {
        this.instances = instances;
        this.remaining = new ArrayList<>(instances.length);
        for (int id = 0; id < instances.length; ++id) {
            this.remaining.add(id);
        }
    }

    public int size() {
        return this.remaining.size();
    }

    public boolean isEmpty() {
        return this.remaining.isEmpty();
    }

    /** Identifiers still in the pool, in insertion order. */
    public List<Integer> ids() {
        return Collections.unmodifiableList(new ArrayList<>(this.remaining));
    }

    public double[] get(int id) {
        return this.instances[id];
    }

    public double[][] rows(List<Integer> ids) {
        double[][] rows = new double[ids.size()][];
        for (int i = 0; i < rows.length; ++i) {
            rows[i] = this.instances[ids.get(i)];
        }
        return rows;
    }

    /**
     * Uniform sample without replacement. The sample size is clamped to the pool size.
     */
    public List<Integer> sample(int size, RandomGenerator random) {
        int[] positions = MathArrays.natural(this.remaining.size());
        MathArrays.shuffle(positions, random);
        int n = Math.min(size, positions.length);
        List<Integer> sample = new ArrayList<>(n);
        for (int i = 0; i < n; ++i) {
            sample.add(this.remaining.get(positions[i]));
        }
        return sample;
    }

    public void removeAll(Collection<Integer> ids) {
        Set<Integer> toRemove = new HashSet<>(ids);
        this.remaining.removeIf(toRemove::contains);
    }
}
