package semisup.core;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.special.Gamma;

/**
 * Mutual information between each continuous feature and a discrete class, estimated with
 * the nearest-neighbour method of Ross (2014), "Mutual Information between Discrete and
 * Continuous Data Sets".
 */
public final class MutualInformation {

    private static final double NOISE_SCALE = 1e-10;

    private MutualInformation() {
    }

    /**
     * Relevance score of every column of {@code X} for the labels {@code y}. Each column is
     * scaled to unit variance and jittered with a tiny amount of noise drawn from
     * {@code random} so that repeated values do not produce degenerate radii.
     */
    public static double[] relevance(double[][] X, int[] y, int neighbours, RandomGenerator random) {
        int numFeatures = X.length == 0 ? 0 : X[0].length;
        double[] scores = new double[numFeatures];
        for (int f = 0; f < numFeatures; ++f) {
            scores[f] = estimate(column(X, f, random), y, neighbours);
        }
        return scores;
    }

    static double estimate(double[] x, int[] y, int neighbours) {
        Map<Integer, Integer> counts = new HashMap<>();
        for (int label : y) {
            counts.merge(label, 1, Integer::sum);
        }
        int n = 0;
        double sumK = 0;
        double sumLabel = 0;
        double sumM = 0;
        for (int i = 0; i < x.length; ++i) {
            int count = counts.get(y[i]);
            if (count <= 1) {
                continue;
            }
            int k = Math.min(neighbours, count - 1);
            double radius = Math.nextDown(kthDistanceWithinClass(x, y, i, k));
            int m = 0;
            for (int j = 0; j < x.length; ++j) {
                if (counts.get(y[j]) > 1 && Math.abs(x[j] - x[i]) <= radius) {
                    ++m;
                }
            }
            ++n;
            sumK += Gamma.digamma(k);
            sumLabel += Gamma.digamma(count);
            sumM += Gamma.digamma(Math.max(m, 1));
        }
        if (n == 0) {
            return 0.0;
        }
        double mi = Gamma.digamma(n) + sumK / n - sumLabel / n - sumM / n;
        return Math.max(0.0, mi);
    }

    private static double kthDistanceWithinClass(double[] x, int[] y, int i, int k) {
        double[] best = new double[k];
        Arrays.fill(best, Double.POSITIVE_INFINITY);
        for (int j = 0; j < x.length; ++j) {
            if (j == i || y[j] != y[i]) {
                continue;
            }
            double d = Math.abs(x[j] - x[i]);
            if (d < best[k - 1]) {
                int pos = k - 1;
                while (pos > 0 && best[pos - 1] > d) {
                    best[pos] = best[pos - 1];
                    --pos;
                }
                best[pos] = d;
            }
        }
        return best[k - 1];
    }

    private static double[] column(double[][] X, int f, RandomGenerator random) {
        double[] values = new double[X.length];
        double mean = 0;
        for (int i = 0; i < X.length; ++i) {
            values[i] = X[i][f];
            mean += values[i];
        }
        mean /= Math.max(1, X.length);
        double variance = 0;
        for (double v : values) {
            variance += (v - mean) * (v - mean);
        }
        double std = Math.sqrt(variance / Math.max(1, X.length));
        double meanAbs = 0;
        for (int i = 0; i < values.length; ++i) {
            if (std > 0) {
                values[i] /= std;
            }
            meanAbs += Math.abs(values[i]);
        }
        meanAbs /= Math.max(1, values.length);
        double noise = NOISE_SCALE * Math.max(1.0, meanAbs);
        for (int i = 0; i < values.length; ++i) {
            values[i] += noise * random.nextGaussian();
        }
        return values;
    }
}
