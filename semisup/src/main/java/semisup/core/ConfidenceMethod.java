package semisup.core;

import org.apache.commons.math3.distribution.BetaDistribution;
import org.apache.commons.math3.distribution.NormalDistribution;

/**
 * Interval estimates for a binomial proportion (the accuracy of a classifier).
 * {@code confidence} is the confidence level, e.g. 0.95.
 */
public enum ConfidenceMethod {

    /** Normal approximation (Wald interval). */
    BERNOULLI {
        @Override
        double[] compute(int successes, int trials, double z, double confidence) {
            double p = (double) successes / trials;
            double half = z * Math.sqrt(p * (1 - p) / trials);
            return clip(p - half, p + half);
        }
    },

    WILSON {
        @Override
        double[] compute(int successes, int trials, double z, double confidence) {
            double p = (double) successes / trials;
            double z2 = z * z;
            double denominator = 1 + z2 / trials;
            double center = (p + z2 / (2.0 * trials)) / denominator;
            double half = z / denominator * Math.sqrt(p * (1 - p) / trials + z2 / (4.0 * trials * trials));
            return clip(center - half, center + half);
        }
    },

    AGRESTI_COULL {
        @Override
        double[] compute(int successes, int trials, double z, double confidence) {
            double z2 = z * z;
            double n = trials + z2;
            double p = (successes + z2 / 2) / n;
            double half = z * Math.sqrt(p * (1 - p) / n);
            return clip(p - half, p + half);
        }
    },

    /** Clopper-Pearson exact interval. */
    BETA {
        @Override
        double[] compute(int successes, int trials, double z, double confidence) {
            double tail = (1 - confidence) / 2;
            double low = successes == 0 ? 0.0
                    : new BetaDistribution(null, successes, trials - successes + 1.0).inverseCumulativeProbability(tail);
            double high = successes == trials ? 1.0
                    : new BetaDistribution(null, successes + 1.0, trials - successes).inverseCumulativeProbability(1 - tail);
            return new double[]{low, high};
        }
    },

    JEFFREYS {
        @Override
        double[] compute(int successes, int trials, double z, double confidence) {
            double tail = (1 - confidence) / 2;
            BetaDistribution posterior = new BetaDistribution(null, successes + 0.5, trials - successes + 0.5);
            double low = successes == 0 ? 0.0 : posterior.inverseCumulativeProbability(tail);
            double high = successes == trials ? 1.0 : posterior.inverseCumulativeProbability(1 - tail);
            return new double[]{low, high};
        }
    };

    private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution(null, 0, 1,
            NormalDistribution.DEFAULT_INVERSE_ABSOLUTE_ACCURACY);

    abstract double[] compute(int successes, int trials, double z, double confidence);

    /**
     * Two-sided interval {low, high} for {@code successes} out of {@code trials}.
     * With no trials nothing is known and the interval is [0, 1].
     */
    public double[] interval(int successes, int trials, double confidence) {
        if (trials <= 0) {
            return new double[]{0.0, 1.0};
        }
        double z = STANDARD_NORMAL.inverseCumulativeProbability(1 - (1 - confidence) / 2);
        return compute(successes, trials, z, confidence);
    }

    /**
     * Interval around the accuracy of {@code classifier} on (X, y).
     */
    public double[] interval(TrainableClassifier classifier, double[][] X, int[] y, double confidence) {
        int[] predicted = classifier.predict(X);
        int successes = 0;
        for (int i = 0; i < y.length; ++i) {
            if (predicted[i] == y[i]) {
                ++successes;
            }
        }
        return interval(successes, y.length, confidence);
    }

    /** Midpoint of {@link #interval(TrainableClassifier, double[][], int[], double)}. */
    public double weight(TrainableClassifier classifier, double[][] X, int[] y, double confidence) {
        double[] bounds = interval(classifier, X, y, confidence);
        return (bounds[0] + bounds[1]) / 2;
    }

    public static ConfidenceMethod fromName(String name) {
        return valueOf(name.trim().toUpperCase().replace('-', '_'));
    }

    private static double[] clip(double low, double high) {
        return new double[]{Math.max(0.0, low), Math.min(1.0, high)};
    }
}
