package semisup.core;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

import moa.core.Utils;

/**
 * Numeric helpers shared by the engines: priors, guarded divisions, confidence ranking
 * and probability bookkeeping.
 */
public final class Statistics {

    /** Smallest step used to replace a zero denominator. */
    public static final double EPSILON = Math.ulp(1.0);

    private Statistics() {
    }

    /**
     * Relative frequency of each label, keyed by label in ascending order.
     */
    public static SortedMap<Integer, Double> priorProbability(int[] y) {
        SortedMap<Integer, Double> prior = new TreeMap<>();
        for (int label : y) {
            prior.merge(label, 1.0, Double::sum);
        }
        for (Map.Entry<Integer, Double> entry : prior.entrySet()) {
            entry.setValue(entry.getValue() / y.length);
        }
        return prior;
    }

    /** {@code dividend / divisor}, dividing by {@code epsilon} instead of zero. */
    public static double safeDivision(double dividend, double divisor, double epsilon) {
        if (divisor == 0) {
            return dividend / epsilon;
        }
        return dividend / divisor;
    }

    public static int[] uniqueSorted(int[] y) {
        TreeSet<Integer> unique = new TreeSet<>();
        for (int label : y) {
            unique.add(label);
        }
        int[] classes = new int[unique.size()];
        int i = 0;
        for (int label : unique) {
            classes[i++] = label;
        }
        return classes;
    }

    public static int indexOf(int[] classes, int label) {
        int index = Arrays.binarySearch(classes, label);
        return index < 0 ? -1 : index;
    }

    /**
     * Indices sorted by ascending value; equal values keep their original order.
     */
    public static Integer[] argsort(double[] values) {
        Integer[] order = new Integer[values.length];
        for (int i = 0; i < order.length; ++i) {
            order[i] = i;
        }
        Arrays.sort(order, Comparator.comparingDouble(i -> values[i]));
        return order;
    }

    /**
     * The {@code k} indices with the largest values, in ascending order of value.
     */
    public static int[] topIndices(double[] values, int k) {
        Integer[] order = argsort(values);
        int n = Math.max(0, Math.min(k, order.length));
        int[] top = new int[n];
        for (int i = 0; i < n; ++i) {
            top[i] = order[order.length - n + i];
        }
        return top;
    }

    /** Max of each row. */
    public static double[] maxOfRows(double[][] proba) {
        double[] max = new double[proba.length];
        for (int i = 0; i < proba.length; ++i) {
            max[i] = proba[i][Utils.maxIndex(proba[i])];
        }
        return max;
    }

    /** Label of the max of each row. */
    public static int[] argMaxLabels(double[][] proba, int[] classes) {
        int[] labels = new int[proba.length];
        for (int i = 0; i < proba.length; ++i) {
            labels[i] = classes[Utils.maxIndex(proba[i])];
        }
        return labels;
    }

    /**
     * Re-orders the columns of {@code proba} (ordered as {@code from}) into the order of
     * {@code to}. Classes missing from {@code from} get probability zero.
     */
    public static double[][] alignColumns(double[][] proba, int[] from, int[] to) {
        if (Arrays.equals(from, to)) {
            return proba;
        }
        double[][] aligned = new double[proba.length][to.length];
        for (int j = 0; j < from.length; ++j) {
            int target = indexOf(to, from[j]);
            if (target < 0) {
                continue;
            }
            for (int i = 0; i < proba.length; ++i) {
                aligned[i][target] = proba[i][j];
            }
        }
        return aligned;
    }

    /**
     * Picks, for every class of {@code prior}, the most confident instances predicted as
     * that class, as many as the class's share of the instances plus {@code extra}.
     *
     * @param confidences confidence of each prediction
     * @param predicted   predicted label of each instance
     * @param prior       share of each label
     * @param extra       instances added on top of the proportional share
     * @return selected positions, grouped by class
     */
    public static int[] choiceWithProportion(double[] confidences, int[] predicted,
                                             Map<Integer, Double> prior, int extra) {
        int n = confidences.length;
        Integer[] order = argsort(confidences);
        List<Integer> chosen = new ArrayList<>();
        for (Map.Entry<Integer, Double> entry : prior.entrySet()) {
            int quota = (int) (n * entry.getValue()) + extra;
            for (int i = order.length - 1; i >= 0 && quota > 0; --i) {
                if (predicted[order[i]] == entry.getKey()) {
                    chosen.add(order[i]);
                    --quota;
                }
            }
        }
        int[] positions = new int[chosen.size()];
        for (int i = 0; i < positions.length; ++i) {
            positions[i] = chosen.get(i);
        }
        return positions;
    }

    public static double[] softmax(double[] values) {
        double max = values[Utils.maxIndex(values)];
        double[] result = new double[values.length];
        double sum = 0;
        for (int i = 0; i < values.length; ++i) {
            result[i] = Math.exp(values[i] - max);
            sum += result[i];
        }
        for (int i = 0; i < values.length; ++i) {
            result[i] /= sum;
        }
        return result;
    }

    /**
     * Turns raw votes into a probability row of length {@code numClasses}. Missing or
     * all-zero votes give a uniform row.
     */
    public static double[] normalizeVotes(double[] votes, int numClasses) {
        double[] row = new double[numClasses];
        double sum = 0;
        if (votes != null) {
            for (int i = 0; i < Math.min(votes.length, numClasses); ++i) {
                double vote = votes[i];
                if (vote > 0 && !Double.isNaN(vote) && !Double.isInfinite(vote)) {
                    row[i] = vote;
                    sum += vote;
                }
            }
        }
        if (sum <= 0) {
            Arrays.fill(row, 1.0 / numClasses);
            return row;
        }
        for (int i = 0; i < numClasses; ++i) {
            row[i] /= sum;
        }
        return row;
    }
}
