package semisup.core;

import java.util.Arrays;
import java.util.Comparator;

/**
 * Euclidean k-nearest-neighbour graph with distance-valued edges. A point is never its own
 * neighbour.
 */
public final class NeighborhoodGraph {

    private NeighborhoodGraph() {
    }

    public static double euclidean(double[] a, double[] b) {
        double sum = 0;
        for (int i = 0; i < a.length; ++i) {
            double d = a[i] - b[i];
            sum += d * d;
        }
        return Math.sqrt(sum);
    }

    /**
     * Rows {@code firstRow..n-1} of the kNN distance graph over {@code points}: entry
     * {@code [r][j]} is the distance from point {@code firstRow + r} to point {@code j} when
     * {@code j} is one of its {@code k} nearest neighbours, 0 otherwise. Ties are broken by
     * the lower index.
     */
    public static double[][] distanceGraph(double[][] points, int k, int firstRow) {
        int n = points.length;
        int neighbours = Math.min(k, n - 1);
        double[][] graph = new double[Math.max(0, n - firstRow)][n];
        for (int r = firstRow; r < n; ++r) {
            final double[] distances = new double[n];
            Integer[] order = new Integer[n - 1];
            int o = 0;
            for (int j = 0; j < n; ++j) {
                distances[j] = euclidean(points[r], points[j]);
                if (j != r) {
                    order[o++] = j;
                }
            }
            Arrays.sort(order, Comparator.<Integer>comparingDouble(j -> distances[j]).thenComparingInt(j -> j));
            for (int i = 0; i < neighbours; ++i) {
                graph[r - firstRow][order[i]] = distances[order[i]];
            }
        }
        return graph;
    }

    /**
     * Same layout as {@link #distanceGraph(double[][], int, int)} with each distance replaced
     * by its inverse. Zero distances stay at zero weight.
     */
    public static double[][] inverseDistanceWeights(double[][] points, int k, int firstRow) {
        double[][] graph = distanceGraph(points, k, firstRow);
        for (double[] row : graph) {
            for (int j = 0; j < row.length; ++j) {
                row[j] = row[j] != 0 ? 1.0 / row[j] : 0.0;
            }
        }
        return graph;
    }
}
