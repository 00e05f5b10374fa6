package semisup.core;

import java.util.List;

/**
 * Row/column selection helpers over row-major matrices.
 */
public final class Matrices {

    private Matrices() {
    }

    public static double[][] columns(double[][] X, int[] columns) {
        double[][] projected = new double[X.length][columns.length];
        for (int i = 0; i < X.length; ++i) {
            for (int j = 0; j < columns.length; ++j) {
                projected[i][j] = X[i][columns[j]];
            }
        }
        return projected;
    }

    public static double[][] rows(double[][] X, int[] rows) {
        double[][] selected = new double[rows.length][];
        for (int i = 0; i < rows.length; ++i) {
            selected[i] = X[rows[i]];
        }
        return selected;
    }

    public static double[][] rows(double[][] X, List<Integer> rows) {
        double[][] selected = new double[rows.size()][];
        for (int i = 0; i < selected.length; ++i) {
            selected[i] = X[rows.get(i)];
        }
        return selected;
    }

    public static int[] select(int[] y, List<Integer> rows) {
        int[] selected = new int[rows.size()];
        for (int i = 0; i < selected.length; ++i) {
            selected[i] = y[rows.get(i)];
        }
        return selected;
    }

    public static double[][] concat(double[][] a, double[][] b) {
        double[][] joined = new double[a.length + b.length][];
        System.arraycopy(a, 0, joined, 0, a.length);
        System.arraycopy(b, 0, joined, a.length, b.length);
        return joined;
    }

    public static int[] concat(int[] a, int[] b) {
        int[] joined = new int[a.length + b.length];
        System.arraycopy(a, 0, joined, 0, a.length);
        System.arraycopy(b, 0, joined, a.length, b.length);
        return joined;
    }

    /** 0, 1, ..., n - 1 */
    public static int[] allColumns(int n) {
        int[] columns = new int[n];
        for (int i = 0; i < n; ++i) {
            columns[i] = i;
        }
        return columns;
    }
}
