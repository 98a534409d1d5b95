package com.auditsentinel.core.feature;

import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;

import java.util.Arrays;
import java.util.Objects;

/**
 * Batch statistics shared by the feature builder and the detectors.
 *
 * <p>
 * Percentiles use linear interpolation between closest ranks
 * ({@link Percentile.EstimationType#R_7}), so cutoffs match what analysts get
 * from a spreadsheet or numpy on the same column.
 * </p>
 *
 * @since 1.0.0
 */
public final class FeatureStatistics {

    private FeatureStatistics() {
        // utility class, not instantiable
    }

    public static double mean(double[] values) {
        return values.length == 0 ? 0.0 : StatUtils.mean(values);
    }

    /**
     * @return sample standard deviation, 0 for fewer than two values
     */
    public static double sampleStdDev(double[] values) {
        if (values.length < 2) {
            return 0.0;
        }
        return new StandardDeviation(true).evaluate(values);
    }

    public static double median(double[] values) {
        return percentile(values, 50.0);
    }

    /**
     * @param values  sample, must not be empty
     * @param percent percentile in (0, 100]
     * @return interpolated percentile
     */
    public static double percentile(double[] values, double percent) {
        Objects.requireNonNull(values, "values must not be null");
        if (values.length == 0) {
            throw new IllegalArgumentException("Cannot compute a percentile of an empty sample");
        }
        return new Percentile()
                .withEstimationType(Percentile.EstimationType.R_7)
                .evaluate(values, percent);
    }

    /**
     * Percentile rank of every value within the sample, ties sharing their
     * average rank, scaled to (0, 1].
     */
    public static double[] percentileRanks(double[] values) {
        int n = values.length;
        Integer[] order = new Integer[n];
        for (int i = 0; i < n; i++) {
            order[i] = i;
        }
        Arrays.sort(order, (a, b) -> Double.compare(values[a], values[b]));

        double[] ranks = new double[n];
        int i = 0;
        while (i < n) {
            int j = i;
            while (j + 1 < n && values[order[j + 1]] == values[order[i]]) {
                j++;
            }
            // positions i..j are tied; 1-based ranks i+1..j+1
            double averageRank = (i + j + 2) / 2.0;
            for (int k = i; k <= j; k++) {
                ranks[order[k]] = averageRank / n;
            }
            i = j + 1;
        }
        return ranks;
    }

    /**
     * Scale every column by its median and interquartile range. Columns with a
     * zero IQR are only centred.
     *
     * @param matrix rows of equal length; not modified
     * @return a new scaled matrix
     */
    public static double[][] robustScale(double[][] matrix) {
        if (matrix.length == 0) {
            return new double[0][];
        }
        int columns = matrix[0].length;
        double[][] scaled = new double[matrix.length][columns];
        for (int c = 0; c < columns; c++) {
            double[] column = column(matrix, c);
            double median = median(column);
            double iqr = percentile(column, 75.0) - percentile(column, 25.0);
            double scale = iqr > 0 ? iqr : 1.0;
            for (int r = 0; r < matrix.length; r++) {
                scaled[r][c] = (matrix[r][c] - median) / scale;
            }
        }
        return scaled;
    }

    /**
     * @return the column means of {@code matrix}
     */
    public static double[] columnMeans(double[][] matrix) {
        if (matrix.length == 0) {
            return new double[0];
        }
        double[] means = new double[matrix[0].length];
        for (int c = 0; c < means.length; c++) {
            means[c] = mean(column(matrix, c));
        }
        return means;
    }

    static double[] column(double[][] matrix, int index) {
        double[] column = new double[matrix.length];
        for (int r = 0; r < matrix.length; r++) {
            column[r] = matrix[r][index];
        }
        return column;
    }
}
