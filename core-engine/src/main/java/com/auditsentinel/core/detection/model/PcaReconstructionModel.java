package com.auditsentinel.core.detection.model;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.EigenDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.IntStream;

/**
 * Linear auto-encoder: projects rows onto the top principal components and
 * back, and measures how much is lost.
 *
 * <p>
 * Rows the principal subspace explains poorly have a large reconstruction
 * error. The model is immutable once fitted and may be shared between runs
 * through the {@link ModelRegistry}, provided the feature schema matches.
 * </p>
 *
 * @since 1.0.0
 */
public final class PcaReconstructionModel {

    private final List<String> featureNames;
    private final double[] means;
    private final RealMatrix components;

    private PcaReconstructionModel(List<String> featureNames, double[] means, RealMatrix components) {
        this.featureNames = List.copyOf(featureNames);
        this.means = means;
        this.components = components;
    }

    /**
     * Fit on {@code data}.
     *
     * @param featureNames  schema of the rows
     * @param data          training rows; at least one
     * @param maxComponents number of principal components to keep, at least 1;
     *                      capped at the dimensionality
     * @return the fitted model
     */
    public static PcaReconstructionModel fit(List<String> featureNames, double[][] data, int maxComponents) {
        Objects.requireNonNull(featureNames, "featureNames must not be null");
        Objects.requireNonNull(data, "data must not be null");
        if (data.length == 0) {
            throw new IllegalArgumentException("Cannot fit a reconstruction model on an empty batch");
        }
        if (maxComponents < 1) {
            throw new IllegalArgumentException("components must be >= 1, got: " + maxComponents);
        }
        int n = data.length;
        int d = featureNames.size();

        double[] means = new double[d];
        for (double[] row : data) {
            for (int c = 0; c < d; c++) {
                means[c] += row[c] / n;
            }
        }

        double[][] centred = new double[n][d];
        for (int r = 0; r < n; r++) {
            for (int c = 0; c < d; c++) {
                centred[r][c] = data[r][c] - means[c];
            }
        }
        RealMatrix x = new Array2DRowRealMatrix(centred, false);
        RealMatrix covariance = x.transpose().multiply(x).scalarMultiply(1.0 / Math.max(n - 1, 1));

        EigenDecomposition eigen = new EigenDecomposition(covariance);
        double[] eigenvalues = eigen.getRealEigenvalues();
        int[] order = IntStream.range(0, eigenvalues.length)
                .boxed()
                .sorted(Comparator.comparingDouble((Integer i) -> eigenvalues[i]).reversed())
                .mapToInt(Integer::intValue)
                .toArray();

        int k = Math.min(maxComponents, d);
        RealMatrix basis = new Array2DRowRealMatrix(d, k);
        for (int j = 0; j < k; j++) {
            RealVector v = eigen.getEigenvector(order[j]);
            basis.setColumnVector(j, v);
        }
        return new PcaReconstructionModel(featureNames, means, basis);
    }

    /**
     * Mean squared reconstruction error of every row.
     *
     * @param data rows of the fitted dimensionality
     * @return one error per row, never negative
     */
    public double[] reconstructionErrors(double[][] data) {
        int d = means.length;
        double[] errors = new double[data.length];
        for (int r = 0; r < data.length; r++) {
            double[] centred = new double[d];
            for (int c = 0; c < d; c++) {
                centred[c] = data[r][c] - means[c];
            }
            RealVector row = new ArrayRealVector(centred, false);
            RealVector projected = components.preMultiply(row);
            RealVector reconstructed = components.operate(projected);
            double sum = 0.0;
            for (int c = 0; c < d; c++) {
                double diff = centred[c] - reconstructed.getEntry(c);
                sum += diff * diff;
            }
            errors[r] = d == 0 ? 0.0 : sum / d;
        }
        return errors;
    }

    /**
     * @return {@code true} if this model was fitted on the given feature schema
     */
    public boolean accepts(List<String> schema) {
        return featureNames.equals(schema);
    }

    public List<String> getFeatureNames() {
        return featureNames;
    }

    public int getComponentCount() {
        return components.getColumnDimension();
    }

    @Override
    public String toString() {
        return "PcaReconstructionModel{features=" + featureNames.size()
                + ", components=" + getComponentCount()
                + ", means=" + Arrays.toString(means) + '}';
    }
}
