package com.auditsentinel.core.detection.model;

import org.apache.commons.math3.ml.clustering.Cluster;
import org.apache.commons.math3.ml.clustering.Clusterable;
import org.apache.commons.math3.ml.clustering.DBSCANClusterer;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Density-based clustering (DBSCAN) with Euclidean distance, on top of the
 * commons-math {@link DBSCANClusterer}.
 *
 * <p>
 * A point is a core point when at least {@code minSamples} points, itself
 * included, lie within {@code eps}. Clusters grow from core points; points
 * reachable from no core point are labelled {@value #NOISE}.
 * </p>
 *
 * @since 1.0.0
 */
public final class Dbscan {

    /** Label assigned to points outside every dense region. */
    public static final int NOISE = -1;

    private final double eps;
    private final int minSamples;

    public Dbscan(double eps, int minSamples) {
        if (!(eps > 0)) {
            throw new IllegalArgumentException("eps must be > 0, got: " + eps);
        }
        if (minSamples < 1) {
            throw new IllegalArgumentException("minSamples must be >= 1, got: " + minSamples);
        }
        this.eps = eps;
        this.minSamples = minSamples;
    }

    /**
     * Cluster {@code data}.
     *
     * @param data rows of equal length
     * @return one label per row: a cluster index from 0, or {@link #NOISE}
     */
    public int[] fit(double[][] data) {
        List<IndexedPoint> points = new ArrayList<>(data.length);
        for (int i = 0; i < data.length; i++) {
            points.add(new IndexedPoint(i, data[i]));
        }

        // commons-math does not count the point itself among its neighbours
        DBSCANClusterer<IndexedPoint> clusterer = new DBSCANClusterer<>(eps, minSamples - 1);
        List<Cluster<IndexedPoint>> clusters = clusterer.cluster(points);

        int[] labels = new int[data.length];
        Arrays.fill(labels, NOISE);
        for (int c = 0; c < clusters.size(); c++) {
            for (IndexedPoint point : clusters.get(c).getPoints()) {
                labels[point.index] = c;
            }
        }
        return labels;
    }

    public double getEps() {
        return eps;
    }

    public int getMinSamples() {
        return minSamples;
    }

    /**
     * Row wrapper with identity equality, so that duplicate rows stay
     * separate points for the clusterer.
     */
    private static final class IndexedPoint implements Clusterable {

        private final int index;
        private final double[] coordinates;

        private IndexedPoint(int index, double[] coordinates) {
            this.index = index;
            this.coordinates = coordinates;
        }

        @Override
        public double[] getPoint() {
            return coordinates;
        }
    }
}
