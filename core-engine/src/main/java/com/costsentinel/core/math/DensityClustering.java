package com.costsentinel.core.math;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * DBSCAN over points of any dimensionality, using Euclidean distance.
 *
 * <p>
 * A point with at least {@code minPoints} neighbours (other points within
 * {@code epsilon}) seeds a cluster; the cluster grows breadth-first through every
 * member that is itself a core point. Points reached by no cluster are noise.
 * </p>
 *
 * @since 1.0.0
 */
public final class DensityClustering {

    /** Label of points that belong to no cluster. */
    public static final int NOISE = -1;

    private final double epsilon;
    private final int minPoints;

    /**
     * @param epsilon   neighbourhood radius; must be {@code >= 0}
     * @param minPoints neighbours required for a core point; must be {@code >= 1}
     */
    public DensityClustering(double epsilon, int minPoints) {
        if (!(epsilon >= 0)) {
            throw new IllegalArgumentException("epsilon must be >= 0, got: " + epsilon);
        }
        if (minPoints < 1) {
            throw new IllegalArgumentException("minPoints must be >= 1, got: " + minPoints);
        }
        this.epsilon = epsilon;
        this.minPoints = minPoints;
    }

    /**
     * Cluster scalar values, each treated as a one-dimensional point.
     *
     * @param values points; not modified
     * @return cluster assignment
     */
    public Assignment cluster(double[] values) {
        double[][] points = new double[values.length][];
        for (int i = 0; i < values.length; i++) {
            points[i] = new double[] { values[i] };
        }
        return cluster(points);
    }

    /**
     * Cluster feature vectors of equal dimensionality.
     *
     * @param points feature vectors; must not be {@code null}
     * @return cluster assignment
     */
    public Assignment cluster(double[][] points) {
        Objects.requireNonNull(points, "points must not be null");
        int n = points.length;
        int[] labels = new int[n];
        Arrays.fill(labels, NOISE);
        int clusterId = 0;

        for (int i = 0; i < n; i++) {
            if (labels[i] != NOISE) {
                continue;
            }
            List<Integer> neighbours = neighbours(points, i);
            if (neighbours.size() < minPoints) {
                continue;
            }

            labels[i] = clusterId;
            Deque<Integer> queue = new ArrayDeque<>(neighbours);
            while (!queue.isEmpty()) {
                int current = queue.poll();
                if (labels[current] != NOISE) {
                    continue;
                }
                labels[current] = clusterId;
                List<Integer> currentNeighbours = neighbours(points, current);
                if (currentNeighbours.size() >= minPoints) {
                    for (int neighbour : currentNeighbours) {
                        if (labels[neighbour] == NOISE) {
                            queue.add(neighbour);
                        }
                    }
                }
            }
            clusterId++;
        }
        return new Assignment(labels, clusterId);
    }

    private List<Integer> neighbours(double[][] points, int index) {
        List<Integer> result = new ArrayList<>();
        for (int j = 0; j < points.length; j++) {
            if (j != index && distance(points[index], points[j]) <= epsilon) {
                result.add(j);
            }
        }
        return result;
    }

    private static double distance(double[] a, double[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException(
                    "Points must share a dimensionality, got " + a.length + " and " + b.length);
        }
        if (a.length == 1) {
            return Math.abs(a[0] - b[0]);
        }
        double sum = 0;
        for (int d = 0; d < a.length; d++) {
            double diff = a[d] - b[d];
            sum += diff * diff;
        }
        return Math.sqrt(sum);
    }

    /**
     * Result of a clustering pass: one label per input point.
     */
    public static final class Assignment {

        private final int[] labels;
        private final int clusterCount;

        Assignment(int[] labels, int clusterCount) {
            this.labels = labels;
            this.clusterCount = clusterCount;
        }

        public int labelOf(int index) {
            return labels[index];
        }

        public boolean isNoise(int index) {
            return labels[index] == NOISE;
        }

        public int clusterCount() {
            return clusterCount;
        }

        public int size(int clusterId) {
            int count = 0;
            for (int label : labels) {
                if (label == clusterId) {
                    count++;
                }
            }
            return count;
        }

        /**
         * @return id of the cluster with the most members (lowest id on ties), or
         *         {@link #NOISE} when there is no cluster
         */
        public int largestCluster() {
            int best = NOISE;
            int bestSize = 0;
            for (int c = 0; c < clusterCount; c++) {
                int size = size(c);
                if (size > bestSize) {
                    best = c;
                    bestSize = size;
                }
            }
            return best;
        }
    }
}
