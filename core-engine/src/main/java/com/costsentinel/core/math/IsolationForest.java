package com.costsentinel.core.math;

import java.util.Random;

/**
 * One-dimensional isolation forest.
 *
 * <p>
 * For every scored value, each of the {@code numTrees} trees draws a subsample
 * without replacement and recursively splits it at a uniform random point between
 * the current minimum and maximum, following the branch that holds the scored
 * value. The generator of tree {@code t} is seeded with
 * {@link SeedStrategy#seedFor(int) seedFor(t)} and drives both the subsample and the
 * split points, so tree {@code t} partitions the data the same way for every
 * scored value.
 * </p>
 *
 * <p>
 * A branch ends when the value is alone, the depth limit is reached, or all
 * remaining values are equal. In the last two cases {@link #averagePathLength(int)}
 * of the remaining size is added to the depth, so a constant series scores
 * {@code 0.5} rather than {@code 1.0}.
 * </p>
 *
 * <p>
 * Score: {@code s(x) = 2^(-E[h(x)] / c(subsampleSize))}, in {@code [0, 1]}.
 * </p>
 *
 * @since 1.0.0
 */
public final class IsolationForest {

    /** Euler–Mascheroni constant. */
    private static final double EULER_GAMMA = 0.5772156649;

    private final int numTrees;
    private final int maxSubsampleSize;
    private final int maxDepth;
    private final SeedStrategy seedStrategy;

    /**
     * @param numTrees         trees per scored value; must be {@code > 0}
     * @param maxSubsampleSize upper bound on the per-tree subsample; must be {@code >= 2}
     * @param maxDepth         depth limit of every tree; must be {@code > 0}
     * @param seedStrategy     per-tree seed source; must not be {@code null}
     */
    public IsolationForest(int numTrees, int maxSubsampleSize, int maxDepth, SeedStrategy seedStrategy) {
        if (numTrees <= 0) {
            throw new IllegalArgumentException("numTrees must be > 0, got: " + numTrees);
        }
        if (maxSubsampleSize < 2) {
            throw new IllegalArgumentException("maxSubsampleSize must be >= 2, got: " + maxSubsampleSize);
        }
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("maxDepth must be > 0, got: " + maxDepth);
        }
        if (seedStrategy == null) {
            throw new NullPointerException("seedStrategy must not be null");
        }
        this.numTrees = numTrees;
        this.maxSubsampleSize = maxSubsampleSize;
        this.maxDepth = maxDepth;
        this.seedStrategy = seedStrategy;
    }

    /**
     * Score every value of {@code data} against the whole data set.
     *
     * @param data values to score; not modified
     * @return anomaly score per value, same order as {@code data}
     */
    public double[] score(double[] data) {
        double[] scores = new double[data.length];
        if (data.length == 0) {
            return scores;
        }
        int subsampleSize = Math.min(maxSubsampleSize, data.length);
        double normaliser = averagePathLength(subsampleSize);

        for (int i = 0; i < data.length; i++) {
            if (normaliser <= 0) {
                scores[i] = 0;
                continue;
            }
            double totalPath = 0;
            for (int t = 0; t < numTrees; t++) {
                Random random = new Random(seedStrategy.seedFor(t));
                double[] sample = subsample(data, subsampleSize, random);
                totalPath += pathLength(data[i], sample, 0, random);
            }
            double avgPath = totalPath / numTrees;
            scores[i] = Math.pow(2.0, -avgPath / normaliser);
        }
        return scores;
    }

    /**
     * Expected path length of an unsuccessful binary-search-tree lookup over
     * {@code m} elements: {@code c(m) = 2(ln(m-1) + γ) - 2(m-1)/m}.
     *
     * @param m sample size
     * @return {@code c(m)}, or {@code 0} when {@code m <= 1}
     */
    public static double averagePathLength(int m) {
        if (m <= 1) {
            return 0;
        }
        return 2.0 * (Math.log(m - 1) + EULER_GAMMA) - (2.0 * (m - 1) / m);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private double pathLength(double value, double[] sample, int depth, Random random) {
        if (sample.length <= 1) {
            return depth;
        }
        if (depth >= maxDepth) {
            return depth + averagePathLength(sample.length);
        }

        double min = sample[0];
        double max = sample[0];
        for (double v : sample) {
            min = Math.min(min, v);
            max = Math.max(max, v);
        }
        if (min == max) {
            return depth + averagePathLength(sample.length);
        }

        double splitPoint = min + (max - min) * random.nextDouble();
        boolean goLeft = value < splitPoint;

        int size = 0;
        for (double v : sample) {
            if ((v < splitPoint) == goLeft) {
                size++;
            }
        }
        double[] branch = new double[size];
        int k = 0;
        for (double v : sample) {
            if ((v < splitPoint) == goLeft) {
                branch[k++] = v;
            }
        }
        return pathLength(value, branch, depth + 1, random);
    }

    /** Partial Fisher–Yates shuffle over indices. */
    private static double[] subsample(double[] data, int size, Random random) {
        int[] indices = new int[data.length];
        for (int i = 0; i < data.length; i++) {
            indices[i] = i;
        }
        double[] sample = new double[size];
        for (int i = 0; i < size; i++) {
            int j = i + random.nextInt(data.length - i);
            int tmp = indices[i];
            indices[i] = indices[j];
            indices[j] = tmp;
            sample[i] = data[indices[i]];
        }
        return sample;
    }
}
