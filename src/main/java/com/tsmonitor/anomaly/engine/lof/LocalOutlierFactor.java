package com.tsmonitor.anomaly.engine.lof;

import java.util.PriorityQueue;

/**
 * Density-based outlier model in novelty mode: it is fitted on a reference sample and then
 * scores unseen points against that sample.
 *
 * lrd(p) = 1 / (mean over the k neighbours o of max(d(p, o), kdist(o)) + 1e-10)
 * LOF(p) = mean over the k neighbours o of lrd(o) / lrd(p)
 *
 * LOF close to 1 means p is as dense as its neighbourhood; well above 1 means p sits in a
 * sparser region than its neighbours.
 */
public class LocalOutlierFactor {

    private static final double LRD_EPSILON = 1e-10;

    private final double[][] reference;
    private final int k;
    private final double[] kDistance;
    private final double[] lrd;
    private final double[] trainingFactors;

    private LocalOutlierFactor(double[][] reference, int k, double[] kDistance, double[] lrd, double[] trainingFactors) {
        this.reference = reference;
        this.k = k;
        this.kDistance = kDistance;
        this.lrd = lrd;
        this.trainingFactors = trainingFactors;
    }

    /**
     * @param data       reference rows (at least 2)
     * @param nNeighbors requested neighbourhood size, capped at {@code data.length - 1}
     */
    public static LocalOutlierFactor fit(double[][] data, int nNeighbors) {
        int n = data.length;
        int k = Math.max(1, Math.min(nNeighbors, n - 1));

        int[][] neighbors = new int[n][];
        double[][] distances = new double[n][];
        double[] kDistance = new double[n];
        for (int i = 0; i < n; i++) {
            Neighborhood hood = nearest(data, data[i], k, i);
            neighbors[i] = hood.indices;
            distances[i] = hood.distances;
            kDistance[i] = hood.kthDistance();
        }

        double[] lrd = new double[n];
        for (int i = 0; i < n; i++) {
            lrd[i] = reachabilityDensity(neighbors[i], distances[i], kDistance);
        }

        double[] factors = new double[n];
        for (int i = 0; i < n; i++) {
            factors[i] = factor(neighbors[i], lrd, lrd[i]);
        }
        return new LocalOutlierFactor(data, k, kDistance, lrd, factors);
    }

    /**
     * LOF of an unseen point relative to the reference sample.
     */
    public double outlierFactor(double[] point) {
        Neighborhood hood = nearest(reference, point, k, -1);
        double pointLrd = reachabilityDensity(hood.indices, hood.distances, kDistance);
        return factor(hood.indices, lrd, pointLrd);
    }

    public double[] outlierFactors(double[][] points) {
        double[] out = new double[points.length];
        for (int i = 0; i < points.length; i++) {
            out[i] = outlierFactor(points[i]);
        }
        return out;
    }

    public double[] getTrainingFactors() {
        return trainingFactors.clone();
    }

    public int getNeighbors() {
        return k;
    }

    public int getFeatureCount() {
        return reference[0].length;
    }

    private static double reachabilityDensity(int[] neighborIdx, double[] neighborDist, double[] kDistance) {
        double sum = 0.0;
        for (int j = 0; j < neighborIdx.length; j++) {
            sum += Math.max(neighborDist[j], kDistance[neighborIdx[j]]);
        }
        return 1.0 / (sum / neighborIdx.length + LRD_EPSILON);
    }

    private static double factor(int[] neighborIdx, double[] lrd, double ownLrd) {
        double sum = 0.0;
        for (int idx : neighborIdx) {
            sum += lrd[idx] / ownLrd;
        }
        return sum / neighborIdx.length;
    }

    /**
     * Brute-force k nearest rows by Euclidean distance, skipping {@code excludeIdx}.
     */
    private static Neighborhood nearest(double[][] data, double[] point, int k, int excludeIdx) {
        // Max-heap on distance keeps the k closest seen so far
        PriorityQueue<double[]> heap = new PriorityQueue<>(k + 1, (a, b) -> Double.compare(b[1], a[1]));
        for (int i = 0; i < data.length; i++) {
            if (i == excludeIdx) continue;
            double d = distance(data[i], point);
            if (heap.size() < k) {
                heap.add(new double[] {i, d});
            } else if (d < heap.peek()[1]) {
                heap.poll();
                heap.add(new double[] {i, d});
            }
        }
        int size = heap.size();
        int[] indices = new int[size];
        double[] distances = new double[size];
        for (int j = size - 1; j >= 0; j--) {
            double[] entry = heap.poll();
            indices[j] = (int) entry[0];
            distances[j] = entry[1];
        }
        return new Neighborhood(indices, distances);
    }

    private static double distance(double[] a, double[] b) {
        double sum = 0.0;
        for (int f = 0; f < a.length; f++) {
            double d = a[f] - b[f];
            sum += d * d;
        }
        return Math.sqrt(sum);
    }

    private record Neighborhood(int[] indices, double[] distances) {
        // Sorted ascending, so the last entry is the k-th neighbour
        double kthDistance() {
            return distances[distances.length - 1];
        }
    }
}
