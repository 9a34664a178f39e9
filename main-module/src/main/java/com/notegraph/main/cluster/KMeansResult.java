package com.notegraph.main.cluster;

/**
 * @param assignments cluster index per input vector
 * @param centroids   one centroid per cluster index
 * @param iterations  Lloyd iterations actually run
 */
public record KMeansResult(int[] assignments, double[][] centroids, int iterations) {
}
