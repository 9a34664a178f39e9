package com.notegraph.main.cluster;

import com.notegraph.common.model.Cluster;
import com.notegraph.common.model.ClustersIndex;
import com.notegraph.common.model.EmbeddingsIndex;
import com.notegraph.main.config.GraphProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * k-means clustering of note embeddings with k-means++ seeding and automatic k selection.
 */
@Slf4j
@Component
public class ClusteringEngine {

    static final String CLUSTER_ID_PREFIX = "cluster-";

    private final GraphProperties properties;
    private final Clock clock;
    private final Random random;

    @Autowired
    public ClusteringEngine(GraphProperties properties, Clock clock) {
        this(properties, clock, new Random());
    }

    public ClusteringEngine(GraphProperties properties, Clock clock, Random random) {
        this.properties = properties;
        this.clock = clock;
        this.random = random;
    }

    /**
     * {@code clamp(floor(sqrt(n / 2)), min, max)}, or 0 when there are fewer than {@code min} points.
     */
    public static int chooseK(int n, int min, int max) {
        if (n < min) {
            return 0;
        }
        int k = (int) Math.floor(Math.sqrt(n / 2.0));
        return Math.max(min, Math.min(k, max));
    }

    public static double squaredDistance(double[] a, double[] b) {
        double sum = 0;
        for (int i = 0; i < a.length; i++) {
            double d = a[i] - b[i];
            sum += d * d;
        }
        return sum;
    }

    /**
     * k-means++ seeding: first centroid uniformly at random, each next one sampled with probability
     * proportional to its squared distance from the nearest centroid chosen so far.
     */
    public double[][] seedCentroids(double[][] vectors, int k) {
        int n = vectors.length;
        double[][] centroids = new double[k][];
        centroids[0] = vectors[random.nextInt(n)].clone();

        double[] distances = new double[n];
        Arrays.fill(distances, Double.POSITIVE_INFINITY);

        for (int c = 1; c < k; c++) {
            double[] latest = centroids[c - 1];
            double totalWeight = 0;
            for (int i = 0; i < n; i++) {
                distances[i] = Math.min(distances[i], squaredDistance(vectors[i], latest));
                totalWeight += distances[i];
            }

            double remaining = random.nextDouble() * totalWeight;
            int chosen = 0;
            for (int i = 0; i < n; i++) {
                remaining -= distances[i];
                if (remaining <= 0) {
                    chosen = i;
                    break;
                }
            }
            centroids[c] = vectors[chosen].clone();
        }
        return centroids;
    }

    public KMeansResult kmeans(double[][] vectors, int k, int maxIterations) {
        return kmeans(vectors, k, maxIterations, seedCentroids(vectors, k));
    }

    /**
     * Lloyd's iteration from the given centroids. Stops after the first pass without an assignment change.
     * A centroid left without points keeps its previous position.
     */
    public KMeansResult kmeans(double[][] vectors, int k, int maxIterations, double[][] initialCentroids) {
        int n = vectors.length;
        int dimension = vectors[0].length;

        double[][] centroids = new double[k][];
        for (int c = 0; c < k; c++) {
            centroids[c] = initialCentroids[c].clone();
        }
        int[] assignments = new int[n];
        int iterations = 0;

        for (int iteration = 0; iteration < maxIterations; iteration++) {
            iterations = iteration + 1;
            boolean changed = false;

            for (int i = 0; i < n; i++) {
                int best = 0;
                double bestDistance = Double.POSITIVE_INFINITY;
                for (int c = 0; c < k; c++) {
                    double distance = squaredDistance(vectors[i], centroids[c]);
                    if (distance < bestDistance) {
                        bestDistance = distance;
                        best = c;
                    }
                }
                if (assignments[i] != best) {
                    assignments[i] = best;
                    changed = true;
                }
            }

            if (!changed) {
                break;
            }

            double[][] sums = new double[k][dimension];
            int[] counts = new int[k];
            for (int i = 0; i < n; i++) {
                int c = assignments[i];
                for (int d = 0; d < dimension; d++) {
                    sums[c][d] += vectors[i][d];
                }
                counts[c]++;
            }
            for (int c = 0; c < k; c++) {
                if (counts[c] == 0) {
                    continue;
                }
                for (int d = 0; d < dimension; d++) {
                    sums[c][d] /= counts[c];
                }
                centroids[c] = sums[c];
            }
        }

        return new KMeansResult(assignments, centroids, iterations);
    }

    public ClustersIndex clusterEmbeddings(EmbeddingsIndex index) {
        return clusterEmbeddings(index, null, null);
    }

    /**
     * Clusters every embedded note.
     *
     * @param requestedK    explicit k, or null to pick one with {@link #chooseK}
     * @param maxIterations iteration cap, or null for the configured default
     * @return a fresh index; empty for fewer notes than the clustering minimum. Clusters left empty are dropped
     */
    public ClustersIndex clusterEmbeddings(EmbeddingsIndex index, Integer requestedK, Integer maxIterations) {
        Instant now = clock.instant();
        List<String> noteIds = new ArrayList<>(index.embeddings().keySet());

        if (noteIds.isEmpty() || noteIds.size() < properties.getMinNotesForClustering()) {
            return new ClustersIndex(new LinkedHashMap<>(), now);
        }

        int k = requestedK != null
                ? requestedK
                : chooseK(noteIds.size(), properties.getMinClusters(), properties.getMaxClusters());
        if (k <= 0) {
            return new ClustersIndex(new LinkedHashMap<>(), now);
        }

        double[][] vectors = noteIds.stream()
                .map(id -> index.embeddings().get(id).vector())
                .toArray(double[][]::new);
        int iterationCap = maxIterations != null ? maxIterations : properties.getKmeansMaxIterations();
        KMeansResult result = kmeans(vectors, k, iterationCap);

        List<List<String>> members = new ArrayList<>();
        for (int c = 0; c < k; c++) {
            members.add(new ArrayList<>());
        }
        for (int i = 0; i < noteIds.size(); i++) {
            members.get(result.assignments()[i]).add(noteIds.get(i));
        }

        Map<String, Cluster> clusters = new LinkedHashMap<>();
        for (int c = 0; c < k; c++) {
            List<String> clusterMembers = members.get(c);
            if (clusterMembers.isEmpty()) {
                continue;
            }
            clusterMembers.sort(null);
            String id = CLUSTER_ID_PREFIX + c;
            clusters.put(id, new Cluster(id, result.centroids()[c], clusterMembers, now, now));
        }

        log.info("Clustered {} notes into {} clusters (k={}, iterations={})",
                noteIds.size(), clusters.size(), k, result.iterations());
        return new ClustersIndex(clusters, now);
    }
}
