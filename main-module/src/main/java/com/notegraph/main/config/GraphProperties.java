package com.notegraph.main.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Thresholds and limits of the graph analysis passes.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "graph")
public class GraphProperties {

    /**
     * Minimum cosine similarity for two notes to be linked.
     */
    @DecimalMin("-1.0")
    @DecimalMax("1.0")
    private double similarityThreshold = 0.82;

    @Min(1)
    private int minClusters = 2;

    @Min(1)
    private int maxClusters = 20;

    @Min(1)
    private int kmeansMaxIterations = 50;

    @Min(1)
    private int minNotesForClustering = 3;

    /**
     * Pairs within one cluster below this similarity are tensions.
     */
    @DecimalMin("-1.0")
    @DecimalMax("1.0")
    private double tensionThreshold = 0.72;

    @Min(2)
    private int minNotesForTension = 4;

    /**
     * A clustered note less similar than this to its centroid is an outlier.
     */
    @DecimalMin("-1.0")
    @DecimalMax("1.0")
    private double clusterOutlierThreshold = 0.7;

    /**
     * Notes scoring at least this much are recorded as decaying.
     */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double decayScoreThreshold = 0.3;

    /**
     * Cluster centroid pairs above this similarity are suggested for merging.
     */
    @DecimalMin("-1.0")
    @DecimalMax("1.0")
    private double closeClusterThreshold = 0.92;

    /**
     * Parallel note document reads when building meta-note sets and agent feeds.
     */
    @Min(1)
    private int noteFetchConcurrency = 8;
}
