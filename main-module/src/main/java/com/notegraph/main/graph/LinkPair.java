package com.notegraph.main.graph;

/**
 * An undirected link, as produced by a full re-link pass.
 */
public record LinkPair(String noteA, String noteB, double similarity) {
}
