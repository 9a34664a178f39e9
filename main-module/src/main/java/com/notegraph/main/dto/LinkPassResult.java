package com.notegraph.main.dto;

/**
 * @param totalLinks unique undirected pairs written
 */
public record LinkPassResult(int notesProcessed, int totalLinks) {
}
