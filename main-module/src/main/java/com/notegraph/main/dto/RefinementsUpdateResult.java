package com.notegraph.main.dto;

/**
 * @param updated suggestions written by this submission
 * @param total   suggestions in the index afterwards
 */
public record RefinementsUpdateResult(int updated, int total) {
}
