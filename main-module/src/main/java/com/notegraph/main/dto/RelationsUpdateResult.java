package com.notegraph.main.dto;

/**
 * @param updated relations written by this submission
 * @param total   relations in the index afterwards
 */
public record RelationsUpdateResult(int updated, int total) {
}
