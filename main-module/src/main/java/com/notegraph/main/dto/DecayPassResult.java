package com.notegraph.main.dto;

import com.notegraph.common.model.DecayRecord;

import java.util.List;

/**
 * @param staleCount notes at or above the decay threshold
 */
public record DecayPassResult(int noteCount, int staleCount, List<DecayRecord> records) {
}
