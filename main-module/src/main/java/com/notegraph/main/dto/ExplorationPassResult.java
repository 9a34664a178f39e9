package com.notegraph.main.dto;

import com.notegraph.common.model.ExplorationSuggestion;

import java.util.List;
import java.util.Map;

/**
 * @param byType suggestion count per type tag
 */
public record ExplorationPassResult(int suggestionCount, Map<String, Integer> byType, List<ExplorationSuggestion> suggestions) {
}
