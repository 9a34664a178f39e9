package com.notegraph.main.dto;

import com.notegraph.common.model.Tension;

import java.util.List;

public record TensionPassResult(int noteCount, int clusterCount, int tensionCount, List<Tension> tensions) {
}
