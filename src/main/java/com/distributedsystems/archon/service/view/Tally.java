package com.distributedsystems.archon.service.view;

import java.util.Map;

/**
 * Per-option counts in option order. {@code sum(counts) + spoiled == totalVoters}.
 */
public record Tally(Map<String, Long> counts, long spoiled, long totalVoters) {
}
