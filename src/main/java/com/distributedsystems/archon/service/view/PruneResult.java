package com.distributedsystems.archon.service.view;

public record PruneResult(int pollsRemoved, int votesRemoved, long pollsRemaining, long votesRemaining) {
}
