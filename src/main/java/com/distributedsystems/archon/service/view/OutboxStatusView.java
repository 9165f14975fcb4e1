package com.distributedsystems.archon.service.view;

public record OutboxStatusView(boolean syncEnabled,
                               long pending,
                               long abandoned,
                               int consecutiveFailures,
                               boolean breakerOpen,
                               long breakerOpenUntilMs) {
}
