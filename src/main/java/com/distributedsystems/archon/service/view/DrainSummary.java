package com.distributedsystems.archon.service.view;

import java.util.List;

public record DrainSummary(String skippedReason,
                           int attempted,
                           int delivered,
                           int failed,
                           int abandoned,
                           int skipped,
                           boolean breakerOpen,
                           List<DeliveryResult> results) {

    public static DrainSummary skipped(String reason, boolean breakerOpen) {
        return new DrainSummary(reason, 0, 0, 0, 0, 0, breakerOpen, List.of());
    }
}
