package com.distributedsystems.archon.service.view;

import java.util.List;
import java.util.Map;

/**
 * Read-only aggregate returned by the status operation.
 */
public record IdentityStatus(IdentityView identity,
                             String requestedDid,
                             boolean currentDid,
                             List<BindingView> bindings,
                             Map<String, Long> activeBindingCounts,
                             String governanceTier,
                             long activePolls,
                             long closedPolls,
                             long totalVotes,
                             boolean syncEnabled,
                             long governanceMinBondSats) {
}
