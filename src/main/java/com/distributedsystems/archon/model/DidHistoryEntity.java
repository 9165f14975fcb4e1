package com.distributedsystems.archon.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Every DID ever issued for a node key. Rows are only ever inserted or stamped as superseded.
 */
@Entity
@Table(
        name = "archon_did_history",
        indexes = {
                @Index(name = "idx_archon_did_history_node", columnList = "node_pubkey, generation")
        }
)
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DidHistoryEntity {

    @Id
    @Column(length = 128)
    private String did;

    @Column(name = "node_pubkey", nullable = false, length = 66)
    private String nodePubkey;

    @Column(nullable = false)
    private int generation;

    @Column(nullable = false)
    private long issuedAt;

    private Long supersededAt;

    public boolean isCurrent() {
        return supersededAt == null;
    }
}
