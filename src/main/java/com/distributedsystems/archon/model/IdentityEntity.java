package com.distributedsystems.archon.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Entity
@Table(
        name = "archon_identity",
        indexes = {
                @Index(name = "idx_archon_identity_did", columnList = "did", unique = true)
        }
)
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class IdentityEntity {

    @Id
    @Column(name = "node_pubkey", length = 66, updatable = false)
    private String nodePubkey;

    @Column(nullable = false, length = 128)
    private String did;

    @Builder.Default
    private int didGeneration = 0;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    @Builder.Default
    private GovernanceTier governanceTier = GovernanceTier.BASIC;

    @Builder.Default
    private long bondSats = 0L;

    private Long bondVerifiedAt;

    @Column(nullable = false)
    private long createdAt;

    @Column(nullable = false)
    private long updatedAt;
}
