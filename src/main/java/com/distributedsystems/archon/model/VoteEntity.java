package com.distributedsystems.archon.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One ballot. The (poll, voter key) pair is unique at the table level; rows are never updated.
 */
@Entity
@Table(
        name = "archon_votes",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_archon_votes_poll_voter", columnNames = {"poll_id", "voter_pubkey"})
        },
        indexes = {
                @Index(name = "idx_archon_votes_voter", columnList = "voter_pubkey, voted_at"),
                @Index(name = "idx_archon_votes_poll", columnList = "poll_id")
        }
)
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class VoteEntity {

    @Id
    @Column(length = 36)
    private String voteId;

    @Column(name = "poll_id", nullable = false, length = 36, updatable = false)
    private String pollId;

    @Column(name = "voter_pubkey", nullable = false, length = 66, updatable = false)
    private String voterPubkey;

    @Column(length = 128)
    private String voterDid;

    @Column(nullable = false, updatable = false)
    private int choiceIndex;

    @Column(nullable = false, length = 500)
    private String reason;

    @Column(nullable = false, length = 512)
    private String signature;

    @Column(name = "voted_at", nullable = false)
    private long votedAt;

    public Choice choice() {
        return new Choice(choiceIndex);
    }
}
