package com.distributedsystems.archon.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Entity
@Table(
        name = "archon_outbox",
        indexes = {
                @Index(name = "idx_archon_outbox_due", columnList = "status, next_attempt_at_ms")
        }
)
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OutboxEntryEntity {

    /** Insertion order; delivery follows it. */
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long seq;

    @Column(nullable = false, unique = true, length = 36)
    private String entryId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private OutboxOperation operation;

    @Column(nullable = false, length = 128)
    private String entityId;

    @Column(nullable = false, length = 256)
    private String resourcePath;

    @Lob
    @Column(nullable = false)
    private String payload;

    @Builder.Default
    private int attempts = 0;

    @Column(name = "next_attempt_at_ms", nullable = false)
    private long nextAttemptAtMs;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    @Builder.Default
    private OutboxStatus status = OutboxStatus.PENDING;

    @Column(length = 500)
    private String lastError;

    @Column(name = "created_at", nullable = false)
    private long createdAt;

    @Column(nullable = false)
    private long updatedAt;
}
