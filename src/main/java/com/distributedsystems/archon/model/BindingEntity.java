package com.distributedsystems.archon.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Entity
@Table(
        name = "archon_bindings",
        indexes = {
                @Index(name = "idx_archon_bindings_did_kind", columnList = "did, kind"),
                @Index(name = "idx_archon_bindings_external", columnList = "kind, external_key")
        }
)
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BindingEntity {

    @Id
    @Column(length = 36)
    private String bindingId;

    @Column(nullable = false, length = 128)
    private String did;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private BindingKind kind;

    @Column(name = "external_key", nullable = false, length = 66)
    private String externalKey;

    @Lob
    @Column(nullable = false)
    private String attestation;

    @Column(nullable = false, length = 512)
    private String signature;

    @Column(nullable = false)
    private long createdAt;

    private Long supersededAt;

    public boolean isActive() {
        return supersededAt == null;
    }
}
