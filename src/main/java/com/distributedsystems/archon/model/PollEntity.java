package com.distributedsystems.archon.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Entity
@Table(
        name = "archon_polls",
        indexes = {
                @Index(name = "idx_archon_polls_deadline", columnList = "deadline")
        }
)
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PollEntity {

    @Id
    @Column(length = 36)
    private String pollId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private PollType pollType;

    @Column(nullable = false, length = 200)
    private String title;

    // worst case is ten 64-char options with every char JSON-escaped to six
    @Convert(converter = StringListConverter.class)
    @Column(nullable = false, length = 4096)
    private List<String> options;

    @Column(nullable = false, length = 8192)
    private String metadata;

    @Column(nullable = false)
    private long deadline;

    @Column(nullable = false, length = 66)
    private String createdBy;

    @Column(length = 128)
    private String creatorDid;

    @Column(nullable = false)
    private long createdAt;

    public PollStatus statusAt(long nowSeconds) {
        return PollStatus.at(deadline, nowSeconds);
    }
}
