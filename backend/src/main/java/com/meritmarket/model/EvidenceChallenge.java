package com.meritmarket.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;

@Setter
@Getter
@Entity
@Table(
        name = "evidence_challenge",
        uniqueConstraints = @UniqueConstraint(columnNames = {"resolution_id", "challenge_index"})
)
public class EvidenceChallenge {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "resolution_id", nullable = false)
    private Long resolutionId;

    @Column(name = "challenge_index", nullable = false)
    private Integer challengeIndex;

    @Column(nullable = false, length = 128)
    private String challenger;

    @Column(nullable = false, length = 1000)
    private String reason;

    @Column(nullable = false)
    private Long stake;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @Column(nullable = false)
    private Boolean resolved = false;

    @Column(nullable = false)
    private Boolean upheld = false;

    @Column(name = "resolved_by", length = 128)
    private String resolvedBy;

    @Column(name = "resolved_at")
    private OffsetDateTime resolvedAt;

    @Column(nullable = false)
    private Long payout = 0L;
}
