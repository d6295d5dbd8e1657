package com.meritmarket.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;

@Setter
@Getter
@Entity
@Table(
        name = "dispute",
        uniqueConstraints = @UniqueConstraint(columnNames = {"resolution_id", "dispute_index"})
)
public class Dispute {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "resolution_id", nullable = false)
    private Long resolutionId;

    @Column(name = "dispute_index", nullable = false)
    private Integer disputeIndex;

    @Column(nullable = false, length = 128)
    private String challenger;

    @Column(name = "alternative_outcome", nullable = false)
    private Integer alternativeOutcome;

    @Column(nullable = false)
    private Long bond;

    @Column(name = "support_stake", nullable = false)
    private Long supportStake = 0L;

    @Column(name = "supporter_count", nullable = false)
    private Integer supporterCount = 0;

    @Column(name = "endorsement_count", nullable = false)
    private Integer endorsementCount = 0;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private DisputeStatus status = DisputeStatus.ACTIVE;

    @Column(name = "evidence_uri", nullable = false, length = 512)
    private String evidenceUri;

    @Column(name = "evidence_hash", nullable = false, length = 66)
    private String evidenceHash;

    @Column(name = "challenger_bonus", nullable = false)
    private Long challengerBonus = 0L;

    @Column(name = "challenger_claimed", nullable = false)
    private Boolean challengerClaimed = false;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    public long totalPool() {
        return bond + supportStake;
    }

    public boolean isActive() {
        return status == DisputeStatus.ACTIVE;
    }
}
