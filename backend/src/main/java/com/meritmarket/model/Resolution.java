package com.meritmarket.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;

/**
 * Proposed outcome for one market, one proposal cycle. A rejected resolution hands the market back
 * to its settlement phase and the next proposal opens cycle + 1; old cycles stay for claims and audit.
 */
@Setter
@Getter
@Entity
@Table(
        name = "resolution",
        uniqueConstraints = @UniqueConstraint(columnNames = {"market_id", "resolution_cycle"})
)
public class Resolution {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "market_id", nullable = false, length = 128)
    private String marketId;

    @Column(name = "resolution_cycle", nullable = false)
    private Integer cycle;

    @Column(nullable = false, length = 128)
    private String proposer;

    @Column(name = "proposed_outcome", nullable = false)
    private Integer proposedOutcome;

    @Column(name = "proposed_at", nullable = false)
    private OffsetDateTime proposedAt;

    @Column(name = "evidence_uri", nullable = false, length = 512)
    private String evidenceUri;

    @Column(name = "evidence_hash", nullable = false, length = 66)
    private String evidenceHash;

    @Column(name = "proposer_timing_bonus_bps", nullable = false)
    private Integer proposerTimingBonusBps = 0;

    @Column(name = "support_stake", nullable = false)
    private Long supportStake = 0L;

    @Column(name = "support_weighted", nullable = false)
    private Long supportWeighted = 0L;

    @Column(name = "opposition_stake", nullable = false)
    private Long oppositionStake = 0L;

    @Column(name = "supporter_count", nullable = false)
    private Integer supporterCount = 0;

    @Column(name = "opposer_count", nullable = false)
    private Integer opposerCount = 0;

    @Column(name = "legislator_support_votes", nullable = false)
    private Integer legislatorSupportVotes = 0;

    @Column(name = "legislator_oppose_votes", nullable = false)
    private Integer legislatorOpposeVotes = 0;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private ResolutionStatus status = ResolutionStatus.PENDING;

    @Column(nullable = false)
    private Boolean disputed = false;

    @Column(name = "dispute_count", nullable = false)
    private Integer disputeCount = 0;

    @Column(name = "challenge_count", nullable = false)
    private Integer challengeCount = 0;

    @Column(nullable = false)
    private Boolean finalized = false;

    @Column(name = "finalized_at")
    private OffsetDateTime finalizedAt;

    @Column(name = "final_outcome")
    private Integer finalOutcome;

    @Column(name = "winning_dispute_index")
    private Integer winningDisputeIndex;

    @Column(name = "protocol_fee", nullable = false)
    private Long protocolFee = 0L;

    /**
     * Reward budget shared by supporters in proportion to their weighted stake.
     */
    @Column(name = "support_reward_pool", nullable = false)
    private Long supportRewardPool = 0L;

    /**
     * Payout budget shared by opposition stakers in proportion to their stake (principal included).
     */
    @Column(name = "opposition_reward_pool", nullable = false)
    private Long oppositionRewardPool = 0L;

    @Column(name = "evidence_bonus_paid", nullable = false)
    private Long evidenceBonusPaid = 0L;

    @Column(name = "slashed_amount", nullable = false)
    private Long slashedAmount = 0L;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now();

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt = OffsetDateTime.now();

    public boolean isOpen() {
        return !Boolean.TRUE.equals(finalized);
    }

    public boolean isApproved() {
        return status == ResolutionStatus.APPROVED;
    }

    public boolean isRejected() {
        return status == ResolutionStatus.REJECTED;
    }
}
