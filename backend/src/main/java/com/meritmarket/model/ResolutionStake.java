package com.meritmarket.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;

/**
 * One participant's stake in one role. Dispute support rows carry the dispute index; support and
 * opposition rows leave it null.
 */
@Setter
@Getter
@Entity
@Table(name = "resolution_stake")
public class ResolutionStake {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "resolution_id", nullable = false)
    private Long resolutionId;

    @Column(name = "dispute_index")
    private Integer disputeIndex;

    @Column(nullable = false, length = 128)
    private String participant;

    @Enumerated(EnumType.STRING)
    @Column(name = "stake_role", nullable = false, length = 24)
    private StakeRole role;

    @Column(nullable = false)
    private Long amount = 0L;

    @Column(name = "weighted_amount", nullable = false)
    private Long weightedAmount = 0L;

    @Column(name = "timing_bonus_bps", nullable = false)
    private Integer timingBonusBps = 0;

    @Column(name = "last_contribution_at", nullable = false)
    private OffsetDateTime lastContributionAt;

    @Column(nullable = false)
    private Boolean withdrawn = false;

    @Column(name = "withdrawn_at")
    private OffsetDateTime withdrawnAt;

    @Column(nullable = false)
    private Long payout = 0L;
}
