package com.meritmarket.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;

/**
 * Earmarked funds attributable to one market: every bond and stake taken in, minus every payout,
 * refund and fee taken out.
 */
@Setter
@Getter
@Entity
@Table(name = "market_escrow")
public class MarketEscrow {
    @Id
    @Column(name = "market_id", length = 128)
    private String marketId;

    @Column(name = "locked_amount", nullable = false)
    private Long lockedAmount = 0L;

    @Column(name = "total_deposited", nullable = false)
    private Long totalDeposited = 0L;

    @Column(name = "total_released", nullable = false)
    private Long totalReleased = 0L;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt = OffsetDateTime.now();
}
