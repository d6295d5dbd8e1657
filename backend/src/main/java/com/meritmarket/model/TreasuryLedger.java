package com.meritmarket.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;

/**
 * Singleton accounting row. Mutated only through TreasuryLedgerService.
 */
@Setter
@Getter
@Entity
@Table(name = "treasury_ledger")
public class TreasuryLedger {
    public static final int SINGLETON_ID = 1;

    @Id
    private Integer id = SINGLETON_ID;

    @Column(name = "earmarked_funds", nullable = false)
    private Long earmarkedFunds = 0L;

    @Column(name = "protocol_fees", nullable = false)
    private Long protocolFees = 0L;

    @Column(name = "total_slashed", nullable = false)
    private Long totalSlashed = 0L;

    @Column(name = "total_paid_out", nullable = false)
    private Long totalPaidOut = 0L;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt = OffsetDateTime.now();
}
