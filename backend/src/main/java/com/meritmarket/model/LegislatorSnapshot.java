package com.meritmarket.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

/**
 * Roster member frozen at proposal time; only these identities may vote or endorse for the resolution.
 */
@Setter
@Getter
@Entity
@Table(
        name = "legislator_snapshot",
        uniqueConstraints = @UniqueConstraint(columnNames = {"resolution_id", "legislator"})
)
public class LegislatorSnapshot {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "resolution_id", nullable = false)
    private Long resolutionId;

    @Column(nullable = false, length = 128)
    private String legislator;

    @Column(name = "voting_weight", nullable = false)
    private Long votingWeight = 0L;
}
