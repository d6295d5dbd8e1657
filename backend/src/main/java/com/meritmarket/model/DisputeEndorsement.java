package com.meritmarket.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;

@Setter
@Getter
@Entity
@Table(
        name = "dispute_endorsement",
        uniqueConstraints = @UniqueConstraint(columnNames = {"resolution_id", "dispute_index", "legislator"})
)
public class DisputeEndorsement {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "resolution_id", nullable = false)
    private Long resolutionId;

    @Column(name = "dispute_index", nullable = false)
    private Integer disputeIndex;

    @Column(nullable = false, length = 128)
    private String legislator;

    @Column(name = "endorsed_at", nullable = false)
    private OffsetDateTime endorsedAt;
}
