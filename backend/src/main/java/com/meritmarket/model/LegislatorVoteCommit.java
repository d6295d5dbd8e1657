package com.meritmarket.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;

@Setter
@Getter
@Entity
@Table(
        name = "legislator_vote_commit",
        uniqueConstraints = @UniqueConstraint(columnNames = {"resolution_id", "legislator"})
)
public class LegislatorVoteCommit {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "resolution_id", nullable = false)
    private Long resolutionId;

    @Column(nullable = false, length = 128)
    private String legislator;

    @Column(name = "commit_hash", nullable = false, length = 66)
    private String commitHash;

    @Column(name = "committed_at", nullable = false, updatable = false)
    private OffsetDateTime committedAt;

    @Column(nullable = false)
    private Boolean revealed = false;

    @Column(name = "vote_support")
    private Boolean support;

    @Column(name = "revealed_at")
    private OffsetDateTime revealedAt;

    @Column(nullable = false)
    private Boolean slashed = false;

    @Column(name = "slashed_at")
    private OffsetDateTime slashedAt;

    @Column(name = "slashed_amount", nullable = false)
    private Long slashedAmount = 0L;
}
