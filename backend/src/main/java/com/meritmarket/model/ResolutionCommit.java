package com.meritmarket.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;

@Setter
@Getter
@Entity
@Table(name = "resolution_commit")
public class ResolutionCommit {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "market_id", nullable = false, length = 128)
    private String marketId;

    @Column(nullable = false, length = 128)
    private String committer;

    @Column(name = "commit_hash", nullable = false, length = 66)
    private String commitHash;

    @Column(nullable = false)
    private Long bond;

    @Column(nullable = false)
    private Boolean revealed = false;

    @Column(nullable = false)
    private Boolean slashed = false;

    @Column(name = "slashed_by", length = 128)
    private String slashedBy;

    @Column(name = "committed_at", nullable = false, updatable = false)
    private OffsetDateTime committedAt;

    @Column(name = "consumed_at")
    private OffsetDateTime consumedAt;

    public boolean isPending() {
        return !Boolean.TRUE.equals(revealed) && !Boolean.TRUE.equals(slashed);
    }
}
