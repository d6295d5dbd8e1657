package com.meritmarket.service;

import java.time.OffsetDateTime;

public record ResolutionLifecycleEvent(
        String marketId,
        int cycle,
        Transition transition,
        String detail,
        OffsetDateTime occurredAt
) {

    public enum Transition {
        COMMITTED,
        PROPOSED,
        COMMIT_SLASHED,
        APPROVED,
        REJECTED,
        DISPUTED,
        CHALLENGED,
        CHALLENGE_RESOLVED,
        LEGISLATOR_SLASHED,
        FINALIZED
    }
}
