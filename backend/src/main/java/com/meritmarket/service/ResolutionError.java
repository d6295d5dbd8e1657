package com.meritmarket.service;

import org.springframework.http.HttpStatus;

public enum ResolutionError {
    INVALID_ARGUMENT(HttpStatus.BAD_REQUEST),
    INVALID_OUTCOME(HttpStatus.BAD_REQUEST),
    INVALID_EVIDENCE(HttpStatus.BAD_REQUEST),
    BOND_TOO_LOW(HttpStatus.BAD_REQUEST),
    STAKE_TOO_LOW(HttpStatus.BAD_REQUEST),
    COMMITMENT_MISMATCH(HttpStatus.BAD_REQUEST),

    MARKET_NOT_FOUND(HttpStatus.NOT_FOUND),
    RESOLUTION_NOT_FOUND(HttpStatus.NOT_FOUND),
    COMMIT_NOT_FOUND(HttpStatus.NOT_FOUND),
    CHALLENGE_NOT_FOUND(HttpStatus.NOT_FOUND),
    DISPUTE_NOT_FOUND(HttpStatus.NOT_FOUND),
    VOTE_NOT_COMMITTED(HttpStatus.NOT_FOUND),

    NOT_AUTHORIZED(HttpStatus.FORBIDDEN),
    NOT_LEGISLATOR(HttpStatus.FORBIDDEN),

    MARKET_NOT_IN_SETTLEMENT(HttpStatus.CONFLICT),
    TRADING_NOT_ENDED(HttpStatus.CONFLICT),
    COMMIT_ALREADY_PENDING(HttpStatus.CONFLICT),
    COMMIT_COOLDOWN_ACTIVE(HttpStatus.CONFLICT),
    REVEAL_TOO_EARLY(HttpStatus.CONFLICT),
    REVEAL_WINDOW_CLOSED(HttpStatus.CONFLICT),
    REVEAL_WINDOW_OPEN(HttpStatus.CONFLICT),
    RESOLUTION_EXISTS(HttpStatus.CONFLICT),
    INVALID_STATUS(HttpStatus.CONFLICT),
    WINDOW_NOT_OPEN(HttpStatus.CONFLICT),
    WINDOW_CLOSED(HttpStatus.CONFLICT),
    STAKE_WITHDRAWN(HttpStatus.CONFLICT),
    CHALLENGE_LIMIT_REACHED(HttpStatus.CONFLICT),
    CHALLENGE_ALREADY_RESOLVED(HttpStatus.CONFLICT),
    CHALLENGES_UNRESOLVED(HttpStatus.CONFLICT),
    VOTE_ALREADY_COMMITTED(HttpStatus.CONFLICT),
    VOTE_ALREADY_REVEALED(HttpStatus.CONFLICT),
    ALREADY_SLASHED(HttpStatus.CONFLICT),
    DISPUTE_NOT_ACTIVE(HttpStatus.CONFLICT),
    ALREADY_ENDORSED(HttpStatus.CONFLICT),
    ALREADY_FINALIZED(HttpStatus.CONFLICT),
    NOT_FINALIZED(HttpStatus.CONFLICT),
    NOTHING_TO_CLAIM(HttpStatus.CONFLICT),
    ALREADY_CLAIMED(HttpStatus.CONFLICT);

    private final HttpStatus status;

    ResolutionError(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus status() {
        return status;
    }
}
