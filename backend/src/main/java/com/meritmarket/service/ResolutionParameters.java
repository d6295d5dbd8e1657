package com.meritmarket.service;

import java.math.BigInteger;
import java.time.Duration;
import java.time.OffsetDateTime;

/**
 * Fixed protocol constants. Amounts are in base units ({@link #TOKEN_UNIT} per whole token),
 * percentages in basis points of {@link #BASIS_POINTS}.
 */
public final class ResolutionParameters {

    public static final long TOKEN_UNIT = 1_000_000_000L;
    public static final long BASIS_POINTS = 10_000L;

    // Commit-reveal proposal
    public static final long MIN_COMMIT_BOND = TOKEN_UNIT / 10;
    public static final Duration COMMIT_COOLDOWN = Duration.ofHours(1);
    public static final Duration MIN_REVEAL_DELAY = Duration.ofMinutes(10);
    public static final Duration MAX_REVEAL_DELAY = Duration.ofHours(24);
    public static final int MAX_EVIDENCE_URI_LENGTH = 512;
    public static final long MIN_PROPOSAL_STAKE = TOKEN_UNIT;
    public static final long SLASH_BOUNTY_BPS = 1_000L;

    // Support / opposition staking
    public static final long MIN_STAKE = TOKEN_UNIT / 100;
    public static final Duration SUPPORT_PERIOD = Duration.ofHours(24);
    public static final Duration EARLY_BONUS_WINDOW = Duration.ofHours(1);
    public static final long MAX_TIMING_BONUS_BPS = 2_000L;
    public static final long APPROVAL_THRESHOLD_BPS = 7_500L;

    // Evidence challenges
    public static final Duration EVIDENCE_CHALLENGE_PERIOD = Duration.ofHours(6);
    public static final long MIN_CHALLENGE_STAKE = TOKEN_UNIT / 2;
    public static final int MAX_EVIDENCE_CHALLENGES = 10;
    public static final int MAX_CHALLENGE_REASON_LENGTH = 1_000;
    public static final long UPHELD_CHALLENGE_PAYOUT_MULTIPLIER = 2L;

    // Legislator voting
    public static final Duration LEGISLATOR_COMMIT_PERIOD = Duration.ofHours(24);
    public static final Duration LEGISLATOR_REVEAL_PERIOD = Duration.ofHours(24);
    public static final long SUPERMAJORITY_BPS = 6_666L;
    public static final long LEGISLATOR_SLASH_BPS = 1_000L;

    // Disputes and scoring
    public static final Duration DISPUTE_PERIOD = Duration.ofHours(72);
    public static final long DISPUTE_BASE_MULTIPLIER = 2L;
    public static final long MIN_DISPUTE_BOND = TOKEN_UNIT;
    public static final long MAX_DISPUTE_BOND = 1_000L * TOKEN_UNIT;
    public static final int MAX_SCORED_BACKERS = 10;
    public static final long STAKE_SCORE_WEIGHT_BPS = 6_000L;
    public static final long VOTE_SCORE_WEIGHT_BPS = 4_000L;
    public static final long LEGISLATOR_VOTE_WEIGHT = 10L;

    // Finalization and rewards
    public static final Duration FINALIZATION_BUFFER = Duration.ofHours(1);
    public static final long PROTOCOL_FEE_BPS = 250L;
    public static final long CHALLENGER_BONUS_BPS = 3_000L;
    public static final long CHALLENGER_BONUS_CAP_BPS = 5_000L;

    private ResolutionParameters() {
    }

    public static OffsetDateTime supportDeadline(OffsetDateTime proposedAt) {
        return proposedAt.plus(SUPPORT_PERIOD);
    }

    public static OffsetDateTime evidenceChallengeDeadline(OffsetDateTime proposedAt) {
        return proposedAt.plus(EVIDENCE_CHALLENGE_PERIOD);
    }

    public static OffsetDateTime legislatorCommitDeadline(OffsetDateTime proposedAt) {
        return supportDeadline(proposedAt).plus(LEGISLATOR_COMMIT_PERIOD);
    }

    public static OffsetDateTime legislatorRevealDeadline(OffsetDateTime proposedAt) {
        return legislatorCommitDeadline(proposedAt).plus(LEGISLATOR_REVEAL_PERIOD);
    }

    public static OffsetDateTime disputeDeadline(OffsetDateTime proposedAt) {
        return proposedAt.plus(DISPUTE_PERIOD);
    }

    public static OffsetDateTime finalizationTime(OffsetDateTime proposedAt) {
        return disputeDeadline(proposedAt).plus(FINALIZATION_BUFFER);
    }

    public static long basisPoints(long amount, long bps) {
        return BigInteger.valueOf(amount)
                .multiply(BigInteger.valueOf(bps))
                .divide(BigInteger.valueOf(BASIS_POINTS))
                .longValueExact();
    }

    /**
     * {@code part * BASIS_POINTS >= total * thresholdBps}, without overflow.
     */
    public static boolean meetsThreshold(long part, long total, long thresholdBps) {
        return BigInteger.valueOf(part).multiply(BigInteger.valueOf(BASIS_POINTS))
                .compareTo(BigInteger.valueOf(total).multiply(BigInteger.valueOf(thresholdBps))) >= 0;
    }

    /**
     * {@code amount * numerator / denominator}, rounded down.
     */
    public static long mulDiv(long amount, long numerator, long denominator) {
        return BigInteger.valueOf(amount)
                .multiply(BigInteger.valueOf(numerator))
                .divide(BigInteger.valueOf(denominator))
                .longValueExact();
    }
}
