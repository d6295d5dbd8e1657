package com.meritmarket.dto;

import java.time.OffsetDateTime;

public final class ResolutionResponses {

    private ResolutionResponses() {
    }

    public record CommitSummary(
            Long commitId,
            String marketId,
            String committer,
            String commitHash,
            long bond,
            boolean revealed,
            boolean slashed,
            OffsetDateTime committedAt,
            OffsetDateTime revealOpensAt,
            OffsetDateTime revealClosesAt
    ) {
    }

    public record ResolutionDetail(
            String marketId,
            int cycle,
            String proposer,
            int proposedOutcome,
            String status,
            boolean disputed,
            boolean finalized,
            Integer finalOutcome,
            Integer winningDisputeIndex,
            String evidenceUri,
            String evidenceHash,
            int proposerTimingBonusBps,
            long supportStake,
            long supportWeighted,
            long oppositionStake,
            int supporterCount,
            int opposerCount,
            int legislatorSupportVotes,
            int legislatorOpposeVotes,
            int disputeCount,
            int challengeCount,
            long protocolFee,
            long supportRewardPool,
            long oppositionRewardPool,
            long slashedAmount,
            Windows windows,
            OffsetDateTime proposedAt,
            OffsetDateTime finalizedAt
    ) {
    }

    public record Windows(
            OffsetDateTime supportCloses,
            OffsetDateTime evidenceChallengeCloses,
            OffsetDateTime legislatorCommitCloses,
            OffsetDateTime legislatorRevealCloses,
            OffsetDateTime disputeCloses,
            OffsetDateTime finalizableAt
    ) {
    }

    public record StakeSummary(
            String participant,
            String role,
            Integer disputeIndex,
            long amount,
            long weightedAmount,
            int timingBonusBps,
            boolean withdrawn,
            long payout,
            OffsetDateTime lastContributionAt
    ) {
    }

    public record DisputeSummary(
            int disputeIndex,
            String challenger,
            int alternativeOutcome,
            long bond,
            long supportStake,
            int supporterCount,
            int endorsementCount,
            String status,
            String evidenceUri,
            String evidenceHash,
            long challengerBonus,
            boolean challengerClaimed,
            OffsetDateTime createdAt
    ) {
    }

    public record ChallengeSummary(
            int challengeIndex,
            String challenger,
            String reason,
            long stake,
            boolean resolved,
            boolean upheld,
            String resolvedBy,
            long payout,
            OffsetDateTime createdAt,
            OffsetDateTime resolvedAt
    ) {
    }

    public record VoteCommitSummary(
            String legislator,
            String commitHash,
            boolean revealed,
            Boolean support,
            boolean slashed,
            OffsetDateTime committedAt
    ) {
    }

    public record DisputeBondQuote(
            String marketId,
            long requiredBond
    ) {
    }
}
