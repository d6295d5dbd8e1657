package com.meritmarket.mapper;

import com.meritmarket.dto.ResolutionResponses;
import com.meritmarket.model.Dispute;
import com.meritmarket.model.EvidenceChallenge;
import com.meritmarket.model.LegislatorVoteCommit;
import com.meritmarket.model.Resolution;
import com.meritmarket.model.ResolutionCommit;
import com.meritmarket.model.ResolutionStake;
import com.meritmarket.service.ResolutionParameters;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;

@Component
public class ResolutionResponseMapper {

    public ResolutionResponses.CommitSummary toCommitSummary(ResolutionCommit commit) {
        return new ResolutionResponses.CommitSummary(
                commit.getId(),
                commit.getMarketId(),
                commit.getCommitter(),
                commit.getCommitHash(),
                commit.getBond(),
                Boolean.TRUE.equals(commit.getRevealed()),
                Boolean.TRUE.equals(commit.getSlashed()),
                commit.getCommittedAt(),
                commit.getCommittedAt().plus(ResolutionParameters.MIN_REVEAL_DELAY),
                commit.getCommittedAt().plus(ResolutionParameters.MAX_REVEAL_DELAY)
        );
    }

    public ResolutionResponses.ResolutionDetail toResolutionDetail(Resolution resolution) {
        return new ResolutionResponses.ResolutionDetail(
                resolution.getMarketId(),
                resolution.getCycle(),
                resolution.getProposer(),
                resolution.getProposedOutcome(),
                resolution.getStatus().name(),
                Boolean.TRUE.equals(resolution.getDisputed()),
                Boolean.TRUE.equals(resolution.getFinalized()),
                resolution.getFinalOutcome(),
                resolution.getWinningDisputeIndex(),
                resolution.getEvidenceUri(),
                resolution.getEvidenceHash(),
                resolution.getProposerTimingBonusBps(),
                resolution.getSupportStake(),
                resolution.getSupportWeighted(),
                resolution.getOppositionStake(),
                resolution.getSupporterCount(),
                resolution.getOpposerCount(),
                resolution.getLegislatorSupportVotes(),
                resolution.getLegislatorOpposeVotes(),
                resolution.getDisputeCount(),
                resolution.getChallengeCount(),
                resolution.getProtocolFee(),
                resolution.getSupportRewardPool(),
                resolution.getOppositionRewardPool(),
                resolution.getSlashedAmount(),
                toWindows(resolution.getProposedAt()),
                resolution.getProposedAt(),
                resolution.getFinalizedAt()
        );
    }

    public List<ResolutionResponses.ResolutionDetail> toResolutionDetails(Collection<Resolution> resolutions) {
        return resolutions.stream().map(this::toResolutionDetail).toList();
    }

    public ResolutionResponses.StakeSummary toStakeSummary(ResolutionStake stake) {
        return new ResolutionResponses.StakeSummary(
                stake.getParticipant(),
                stake.getRole().name(),
                stake.getDisputeIndex(),
                stake.getAmount(),
                stake.getWeightedAmount(),
                stake.getTimingBonusBps(),
                Boolean.TRUE.equals(stake.getWithdrawn()),
                stake.getPayout(),
                stake.getLastContributionAt()
        );
    }

    public List<ResolutionResponses.StakeSummary> toStakeSummaries(Collection<ResolutionStake> stakes) {
        return stakes.stream().map(this::toStakeSummary).toList();
    }

    public ResolutionResponses.DisputeSummary toDisputeSummary(Dispute dispute) {
        return new ResolutionResponses.DisputeSummary(
                dispute.getDisputeIndex(),
                dispute.getChallenger(),
                dispute.getAlternativeOutcome(),
                dispute.getBond(),
                dispute.getSupportStake(),
                dispute.getSupporterCount(),
                dispute.getEndorsementCount(),
                dispute.getStatus().name(),
                dispute.getEvidenceUri(),
                dispute.getEvidenceHash(),
                dispute.getChallengerBonus(),
                Boolean.TRUE.equals(dispute.getChallengerClaimed()),
                dispute.getCreatedAt()
        );
    }

    public List<ResolutionResponses.DisputeSummary> toDisputeSummaries(Collection<Dispute> disputes) {
        return disputes.stream().map(this::toDisputeSummary).toList();
    }

    public ResolutionResponses.ChallengeSummary toChallengeSummary(EvidenceChallenge challenge) {
        return new ResolutionResponses.ChallengeSummary(
                challenge.getChallengeIndex(),
                challenge.getChallenger(),
                challenge.getReason(),
                challenge.getStake(),
                Boolean.TRUE.equals(challenge.getResolved()),
                Boolean.TRUE.equals(challenge.getUpheld()),
                challenge.getResolvedBy(),
                challenge.getPayout(),
                challenge.getCreatedAt(),
                challenge.getResolvedAt()
        );
    }

    public List<ResolutionResponses.ChallengeSummary> toChallengeSummaries(Collection<EvidenceChallenge> challenges) {
        return challenges.stream().map(this::toChallengeSummary).toList();
    }

    public ResolutionResponses.VoteCommitSummary toVoteCommitSummary(LegislatorVoteCommit commit) {
        return new ResolutionResponses.VoteCommitSummary(
                commit.getLegislator(),
                commit.getCommitHash(),
                Boolean.TRUE.equals(commit.getRevealed()),
                commit.getSupport(),
                Boolean.TRUE.equals(commit.getSlashed()),
                commit.getCommittedAt()
        );
    }

    private ResolutionResponses.Windows toWindows(OffsetDateTime proposedAt) {
        return new ResolutionResponses.Windows(
                ResolutionParameters.supportDeadline(proposedAt),
                ResolutionParameters.evidenceChallengeDeadline(proposedAt),
                ResolutionParameters.legislatorCommitDeadline(proposedAt),
                ResolutionParameters.legislatorRevealDeadline(proposedAt),
                ResolutionParameters.disputeDeadline(proposedAt),
                ResolutionParameters.finalizationTime(proposedAt)
        );
    }
}
