package com.meritmarket.service;

import com.meritmarket.config.ResolutionRuntimeProperties;
import com.meritmarket.gateway.PriceOracle;
import com.meritmarket.model.Dispute;
import com.meritmarket.model.EvidenceChallenge;
import com.meritmarket.model.LegislatorVoteCommit;
import com.meritmarket.model.Resolution;
import com.meritmarket.model.ResolutionCommit;
import com.meritmarket.model.ResolutionStake;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Entry point for every protocol operation. State-mutating operations run one at a time under
 * {@link ProtocolOperationGuard}, each in its own transaction.
 */
@Service
@RequiredArgsConstructor
public class ResolutionProtocol {

    private static final Logger log = LoggerFactory.getLogger(ResolutionProtocol.class);

    private final ProtocolOperationGuard guard;
    private final ResolutionProposalService proposalService;
    private final ResolutionStakingService stakingService;
    private final EvidenceChallengeService evidenceChallengeService;
    private final LegislatorVotingService legislatorVotingService;
    private final DisputeService disputeService;
    private final ResolutionFinalizationService finalizationService;
    private final RewardClaimService rewardClaimService;
    private final TreasuryLedgerService treasuryLedgerService;
    private final ResolutionLookupService lookupService;
    private final PriceOracle priceOracle;
    private final ResolutionRuntimeProperties properties;

    // Proposal

    public ResolutionCommit commitResolution(String marketId, String committer, String commitHash, long bond) {
        return guard.execute("commitResolution",
                () -> proposalService.commitResolution(marketId, committer, commitHash, bond));
    }

    public Resolution proposeResolution(String marketId, String proposer, int outcome, String evidenceUri,
                                        String evidenceHash, String salt, long stake) {
        return guard.execute("proposeResolution",
                () -> proposalService.proposeResolution(marketId, proposer, outcome, evidenceUri, evidenceHash, salt, stake));
    }

    public ResolutionProposalService.CommitSlashResult slashUnrevealedCommit(String marketId, String caller, String committer) {
        return guard.execute("slashUnrevealedCommit",
                () -> proposalService.slashUnrevealedCommit(marketId, caller, committer));
    }

    // Staking

    public ResolutionStake supportResolution(String marketId, String participant, long amount) {
        return guard.execute("supportResolution", () -> stakingService.supportResolution(marketId, participant, amount));
    }

    public ResolutionStake opposeResolution(String marketId, String participant, long amount) {
        return guard.execute("opposeResolution", () -> stakingService.opposeResolution(marketId, participant, amount));
    }

    // Evidence challenges

    public EvidenceChallenge challengeEvidence(String marketId, String challenger, String reason, long stake) {
        return guard.execute("challengeEvidence",
                () -> evidenceChallengeService.challengeEvidence(marketId, challenger, reason, stake));
    }

    public EvidenceChallenge resolveEvidenceChallenge(String marketId, String resolver, int challengeIndex, boolean upheld) {
        return guard.execute("resolveEvidenceChallenge",
                () -> evidenceChallengeService.resolveEvidenceChallenge(marketId, resolver, challengeIndex, upheld));
    }

    // Legislator voting

    public LegislatorVoteCommit commitLegislatorVote(String marketId, String legislator, String commitHash) {
        return guard.execute("commitLegislatorVote",
                () -> legislatorVotingService.commitLegislatorVote(marketId, legislator, commitHash));
    }

    public Resolution revealLegislatorVote(String marketId, String legislator, boolean support, String salt) {
        return guard.execute("revealLegislatorVote",
                () -> legislatorVotingService.revealLegislatorVote(marketId, legislator, support, salt));
    }

    public LegislatorVotingService.LegislatorSlashResult slashNonRevealingLegislator(String marketId, Integer cycle,
                                                                                   String caller, String legislator) {
        return guard.execute("slashNonRevealingLegislator",
                () -> legislatorVotingService.slashNonRevealingLegislator(marketId, cycle, caller, legislator));
    }

    // Disputes

    public Dispute disputeResolution(String marketId, String challenger, int alternativeOutcome, String evidenceUri,
                                     String evidenceHash, long bond) {
        return guard.execute("disputeResolution",
                () -> disputeService.disputeResolution(marketId, challenger, alternativeOutcome, evidenceUri, evidenceHash, bond));
    }

    public ResolutionStake supportDispute(String marketId, String participant, int disputeIndex, long amount) {
        return guard.execute("supportDispute",
                () -> disputeService.supportDispute(marketId, participant, disputeIndex, amount));
    }

    public Dispute endorseDispute(String marketId, String legislator, int disputeIndex) {
        return guard.execute("endorseDispute", () -> disputeService.endorseDispute(marketId, legislator, disputeIndex));
    }

    // Finalization and claims

    public ResolutionFinalizationService.FinalizationResult finalizeResolution(String marketId) {
        return guard.execute("finalizeResolution", () -> finalizationService.finalizeResolution(marketId));
    }

    public RewardClaimService.ClaimReceipt claimResolutionReward(String marketId, Integer cycle, String participant) {
        return guard.execute("claimResolutionReward", () -> {
            autoFinalize(marketId, cycle);
            return rewardClaimService.claimResolutionReward(marketId, cycle, participant);
        });
    }

    public RewardClaimService.ClaimReceipt claimOppositionReward(String marketId, Integer cycle, String participant) {
        return guard.execute("claimOppositionReward", () -> {
            autoFinalize(marketId, cycle);
            return rewardClaimService.claimOppositionReward(marketId, cycle, participant);
        });
    }

    public RewardClaimService.ClaimReceipt claimDisputeReward(String marketId, Integer cycle, String challenger,
                                                             int disputeIndex) {
        return guard.execute("claimDisputeReward", () -> {
            autoFinalize(marketId, cycle);
            return rewardClaimService.claimDisputeReward(marketId, cycle, challenger, disputeIndex);
        });
    }

    public RewardClaimService.ClaimReceipt reclaimDisputeStake(String marketId, Integer cycle, String participant,
                                                              int disputeIndex) {
        return guard.execute("reclaimDisputeStake", () -> {
            autoFinalize(marketId, cycle);
            return rewardClaimService.reclaimDisputeStake(marketId, cycle, participant, disputeIndex);
        });
    }

    /**
     * Finalizes every open cycle whose finalization time has passed. A cycle that cannot be finalized
     * is logged and left for the next run.
     *
     * @return number of cycles finalized
     */
    public int finalizeDue() {
        int finalized = 0;
        for (Resolution due : finalizationService.dueForFinalization()) {
            try {
                boolean settled = guard.execute("finalizeDue",
                        () -> finalizationService.finalizeIfDue(due.getMarketId(), due.getCycle()).isPresent());
                if (settled) {
                    finalized++;
                }
            } catch (RuntimeException e) {
                log.warn("Could not finalize market {} cycle {}: {}", due.getMarketId(), due.getCycle(), e.getMessage());
            }
        }
        return finalized;
    }

    // Treasury

    public TreasuryLedgerService.TreasurySnapshot withdrawProtocolFees(String caller, String recipient, long amount) {
        return guard.execute("withdrawProtocolFees", () -> {
            if (caller == null || !properties.getOracleManagers().contains(caller)) {
                throw new ResolutionValidationException(ResolutionError.NOT_AUTHORIZED,
                        caller + " may not withdraw protocol fees");
            }
            ResolutionLookupService.requireIdentity(recipient, "Recipient");
            treasuryLedgerService.withdrawProtocolFees(recipient, amount);
            return treasuryLedgerService.snapshot();
        });
    }

    public TreasuryLedgerService.TreasurySnapshot treasury() {
        return treasuryLedgerService.snapshot();
    }

    // Queries

    public Resolution resolution(String marketId, Integer cycle) {
        return lookupService.byCycle(marketId, cycle);
    }

    public List<Resolution> history(String marketId) {
        return lookupService.history(marketId);
    }

    public List<Dispute> disputes(String marketId, Integer cycle) {
        return lookupService.disputes(lookupService.byCycle(marketId, cycle));
    }

    public List<EvidenceChallenge> challenges(String marketId, Integer cycle) {
        return lookupService.challenges(lookupService.byCycle(marketId, cycle));
    }

    public List<ResolutionStake> stakes(String marketId, Integer cycle, String participant) {
        Resolution resolution = lookupService.byCycle(marketId, cycle);
        return participant == null
                ? lookupService.stakes(resolution)
                : lookupService.stakesOf(resolution, participant);
    }

    public long requiredDisputeBond(String marketId) {
        return disputeService.requiredBond(marketId);
    }

    public PriceOracle.RecordedPrice recordedPrice(String marketId) {
        lookupService.requireMarket(marketId);
        return priceOracle.recordedPrice(marketId);
    }

    private void autoFinalize(String marketId, Integer cycle) {
        if (!properties.isAutoFinalizeOnClaim()) {
            return;
        }
        finalizationService.finalizeIfDue(marketId, cycle)
                .ifPresent(result -> log.info("Claim on market {} finalized cycle {} as {}",
                        marketId, result.cycle(), result.status()));
    }
}
