package com.meritmarket.service;

import com.meritmarket.model.Dispute;
import com.meritmarket.model.DisputeStatus;
import com.meritmarket.model.Resolution;
import com.meritmarket.model.ResolutionStake;
import com.meritmarket.model.StakeRole;
import com.meritmarket.repository.DisputeRepository;
import com.meritmarket.repository.ResolutionStakeRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;

import static com.meritmarket.service.ResolutionParameters.mulDiv;

/**
 * Per-claimant payouts from a finalized resolution cycle.
 * Each claim marks its stake (or challenger flag) as paid before the transfer and checks the market's
 * escrow can cover it, so a second call for the same stake fails with {@link ResolutionError#ALREADY_CLAIMED}.
 */
@Service
@RequiredArgsConstructor
public class RewardClaimService {

    private static final Logger log = LoggerFactory.getLogger(RewardClaimService.class);

    private final ResolutionStakeRepository resolutionStakeRepository;
    private final DisputeRepository disputeRepository;
    private final TreasuryLedgerService treasuryLedgerService;
    private final ResolutionLookupService lookupService;
    private final Clock clock;

    /**
     * Supporter principal plus their weighted share of the reward pool. Approved resolutions only.
     */
    @Transactional
    public ClaimReceipt claimResolutionReward(String marketId, Integer cycle, String participant) {
        Resolution resolution = finalizedResolution(marketId, cycle);
        if (!resolution.isApproved()) {
            throw nothingToClaim("Supporter stakes on market " + marketId + " cycle "
                    + resolution.getCycle() + " were forfeited");
        }
        ResolutionStake stake = unclaimedStake(resolution, StakeRole.SUPPORT, participant, null);

        long reward = resolution.getSupportWeighted() == 0 ? 0L
                : mulDiv(stake.getWeightedAmount(), resolution.getSupportRewardPool(), resolution.getSupportWeighted());
        long payout = Math.addExact(stake.getAmount(), reward);
        return pay(resolution, stake, payout, "support reward");
    }

    /**
     * Opposition share of the forfeited pool. Rejected resolutions only.
     */
    @Transactional
    public ClaimReceipt claimOppositionReward(String marketId, Integer cycle, String participant) {
        Resolution resolution = finalizedResolution(marketId, cycle);
        if (!resolution.isRejected()) {
            throw nothingToClaim("Opposition stakes on market " + marketId + " cycle "
                    + resolution.getCycle() + " were forfeited");
        }
        ResolutionStake stake = unclaimedStake(resolution, StakeRole.OPPOSITION, participant, null);

        long payout = mulDiv(stake.getAmount(), resolution.getOppositionRewardPool(), resolution.getOppositionStake());
        if (payout == 0) {
            throw nothingToClaim("Opposition pool on market " + marketId + " is empty");
        }
        return pay(resolution, stake, payout, "opposition reward");
    }

    /**
     * Challenger bond plus bonus for an upheld dispute, or the bare bond for a withdrawn one.
     */
    @Transactional
    public ClaimReceipt claimDisputeReward(String marketId, Integer cycle, String challenger, int disputeIndex) {
        Resolution resolution = finalizedResolution(marketId, cycle);
        Dispute dispute = lookupService.dispute(resolution, disputeIndex);
        if (!dispute.getChallenger().equals(challenger)) {
            throw new ResolutionValidationException(ResolutionError.NOT_AUTHORIZED,
                    challenger + " did not file dispute " + disputeIndex);
        }
        if (Boolean.TRUE.equals(dispute.getChallengerClaimed())) {
            throw new ResolutionValidationException(ResolutionError.ALREADY_CLAIMED,
                    "Dispute " + disputeIndex + " on market " + marketId + " was already claimed");
        }

        long payout;
        if (dispute.getStatus() == DisputeStatus.UPHELD) {
            payout = Math.addExact(dispute.getBond(), dispute.getChallengerBonus());
        } else if (dispute.getStatus() == DisputeStatus.WITHDRAWN) {
            payout = dispute.getBond();
        } else {
            throw nothingToClaim("Dispute " + disputeIndex + " on market " + marketId + " is " + dispute.getStatus());
        }
        requireCoverage(resolution, payout);

        dispute.setChallengerClaimed(true);
        disputeRepository.save(dispute);
        treasuryLedgerService.releaseFunds(marketId, challenger, payout, "dispute " + disputeIndex + " challenger claim");

        log.info("{} claimed {} for dispute {} on market {} cycle {}",
                challenger, payout, disputeIndex, marketId, resolution.getCycle());
        return new ClaimReceipt(marketId, resolution.getCycle(), challenger, "DISPUTE_CHALLENGER", payout);
    }

    /**
     * Principal of a dispute backer whose dispute was upheld or withdrawn. Backers of rejected disputes forfeit.
     */
    @Transactional
    public ClaimReceipt reclaimDisputeStake(String marketId, Integer cycle, String participant, int disputeIndex) {
        Resolution resolution = finalizedResolution(marketId, cycle);
        Dispute dispute = lookupService.dispute(resolution, disputeIndex);
        if (dispute.getStatus() != DisputeStatus.UPHELD && dispute.getStatus() != DisputeStatus.WITHDRAWN) {
            throw nothingToClaim("Backing of dispute " + disputeIndex + " on market " + marketId
                    + " was forfeited (" + dispute.getStatus() + ")");
        }
        ResolutionStake stake = unclaimedStake(resolution, StakeRole.DISPUTE_SUPPORT, participant, disputeIndex);
        return pay(resolution, stake, stake.getAmount(), "dispute " + disputeIndex + " stake");
    }

    private Resolution finalizedResolution(String marketId, Integer cycle) {
        Resolution resolution = lookupService.byCycle(marketId, cycle);
        if (resolution.isOpen()) {
            throw new ResolutionValidationException(ResolutionError.NOT_FINALIZED,
                    "Resolution for market " + marketId + " cycle " + resolution.getCycle() + " is not finalized");
        }
        return resolution;
    }

    private ResolutionStake unclaimedStake(Resolution resolution, StakeRole role, String participant, Integer disputeIndex) {
        ResolutionLookupService.requireIdentity(participant, "Claimant");
        ResolutionStake stake = (disputeIndex == null
                ? resolutionStakeRepository.findByResolutionIdAndRoleAndParticipantAndDisputeIndexIsNull(
                        resolution.getId(), role, participant)
                : resolutionStakeRepository.findByResolutionIdAndRoleAndParticipantAndDisputeIndex(
                        resolution.getId(), role, participant, disputeIndex))
                .orElseThrow(() -> nothingToClaim(participant + " has no " + role + " stake on market "
                        + resolution.getMarketId() + " cycle " + resolution.getCycle()));
        if (Boolean.TRUE.equals(stake.getWithdrawn())) {
            throw new ResolutionValidationException(ResolutionError.ALREADY_CLAIMED,
                    participant + " already claimed their " + role + " stake on market " + resolution.getMarketId());
        }
        return stake;
    }

    private ClaimReceipt pay(Resolution resolution, ResolutionStake stake, long payout, String reason) {
        requireCoverage(resolution, payout);

        stake.setWithdrawn(true);
        stake.setWithdrawnAt(OffsetDateTime.now(clock));
        stake.setPayout(payout);
        resolutionStakeRepository.save(stake);

        treasuryLedgerService.releaseFunds(resolution.getMarketId(), stake.getParticipant(), payout, reason);

        log.info("{} claimed {} ({}) on market {} cycle {}",
                stake.getParticipant(), payout, reason, resolution.getMarketId(), resolution.getCycle());
        return new ClaimReceipt(resolution.getMarketId(), resolution.getCycle(), stake.getParticipant(),
                stake.getRole().name(), payout);
    }

    private void requireCoverage(Resolution resolution, long payout) {
        if (!treasuryLedgerService.canCover(resolution.getMarketId(), payout)) {
            throw new LedgerInsolvencyException("Market " + resolution.getMarketId()
                    + " cannot cover claim of " + payout);
        }
    }

    private static ResolutionValidationException nothingToClaim(String detail) {
        return new ResolutionValidationException(ResolutionError.NOTHING_TO_CLAIM, detail);
    }

    public record ClaimReceipt(String marketId, int cycle, String participant, String role, long payout) {
    }
}
