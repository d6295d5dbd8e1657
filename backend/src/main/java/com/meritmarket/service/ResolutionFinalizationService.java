package com.meritmarket.service;

import com.meritmarket.model.Dispute;
import com.meritmarket.model.DisputeStatus;
import com.meritmarket.model.EvidenceChallenge;
import com.meritmarket.model.Resolution;
import com.meritmarket.model.ResolutionStatus;
import com.meritmarket.repository.DisputeRepository;
import com.meritmarket.repository.EvidenceChallengeRepository;
import com.meritmarket.repository.ResolutionRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.meritmarket.service.ResolutionParameters.CHALLENGER_BONUS_BPS;
import static com.meritmarket.service.ResolutionParameters.CHALLENGER_BONUS_CAP_BPS;
import static com.meritmarket.service.ResolutionParameters.DISPUTE_PERIOD;
import static com.meritmarket.service.ResolutionParameters.FINALIZATION_BUFFER;
import static com.meritmarket.service.ResolutionParameters.PROTOCOL_FEE_BPS;
import static com.meritmarket.service.ResolutionParameters.UPHELD_CHALLENGE_PAYOUT_MULTIPLIER;
import static com.meritmarket.service.ResolutionParameters.basisPoints;
import static com.meritmarket.service.ResolutionParameters.finalizationTime;

/**
 * Single irreversible settlement of a resolution cycle.
 * Settlement outcomes:
 * - Approved: opposition stake (net of fee) and rejected dispute stakes become the supporters' reward pool,
 *   shared by weighted stake; supporter principal is returned at claim time
 * - Rejected (legislator supermajority, upheld evidence challenge): supporter stake is slashed into the
 *   opposition pool, shared by opposition stake; the market goes back to settlement for a new cycle
 * - Dispute upheld: as rejected, and the winning challenger takes a bonus from the forfeited pool
 * Reward pools are stored as totals; per-claimant payouts are computed lazily by {@link RewardClaimService}.
 */
@Service
@RequiredArgsConstructor
public class ResolutionFinalizationService {

    private static final Logger log = LoggerFactory.getLogger(ResolutionFinalizationService.class);

    private final ResolutionRepository resolutionRepository;
    private final DisputeRepository disputeRepository;
    private final EvidenceChallengeRepository evidenceChallengeRepository;
    private final TreasuryLedgerService treasuryLedgerService;
    private final ResolutionScoringService scoringService;
    private final ResolutionLookupService lookupService;
    private final MarketStateNotifier marketStateNotifier;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    @Transactional
    public FinalizationResult finalizeResolution(String marketId) {
        Resolution resolution = lookupService.current(marketId);
        if (!resolution.isOpen()) {
            throw new ResolutionValidationException(ResolutionError.ALREADY_FINALIZED,
                    "Resolution for market " + marketId + " cycle " + resolution.getCycle() + " is finalized");
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        OffsetDateTime due = finalizationTime(resolution.getProposedAt());
        if (now.isBefore(due)) {
            throw ResolutionValidationException.windowNotOpen("Finalization", due);
        }
        if (evidenceChallengeRepository.existsByResolutionIdAndResolvedFalse(resolution.getId())) {
            throw new ResolutionValidationException(ResolutionError.CHALLENGES_UNRESOLVED,
                    "Market " + marketId + " has unresolved evidence challenges");
        }
        return settle(resolution, now);
    }

    /**
     * Finalizes the given cycle if it is due and unblocked; otherwise does nothing.
     */
    @Transactional
    public Optional<FinalizationResult> finalizeIfDue(String marketId, Integer cycle) {
        Resolution resolution = lookupService.byCycle(marketId, cycle);
        OffsetDateTime now = OffsetDateTime.now(clock);
        if (!resolution.isOpen()
                || now.isBefore(finalizationTime(resolution.getProposedAt()))
                || evidenceChallengeRepository.existsByResolutionIdAndResolvedFalse(resolution.getId())) {
            return Optional.empty();
        }
        return Optional.of(settle(resolution, now));
    }

    @Transactional(readOnly = true)
    public List<Resolution> dueForFinalization() {
        OffsetDateTime proposedBefore = OffsetDateTime.now(clock).minus(DISPUTE_PERIOD).minus(FINALIZATION_BUFFER);
        return resolutionRepository.findByFinalizedFalseAndProposedAtBefore(proposedBefore);
    }

    /**
     * Rejects and settles the resolution after an upheld evidence challenge. The challenger is owed their
     * stake plus an equal bonus out of the forfeited support pool; any other open challenge is refunded and
     * every active dispute is withdrawn so its backers can reclaim their principal.
     */
    @Transactional
    public FinalizationResult settleUpheldChallenge(Resolution resolution, EvidenceChallenge upheld, String resolver) {
        OffsetDateTime now = OffsetDateTime.now(clock);

        long challengerPayout = Math.multiplyExact(upheld.getStake(), UPHELD_CHALLENGE_PAYOUT_MULTIPLIER);
        long evidenceBonus = challengerPayout - upheld.getStake();
        upheld.setResolved(true);
        upheld.setUpheld(true);
        upheld.setResolvedBy(resolver);
        upheld.setResolvedAt(now);
        upheld.setPayout(challengerPayout);
        evidenceChallengeRepository.save(upheld);

        long refunds = 0L;
        List<EvidenceChallenge> refunded = new ArrayList<>();
        for (EvidenceChallenge other : evidenceChallengeRepository
                .findByResolutionIdOrderByChallengeIndexAsc(resolution.getId())) {
            if (Boolean.TRUE.equals(other.getResolved()) || other.getId().equals(upheld.getId())) {
                continue;
            }
            other.setResolved(true);
            other.setUpheld(false);
            other.setResolvedBy(resolver);
            other.setResolvedAt(now);
            other.setPayout(other.getStake());
            refunds = Math.addExact(refunds, other.getStake());
            refunded.add(evidenceChallengeRepository.save(other));
        }

        for (Dispute dispute : disputeRepository.findByResolutionIdOrderByDisputeIndexAsc(resolution.getId())) {
            if (dispute.isActive()) {
                dispute.setStatus(DisputeStatus.WITHDRAWN);
                disputeRepository.save(dispute);
            }
        }

        FinalizationResult result = settleRejected(resolution, 0L, evidenceBonus, null, now,
                "evidence challenge " + upheld.getChallengeIndex() + " upheld");

        long outgoing = Math.addExact(challengerPayout, refunds);
        if (!treasuryLedgerService.canCover(resolution.getMarketId(), outgoing)) {
            throw new LedgerInsolvencyException("Market " + resolution.getMarketId()
                    + " cannot cover evidence challenge payouts of " + outgoing);
        }
        treasuryLedgerService.releaseFunds(resolution.getMarketId(), upheld.getChallenger(), challengerPayout,
                "upheld evidence challenge");
        for (EvidenceChallenge other : refunded) {
            treasuryLedgerService.releaseFunds(resolution.getMarketId(), other.getChallenger(), other.getStake(),
                    "evidence challenge refund");
        }
        return result;
    }

    private FinalizationResult settle(Resolution resolution, OffsetDateTime now) {
        List<Dispute> disputes = disputeRepository.findByResolutionIdOrderByDisputeIndexAsc(resolution.getId());
        List<Dispute> active = disputes.stream().filter(Dispute::isActive).toList();

        Dispute winner = null;
        long rejectedDisputeStakes = 0L;
        if (!active.isEmpty()) {
            ResolutionScoringService.ScoringOutcome scoring = scoringService.selectWinner(resolution, active);
            for (Dispute dispute : active) {
                if (scoring.disputeWon() && dispute.getDisputeIndex().equals(scoring.winningIndex())) {
                    dispute.setStatus(DisputeStatus.UPHELD);
                    winner = dispute;
                } else {
                    dispute.setStatus(DisputeStatus.REJECTED);
                    rejectedDisputeStakes = Math.addExact(rejectedDisputeStakes, dispute.totalPool());
                }
                disputeRepository.save(dispute);
            }
        }

        if (winner != null) {
            return settleRejected(resolution, rejectedDisputeStakes, 0L, winner, now,
                    "dispute " + winner.getDisputeIndex() + " upheld");
        }
        if (resolution.isRejected()) {
            return settleRejected(resolution, rejectedDisputeStakes, 0L, null, now, "legislator supermajority");
        }
        return settleApproved(resolution, rejectedDisputeStakes, now);
    }

    private FinalizationResult settleApproved(Resolution resolution, long rejectedDisputeStakes, OffsetDateTime now) {
        long support = resolution.getSupportStake();
        long opposition = resolution.getOppositionStake();
        long forfeited = Math.addExact(opposition, rejectedDisputeStakes);
        // the fee is paid out of forfeited stake only, never out of supporter principal
        long fee = Math.min(basisPoints(Math.addExact(support, opposition), PROTOCOL_FEE_BPS), forfeited);
        long rewardPool = forfeited - fee;

        resolution.setStatus(ResolutionStatus.APPROVED);
        resolution.setFinalOutcome(resolution.getProposedOutcome());
        resolution.setProtocolFee(fee);
        resolution.setSupportRewardPool(rewardPool);
        resolution.setSlashedAmount(forfeited);
        markFinalized(resolution, now);

        treasuryLedgerService.collectFee(resolution.getMarketId(), fee,
                "approved resolution cycle " + resolution.getCycle());
        treasuryLedgerService.recordSlashed(forfeited, "forfeited opposition on market " + resolution.getMarketId());
        marketStateNotifier.finalized(resolution.getMarketId(), resolution.getProposedOutcome());

        log.info("Finalized market {} cycle {} APPROVED with outcome {}: fee {}, supporter reward pool {}",
                resolution.getMarketId(), resolution.getCycle(), resolution.getProposedOutcome(), fee, rewardPool);
        return publish(resolution, now, "approved");
    }

    private FinalizationResult settleRejected(Resolution resolution,
                                              long rejectedDisputeStakes,
                                              long evidenceBonus,
                                              Dispute winningDispute,
                                              OffsetDateTime now,
                                              String reason) {
        long support = resolution.getSupportStake();
        long opposition = resolution.getOppositionStake();
        long fee = basisPoints(Math.addExact(support, opposition), PROTOCOL_FEE_BPS);
        long available = Math.addExact(Math.addExact(support, opposition), rejectedDisputeStakes) - fee - evidenceBonus;
        if (available < 0) {
            throw new LedgerInsolvencyException("Forfeited pool of market " + resolution.getMarketId()
                    + " cannot fund evidence bonus " + evidenceBonus);
        }

        long challengerBonus = 0L;
        if (winningDispute != null) {
            long disputePool = winningDispute.totalPool();
            challengerBonus = Math.min(
                    Math.min(basisPoints(disputePool, CHALLENGER_BONUS_BPS), basisPoints(disputePool, CHALLENGER_BONUS_CAP_BPS)),
                    available);
            winningDispute.setChallengerBonus(challengerBonus);
            disputeRepository.save(winningDispute);
            resolution.setWinningDisputeIndex(winningDispute.getDisputeIndex());
        }

        long pool = available - challengerBonus;
        long swept = opposition > 0 ? 0L : pool;
        long forfeited = Math.addExact(support, rejectedDisputeStakes);

        resolution.setStatus(ResolutionStatus.REJECTED);
        resolution.setFinalOutcome(null);
        resolution.setProtocolFee(Math.addExact(fee, swept));
        resolution.setSupportRewardPool(0L);
        resolution.setOppositionRewardPool(opposition > 0 ? pool : 0L);
        resolution.setEvidenceBonusPaid(evidenceBonus);
        resolution.setSlashedAmount(forfeited);
        markFinalized(resolution, now);

        treasuryLedgerService.collectFee(resolution.getMarketId(), Math.addExact(fee, swept),
                "rejected resolution cycle " + resolution.getCycle());
        treasuryLedgerService.recordSlashed(forfeited, "forfeited support on market " + resolution.getMarketId());
        marketStateNotifier.returnedToSettlement(resolution.getMarketId());

        log.info("Finalized market {} cycle {} REJECTED ({}): fee {}, opposition pool {}, challenger bonus {}",
                resolution.getMarketId(), resolution.getCycle(), reason, fee + swept,
                resolution.getOppositionRewardPool(), challengerBonus);
        return publish(resolution, now, reason);
    }

    private void markFinalized(Resolution resolution, OffsetDateTime now) {
        resolution.setFinalized(true);
        resolution.setFinalizedAt(now);
        resolution.setUpdatedAt(now);
        resolutionRepository.save(resolution);
    }

    private FinalizationResult publish(Resolution resolution, OffsetDateTime now, String reason) {
        eventPublisher.publishEvent(new ResolutionLifecycleEvent(resolution.getMarketId(), resolution.getCycle(),
                ResolutionLifecycleEvent.Transition.FINALIZED, reason, now));
        return new FinalizationResult(
                resolution.getMarketId(),
                resolution.getCycle(),
                resolution.getStatus(),
                resolution.getFinalOutcome(),
                resolution.getWinningDisputeIndex(),
                resolution.getProtocolFee(),
                resolution.getSupportRewardPool(),
                resolution.getOppositionRewardPool(),
                reason
        );
    }

    public record FinalizationResult(
            String marketId,
            int cycle,
            ResolutionStatus status,
            Integer finalOutcome,
            Integer winningDisputeIndex,
            long protocolFee,
            long supportRewardPool,
            long oppositionRewardPool,
            String reason
    ) {
    }
}
