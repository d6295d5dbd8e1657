package com.meritmarket.service;

import com.meritmarket.model.Resolution;
import com.meritmarket.model.ResolutionStake;
import com.meritmarket.model.ResolutionStatus;
import com.meritmarket.model.StakeRole;
import com.meritmarket.repository.ResolutionRepository;
import com.meritmarket.repository.ResolutionStakeRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;

import static com.meritmarket.service.ResolutionParameters.APPROVAL_THRESHOLD_BPS;
import static com.meritmarket.service.ResolutionParameters.MIN_STAKE;
import static com.meritmarket.service.ResolutionParameters.meetsThreshold;
import static com.meritmarket.service.ResolutionParameters.supportDeadline;

/**
 * Support and opposition stakes on an open resolution.
 * Supporters earn a timing bonus that weights their share of the reward pool.
 */
@Service
@RequiredArgsConstructor
public class ResolutionStakingService {

    private static final Logger log = LoggerFactory.getLogger(ResolutionStakingService.class);

    private final ResolutionRepository resolutionRepository;
    private final ResolutionStakeRepository resolutionStakeRepository;
    private final TreasuryLedgerService treasuryLedgerService;
    private final TimingBonusCalculator timingBonusCalculator;
    private final ResolutionLookupService lookupService;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    @Transactional
    public ResolutionStake supportResolution(String marketId, String participant, long amount) {
        return stake(marketId, participant, amount, StakeRole.SUPPORT);
    }

    @Transactional
    public ResolutionStake opposeResolution(String marketId, String participant, long amount) {
        return stake(marketId, participant, amount, StakeRole.OPPOSITION);
    }

    private ResolutionStake stake(String marketId, String participant, long amount, StakeRole role) {
        ResolutionLookupService.requireIdentity(participant, "Staker");
        Resolution resolution = lookupService.current(marketId);
        if (!resolution.isOpen() || resolution.isRejected()) {
            throw ResolutionValidationException.invalidStatus("Resolution for market " + marketId
                    + " no longer accepts stakes (status " + resolution.getStatus()
                    + ", finalized " + resolution.getFinalized() + ")");
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        OffsetDateTime deadline = supportDeadline(resolution.getProposedAt());
        if (!now.isBefore(deadline)) {
            throw ResolutionValidationException.windowClosed("Support", deadline);
        }
        if (amount < MIN_STAKE) {
            throw new ResolutionValidationException(ResolutionError.STAKE_TOO_LOW,
                    "Stake " + amount + " below minimum " + MIN_STAKE);
        }

        ResolutionStake stake = resolutionStakeRepository
                .findByResolutionIdAndRoleAndParticipantAndDisputeIndexIsNull(resolution.getId(), role, participant)
                .orElse(null);
        if (stake != null && Boolean.TRUE.equals(stake.getWithdrawn())) {
            throw new ResolutionValidationException(ResolutionError.STAKE_WITHDRAWN,
                    "Withdrawn " + role + " stake of " + participant + " cannot be topped up");
        }
        boolean firstContribution = stake == null;

        treasuryLedgerService.lockFunds(marketId, participant, amount, role.name().toLowerCase() + " stake");

        if (firstContribution) {
            stake = new ResolutionStake();
            stake.setResolutionId(resolution.getId());
            stake.setParticipant(participant);
            stake.setRole(role);
        }
        stake.setAmount(Math.addExact(stake.getAmount(), amount));
        stake.setLastContributionAt(now);

        if (role == StakeRole.SUPPORT) {
            long bonusBps = timingBonusCalculator.bonusBps(resolution.getProposedAt(), now);
            long weighted = timingBonusCalculator.weightedAmount(amount, bonusBps);
            stake.setWeightedAmount(Math.addExact(stake.getWeightedAmount(), weighted));
            stake.setTimingBonusBps((int) Math.max(stake.getTimingBonusBps(), bonusBps));

            resolution.setSupportStake(Math.addExact(resolution.getSupportStake(), amount));
            resolution.setSupportWeighted(Math.addExact(resolution.getSupportWeighted(), weighted));
            if (firstContribution) {
                resolution.setSupporterCount(resolution.getSupporterCount() + 1);
            }
            applyAutoApproval(resolution, now);
        } else {
            stake.setWeightedAmount(Math.addExact(stake.getWeightedAmount(), amount));
            resolution.setOppositionStake(Math.addExact(resolution.getOppositionStake(), amount));
            if (firstContribution) {
                resolution.setOpposerCount(resolution.getOpposerCount() + 1);
            }
        }

        resolution.setUpdatedAt(now);
        resolutionRepository.save(resolution);
        ResolutionStake saved = resolutionStakeRepository.save(stake);

        log.info("{} staked {} {} on market {} cycle {} (support {}, opposition {})",
                participant, amount, role, marketId, resolution.getCycle(),
                resolution.getSupportStake(), resolution.getOppositionStake());
        return saved;
    }

    /**
     * Advisory promotion to APPROVED once support reaches the approval threshold of all stake.
     */
    private void applyAutoApproval(Resolution resolution, OffsetDateTime now) {
        if (resolution.getStatus() != ResolutionStatus.PENDING) {
            return;
        }
        long support = resolution.getSupportStake();
        long total = Math.addExact(support, resolution.getOppositionStake());
        if (meetsThreshold(support, total, APPROVAL_THRESHOLD_BPS)) {
            resolution.setStatus(ResolutionStatus.APPROVED);
            eventPublisher.publishEvent(new ResolutionLifecycleEvent(resolution.getMarketId(), resolution.getCycle(),
                    ResolutionLifecycleEvent.Transition.APPROVED, "support threshold", now));
            log.info("Market {} cycle {} auto-approved at support {} of {}",
                    resolution.getMarketId(), resolution.getCycle(), support, total);
        }
    }
}
