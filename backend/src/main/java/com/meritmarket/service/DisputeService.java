package com.meritmarket.service;

import com.meritmarket.gateway.PredictionMarketGateway;
import com.meritmarket.model.Dispute;
import com.meritmarket.model.DisputeEndorsement;
import com.meritmarket.model.Resolution;
import com.meritmarket.model.ResolutionStake;
import com.meritmarket.model.StakeRole;
import com.meritmarket.repository.DisputeEndorsementRepository;
import com.meritmarket.repository.DisputeRepository;
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

import static com.meritmarket.service.ResolutionParameters.MIN_STAKE;
import static com.meritmarket.service.ResolutionParameters.disputeDeadline;

/**
 * Bonded counter-proposals against an open resolution, with their own backing stake and
 * legislator endorsements. Disputes are scored at finalization.
 */
@Service
@RequiredArgsConstructor
public class DisputeService {

    private static final Logger log = LoggerFactory.getLogger(DisputeService.class);

    private final DisputeRepository disputeRepository;
    private final DisputeEndorsementRepository disputeEndorsementRepository;
    private final ResolutionRepository resolutionRepository;
    private final ResolutionStakeRepository resolutionStakeRepository;
    private final PredictionMarketGateway marketGateway;
    private final TreasuryLedgerService treasuryLedgerService;
    private final DisputeBondCalculator disputeBondCalculator;
    private final ResolutionLookupService lookupService;
    private final MarketStateNotifier marketStateNotifier;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    @Transactional(readOnly = true)
    public long requiredBond(String marketId) {
        Resolution resolution = lookupService.current(marketId);
        return disputeBondCalculator.requiredBond(resolution, OffsetDateTime.now(clock));
    }

    @Transactional
    public Dispute disputeResolution(String marketId,
                                     String challenger,
                                     int alternativeOutcome,
                                     String evidenceUri,
                                     String evidenceHash,
                                     long bond) {
        ResolutionLookupService.requireIdentity(challenger, "Challenger");
        Resolution resolution = lookupService.current(marketId);
        if (!resolution.isOpen()) {
            throw new ResolutionValidationException(ResolutionError.ALREADY_FINALIZED,
                    "Resolution for market " + marketId + " is finalized");
        }
        if (resolution.isRejected()) {
            throw ResolutionValidationException.invalidStatus("Rejected resolution on market " + marketId
                    + " cannot be disputed");
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        requireDisputeWindow(resolution, now);

        int outcomeCount = marketGateway.outcomeCount(marketId);
        if (alternativeOutcome < 0 || alternativeOutcome >= outcomeCount) {
            throw new ResolutionValidationException(ResolutionError.INVALID_OUTCOME,
                    "Outcome " + alternativeOutcome + " out of range [0, " + outcomeCount + ")");
        }
        if (alternativeOutcome == resolution.getProposedOutcome()) {
            throw new ResolutionValidationException(ResolutionError.INVALID_OUTCOME,
                    "Dispute must propose an outcome other than " + resolution.getProposedOutcome());
        }
        String normalizedEvidenceHash = ResolutionProposalService.normalizeEvidenceHash(evidenceHash);
        ResolutionProposalService.validateEvidence(evidenceUri, normalizedEvidenceHash);

        long requiredBond = disputeBondCalculator.requiredBond(resolution, now);
        if (bond < requiredBond) {
            throw new ResolutionValidationException(ResolutionError.BOND_TOO_LOW,
                    "Dispute bond " + bond + " below required " + requiredBond);
        }

        treasuryLedgerService.lockFunds(marketId, challenger, bond, "dispute bond");

        Dispute dispute = new Dispute();
        dispute.setResolutionId(resolution.getId());
        dispute.setDisputeIndex(resolution.getDisputeCount());
        dispute.setChallenger(challenger);
        dispute.setAlternativeOutcome(alternativeOutcome);
        dispute.setBond(bond);
        dispute.setEvidenceUri(evidenceUri);
        dispute.setEvidenceHash(normalizedEvidenceHash);
        dispute.setCreatedAt(now);
        Dispute saved = disputeRepository.save(dispute);

        resolution.setDisputed(true);
        resolution.setDisputeCount(resolution.getDisputeCount() + 1);
        resolution.setUpdatedAt(now);
        resolutionRepository.save(resolution);

        marketStateNotifier.disputeFiled(marketId);

        eventPublisher.publishEvent(new ResolutionLifecycleEvent(marketId, resolution.getCycle(),
                ResolutionLifecycleEvent.Transition.DISPUTED, "dispute " + saved.getDisputeIndex(), now));
        log.info("{} disputed market {} cycle {} with outcome {} and bond {} (required {})",
                challenger, marketId, resolution.getCycle(), alternativeOutcome, bond, requiredBond);
        return saved;
    }

    @Transactional
    public ResolutionStake supportDispute(String marketId, String participant, int disputeIndex, long amount) {
        ResolutionLookupService.requireIdentity(participant, "Backer");
        Resolution resolution = lookupService.current(marketId);
        Dispute dispute = lookupService.dispute(resolution, disputeIndex);
        requireActive(dispute);

        OffsetDateTime now = OffsetDateTime.now(clock);
        requireDisputeWindow(resolution, now);
        if (amount < MIN_STAKE) {
            throw new ResolutionValidationException(ResolutionError.STAKE_TOO_LOW,
                    "Stake " + amount + " below minimum " + MIN_STAKE);
        }
        if (participant.equals(dispute.getChallenger())) {
            throw ResolutionValidationException.invalidArgument("The challenger backs dispute " + disputeIndex
                    + " through its bond");
        }

        ResolutionStake stake = resolutionStakeRepository
                .findByResolutionIdAndRoleAndParticipantAndDisputeIndex(
                        resolution.getId(), StakeRole.DISPUTE_SUPPORT, participant, disputeIndex)
                .orElse(null);
        if (stake != null && Boolean.TRUE.equals(stake.getWithdrawn())) {
            throw new ResolutionValidationException(ResolutionError.STAKE_WITHDRAWN,
                    "Withdrawn dispute stake of " + participant + " cannot be topped up");
        }
        boolean firstContribution = stake == null;

        treasuryLedgerService.lockFunds(marketId, participant, amount, "dispute support stake");

        if (firstContribution) {
            stake = new ResolutionStake();
            stake.setResolutionId(resolution.getId());
            stake.setDisputeIndex(disputeIndex);
            stake.setParticipant(participant);
            stake.setRole(StakeRole.DISPUTE_SUPPORT);
            dispute.setSupporterCount(dispute.getSupporterCount() + 1);
        }
        stake.setAmount(Math.addExact(stake.getAmount(), amount));
        stake.setWeightedAmount(stake.getAmount());
        stake.setLastContributionAt(now);
        dispute.setSupportStake(Math.addExact(dispute.getSupportStake(), amount));

        disputeRepository.save(dispute);
        ResolutionStake saved = resolutionStakeRepository.save(stake);

        log.info("{} backed dispute {} on market {} with {} (dispute pool {})",
                participant, disputeIndex, marketId, amount, dispute.totalPool());
        return saved;
    }

    @Transactional
    public Dispute endorseDispute(String marketId, String legislator, int disputeIndex) {
        Resolution resolution = lookupService.current(marketId);
        if (!lookupService.isSnapshotLegislator(resolution, legislator)) {
            throw new ResolutionValidationException(ResolutionError.NOT_LEGISLATOR,
                    legislator + " was not on the legislator roster when market " + marketId + " was proposed");
        }
        Dispute dispute = lookupService.dispute(resolution, disputeIndex);
        requireActive(dispute);

        OffsetDateTime now = OffsetDateTime.now(clock);
        requireDisputeWindow(resolution, now);
        if (disputeEndorsementRepository.existsByResolutionIdAndDisputeIndexAndLegislator(
                resolution.getId(), disputeIndex, legislator)) {
            throw new ResolutionValidationException(ResolutionError.ALREADY_ENDORSED,
                    legislator + " already endorsed dispute " + disputeIndex + " on market " + marketId);
        }

        DisputeEndorsement endorsement = new DisputeEndorsement();
        endorsement.setResolutionId(resolution.getId());
        endorsement.setDisputeIndex(disputeIndex);
        endorsement.setLegislator(legislator);
        endorsement.setEndorsedAt(now);
        disputeEndorsementRepository.save(endorsement);

        dispute.setEndorsementCount(dispute.getEndorsementCount() + 1);
        Dispute saved = disputeRepository.save(dispute);

        log.info("Legislator {} endorsed dispute {} on market {} ({} endorsements)",
                legislator, disputeIndex, marketId, saved.getEndorsementCount());
        return saved;
    }

    private static void requireDisputeWindow(Resolution resolution, OffsetDateTime now) {
        if (!resolution.isOpen()) {
            throw new ResolutionValidationException(ResolutionError.ALREADY_FINALIZED,
                    "Resolution for market " + resolution.getMarketId() + " is finalized");
        }
        OffsetDateTime deadline = disputeDeadline(resolution.getProposedAt());
        if (!now.isBefore(deadline)) {
            throw ResolutionValidationException.windowClosed("Dispute", deadline);
        }
    }

    private static void requireActive(Dispute dispute) {
        if (!dispute.isActive()) {
            throw new ResolutionValidationException(ResolutionError.DISPUTE_NOT_ACTIVE,
                    "Dispute " + dispute.getDisputeIndex() + " is " + dispute.getStatus());
        }
    }
}
