package com.meritmarket.service;

import com.meritmarket.config.ResolutionRuntimeProperties;
import com.meritmarket.model.EvidenceChallenge;
import com.meritmarket.model.Resolution;
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

import static com.meritmarket.service.ResolutionParameters.MAX_CHALLENGE_REASON_LENGTH;
import static com.meritmarket.service.ResolutionParameters.MAX_EVIDENCE_CHALLENGES;
import static com.meritmarket.service.ResolutionParameters.MIN_CHALLENGE_STAKE;
import static com.meritmarket.service.ResolutionParameters.evidenceChallengeDeadline;

/**
 * Staked objections to the evidence behind a proposal. Adjudicated by a snapshot legislator or an
 * oracle manager; finalization waits until every challenge is resolved.
 */
@Service
@RequiredArgsConstructor
public class EvidenceChallengeService {

    private static final Logger log = LoggerFactory.getLogger(EvidenceChallengeService.class);

    private final EvidenceChallengeRepository evidenceChallengeRepository;
    private final ResolutionRepository resolutionRepository;
    private final TreasuryLedgerService treasuryLedgerService;
    private final ResolutionFinalizationService finalizationService;
    private final ResolutionLookupService lookupService;
    private final ResolutionRuntimeProperties properties;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    @Transactional
    public EvidenceChallenge challengeEvidence(String marketId, String challenger, String reason, long stake) {
        ResolutionLookupService.requireIdentity(challenger, "Challenger");
        Resolution resolution = lookupService.current(marketId);
        if (!resolution.isOpen()) {
            throw new ResolutionValidationException(ResolutionError.ALREADY_FINALIZED,
                    "Resolution for market " + marketId + " is finalized");
        }
        if (resolution.isRejected()) {
            throw ResolutionValidationException.invalidStatus("Resolution for market " + marketId + " is rejected");
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        OffsetDateTime deadline = evidenceChallengeDeadline(resolution.getProposedAt());
        if (!now.isBefore(deadline)) {
            throw ResolutionValidationException.windowClosed("Evidence challenge", deadline);
        }
        if (stake < MIN_CHALLENGE_STAKE) {
            throw new ResolutionValidationException(ResolutionError.STAKE_TOO_LOW,
                    "Challenge stake " + stake + " below minimum " + MIN_CHALLENGE_STAKE);
        }
        if (reason == null || reason.isBlank() || reason.length() > MAX_CHALLENGE_REASON_LENGTH) {
            throw ResolutionValidationException.invalidArgument(
                    "Challenge reason must be 1-" + MAX_CHALLENGE_REASON_LENGTH + " characters");
        }
        long existing = evidenceChallengeRepository.countByResolutionId(resolution.getId());
        if (existing >= MAX_EVIDENCE_CHALLENGES) {
            throw new ResolutionValidationException(ResolutionError.CHALLENGE_LIMIT_REACHED,
                    "Market " + marketId + " already has " + existing + " evidence challenges");
        }

        treasuryLedgerService.lockFunds(marketId, challenger, stake, "evidence challenge stake");

        EvidenceChallenge challenge = new EvidenceChallenge();
        challenge.setResolutionId(resolution.getId());
        challenge.setChallengeIndex((int) existing);
        challenge.setChallenger(challenger);
        challenge.setReason(reason);
        challenge.setStake(stake);
        challenge.setCreatedAt(now);
        EvidenceChallenge saved = evidenceChallengeRepository.save(challenge);

        resolution.setChallengeCount(resolution.getChallengeCount() + 1);
        resolution.setUpdatedAt(now);
        resolutionRepository.save(resolution);

        eventPublisher.publishEvent(new ResolutionLifecycleEvent(marketId, resolution.getCycle(),
                ResolutionLifecycleEvent.Transition.CHALLENGED, "challenge " + saved.getChallengeIndex(), now));
        log.info("{} challenged evidence on market {} cycle {} with stake {}",
                challenger, marketId, resolution.getCycle(), stake);
        return saved;
    }

    /**
     * Upheld: the resolution is rejected and settled at once. Not upheld: the challenge stake is refunded.
     */
    @Transactional
    public EvidenceChallenge resolveEvidenceChallenge(String marketId, String resolver, int challengeIndex, boolean upheld) {
        ResolutionLookupService.requireIdentity(resolver, "Resolver");
        Resolution resolution = lookupService.current(marketId);
        if (!lookupService.isSnapshotLegislator(resolution, resolver)
                && !properties.getOracleManagers().contains(resolver)) {
            throw new ResolutionValidationException(ResolutionError.NOT_AUTHORIZED,
                    resolver + " may not adjudicate evidence challenges on market " + marketId);
        }

        EvidenceChallenge challenge = lookupService.challenge(resolution, challengeIndex);
        if (Boolean.TRUE.equals(challenge.getResolved())) {
            throw new ResolutionValidationException(ResolutionError.CHALLENGE_ALREADY_RESOLVED,
                    "Evidence challenge " + challengeIndex + " on market " + marketId + " is resolved");
        }
        if (!resolution.isOpen()) {
            throw new ResolutionValidationException(ResolutionError.ALREADY_FINALIZED,
                    "Resolution for market " + marketId + " is finalized");
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        if (upheld) {
            finalizationService.settleUpheldChallenge(resolution, challenge, resolver);
            log.info("{} upheld evidence challenge {} on market {}; resolution cycle {} rejected",
                    resolver, challengeIndex, marketId, resolution.getCycle());
        } else {
            challenge.setResolved(true);
            challenge.setUpheld(false);
            challenge.setResolvedBy(resolver);
            challenge.setResolvedAt(now);
            challenge.setPayout(challenge.getStake());
            evidenceChallengeRepository.save(challenge);
            treasuryLedgerService.releaseFunds(marketId, challenge.getChallenger(), challenge.getStake(),
                    "evidence challenge refund");
            log.info("{} dismissed evidence challenge {} on market {}", resolver, challengeIndex, marketId);
        }

        eventPublisher.publishEvent(new ResolutionLifecycleEvent(marketId, resolution.getCycle(),
                ResolutionLifecycleEvent.Transition.CHALLENGE_RESOLVED,
                "challenge " + challengeIndex + (upheld ? " upheld" : " dismissed"), now));
        return challenge;
    }
}
