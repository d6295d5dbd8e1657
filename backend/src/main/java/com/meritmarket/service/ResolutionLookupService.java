package com.meritmarket.service;

import com.meritmarket.gateway.PredictionMarketGateway;
import com.meritmarket.model.Dispute;
import com.meritmarket.model.EvidenceChallenge;
import com.meritmarket.model.Resolution;
import com.meritmarket.model.ResolutionStake;
import com.meritmarket.repository.DisputeRepository;
import com.meritmarket.repository.EvidenceChallengeRepository;
import com.meritmarket.repository.LegislatorSnapshotRepository;
import com.meritmarket.repository.ResolutionRepository;
import com.meritmarket.repository.ResolutionStakeRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Loads protocol records and turns missing ones into the matching {@link ResolutionError}.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class ResolutionLookupService {

    private final PredictionMarketGateway marketGateway;
    private final ResolutionRepository resolutionRepository;
    private final DisputeRepository disputeRepository;
    private final EvidenceChallengeRepository evidenceChallengeRepository;
    private final ResolutionStakeRepository resolutionStakeRepository;
    private final LegislatorSnapshotRepository legislatorSnapshotRepository;

    public void requireMarket(String marketId) {
        if (marketId == null || marketId.isBlank() || !marketGateway.exists(marketId)) {
            throw new ResolutionValidationException(ResolutionError.MARKET_NOT_FOUND, "Unknown market " + marketId);
        }
    }

    /**
     * Latest cycle for the market, finalized or not.
     */
    public Resolution current(String marketId) {
        return resolutionRepository.findTopByMarketIdOrderByCycleDesc(marketId)
                .orElseThrow(() -> ResolutionValidationException.resolutionNotFound(marketId));
    }

    public Resolution byCycle(String marketId, Integer cycle) {
        if (cycle == null) {
            return current(marketId);
        }
        return resolutionRepository.findByMarketIdAndCycle(marketId, cycle)
                .orElseThrow(() -> new ResolutionValidationException(ResolutionError.RESOLUTION_NOT_FOUND,
                        "No resolution cycle " + cycle + " for market " + marketId));
    }

    public List<Resolution> history(String marketId) {
        return resolutionRepository.findByMarketIdOrderByCycleAsc(marketId);
    }

    public Dispute dispute(Resolution resolution, int disputeIndex) {
        return disputeRepository.findByResolutionIdAndDisputeIndex(resolution.getId(), disputeIndex)
                .orElseThrow(() -> new ResolutionValidationException(ResolutionError.DISPUTE_NOT_FOUND,
                        "No dispute " + disputeIndex + " for market " + resolution.getMarketId()));
    }

    public List<Dispute> disputes(Resolution resolution) {
        return disputeRepository.findByResolutionIdOrderByDisputeIndexAsc(resolution.getId());
    }

    public EvidenceChallenge challenge(Resolution resolution, int challengeIndex) {
        return evidenceChallengeRepository.findByResolutionIdAndChallengeIndex(resolution.getId(), challengeIndex)
                .orElseThrow(() -> new ResolutionValidationException(ResolutionError.CHALLENGE_NOT_FOUND,
                        "No evidence challenge " + challengeIndex + " for market " + resolution.getMarketId()));
    }

    public List<EvidenceChallenge> challenges(Resolution resolution) {
        return evidenceChallengeRepository.findByResolutionIdOrderByChallengeIndexAsc(resolution.getId());
    }

    public List<ResolutionStake> stakes(Resolution resolution) {
        return resolutionStakeRepository.findByResolutionId(resolution.getId());
    }

    public List<ResolutionStake> stakesOf(Resolution resolution, String participant) {
        return resolutionStakeRepository.findByResolutionIdAndParticipant(resolution.getId(), participant);
    }

    public boolean isSnapshotLegislator(Resolution resolution, String identity) {
        return identity != null
                && legislatorSnapshotRepository.existsByResolutionIdAndLegislator(resolution.getId(), identity);
    }

    static void requireIdentity(String identity, String role) {
        if (identity == null || identity.isBlank()) {
            throw ResolutionValidationException.invalidArgument(role + " identity is required");
        }
    }
}
