package com.meritmarket.service;

import com.meritmarket.gateway.LegislatorRoster;
import com.meritmarket.gateway.ReputationLedger;
import com.meritmarket.model.DisputeStatus;
import com.meritmarket.model.LegislatorSnapshot;
import com.meritmarket.model.LegislatorVoteCommit;
import com.meritmarket.model.Resolution;
import com.meritmarket.model.ResolutionStatus;
import com.meritmarket.repository.DisputeRepository;
import com.meritmarket.repository.LegislatorSnapshotRepository;
import com.meritmarket.repository.LegislatorVoteCommitRepository;
import com.meritmarket.repository.ResolutionRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.meritmarket.service.ResolutionParameters.LEGISLATOR_SLASH_BPS;
import static com.meritmarket.service.ResolutionParameters.SUPERMAJORITY_BPS;
import static com.meritmarket.service.ResolutionParameters.basisPoints;
import static com.meritmarket.service.ResolutionParameters.legislatorCommitDeadline;
import static com.meritmarket.service.ResolutionParameters.legislatorRevealDeadline;
import static com.meritmarket.service.ResolutionParameters.meetsThreshold;
import static com.meritmarket.service.ResolutionParameters.supportDeadline;

/**
 * Legislator commit-reveal voting, restricted to the roster frozen when the resolution was proposed.
 * The commit window opens when the support window closes; the reveal window follows it.
 */
@Service
@RequiredArgsConstructor
public class LegislatorVotingService {

    private static final Logger log = LoggerFactory.getLogger(LegislatorVotingService.class);

    private final LegislatorRoster legislatorRoster;
    private final ReputationLedger reputationLedger;
    private final LegislatorSnapshotRepository legislatorSnapshotRepository;
    private final LegislatorVoteCommitRepository legislatorVoteCommitRepository;
    private final ResolutionRepository resolutionRepository;
    private final DisputeRepository disputeRepository;
    private final ResolutionLookupService lookupService;
    private final ExternalCallIsolator isolator;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    /**
     * Current roster and weights, read before a proposal moves any funds.
     */
    public Map<String, Long> readRoster() {
        Map<String, Long> roster = new LinkedHashMap<>();
        for (String legislator : legislatorRoster.legislators()) {
            roster.put(legislator, legislatorRoster.votingWeight(legislator));
        }
        return roster;
    }

    @Transactional
    public List<LegislatorSnapshot> snapshotRoster(Long resolutionId, Map<String, Long> roster) {
        List<LegislatorSnapshot> snapshot = roster.entrySet().stream()
                .map(entry -> {
                    LegislatorSnapshot member = new LegislatorSnapshot();
                    member.setResolutionId(resolutionId);
                    member.setLegislator(entry.getKey());
                    member.setVotingWeight(entry.getValue());
                    return member;
                })
                .toList();
        log.info("Snapshotted {} legislator(s) for resolution {}", snapshot.size(), resolutionId);
        return legislatorSnapshotRepository.saveAll(snapshot);
    }

    @Transactional
    public LegislatorVoteCommit commitLegislatorVote(String marketId, String legislator, String commitHash) {
        Resolution resolution = lookupService.current(marketId);
        requireOpen(resolution);
        requireSnapshotLegislator(resolution, legislator);

        OffsetDateTime now = OffsetDateTime.now(clock);
        OffsetDateTime opensAt = supportDeadline(resolution.getProposedAt());
        OffsetDateTime closesAt = legislatorCommitDeadline(resolution.getProposedAt());
        if (now.isBefore(opensAt)) {
            throw ResolutionValidationException.windowNotOpen("Legislator commit", opensAt);
        }
        if (!now.isBefore(closesAt)) {
            throw ResolutionValidationException.windowClosed("Legislator commit", closesAt);
        }
        if (legislatorVoteCommitRepository.findByResolutionIdAndLegislator(resolution.getId(), legislator).isPresent()) {
            throw new ResolutionValidationException(ResolutionError.VOTE_ALREADY_COMMITTED,
                    "Legislator " + legislator + " already committed a vote on market " + marketId);
        }

        String normalizedHash = normalizeCommitHash(commitHash);

        LegislatorVoteCommit commit = new LegislatorVoteCommit();
        commit.setResolutionId(resolution.getId());
        commit.setLegislator(legislator);
        commit.setCommitHash(normalizedHash);
        commit.setCommittedAt(now);
        LegislatorVoteCommit saved = legislatorVoteCommitRepository.save(commit);

        log.info("Legislator {} committed a vote on market {} cycle {}", legislator, marketId, resolution.getCycle());
        return saved;
    }

    /**
     * Reveals a committed vote, counts it and applies the supermajority override unless a dispute is active.
     */
    @Transactional
    public Resolution revealLegislatorVote(String marketId, String legislator, boolean support, String salt) {
        Resolution resolution = lookupService.current(marketId);
        requireOpen(resolution);
        requireSnapshotLegislator(resolution, legislator);

        LegislatorVoteCommit commit = legislatorVoteCommitRepository
                .findByResolutionIdAndLegislator(resolution.getId(), legislator)
                .orElseThrow(() -> new ResolutionValidationException(ResolutionError.VOTE_NOT_COMMITTED,
                        "Legislator " + legislator + " has no vote commit on market " + marketId
                                + " cycle " + resolution.getCycle()));
        if (Boolean.TRUE.equals(commit.getRevealed())) {
            throw new ResolutionValidationException(ResolutionError.VOTE_ALREADY_REVEALED,
                    "Legislator " + legislator + " already revealed on market " + marketId);
        }
        if (Boolean.TRUE.equals(commit.getSlashed())) {
            throw new ResolutionValidationException(ResolutionError.ALREADY_SLASHED,
                    "Vote commit of " + legislator + " was slashed");
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        OffsetDateTime opensAt = legislatorCommitDeadline(resolution.getProposedAt());
        OffsetDateTime closesAt = legislatorRevealDeadline(resolution.getProposedAt());
        if (now.isBefore(opensAt)) {
            throw ResolutionValidationException.windowNotOpen("Legislator reveal", opensAt);
        }
        if (!now.isBefore(closesAt)) {
            throw ResolutionValidationException.windowClosed("Legislator reveal", closesAt);
        }

        String expected;
        try {
            expected = ResolutionCommitmentCodec.computeVoteCommitment(support, salt, legislator);
        } catch (IllegalArgumentException e) {
            throw ResolutionValidationException.invalidArgument(e.getMessage());
        }
        if (!expected.equals(commit.getCommitHash())) {
            throw new ResolutionValidationException(ResolutionError.COMMITMENT_MISMATCH,
                    "Revealed vote does not match the commitment of " + legislator);
        }

        commit.setRevealed(true);
        commit.setSupport(support);
        commit.setRevealedAt(now);
        legislatorVoteCommitRepository.save(commit);

        if (support) {
            resolution.setLegislatorSupportVotes(resolution.getLegislatorSupportVotes() + 1);
        } else {
            resolution.setLegislatorOpposeVotes(resolution.getLegislatorOpposeVotes() + 1);
        }
        applySupermajorityOverride(resolution, now);
        resolution.setUpdatedAt(now);
        Resolution saved = resolutionRepository.save(resolution);

        log.info("Legislator {} revealed {} on market {} (support={}, oppose={})",
                legislator, support ? "SUPPORT" : "OPPOSE", marketId,
                saved.getLegislatorSupportVotes(), saved.getLegislatorOpposeVotes());
        return saved;
    }

    /**
     * Permissionless penalty for a legislator who committed but did not reveal on the given cycle (latest when
     * null). The reputation slash is best-effort; the commit is marked slashed either way so the penalty cannot
     * be applied twice.
     */
    @Transactional
    public LegislatorSlashResult slashNonRevealingLegislator(String marketId, Integer cycle, String caller,
                                                            String legislator) {
        ResolutionLookupService.requireIdentity(caller, "Caller");
        Resolution resolution = lookupService.byCycle(marketId, cycle);

        LegislatorVoteCommit commit = legislatorVoteCommitRepository
                .findByResolutionIdAndLegislator(resolution.getId(), legislator)
                .orElseThrow(() -> new ResolutionValidationException(ResolutionError.VOTE_NOT_COMMITTED,
                        "Legislator " + legislator + " has no vote commit on market " + marketId
                                + " cycle " + resolution.getCycle()));
        if (Boolean.TRUE.equals(commit.getSlashed())) {
            throw new ResolutionValidationException(ResolutionError.ALREADY_SLASHED,
                    "Legislator " + legislator + " was already slashed on market " + marketId);
        }
        if (Boolean.TRUE.equals(commit.getRevealed())) {
            throw new ResolutionValidationException(ResolutionError.VOTE_ALREADY_REVEALED,
                    "Legislator " + legislator + " revealed in time");
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        OffsetDateTime revealDeadline = legislatorRevealDeadline(resolution.getProposedAt());
        if (now.isBefore(revealDeadline)) {
            throw new ResolutionValidationException(ResolutionError.REVEAL_WINDOW_OPEN,
                    "Legislator reveal window is open until " + revealDeadline);
        }

        long balance = isolator.call("reputation", "balanceOf", marketId,
                () -> reputationLedger.balanceOf(legislator)).valueIfPresent().orElse(0L);
        long penalty = basisPoints(balance, LEGISLATOR_SLASH_BPS);
        boolean applied = penalty > 0 && isolator.run("reputation", "slash", marketId,
                () -> reputationLedger.slash(legislator, penalty)).success();

        commit.setSlashed(true);
        commit.setSlashedAt(now);
        commit.setSlashedAmount(applied ? penalty : 0L);
        legislatorVoteCommitRepository.save(commit);

        eventPublisher.publishEvent(new ResolutionLifecycleEvent(marketId, resolution.getCycle(),
                ResolutionLifecycleEvent.Transition.LEGISLATOR_SLASHED, legislator, now));
        log.info("Legislator {} slashed {} reputation on market {} at request of {} (applied={})",
                legislator, penalty, marketId, caller, applied);
        return new LegislatorSlashResult(legislator, applied ? penalty : 0L, applied);
    }

    private void applySupermajorityOverride(Resolution resolution, OffsetDateTime now) {
        if (disputeRepository.existsByResolutionIdAndStatus(resolution.getId(), DisputeStatus.ACTIVE)) {
            log.debug("Override suppressed on market {}: active dispute", resolution.getMarketId());
            return;
        }
        long supportVotes = resolution.getLegislatorSupportVotes();
        long opposeVotes = resolution.getLegislatorOpposeVotes();
        long totalVotes = supportVotes + opposeVotes;
        if (totalVotes == 0) {
            return;
        }

        ResolutionStatus previous = resolution.getStatus();
        if (meetsThreshold(opposeVotes, totalVotes, SUPERMAJORITY_BPS)) {
            resolution.setStatus(ResolutionStatus.REJECTED);
        } else if (meetsThreshold(supportVotes, totalVotes, SUPERMAJORITY_BPS)) {
            resolution.setStatus(ResolutionStatus.APPROVED);
        }
        if (resolution.getStatus() != previous) {
            log.info("Legislator supermajority moved market {} from {} to {}",
                    resolution.getMarketId(), previous, resolution.getStatus());
            eventPublisher.publishEvent(new ResolutionLifecycleEvent(resolution.getMarketId(), resolution.getCycle(),
                    resolution.isRejected()
                            ? ResolutionLifecycleEvent.Transition.REJECTED
                            : ResolutionLifecycleEvent.Transition.APPROVED,
                    "legislator supermajority", now));
        }
    }

    private void requireSnapshotLegislator(Resolution resolution, String legislator) {
        if (!lookupService.isSnapshotLegislator(resolution, legislator)) {
            throw new ResolutionValidationException(ResolutionError.NOT_LEGISLATOR,
                    legislator + " was not on the legislator roster when market "
                            + resolution.getMarketId() + " was proposed");
        }
    }

    private static void requireOpen(Resolution resolution) {
        if (!resolution.isOpen()) {
            throw new ResolutionValidationException(ResolutionError.ALREADY_FINALIZED,
                    "Resolution for market " + resolution.getMarketId() + " is finalized");
        }
    }

    static String normalizeCommitHash(String commitHash) {
        String normalized;
        try {
            normalized = ResolutionCommitmentCodec.normalizeHash(commitHash);
        } catch (IllegalArgumentException e) {
            throw ResolutionValidationException.invalidArgument("Commit hash: " + e.getMessage());
        }
        if (ResolutionCommitmentCodec.isZeroHash(normalized)) {
            throw ResolutionValidationException.invalidArgument("Commit hash must be non-zero");
        }
        return normalized;
    }

    public record LegislatorSlashResult(String legislator, long penalty, boolean applied) {
    }
}
