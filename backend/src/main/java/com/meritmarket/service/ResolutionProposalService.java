package com.meritmarket.service;

import com.meritmarket.gateway.MarketResolutionState;
import com.meritmarket.gateway.PredictionMarketGateway;
import com.meritmarket.gateway.PriceOracle;
import com.meritmarket.model.Resolution;
import com.meritmarket.model.ResolutionCommit;
import com.meritmarket.model.ResolutionStake;
import com.meritmarket.model.ResolutionStatus;
import com.meritmarket.model.StakeRole;
import com.meritmarket.repository.ResolutionCommitRepository;
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
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

import static com.meritmarket.service.ResolutionParameters.COMMIT_COOLDOWN;
import static com.meritmarket.service.ResolutionParameters.MAX_EVIDENCE_URI_LENGTH;
import static com.meritmarket.service.ResolutionParameters.MAX_REVEAL_DELAY;
import static com.meritmarket.service.ResolutionParameters.MIN_COMMIT_BOND;
import static com.meritmarket.service.ResolutionParameters.MIN_PROPOSAL_STAKE;
import static com.meritmarket.service.ResolutionParameters.MIN_REVEAL_DELAY;
import static com.meritmarket.service.ResolutionParameters.SLASH_BOUNTY_BPS;
import static com.meritmarket.service.ResolutionParameters.basisPoints;

/**
 * Commit-reveal proposal engine.
 * A proposer first commits {@code keccak(outcome, evidenceUri, evidenceHash, salt, proposer)} with a bond,
 * then reveals inside the reveal window, which creates the next resolution cycle for the market.
 */
@Service
@RequiredArgsConstructor
public class ResolutionProposalService {

    private static final Logger log = LoggerFactory.getLogger(ResolutionProposalService.class);

    private final ResolutionCommitRepository resolutionCommitRepository;
    private final ResolutionRepository resolutionRepository;
    private final ResolutionStakeRepository resolutionStakeRepository;
    private final PredictionMarketGateway marketGateway;
    private final PriceOracle priceOracle;
    private final TreasuryLedgerService treasuryLedgerService;
    private final LegislatorVotingService legislatorVotingService;
    private final TimingBonusCalculator timingBonusCalculator;
    private final ResolutionLookupService lookupService;
    private final MarketStateNotifier marketStateNotifier;
    private final ExternalCallIsolator isolator;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    @Transactional
    public ResolutionCommit commitResolution(String marketId, String committer, String commitHash, long bond) {
        ResolutionLookupService.requireIdentity(committer, "Committer");
        String normalizedHash = LegislatorVotingService.normalizeCommitHash(commitHash);
        if (bond < MIN_COMMIT_BOND) {
            throw new ResolutionValidationException(ResolutionError.BOND_TOO_LOW,
                    "Commit bond " + bond + " below minimum " + MIN_COMMIT_BOND);
        }
        lookupService.requireMarket(marketId);

        MarketResolutionState marketState = marketGateway.resolutionState(marketId);
        if (marketState != MarketResolutionState.SETTLEMENT) {
            throw new ResolutionValidationException(ResolutionError.MARKET_NOT_IN_SETTLEMENT,
                    "Market " + marketId + " is in " + marketState + ", expected SETTLEMENT");
        }
        if (resolutionCommitRepository.findFirstByMarketIdAndCommitterAndRevealedFalseAndSlashedFalse(
                marketId, committer).isPresent()) {
            throw new ResolutionValidationException(ResolutionError.COMMIT_ALREADY_PENDING,
                    committer + " already has a pending commit on market " + marketId);
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        Optional<ResolutionCommit> lastCommit = resolutionCommitRepository.findTopByCommitterOrderByCommittedAtDesc(committer);
        if (lastCommit.isPresent()) {
            OffsetDateTime cooldownEnds = lastCommit.get().getCommittedAt().plus(COMMIT_COOLDOWN);
            if (now.isBefore(cooldownEnds)) {
                throw new ResolutionValidationException(ResolutionError.COMMIT_COOLDOWN_ACTIVE,
                        committer + " may commit again at " + cooldownEnds);
            }
        }

        treasuryLedgerService.lockFunds(marketId, committer, bond, "commit bond");

        ResolutionCommit commit = new ResolutionCommit();
        commit.setMarketId(marketId);
        commit.setCommitter(committer);
        commit.setCommitHash(normalizedHash);
        commit.setBond(bond);
        commit.setCommittedAt(now);
        ResolutionCommit saved = resolutionCommitRepository.save(commit);

        eventPublisher.publishEvent(new ResolutionLifecycleEvent(marketId, 0,
                ResolutionLifecycleEvent.Transition.COMMITTED, committer, now));
        log.info("{} committed a resolution for market {} with bond {}", committer, marketId, bond);
        return saved;
    }

    /**
     * Reveals the caller's pending commit and opens a new resolution cycle.
     * The proposer's stake becomes the first support stake; the commit bond is refunded.
     */
    @Transactional
    public Resolution proposeResolution(String marketId,
                                        String proposer,
                                        int outcome,
                                        String evidenceUri,
                                        String evidenceHash,
                                        String salt,
                                        long stake) {
        ResolutionLookupService.requireIdentity(proposer, "Proposer");
        lookupService.requireMarket(marketId);

        ResolutionCommit commit = resolutionCommitRepository
                .findFirstByMarketIdAndCommitterAndRevealedFalseAndSlashedFalse(marketId, proposer)
                .orElseThrow(() -> new ResolutionValidationException(ResolutionError.COMMIT_NOT_FOUND,
                        proposer + " has no pending commit on market " + marketId));

        OffsetDateTime now = OffsetDateTime.now(clock);
        OffsetDateTime revealOpens = commit.getCommittedAt().plus(MIN_REVEAL_DELAY);
        OffsetDateTime revealCloses = commit.getCommittedAt().plus(MAX_REVEAL_DELAY);
        if (now.isBefore(revealOpens)) {
            throw new ResolutionValidationException(ResolutionError.REVEAL_TOO_EARLY,
                    "Reveal opens at " + revealOpens);
        }
        if (now.isAfter(revealCloses)) {
            throw new ResolutionValidationException(ResolutionError.REVEAL_WINDOW_CLOSED,
                    "Reveal window closed at " + revealCloses);
        }

        if (outcome < 0) {
            throw new ResolutionValidationException(ResolutionError.INVALID_OUTCOME, "Outcome must be non-negative");
        }
        String normalizedEvidenceHash = normalizeEvidenceHash(evidenceHash);
        String expected;
        try {
            expected = ResolutionCommitmentCodec.computeResolutionCommitment(
                    outcome, evidenceUri == null ? "" : evidenceUri, normalizedEvidenceHash, salt, proposer);
        } catch (IllegalArgumentException e) {
            throw ResolutionValidationException.invalidArgument(e.getMessage());
        }
        if (!expected.equals(commit.getCommitHash())) {
            throw new ResolutionValidationException(ResolutionError.COMMITMENT_MISMATCH,
                    "Revealed proposal does not match the commitment of " + proposer);
        }

        int outcomeCount = marketGateway.outcomeCount(marketId);
        if (outcome >= outcomeCount) {
            throw new ResolutionValidationException(ResolutionError.INVALID_OUTCOME,
                    "Outcome " + outcome + " out of range [0, " + outcomeCount + ")");
        }
        validateEvidence(evidenceUri, normalizedEvidenceHash);
        if (stake < MIN_PROPOSAL_STAKE) {
            throw new ResolutionValidationException(ResolutionError.STAKE_TOO_LOW,
                    "Proposal stake " + stake + " below minimum " + MIN_PROPOSAL_STAKE);
        }

        OffsetDateTime tradingEnd = marketGateway.tradingEnd(marketId);
        if (now.isBefore(tradingEnd)) {
            throw new ResolutionValidationException(ResolutionError.TRADING_NOT_ENDED,
                    "Trading on market " + marketId + " ends at " + tradingEnd);
        }

        Optional<Resolution> previous = resolutionRepository.findTopByMarketIdOrderByCycleDesc(marketId);
        if (previous.isPresent() && (previous.get().isOpen() || !previous.get().isRejected())) {
            throw new ResolutionValidationException(ResolutionError.RESOLUTION_EXISTS,
                    "Market " + marketId + " already has a resolution (cycle " + previous.get().getCycle() + ")");
        }
        int cycle = previous.map(r -> r.getCycle() + 1).orElse(1);

        Map<String, Long> roster = legislatorVotingService.readRoster();

        treasuryLedgerService.lockFunds(marketId, proposer, stake, "proposal stake");
        treasuryLedgerService.releaseFunds(marketId, proposer, commit.getBond(), "commit bond refund");

        commit.setRevealed(true);
        commit.setConsumedAt(now);
        resolutionCommitRepository.save(commit);

        long bonusBps = timingBonusCalculator.bonusBps(tradingEnd, now);
        long weighted = timingBonusCalculator.weightedAmount(stake, bonusBps);

        Resolution resolution = new Resolution();
        resolution.setMarketId(marketId);
        resolution.setCycle(cycle);
        resolution.setProposer(proposer);
        resolution.setProposedOutcome(outcome);
        resolution.setProposedAt(now);
        resolution.setEvidenceUri(evidenceUri);
        resolution.setEvidenceHash(normalizedEvidenceHash);
        resolution.setProposerTimingBonusBps((int) bonusBps);
        resolution.setSupportStake(stake);
        resolution.setSupportWeighted(weighted);
        resolution.setSupporterCount(1);
        resolution.setStatus(ResolutionStatus.PENDING);
        resolution.setCreatedAt(now);
        resolution.setUpdatedAt(now);
        Resolution saved = resolutionRepository.save(resolution);

        ResolutionStake proposerStake = new ResolutionStake();
        proposerStake.setResolutionId(saved.getId());
        proposerStake.setParticipant(proposer);
        proposerStake.setRole(StakeRole.SUPPORT);
        proposerStake.setAmount(stake);
        proposerStake.setWeightedAmount(weighted);
        proposerStake.setTimingBonusBps((int) bonusBps);
        proposerStake.setLastContributionAt(now);
        resolutionStakeRepository.save(proposerStake);

        legislatorVotingService.snapshotRoster(saved.getId(), roster);
        bindPriceReference(marketId);
        marketStateNotifier.proposalAccepted(marketId);

        eventPublisher.publishEvent(new ResolutionLifecycleEvent(marketId, cycle,
                ResolutionLifecycleEvent.Transition.PROPOSED, "outcome " + outcome, now));
        log.info("{} proposed outcome {} for market {} cycle {} with stake {} (timing bonus {} bps)",
                proposer, outcome, marketId, cycle, stake, bonusBps);
        return saved;
    }

    /**
     * Permissionless once the reveal deadline has passed. The caller receives {@code SLASH_BOUNTY_BPS}
     * of the bond; the rest becomes protocol fee.
     */
    @Transactional
    public CommitSlashResult slashUnrevealedCommit(String marketId, String caller, String committer) {
        ResolutionLookupService.requireIdentity(caller, "Caller");
        ResolutionCommit commit = resolutionCommitRepository
                .findTopByMarketIdAndCommitterOrderByCommittedAtDesc(marketId, committer)
                .orElseThrow(() -> new ResolutionValidationException(ResolutionError.COMMIT_NOT_FOUND,
                        committer + " has no commit on market " + marketId));
        if (Boolean.TRUE.equals(commit.getSlashed())) {
            throw new ResolutionValidationException(ResolutionError.ALREADY_SLASHED,
                    "Commit of " + committer + " on market " + marketId + " was already slashed");
        }
        if (Boolean.TRUE.equals(commit.getRevealed())) {
            throw ResolutionValidationException.invalidStatus(
                    "Commit of " + committer + " on market " + marketId + " was revealed");
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        OffsetDateTime revealDeadline = commit.getCommittedAt().plus(MAX_REVEAL_DELAY);
        if (!now.isAfter(revealDeadline)) {
            throw new ResolutionValidationException(ResolutionError.REVEAL_WINDOW_OPEN,
                    "Reveal window is open until " + revealDeadline);
        }

        long bond = commit.getBond();
        long bounty = basisPoints(bond, SLASH_BOUNTY_BPS);
        long fee = bond - bounty;
        if (!treasuryLedgerService.canCover(marketId, bond)) {
            throw new LedgerInsolvencyException("Market " + marketId + " escrow cannot cover slashed bond " + bond);
        }

        commit.setSlashed(true);
        commit.setSlashedBy(caller);
        commit.setConsumedAt(now);
        resolutionCommitRepository.save(commit);

        treasuryLedgerService.collectFee(marketId, fee, "unrevealed commit of " + committer);
        if (bounty > 0) {
            treasuryLedgerService.releaseFunds(marketId, caller, bounty, "slash bounty");
        }
        treasuryLedgerService.recordSlashed(bond, "unrevealed commit of " + committer);

        eventPublisher.publishEvent(new ResolutionLifecycleEvent(marketId, 0,
                ResolutionLifecycleEvent.Transition.COMMIT_SLASHED, committer, now));
        log.info("{} slashed unrevealed commit of {} on market {}: bounty {}, fee {}",
                caller, committer, marketId, bounty, fee);
        return new CommitSlashResult(committer, bond, bounty, fee);
    }

    private void bindPriceReference(String marketId) {
        Optional<String> feedId = isolator.call("market", "priceFeedId", marketId,
                () -> marketGateway.priceFeedId(marketId)).valueIfPresent().flatMap(Function.identity());
        if (feedId.isEmpty()) {
            return;
        }
        String asset = isolator.call("market", "priceAsset", marketId,
                () -> marketGateway.priceAsset(marketId)).valueIfPresent().flatMap(Function.identity()).orElse(null);
        isolator.call("priceOracle", "recordPrice", marketId,
                () -> priceOracle.recordPrice(marketId, feedId.get(), asset))
                .valueIfPresent()
                .ifPresent(price -> log.info("Bound price {} (round {}) of {} to market {}",
                        price.value(), price.round(), price.asset(), marketId));
    }

    static String normalizeEvidenceHash(String evidenceHash) {
        try {
            return ResolutionCommitmentCodec.normalizeHash(evidenceHash);
        } catch (IllegalArgumentException e) {
            throw new ResolutionValidationException(ResolutionError.INVALID_EVIDENCE,
                    "Evidence hash: " + e.getMessage());
        }
    }

    static void validateEvidence(String evidenceUri, String normalizedEvidenceHash) {
        if (evidenceUri == null || evidenceUri.isBlank()) {
            throw new ResolutionValidationException(ResolutionError.INVALID_EVIDENCE, "Evidence URI is required");
        }
        if (evidenceUri.length() > MAX_EVIDENCE_URI_LENGTH) {
            throw new ResolutionValidationException(ResolutionError.INVALID_EVIDENCE,
                    "Evidence URI longer than " + MAX_EVIDENCE_URI_LENGTH + " characters");
        }
        if (ResolutionCommitmentCodec.isZeroHash(normalizedEvidenceHash)) {
            throw new ResolutionValidationException(ResolutionError.INVALID_EVIDENCE, "Evidence hash must be non-zero");
        }
    }

    public record CommitSlashResult(String committer, long bond, long bounty, long protocolFee) {
    }
}
