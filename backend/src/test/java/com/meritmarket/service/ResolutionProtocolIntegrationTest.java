package com.meritmarket.service;

import com.meritmarket.gateway.InMemoryCustodyGateway;
import com.meritmarket.gateway.InMemoryLegislatorRoster;
import com.meritmarket.gateway.InMemoryPredictionMarketGateway;
import com.meritmarket.gateway.InMemoryPriceOracle;
import com.meritmarket.gateway.InMemoryReputationLedger;
import com.meritmarket.gateway.MarketResolutionState;
import com.meritmarket.gateway.PriceOracle;
import com.meritmarket.model.Dispute;
import com.meritmarket.model.DisputeStatus;
import com.meritmarket.model.EvidenceChallenge;
import com.meritmarket.model.MarketEscrow;
import com.meritmarket.model.Resolution;
import com.meritmarket.model.ResolutionCommit;
import com.meritmarket.model.ResolutionStake;
import com.meritmarket.model.ResolutionStatus;
import com.meritmarket.model.StakeRole;
import com.meritmarket.repository.DisputeEndorsementRepository;
import com.meritmarket.repository.DisputeRepository;
import com.meritmarket.repository.EvidenceChallengeRepository;
import com.meritmarket.repository.LegislatorSnapshotRepository;
import com.meritmarket.repository.LegislatorVoteCommitRepository;
import com.meritmarket.repository.MarketEscrowRepository;
import com.meritmarket.repository.ResolutionCommitRepository;
import com.meritmarket.repository.ResolutionRepository;
import com.meritmarket.repository.ResolutionStakeRepository;
import com.meritmarket.repository.TreasuryLedgerRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.test.context.event.ApplicationEvents;
import org.springframework.test.context.event.RecordApplicationEvents;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static com.meritmarket.service.ResolutionParameters.MIN_COMMIT_BOND;
import static com.meritmarket.service.ResolutionParameters.TOKEN_UNIT;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.NONE)
@RecordApplicationEvents
class ResolutionProtocolIntegrationTest {

    private static final Instant START = Instant.parse("2026-03-01T00:00:00Z");
    private static final String EVIDENCE_URI = "ipfs://bafy-settlement-report";
    private static final String EVIDENCE_HASH = "0x" + "ab".repeat(32);
    private static final String SALT = "0x" + "5a".repeat(32);
    private static final long FUNDING = 1_000 * TOKEN_UNIT;
    private static final AtomicInteger MARKET_SEQUENCE = new AtomicInteger();

    @Autowired
    private ResolutionProtocol protocol;

    @Autowired
    private MutableClock clock;

    @Autowired
    private ApplicationEvents events;

    @Autowired
    private InMemoryPredictionMarketGateway marketGateway;

    @Autowired
    private InMemoryCustodyGateway custodyGateway;

    @Autowired
    private InMemoryLegislatorRoster legislatorRoster;

    @Autowired
    private InMemoryReputationLedger reputationLedger;

    @Autowired
    private InMemoryPriceOracle priceOracle;

    @Autowired
    private TreasuryLedgerService treasuryLedgerService;

    @Autowired
    private ResolutionRepository resolutionRepository;

    @Autowired
    private ResolutionCommitRepository resolutionCommitRepository;

    @Autowired
    private ResolutionStakeRepository resolutionStakeRepository;

    @Autowired
    private DisputeRepository disputeRepository;

    @Autowired
    private DisputeEndorsementRepository disputeEndorsementRepository;

    @Autowired
    private EvidenceChallengeRepository evidenceChallengeRepository;

    @Autowired
    private LegislatorSnapshotRepository legislatorSnapshotRepository;

    @Autowired
    private LegislatorVoteCommitRepository legislatorVoteCommitRepository;

    @Autowired
    private MarketEscrowRepository marketEscrowRepository;

    @Autowired
    private TreasuryLedgerRepository treasuryLedgerRepository;

    @BeforeEach
    void resetState() {
        disputeEndorsementRepository.deleteAll();
        legislatorVoteCommitRepository.deleteAll();
        legislatorSnapshotRepository.deleteAll();
        evidenceChallengeRepository.deleteAll();
        disputeRepository.deleteAll();
        resolutionStakeRepository.deleteAll();
        resolutionRepository.deleteAll();
        resolutionCommitRepository.deleteAll();
        marketEscrowRepository.deleteAll();
        treasuryLedgerRepository.deleteAll();

        legislatorRoster.legislators().forEach(legislatorRoster::remove);
        marketGateway.setAvailable(true);
        reputationLedger.setAvailable(true);
        clock.set(START);
    }

    @Test
    void approvedResolutionPaysSupportersFromOpposition() {
        String market = newMarket(2);
        Resolution proposed = commitAndPropose(market, "alice", 1, 10 * TOKEN_UNIT);
        assertEquals(1, proposed.getCycle());
        assertEquals(ResolutionStatus.PENDING, proposed.getStatus());
        assertEquals(MarketResolutionState.DISPUTE_WINDOW, marketGateway.resolutionState(market));

        clock.advance(Duration.ofMinutes(30));
        ResolutionStake bobStake = protocol.supportResolution(market, fund("bob"), 5 * TOKEN_UNIT);
        assertEquals(2_000, bobStake.getTimingBonusBps());
        assertEquals(6 * TOKEN_UNIT, bobStake.getWeightedAmount());
        assertEquals(ResolutionStatus.APPROVED, protocol.resolution(market, null).getStatus());

        protocol.opposeResolution(market, fund("carol"), 2 * TOKEN_UNIT);

        clock.set(finalizationTime(proposed));
        ResolutionFinalizationService.FinalizationResult result = protocol.finalizeResolution(market);

        long fee = 425_000_000L;
        assertEquals(ResolutionStatus.APPROVED, result.status());
        assertEquals(1, result.finalOutcome());
        assertEquals(fee, result.protocolFee());
        assertEquals(2 * TOKEN_UNIT - fee, result.supportRewardPool());
        assertEquals(1, marketGateway.finalOutcome(market).orElseThrow());
        assertEquals(MarketResolutionState.FINALIZED, marketGateway.resolutionState(market));
        assertEquals(15 * TOKEN_UNIT + result.supportRewardPool(), treasuryLedgerService.escrowBalance(market));
        assertEscrowMatchesEarmark();

        Resolution finalized = protocol.resolution(market, 1);
        long bobBefore = custodyGateway.walletBalance("bob");
        RewardClaimService.ClaimReceipt bobClaim = protocol.claimResolutionReward(market, 1, "bob");
        long expectedBobReward = ResolutionParameters.mulDiv(
                6 * TOKEN_UNIT, finalized.getSupportRewardPool(), finalized.getSupportWeighted());
        assertEquals(5 * TOKEN_UNIT + expectedBobReward, bobClaim.payout());
        assertEquals(bobBefore + bobClaim.payout(), custodyGateway.walletBalance("bob"));

        RewardClaimService.ClaimReceipt aliceClaim = protocol.claimResolutionReward(market, null, "alice");
        assertTrue(aliceClaim.payout() > 10 * TOKEN_UNIT);

        ResolutionValidationException again = assertThrows(ResolutionValidationException.class,
                () -> protocol.claimResolutionReward(market, 1, "bob"));
        assertEquals(ResolutionError.ALREADY_CLAIMED, again.getError());

        ResolutionValidationException opposition = assertThrows(ResolutionValidationException.class,
                () -> protocol.claimOppositionReward(market, 1, "carol"));
        assertEquals(ResolutionError.NOTHING_TO_CLAIM, opposition.getError());

        assertTrue(treasuryLedgerService.escrowBalance(market) <= 1L, "only rounding dust may remain");
        assertTrue(protocol.treasury().solvent());
        assertTrue(protocol.treasury().protocolFees() >= fee);
    }

    @Test
    void winningDisputeRejectsResolutionAndReopensSettlement() {
        String market = newMarket(2);
        Resolution proposed = commitAndPropose(market, "alice", 1, TOKEN_UNIT);

        clock.advance(Duration.ofHours(1));
        long bond = protocol.requiredDisputeBond(market);
        assertTrue(bond > 2 * TOKEN_UNIT);
        Dispute dispute = protocol.disputeResolution(market, fund("dave"), 0, EVIDENCE_URI, EVIDENCE_HASH, bond);
        assertEquals(0, dispute.getDisputeIndex());
        assertEquals(MarketResolutionState.DISPUTED, marketGateway.resolutionState(market));

        ResolutionValidationException selfSupport = assertThrows(ResolutionValidationException.class,
                () -> protocol.supportDispute(market, "dave", 0, TOKEN_UNIT));
        assertEquals(ResolutionError.INVALID_ARGUMENT, selfSupport.getError());
        protocol.supportDispute(market, fund("erin"), 0, 7 * TOKEN_UNIT);

        clock.set(finalizationTime(proposed));
        ResolutionFinalizationService.FinalizationResult result = protocol.finalizeResolution(market);

        assertEquals(ResolutionStatus.REJECTED, result.status());
        assertNull(result.finalOutcome());
        assertEquals(0, result.winningDisputeIndex());
        assertEquals(25_000_000L, result.protocolFee());
        assertEquals(MarketResolutionState.SETTLEMENT, marketGateway.resolutionState(market));
        assertFalse(marketGateway.finalOutcome(market).isPresent());

        Dispute upheld = protocol.disputes(market, 1).get(0);
        assertEquals(DisputeStatus.UPHELD, upheld.getStatus());
        assertEquals(975_000_000L, upheld.getChallengerBonus());
        assertEscrowMatchesEarmark();

        assertEquals(bond + 975_000_000L, protocol.claimDisputeReward(market, 1, "dave", 0).payout());
        assertEquals(7 * TOKEN_UNIT, protocol.reclaimDisputeStake(market, 1, "erin", 0).payout());
        assertEquals(ResolutionError.ALREADY_CLAIMED, assertThrows(ResolutionValidationException.class,
                () -> protocol.reclaimDisputeStake(market, 1, "erin", 0)).getError());
        assertEquals(ResolutionError.NOTHING_TO_CLAIM, assertThrows(ResolutionValidationException.class,
                () -> protocol.claimResolutionReward(market, 1, "alice")).getError());
        assertEquals(0L, treasuryLedgerService.escrowBalance(market));

        Resolution second = commitAndPropose(market, "frank", 0, 2 * TOKEN_UNIT);
        assertEquals(2, second.getCycle());
        assertEquals(2, protocol.history(market).size());
        assertEquals(ResolutionStatus.REJECTED, protocol.resolution(market, 1).getStatus());
    }

    @Test
    void tiedDisputeLeavesResolutionApproved() {
        String market = newMarket(3);
        Resolution proposed = commitAndPropose(market, "alice", 2, 4 * TOKEN_UNIT);

        clock.advance(Duration.ofMinutes(5));
        protocol.disputeResolution(market, fund("dave"), 0, EVIDENCE_URI, EVIDENCE_HASH, 8 * TOKEN_UNIT + TOKEN_UNIT / 2);

        clock.set(finalizationTime(proposed));
        ResolutionFinalizationService.FinalizationResult result = protocol.finalizeResolution(market);

        // isqrt(4) * 1 backer == isqrt(8.5) * 1 backer
        assertEquals(ResolutionStatus.APPROVED, result.status());
        assertEquals(2, result.finalOutcome());
        assertEquals(DisputeStatus.REJECTED, protocol.disputes(market, null).get(0).getStatus());
        // no opposition: the fee comes out of the rejected dispute bond
        assertEquals(100_000_000L, result.protocolFee());
        assertEquals(8_400_000_000L, result.supportRewardPool());
        assertEquals(4 * TOKEN_UNIT + 8_400_000_000L, treasuryLedgerService.escrowBalance(market));

        assertEquals(ResolutionError.NOTHING_TO_CLAIM, assertThrows(ResolutionValidationException.class,
                () -> protocol.claimDisputeReward(market, 1, "dave", 0)).getError());
        assertEquals(4 * TOKEN_UNIT + 8_400_000_000L,
                protocol.claimResolutionReward(market, 1, "alice").payout());
        assertEquals(0L, treasuryLedgerService.escrowBalance(market));
    }

    @Test
    void legislatorSupermajorityRejectsAndSlashesSilentLegislator() {
        legislatorRoster.elect("leg-1", 1);
        legislatorRoster.elect("leg-2", 1);
        legislatorRoster.elect("leg-3", 1);
        reputationLedger.mint("leg-3", 1_000L);

        String market = newMarket(2);
        Resolution proposed = commitAndPropose(market, "alice", 1, 10 * TOKEN_UNIT);
        protocol.opposeResolution(market, fund("carol"), 4 * TOKEN_UNIT);
        legislatorRoster.elect("late-legislator", 1);

        String saltOne = "0x" + "01".repeat(32);
        String saltTwo = "0x" + "02".repeat(32);
        String saltThree = "0x" + "03".repeat(32);

        assertEquals(ResolutionError.WINDOW_NOT_OPEN, assertThrows(ResolutionValidationException.class,
                () -> protocol.commitLegislatorVote(market, "leg-1",
                        ResolutionCommitmentCodec.computeVoteCommitment(false, saltOne, "leg-1"))).getError());

        clock.set(proposed.getProposedAt().plusHours(24).toInstant());
        protocol.commitLegislatorVote(market, "leg-1", ResolutionCommitmentCodec.computeVoteCommitment(false, saltOne, "leg-1"));
        protocol.commitLegislatorVote(market, "leg-2", ResolutionCommitmentCodec.computeVoteCommitment(false, saltTwo, "leg-2"));
        protocol.commitLegislatorVote(market, "leg-3", ResolutionCommitmentCodec.computeVoteCommitment(true, saltThree, "leg-3"));
        assertEquals(ResolutionError.NOT_LEGISLATOR, assertThrows(ResolutionValidationException.class,
                () -> protocol.commitLegislatorVote(market, "late-legislator", "0x" + "cd".repeat(32))).getError());

        clock.set(proposed.getProposedAt().plusHours(48).toInstant());
        assertEquals(ResolutionError.COMMITMENT_MISMATCH, assertThrows(ResolutionValidationException.class,
                () -> protocol.revealLegislatorVote(market, "leg-1", true, saltOne)).getError());
        protocol.revealLegislatorVote(market, "leg-1", false, saltOne);
        Resolution afterSecond = protocol.revealLegislatorVote(market, "leg-2", false, saltTwo);
        assertEquals(ResolutionStatus.REJECTED, afterSecond.getStatus());

        ResolutionValidationException early = assertThrows(ResolutionValidationException.class,
                () -> protocol.slashNonRevealingLegislator(market, null, "keeper", "leg-3"));
        assertEquals(ResolutionError.REVEAL_WINDOW_OPEN, early.getError());

        clock.set(proposed.getProposedAt().plusHours(72).toInstant());
        LegislatorVotingService.LegislatorSlashResult slash = protocol.slashNonRevealingLegislator(market, null, "keeper", "leg-3");
        assertTrue(slash.applied());
        assertEquals(100L, slash.penalty());
        assertEquals(900L, reputationLedger.balanceOf("leg-3"));
        assertEquals(ResolutionError.ALREADY_SLASHED, assertThrows(ResolutionValidationException.class,
                () -> protocol.slashNonRevealingLegislator(market, null, "keeper", "leg-3")).getError());

        clock.set(finalizationTime(proposed));
        ResolutionFinalizationService.FinalizationResult result = protocol.finalizeResolution(market);
        assertEquals(ResolutionStatus.REJECTED, result.status());
        assertEquals(350_000_000L, result.protocolFee());
        assertEquals(13_650_000_000L, result.oppositionRewardPool());
        assertEquals(result.oppositionRewardPool(), treasuryLedgerService.escrowBalance(market));
        assertEscrowMatchesEarmark();

        assertEquals(13_650_000_000L, protocol.claimOppositionReward(market, 1, "carol").payout());
        assertEquals(0L, treasuryLedgerService.escrowBalance(market));
    }

    @Test
    void silentLegislatorIsSlashedOnEarlierCycleAfterMarketReopens() {
        legislatorRoster.elect("leg-north", 1);
        legislatorRoster.elect("leg-south", 1);
        legislatorRoster.elect("leg-silent", 1);
        reputationLedger.mint("leg-silent", 1_000L);

        String market = newMarket(2);
        Resolution proposed = commitAndPropose(market, "alice", 1, 3 * TOKEN_UNIT);
        protocol.opposeResolution(market, fund("carol"), TOKEN_UNIT);

        String saltNorth = "0x" + "11".repeat(32);
        String saltSouth = "0x" + "12".repeat(32);
        clock.set(proposed.getProposedAt().plusHours(24).toInstant());
        protocol.commitLegislatorVote(market, "leg-north",
                ResolutionCommitmentCodec.computeVoteCommitment(false, saltNorth, "leg-north"));
        protocol.commitLegislatorVote(market, "leg-south",
                ResolutionCommitmentCodec.computeVoteCommitment(false, saltSouth, "leg-south"));
        protocol.commitLegislatorVote(market, "leg-silent",
                ResolutionCommitmentCodec.computeVoteCommitment(true, "0x" + "13".repeat(32), "leg-silent"));

        clock.set(proposed.getProposedAt().plusHours(48).toInstant());
        protocol.revealLegislatorVote(market, "leg-north", false, saltNorth);
        assertEquals(ResolutionStatus.REJECTED,
                protocol.revealLegislatorVote(market, "leg-south", false, saltSouth).getStatus());

        clock.set(proposed.getProposedAt().plusHours(73).toInstant());
        assertEquals(ResolutionStatus.REJECTED, protocol.finalizeResolution(market).status());
        Resolution reopened = commitAndPropose(market, "frank", 0, TOKEN_UNIT);
        assertEquals(2, reopened.getCycle());

        assertEquals(ResolutionError.VOTE_NOT_COMMITTED, assertThrows(ResolutionValidationException.class,
                () -> protocol.slashNonRevealingLegislator(market, null, "keeper", "leg-silent")).getError());

        LegislatorVotingService.LegislatorSlashResult slash =
                protocol.slashNonRevealingLegislator(market, 1, "keeper", "leg-silent");
        assertTrue(slash.applied());
        assertEquals(900L, reputationLedger.balanceOf("leg-silent"));
        assertEquals(ResolutionError.ALREADY_SLASHED, assertThrows(ResolutionValidationException.class,
                () -> protocol.slashNonRevealingLegislator(market, 1, "keeper", "leg-silent")).getError());
    }

    @Test
    void commitCooldownSpansMarkets() {
        String first = newMarket(2);
        String second = newMarket(2);
        commitAndPropose(first, "alice", 1, TOKEN_UNIT);

        String commitHash = ResolutionCommitmentCodec.computeResolutionCommitment(0, EVIDENCE_URI, EVIDENCE_HASH, SALT, "alice");
        assertEquals(ResolutionError.COMMIT_COOLDOWN_ACTIVE, assertThrows(ResolutionValidationException.class,
                () -> protocol.commitResolution(second, "alice", commitHash, MIN_COMMIT_BOND)).getError());

        clock.advance(ResolutionParameters.COMMIT_COOLDOWN);
        assertEquals(second, protocol.commitResolution(second, "alice", commitHash, MIN_COMMIT_BOND).getMarketId());
    }

    @Test
    void proposalWaitsForTradingToEnd() {
        String market = "market-open-" + MARKET_SEQUENCE.incrementAndGet();
        marketGateway.registerMarket(new InMemoryPredictionMarketGateway.MarketDefinition(
                market, 2, MarketResolutionState.SETTLEMENT, OffsetDateTime.ofInstant(START, ZoneOffset.UTC).plusHours(2),
                0L, null, null));

        String commitHash = ResolutionCommitmentCodec.computeResolutionCommitment(1, EVIDENCE_URI, EVIDENCE_HASH, SALT, "alice");
        protocol.commitResolution(market, fund("alice"), commitHash, MIN_COMMIT_BOND);
        clock.advance(ResolutionParameters.MIN_REVEAL_DELAY);

        assertEquals(ResolutionError.TRADING_NOT_ENDED, assertThrows(ResolutionValidationException.class,
                () -> protocol.proposeResolution(market, "alice", 1, EVIDENCE_URI, EVIDENCE_HASH, SALT, TOKEN_UNIT)).getError());
        assertEquals(MIN_COMMIT_BOND, treasuryLedgerService.escrowBalance(market));
    }

    @Test
    void secondProposalOnOpenCycleIsRefused() {
        String market = newMarket(2);
        String aliceHash = ResolutionCommitmentCodec.computeResolutionCommitment(1, EVIDENCE_URI, EVIDENCE_HASH, SALT, "alice");
        String bobHash = ResolutionCommitmentCodec.computeResolutionCommitment(0, EVIDENCE_URI, EVIDENCE_HASH, SALT, "bob");
        protocol.commitResolution(market, fund("alice"), aliceHash, MIN_COMMIT_BOND);
        protocol.commitResolution(market, fund("bob"), bobHash, MIN_COMMIT_BOND);
        clock.advance(ResolutionParameters.MIN_REVEAL_DELAY);

        protocol.proposeResolution(market, "alice", 1, EVIDENCE_URI, EVIDENCE_HASH, SALT, TOKEN_UNIT);
        assertEquals(ResolutionError.RESOLUTION_EXISTS, assertThrows(ResolutionValidationException.class,
                () -> protocol.proposeResolution(market, "bob", 0, EVIDENCE_URI, EVIDENCE_HASH, SALT, TOKEN_UNIT)).getError());
        assertEquals(1, protocol.history(market).size());
    }

    @Test
    void evidenceChallengesAreCapped() {
        String market = newMarket(2);
        commitAndPropose(market, "alice", 1, TOKEN_UNIT);

        for (int i = 0; i < ResolutionParameters.MAX_EVIDENCE_CHALLENGES; i++) {
            protocol.challengeEvidence(market, fund("challenger-" + i), "Stale source " + i,
                    ResolutionParameters.MIN_CHALLENGE_STAKE);
        }

        long walletBefore = custodyGateway.walletBalance(fund("challenger-late"));
        assertEquals(ResolutionError.CHALLENGE_LIMIT_REACHED, assertThrows(ResolutionValidationException.class,
                () -> protocol.challengeEvidence(market, "challenger-late", "One more",
                        ResolutionParameters.MIN_CHALLENGE_STAKE)).getError());
        assertEquals(walletBefore, custodyGateway.walletBalance("challenger-late"));
    }

    @Test
    void disputeBondBelowRequiredIsRefused() {
        String market = newMarket(2);
        commitAndPropose(market, "alice", 1, 2 * TOKEN_UNIT);

        clock.advance(Duration.ofHours(1));
        long required = protocol.requiredDisputeBond(market);
        assertEquals(ResolutionError.BOND_TOO_LOW, assertThrows(ResolutionValidationException.class,
                () -> protocol.disputeResolution(market, fund("dave"), 0, EVIDENCE_URI, EVIDENCE_HASH, required - 1)).getError());
        assertTrue(protocol.disputes(market, null).isEmpty());

        assertEquals(0, protocol.disputeResolution(market, "dave", 0, EVIDENCE_URI, EVIDENCE_HASH, required).getDisputeIndex());
    }

    @Test
    void withdrawnStakeCannotBeToppedUp() {
        String market = newMarket(2);
        Resolution proposed = commitAndPropose(market, "alice", 1, TOKEN_UNIT);
        ResolutionStake stake = protocol.supportResolution(market, fund("bob"), TOKEN_UNIT);
        stake.setWithdrawn(true);
        resolutionStakeRepository.save(stake);

        assertEquals(ResolutionError.STAKE_WITHDRAWN, assertThrows(ResolutionValidationException.class,
                () -> protocol.supportResolution(market, "bob", TOKEN_UNIT)).getError());
        assertEquals(2 * TOKEN_UNIT, protocol.resolution(market, proposed.getCycle()).getSupportStake());
    }

    @Test
    void upheldEvidenceChallengeSettlesImmediately() {
        String market = newMarket(2);
        commitAndPropose(market, "alice", 1, 10 * TOKEN_UNIT);
        protocol.opposeResolution(market, fund("carol"), 2 * TOKEN_UNIT);

        clock.advance(Duration.ofHours(1));
        long bond = protocol.requiredDisputeBond(market);
        protocol.disputeResolution(market, fund("ivan"), 0, EVIDENCE_URI, EVIDENCE_HASH, bond);
        protocol.challengeEvidence(market, fund("gina"), "Report predates the settlement time", TOKEN_UNIT);
        protocol.challengeEvidence(market, fund("hank"), "Source is unverifiable", TOKEN_UNIT / 2);

        ResolutionValidationException unauthorized = assertThrows(ResolutionValidationException.class,
                () -> protocol.resolveEvidenceChallenge(market, "gina", 0, true));
        assertEquals(ResolutionError.NOT_AUTHORIZED, unauthorized.getError());

        long ginaBefore = custodyGateway.walletBalance("gina");
        long hankBefore = custodyGateway.walletBalance("hank");
        EvidenceChallenge upheld = protocol.resolveEvidenceChallenge(market, "oracle-manager", 0, true);

        assertTrue(upheld.getUpheld());
        assertEquals(2 * TOKEN_UNIT, upheld.getPayout());
        assertEquals(ginaBefore + 2 * TOKEN_UNIT, custodyGateway.walletBalance("gina"));
        assertEquals(hankBefore + TOKEN_UNIT / 2, custodyGateway.walletBalance("hank"));

        Resolution rejected = protocol.resolution(market, null);
        assertTrue(rejected.getFinalized());
        assertEquals(ResolutionStatus.REJECTED, rejected.getStatus());
        assertEquals(300_000_000L, rejected.getProtocolFee());
        assertEquals(10_700_000_000L, rejected.getOppositionRewardPool());
        assertEquals(MarketResolutionState.SETTLEMENT, marketGateway.resolutionState(market));
        assertEquals(DisputeStatus.WITHDRAWN, protocol.disputes(market, null).get(0).getStatus());

        assertEquals(10_700_000_000L, protocol.claimOppositionReward(market, null, "carol").payout());
        assertEquals(bond, protocol.claimDisputeReward(market, null, "ivan", 0).payout());
        assertEquals(0L, treasuryLedgerService.escrowBalance(market));
    }

    @Test
    void dismissedChallengeRefundsStakeAndUnblocksFinalization() {
        String market = newMarket(2);
        Resolution proposed = commitAndPropose(market, "alice", 0, 2 * TOKEN_UNIT);
        protocol.challengeEvidence(market, fund("gina"), "Wrong data source", TOKEN_UNIT);

        clock.set(finalizationTime(proposed));
        assertEquals(ResolutionError.CHALLENGES_UNRESOLVED, assertThrows(ResolutionValidationException.class,
                () -> protocol.finalizeResolution(market)).getError());

        long ginaBefore = custodyGateway.walletBalance("gina");
        EvidenceChallenge dismissed = protocol.resolveEvidenceChallenge(market, "oracle-manager", 0, false);
        assertFalse(dismissed.getUpheld());
        assertEquals(ginaBefore + TOKEN_UNIT, custodyGateway.walletBalance("gina"));

        assertEquals(ResolutionStatus.APPROVED, protocol.finalizeResolution(market).status());
    }

    @Test
    void mismatchedRevealIsRejectedWithoutMovingFunds() {
        String market = newMarket(2);
        String commitHash = ResolutionCommitmentCodec.computeResolutionCommitment(1, EVIDENCE_URI, EVIDENCE_HASH, SALT, "alice");
        protocol.commitResolution(market, fund("alice"), commitHash, MIN_COMMIT_BOND);

        assertEquals(ResolutionError.REVEAL_TOO_EARLY, assertThrows(ResolutionValidationException.class,
                () -> protocol.proposeResolution(market, "alice", 1, EVIDENCE_URI, EVIDENCE_HASH, SALT, TOKEN_UNIT)).getError());

        clock.advance(Duration.ofMinutes(10));
        long walletBefore = custodyGateway.walletBalance("alice");
        ResolutionValidationException mismatch = assertThrows(ResolutionValidationException.class,
                () -> protocol.proposeResolution(market, "alice", 0, EVIDENCE_URI, EVIDENCE_HASH, SALT, TOKEN_UNIT));

        assertEquals(ResolutionError.COMMITMENT_MISMATCH, mismatch.getError());
        assertEquals(walletBefore, custodyGateway.walletBalance("alice"));
        assertEquals(MIN_COMMIT_BOND, treasuryLedgerService.escrowBalance(market));
        assertEquals(ResolutionError.RESOLUTION_NOT_FOUND, assertThrows(ResolutionValidationException.class,
                () -> protocol.resolution(market, null)).getError());
    }

    @Test
    void unrevealedCommitIsSlashedAfterRevealWindow() {
        String market = newMarket(2);
        String commitHash = ResolutionCommitmentCodec.computeResolutionCommitment(1, EVIDENCE_URI, EVIDENCE_HASH, SALT, "alice");
        protocol.commitResolution(market, fund("alice"), commitHash, TOKEN_UNIT);

        assertEquals(ResolutionError.COMMIT_ALREADY_PENDING, assertThrows(ResolutionValidationException.class,
                () -> protocol.commitResolution(market, "alice", commitHash, TOKEN_UNIT)).getError());

        clock.advance(Duration.ofHours(24));
        assertEquals(ResolutionError.REVEAL_WINDOW_OPEN, assertThrows(ResolutionValidationException.class,
                () -> protocol.slashUnrevealedCommit(market, "keeper", "alice")).getError());

        clock.advance(Duration.ofSeconds(1));
        long keeperBefore = custodyGateway.walletBalance("keeper");
        long feesBefore = protocol.treasury().protocolFees();
        ResolutionProposalService.CommitSlashResult slash = protocol.slashUnrevealedCommit(market, "keeper", "alice");

        assertEquals(TOKEN_UNIT / 10, slash.bounty());
        assertEquals(keeperBefore + TOKEN_UNIT / 10, custodyGateway.walletBalance("keeper"));
        assertEquals(feesBefore + TOKEN_UNIT - TOKEN_UNIT / 10, protocol.treasury().protocolFees());
        assertEquals(0L, treasuryLedgerService.escrowBalance(market));
        assertEquals(ResolutionError.ALREADY_SLASHED, assertThrows(ResolutionValidationException.class,
                () -> protocol.slashUnrevealedCommit(market, "keeper", "alice")).getError());
    }

    @Test
    void commitRequiresMarketInSettlement() {
        String market = newMarket(2);
        marketGateway.advanceState(market, MarketResolutionState.TRADING);

        ResolutionValidationException ex = assertThrows(ResolutionValidationException.class,
                () -> protocol.commitResolution(market, fund("alice"), "0x" + "cd".repeat(32), TOKEN_UNIT));

        assertEquals(ResolutionError.MARKET_NOT_IN_SETTLEMENT, ex.getError());
        assertEquals(ResolutionError.MARKET_NOT_FOUND, assertThrows(ResolutionValidationException.class,
                () -> protocol.commitResolution("no-such-market", "alice", "0x" + "cd".repeat(32), TOKEN_UNIT)).getError());
    }

    @Test
    void windowsCloseAtTheirDeadlines() {
        String market = newMarket(2);
        Resolution proposed = commitAndPropose(market, "alice", 1, TOKEN_UNIT);

        clock.set(proposed.getProposedAt().plusHours(6).toInstant());
        assertEquals(ResolutionError.WINDOW_CLOSED, assertThrows(ResolutionValidationException.class,
                () -> protocol.challengeEvidence(market, fund("gina"), "Too late", TOKEN_UNIT)).getError());

        clock.set(proposed.getProposedAt().plusHours(24).toInstant());
        assertEquals(ResolutionError.WINDOW_CLOSED, assertThrows(ResolutionValidationException.class,
                () -> protocol.supportResolution(market, fund("bob"), TOKEN_UNIT)).getError());

        clock.set(proposed.getProposedAt().plusHours(72).toInstant());
        assertEquals(ResolutionError.WINDOW_CLOSED, assertThrows(ResolutionValidationException.class,
                () -> protocol.disputeResolution(market, fund("dave"), 0, EVIDENCE_URI, EVIDENCE_HASH, 10 * TOKEN_UNIT)).getError());
        assertEquals(ResolutionError.WINDOW_NOT_OPEN, assertThrows(ResolutionValidationException.class,
                () -> protocol.finalizeResolution(market)).getError());
    }

    @Test
    void claimFinalizesLazilyOnceDue() {
        String market = newMarket(2);
        Resolution proposed = commitAndPropose(market, "alice", 1, 3 * TOKEN_UNIT);

        assertEquals(ResolutionError.NOT_FINALIZED, assertThrows(ResolutionValidationException.class,
                () -> protocol.claimResolutionReward(market, 1, "alice")).getError());

        clock.set(finalizationTime(proposed));
        RewardClaimService.ClaimReceipt receipt = protocol.claimResolutionReward(market, 1, "alice");

        assertEquals(3 * TOKEN_UNIT, receipt.payout());
        assertTrue(protocol.resolution(market, 1).getFinalized());
        assertEquals(ResolutionError.ALREADY_FINALIZED, assertThrows(ResolutionValidationException.class,
                () -> protocol.finalizeResolution(market)).getError());
    }

    @Test
    void finalizeDueSettlesEveryExpiredCycle() {
        String first = newMarket(2);
        String second = newMarket(2);
        Resolution proposed = commitAndPropose(first, "alice", 1, TOKEN_UNIT);
        commitAndPropose(second, "bob", 0, TOKEN_UNIT);

        assertEquals(0, protocol.finalizeDue());

        clock.set(finalizationTime(proposed).plus(Duration.ofHours(2)));
        assertEquals(2, protocol.finalizeDue());
        assertEquals(0, protocol.finalizeDue());
        assertTrue(protocol.resolution(second, null).getFinalized());
    }

    @Test
    void marketOutageDoesNotBlockFinalization() {
        String market = newMarket(2);
        Resolution proposed = commitAndPropose(market, "alice", 1, TOKEN_UNIT);

        marketGateway.setAvailable(false);
        clock.set(finalizationTime(proposed));
        ResolutionFinalizationService.FinalizationResult result = protocol.finalizeResolution(market);

        assertEquals(ResolutionStatus.APPROVED, result.status());
        assertEquals(MarketResolutionState.DISPUTE_WINDOW, marketGateway.resolutionState(market));
        List<ExternalCallFailedEvent> failures = events.stream(ExternalCallFailedEvent.class).toList();
        assertEquals(2, failures.size());
        assertTrue(failures.stream().allMatch(failure -> "market".equals(failure.collaborator())));
        assertTrue(events.stream(ResolutionLifecycleEvent.class)
                .anyMatch(event -> event.transition() == ResolutionLifecycleEvent.Transition.FINALIZED));
    }

    @Test
    void proposalBindsPriceForPriceLinkedMarket() {
        String market = "market-price-" + MARKET_SEQUENCE.incrementAndGet();
        marketGateway.registerMarket(new InMemoryPredictionMarketGateway.MarketDefinition(
                market, 2, MarketResolutionState.SETTLEMENT, OffsetDateTime.ofInstant(START, ZoneOffset.UTC).minusHours(2),
                0L, "feed-eth-usd", "ETH"));
        priceOracle.publishPrice("ETH", 3_150_00L);

        commitAndPropose(market, "alice", 1, TOKEN_UNIT);

        PriceOracle.RecordedPrice recorded = protocol.recordedPrice(market);
        assertTrue(recorded.recorded());
        assertEquals(3_150_00L, recorded.value());
        assertEquals("ETH", recorded.asset());
    }

    @Test
    void insolventLedgerRefusesNewStake() {
        String market = newMarket(2);
        commitAndPropose(market, "alice", 1, TOKEN_UNIT);

        long custodied = custodyGateway.custodiedBalance();
        custodyGateway.drainCustody(custodied);
        try {
            assertFalse(protocol.treasury().solvent());
            assertThrows(LedgerInsolvencyException.class,
                    () -> protocol.supportResolution(market, fund("bob"), TOKEN_UNIT));
        } finally {
            custodyGateway.drainCustody(-custodied);
        }
        assertTrue(protocol.treasury().solvent());
    }

    @Test
    void feeWithdrawalIsRestrictedToOracleManagers() {
        String market = newMarket(2);
        String commitHash = ResolutionCommitmentCodec.computeResolutionCommitment(1, EVIDENCE_URI, EVIDENCE_HASH, SALT, "alice");
        protocol.commitResolution(market, fund("alice"), commitHash, TOKEN_UNIT);
        clock.advance(Duration.ofHours(25));
        protocol.slashUnrevealedCommit(market, "keeper", "alice");

        assertEquals(ResolutionError.NOT_AUTHORIZED, assertThrows(ResolutionValidationException.class,
                () -> protocol.withdrawProtocolFees("alice", "alice", 1L)).getError());

        long opsBefore = custodyGateway.walletBalance("ops");
        long feesBefore = protocol.treasury().protocolFees();
        TreasuryLedgerService.TreasurySnapshot after = protocol.withdrawProtocolFees("oracle-manager", "ops", 1_000L);

        assertEquals(feesBefore - 1_000L, after.protocolFees());
        assertEquals(opsBefore + 1_000L, custodyGateway.walletBalance("ops"));
        assertTrue(after.solvent());
    }

    private String newMarket(int outcomeCount) {
        String marketId = "market-" + MARKET_SEQUENCE.incrementAndGet();
        marketGateway.registerMarket(new InMemoryPredictionMarketGateway.MarketDefinition(
                marketId,
                outcomeCount,
                MarketResolutionState.SETTLEMENT,
                OffsetDateTime.ofInstant(START, ZoneOffset.UTC).minusHours(2),
                100 * TOKEN_UNIT,
                null,
                null
        ));
        return marketId;
    }

    private String fund(String participant) {
        custodyGateway.fund(participant, FUNDING);
        return participant;
    }

    private Resolution commitAndPropose(String market, String proposer, int outcome, long stake) {
        String commitHash = ResolutionCommitmentCodec.computeResolutionCommitment(
                outcome, EVIDENCE_URI, EVIDENCE_HASH, SALT, proposer);
        ResolutionCommit commit = protocol.commitResolution(market, fund(proposer), commitHash, MIN_COMMIT_BOND);
        assertFalse(commit.getRevealed());
        clock.advance(ResolutionParameters.MIN_REVEAL_DELAY);
        return protocol.proposeResolution(market, proposer, outcome, EVIDENCE_URI, EVIDENCE_HASH, SALT, stake);
    }

    private void assertEscrowMatchesEarmark() {
        long locked = marketEscrowRepository.findAll().stream()
                .mapToLong(MarketEscrow::getLockedAmount)
                .sum();
        assertEquals(locked, treasuryLedgerService.snapshot().earmarkedFunds());
    }

    private static Instant finalizationTime(Resolution resolution) {
        return ResolutionParameters.finalizationTime(resolution.getProposedAt()).toInstant();
    }

    static final class MutableClock extends Clock {

        private volatile Instant instant = START;

        void set(Instant instant) {
            this.instant = instant;
        }

        void advance(Duration duration) {
            this.instant = instant.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return Clock.fixed(instant, zone);
        }

        @Override
        public Instant instant() {
            return instant;
        }
    }

    @TestConfiguration
    static class MutableClockConfig {

        @Bean
        @Primary
        MutableClock mutableProtocolClock() {
            return new MutableClock();
        }
    }
}
