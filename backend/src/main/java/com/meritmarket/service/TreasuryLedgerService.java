package com.meritmarket.service;

import com.meritmarket.gateway.CustodyGateway;
import com.meritmarket.model.MarketEscrow;
import com.meritmarket.model.TreasuryLedger;
import com.meritmarket.repository.MarketEscrowRepository;
import com.meritmarket.repository.TreasuryLedgerRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;

/**
 * Protocol treasury accounting.
 * Tracks funds earmarked for open resolutions and disputes (globally and per market) and the
 * accumulated protocol fee. Custody must always hold at least the earmarked total; every
 * value-moving method re-checks that on entry.
 */
@Service
public class TreasuryLedgerService {

    private static final Logger log = LoggerFactory.getLogger(TreasuryLedgerService.class);

    private final TreasuryLedgerRepository treasuryLedgerRepository;
    private final MarketEscrowRepository marketEscrowRepository;
    private final CustodyGateway custodyGateway;
    private final Clock clock;

    public TreasuryLedgerService(TreasuryLedgerRepository treasuryLedgerRepository,
                                 MarketEscrowRepository marketEscrowRepository,
                                 CustodyGateway custodyGateway,
                                 Clock clock) {
        this.treasuryLedgerRepository = treasuryLedgerRepository;
        this.marketEscrowRepository = marketEscrowRepository;
        this.custodyGateway = custodyGateway;
        this.clock = clock;
    }

    /**
     * Pull funds from a participant into custody and earmark them for a market.
     *
     * @param marketId market the funds back
     * @param from     paying participant
     * @param amount   amount in base units
     * @param reason   description for the log (e.g. "commit bond")
     */
    @Transactional
    public void lockFunds(String marketId, String from, long amount, String reason) {
        requirePositive(amount);
        assertSolvent();

        TreasuryLedger ledger = ledger();
        MarketEscrow escrow = escrow(marketId);

        custodyGateway.collect(from, amount);

        OffsetDateTime now = OffsetDateTime.now(clock);
        ledger.setEarmarkedFunds(Math.addExact(ledger.getEarmarkedFunds(), amount));
        ledger.setUpdatedAt(now);
        escrow.setLockedAmount(Math.addExact(escrow.getLockedAmount(), amount));
        escrow.setTotalDeposited(Math.addExact(escrow.getTotalDeposited(), amount));
        escrow.setUpdatedAt(now);
        treasuryLedgerRepository.save(ledger);
        marketEscrowRepository.save(escrow);

        log.info("Locked {} from {} for market {} ({}), earmarked total {}",
                amount, from, marketId, reason, ledger.getEarmarkedFunds());
    }

    /**
     * Pay earmarked funds of a market out of custody. Counters are reduced before the transfer;
     * a failed transfer propagates and rolls the whole operation back.
     */
    @Transactional
    public void releaseFunds(String marketId, String to, long amount, String reason) {
        requirePositive(amount);
        assertSolvent();

        TreasuryLedger ledger = ledger();
        MarketEscrow escrow = escrow(marketId);
        if (escrow.getLockedAmount() < amount || ledger.getEarmarkedFunds() < amount) {
            throw new LedgerInsolvencyException("Market " + marketId + " escrow " + escrow.getLockedAmount()
                    + " cannot cover payout " + amount + " (" + reason + ")");
        }
        if (custodyGateway.custodiedBalance() < amount) {
            throw new LedgerInsolvencyException("Custody cannot cover payout " + amount + " (" + reason + ")");
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        ledger.setEarmarkedFunds(ledger.getEarmarkedFunds() - amount);
        ledger.setTotalPaidOut(Math.addExact(ledger.getTotalPaidOut(), amount));
        ledger.setUpdatedAt(now);
        escrow.setLockedAmount(escrow.getLockedAmount() - amount);
        escrow.setTotalReleased(Math.addExact(escrow.getTotalReleased(), amount));
        escrow.setUpdatedAt(now);
        treasuryLedgerRepository.save(ledger);
        marketEscrowRepository.save(escrow);

        custodyGateway.disburse(to, amount);

        log.info("Released {} to {} from market {} ({}), earmarked total {}",
                amount, to, marketId, reason, ledger.getEarmarkedFunds());
    }

    /**
     * Move earmarked market funds into the protocol fee balance. Funds stay in custody.
     */
    @Transactional
    public void collectFee(String marketId, long amount, String reason) {
        if (amount == 0) {
            return;
        }
        requirePositive(amount);
        assertSolvent();

        TreasuryLedger ledger = ledger();
        MarketEscrow escrow = escrow(marketId);
        if (escrow.getLockedAmount() < amount) {
            throw new LedgerInsolvencyException("Market " + marketId + " escrow " + escrow.getLockedAmount()
                    + " cannot cover fee " + amount);
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        ledger.setEarmarkedFunds(ledger.getEarmarkedFunds() - amount);
        ledger.setProtocolFees(Math.addExact(ledger.getProtocolFees(), amount));
        ledger.setUpdatedAt(now);
        escrow.setLockedAmount(escrow.getLockedAmount() - amount);
        escrow.setTotalReleased(Math.addExact(escrow.getTotalReleased(), amount));
        escrow.setUpdatedAt(now);
        treasuryLedgerRepository.save(ledger);
        marketEscrowRepository.save(escrow);

        log.info("Collected protocol fee {} from market {} ({}), fee balance {}",
                amount, marketId, reason, ledger.getProtocolFees());
    }

    @Transactional
    public void recordSlashed(long amount, String reason) {
        if (amount <= 0) {
            return;
        }
        TreasuryLedger ledger = ledger();
        ledger.setTotalSlashed(Math.addExact(ledger.getTotalSlashed(), amount));
        ledger.setUpdatedAt(OffsetDateTime.now(clock));
        treasuryLedgerRepository.save(ledger);
        log.info("Recorded {} slashed ({}), total slashed {}", amount, reason, ledger.getTotalSlashed());
    }

    @Transactional
    public void withdrawProtocolFees(String to, long amount) {
        requirePositive(amount);
        assertSolvent();

        TreasuryLedger ledger = ledger();
        if (ledger.getProtocolFees() < amount) {
            throw new LedgerInsolvencyException(
                    "Protocol fee balance " + ledger.getProtocolFees() + " cannot cover " + amount);
        }
        if (custodyGateway.custodiedBalance() - amount < ledger.getEarmarkedFunds()) {
            throw new LedgerInsolvencyException("Fee withdrawal of " + amount + " would leave earmarked funds uncovered");
        }

        ledger.setProtocolFees(ledger.getProtocolFees() - amount);
        ledger.setTotalPaidOut(Math.addExact(ledger.getTotalPaidOut(), amount));
        ledger.setUpdatedAt(OffsetDateTime.now(clock));
        treasuryLedgerRepository.save(ledger);

        custodyGateway.disburse(to, amount);
        log.info("Withdrew {} protocol fees to {}, fee balance {}", amount, to, ledger.getProtocolFees());
    }

    /**
     * Whether the market's escrow and custody can both cover a payout of {@code amount}.
     */
    @Transactional(readOnly = true)
    public boolean canCover(String marketId, long amount) {
        long escrowed = escrowBalance(marketId);
        return escrowed >= amount && custodyGateway.custodiedBalance() >= amount;
    }

    @Transactional(readOnly = true)
    public long escrowBalance(String marketId) {
        return marketEscrowRepository.findById(marketId)
                .map(MarketEscrow::getLockedAmount)
                .orElse(0L);
    }

    /**
     * @throws LedgerInsolvencyException when custody holds less than the earmarked total
     */
    @Transactional(readOnly = true)
    public void assertSolvent() {
        long earmarked = treasuryLedgerRepository.findById(TreasuryLedger.SINGLETON_ID)
                .map(TreasuryLedger::getEarmarkedFunds)
                .orElse(0L);
        long custodied = custodyGateway.custodiedBalance();
        if (custodied < earmarked) {
            log.error("Ledger insolvent: custodied {} < earmarked {}", custodied, earmarked);
            throw new LedgerInsolvencyException("Custodied balance " + custodied + " below earmarked " + earmarked);
        }
    }

    @Transactional(readOnly = true)
    public TreasurySnapshot snapshot() {
        TreasuryLedger ledger = treasuryLedgerRepository.findById(TreasuryLedger.SINGLETON_ID)
                .orElseGet(TreasuryLedger::new);
        return new TreasurySnapshot(
                custodyGateway.custodiedBalance(),
                ledger.getEarmarkedFunds(),
                ledger.getProtocolFees(),
                ledger.getTotalSlashed(),
                ledger.getTotalPaidOut()
        );
    }

    private TreasuryLedger ledger() {
        return treasuryLedgerRepository.findById(TreasuryLedger.SINGLETON_ID)
                .orElseGet(() -> treasuryLedgerRepository.save(new TreasuryLedger()));
    }

    private MarketEscrow escrow(String marketId) {
        return marketEscrowRepository.findById(marketId).orElseGet(() -> {
            MarketEscrow created = new MarketEscrow();
            created.setMarketId(marketId);
            return created;
        });
    }

    private static void requirePositive(long amount) {
        if (amount <= 0) {
            throw ResolutionValidationException.invalidArgument("Amount must be positive, got " + amount);
        }
    }

    public record TreasurySnapshot(
            long custodiedBalance,
            long earmarkedFunds,
            long protocolFees,
            long totalSlashed,
            long totalPaidOut
    ) {
        public boolean solvent() {
            return custodiedBalance >= earmarkedFunds;
        }
    }
}
