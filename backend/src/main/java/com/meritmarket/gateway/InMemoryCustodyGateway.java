package com.meritmarket.gateway;

import com.meritmarket.config.ResolutionRuntimeProperties;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.HashMap;
import java.util.Map;

/**
 * Participant wallets and the protocol custody account, kept in memory.
 * Transfers made inside a transaction are reversed if that transaction rolls back, so wallets
 * stay consistent with the escrow ledger.
 */
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
        prefix = "resolution.collaborators",
        name = "mode",
        havingValue = "in_memory",
        matchIfMissing = true
)
public class InMemoryCustodyGateway implements CustodyGateway {

    private static final Logger log = LoggerFactory.getLogger(InMemoryCustodyGateway.class);

    private final ResolutionRuntimeProperties properties;
    private final Map<String, Long> wallets = new HashMap<>();

    private long custodied;

    @PostConstruct
    void seedWallets() {
        properties.getInMemory().getWallets().forEach(this::fund);
    }

    public synchronized void fund(String participant, long amount) {
        wallets.merge(participant, amount, Long::sum);
    }

    public synchronized long walletBalance(String participant) {
        return wallets.getOrDefault(participant, 0L);
    }

    /**
     * Removes funds from custody without any ledger entry, as a lost or stolen transfer would.
     */
    public synchronized void drainCustody(long amount) {
        custodied -= amount;
    }

    @Override
    public synchronized void collect(String from, long amount) {
        long balance = wallets.getOrDefault(from, 0L);
        if (balance < amount) {
            throw new CustodyTransferException(
                    "Wallet " + from + " cannot cover " + amount + " (balance " + balance + ")");
        }
        wallets.put(from, balance - amount);
        custodied += amount;
        log.debug("Collected {} from {}, custody balance {}", amount, from, custodied);
        onRollback(() -> reverseCollect(from, amount));
    }

    @Override
    public synchronized void disburse(String to, long amount) {
        if (custodied < amount) {
            throw new CustodyTransferException("Custody cannot cover " + amount + " (balance " + custodied + ")");
        }
        custodied -= amount;
        wallets.merge(to, amount, Long::sum);
        log.debug("Disbursed {} to {}, custody balance {}", amount, to, custodied);
        onRollback(() -> reverseDisburse(to, amount));
    }

    @Override
    public synchronized long custodiedBalance() {
        return custodied;
    }

    private synchronized void reverseCollect(String from, long amount) {
        custodied -= amount;
        wallets.merge(from, amount, Long::sum);
        log.debug("Rolled back collection of {} from {}", amount, from);
    }

    private synchronized void reverseDisburse(String to, long amount) {
        wallets.merge(to, -amount, Long::sum);
        custodied += amount;
        log.debug("Rolled back disbursement of {} to {}", amount, to);
    }

    private static void onRollback(Runnable compensation) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCompletion(int status) {
                if (status == STATUS_ROLLED_BACK) {
                    compensation.run();
                }
            }
        });
    }
}
