package com.meritmarket.gateway;

import com.meritmarket.config.ResolutionRuntimeProperties;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
        prefix = "resolution.collaborators",
        name = "mode",
        havingValue = "in_memory",
        matchIfMissing = true
)
public class InMemoryReputationLedger implements ReputationLedger {

    private final ResolutionRuntimeProperties properties;
    private final Map<String, Long> balances = new ConcurrentHashMap<>();

    private volatile boolean available = true;

    @PostConstruct
    void seedBalances() {
        properties.getInMemory().getReputation().forEach(this::mint);
    }

    public void mint(String identity, long amount) {
        balances.merge(identity, amount, Long::sum);
    }

    public void setAvailable(boolean available) {
        this.available = available;
    }

    @Override
    public long balanceOf(String identity) {
        return identity == null ? 0L : balances.getOrDefault(identity, 0L);
    }

    @Override
    public void slash(String identity, long amount) {
        if (!available) {
            throw new IllegalStateException("Reputation ledger unavailable");
        }
        balances.compute(identity, (key, current) -> {
            long balance = current == null ? 0L : current;
            if (balance < amount) {
                throw new IllegalStateException("Cannot slash " + amount + " from reputation balance " + balance);
            }
            return balance - amount;
        });
    }
}
