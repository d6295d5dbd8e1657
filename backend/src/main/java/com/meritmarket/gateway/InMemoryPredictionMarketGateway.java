package com.meritmarket.gateway;

import com.meritmarket.config.ResolutionRuntimeProperties;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Market state machine kept in memory, seeded from {@code resolution.in-memory.markets}.
 * {@link #setAvailable(boolean)} simulates an unreachable market contract.
 */
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
        prefix = "resolution.collaborators",
        name = "mode",
        havingValue = "in_memory",
        matchIfMissing = true
)
public class InMemoryPredictionMarketGateway implements PredictionMarketGateway {

    private static final Logger log = LoggerFactory.getLogger(InMemoryPredictionMarketGateway.class);

    private final ResolutionRuntimeProperties properties;
    private final Map<String, MarketRecord> markets = new ConcurrentHashMap<>();

    private volatile boolean available = true;

    @PostConstruct
    void seedMarkets() {
        for (ResolutionRuntimeProperties.SeedMarket seed : properties.getInMemory().getMarkets()) {
            registerMarket(new MarketDefinition(
                    seed.getId(),
                    seed.getOutcomeCount(),
                    MarketResolutionState.valueOf(seed.getState()),
                    OffsetDateTime.ofInstant(Instant.ofEpochSecond(seed.getTradingEndEpochSecond()), ZoneOffset.UTC),
                    seed.getTotalStake(),
                    seed.getPriceFeedId(),
                    seed.getPriceAsset()
            ));
        }
        if (!markets.isEmpty()) {
            log.info("Seeded {} in-memory market(s)", markets.size());
        }
    }

    public void registerMarket(MarketDefinition definition) {
        markets.put(definition.marketId(), new MarketRecord(definition));
    }

    public void setAvailable(boolean available) {
        this.available = available;
    }

    public Optional<Integer> finalOutcome(String marketId) {
        return Optional.ofNullable(record(marketId).finalOutcome);
    }

    @Override
    public boolean exists(String marketId) {
        return marketId != null && markets.containsKey(marketId);
    }

    @Override
    public MarketResolutionState resolutionState(String marketId) {
        return record(marketId).state;
    }

    @Override
    public void advanceState(String marketId, MarketResolutionState target) {
        ensureAvailable();
        MarketRecord market = record(marketId);
        log.debug("Market {} state {} -> {}", marketId, market.state, target);
        market.state = target;
    }

    @Override
    public void setFinalOutcome(String marketId, int outcome) {
        ensureAvailable();
        MarketRecord market = record(marketId);
        if (outcome < 0 || outcome >= market.definition.outcomeCount()) {
            throw new IllegalArgumentException("Outcome " + outcome + " out of range for market " + marketId);
        }
        market.finalOutcome = outcome;
    }

    @Override
    public OffsetDateTime tradingEnd(String marketId) {
        return record(marketId).definition.tradingEnd();
    }

    @Override
    public OffsetDateTime resolutionTime(String marketId) {
        return record(marketId).definition.tradingEnd();
    }

    @Override
    public int outcomeCount(String marketId) {
        return record(marketId).definition.outcomeCount();
    }

    @Override
    public long totalStake(String marketId) {
        return record(marketId).definition.totalStake();
    }

    @Override
    public Optional<String> priceFeedId(String marketId) {
        return Optional.ofNullable(record(marketId).definition.priceFeedId());
    }

    @Override
    public Optional<String> priceAsset(String marketId) {
        return Optional.ofNullable(record(marketId).definition.priceAsset());
    }

    private MarketRecord record(String marketId) {
        MarketRecord market = marketId == null ? null : markets.get(marketId);
        if (market == null) {
            throw new IllegalArgumentException("Unknown market: " + marketId);
        }
        return market;
    }

    private void ensureAvailable() {
        if (!available) {
            throw new IllegalStateException("Market contract unavailable");
        }
    }

    public record MarketDefinition(
            String marketId,
            int outcomeCount,
            MarketResolutionState initialState,
            OffsetDateTime tradingEnd,
            long totalStake,
            String priceFeedId,
            String priceAsset
    ) {
    }

    private static final class MarketRecord {
        private final MarketDefinition definition;
        private volatile MarketResolutionState state;
        private volatile Integer finalOutcome;

        private MarketRecord(MarketDefinition definition) {
            this.definition = definition;
            this.state = definition.initialState();
        }
    }
}
