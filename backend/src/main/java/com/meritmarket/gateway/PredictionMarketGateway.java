package com.meritmarket.gateway;

import java.time.OffsetDateTime;
import java.util.Optional;

/**
 * Boundary to the market contract whose outcome is being resolved.
 * Query methods throw {@link IllegalArgumentException} for unknown markets.
 */
public interface PredictionMarketGateway {

    boolean exists(String marketId);

    MarketResolutionState resolutionState(String marketId);

    void advanceState(String marketId, MarketResolutionState target);

    void setFinalOutcome(String marketId, int outcome);

    OffsetDateTime tradingEnd(String marketId);

    OffsetDateTime resolutionTime(String marketId);

    int outcomeCount(String marketId);

    long totalStake(String marketId);

    /**
     * Price feed the market settles against, empty for markets that are not price-linked.
     */
    Optional<String> priceFeedId(String marketId);

    Optional<String> priceAsset(String marketId);
}
