package com.meritmarket.gateway;

import com.meritmarket.config.ResolutionRuntimeProperties;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Latest published price per asset; {@link #recordPrice} binds that price to a market.
 */
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
        prefix = "resolution.collaborators",
        name = "mode",
        havingValue = "in_memory",
        matchIfMissing = true
)
public class InMemoryPriceOracle implements PriceOracle {

    private final ResolutionRuntimeProperties properties;
    private final Clock clock;

    private final Map<String, PublishedPrice> latestPrices = new ConcurrentHashMap<>();
    private final Map<String, RecordedPrice> recordedPrices = new ConcurrentHashMap<>();
    private final AtomicLong rounds = new AtomicLong();

    @PostConstruct
    void seedPrices() {
        properties.getInMemory().getPrices().forEach(this::publishPrice);
    }

    public void publishPrice(String asset, long value) {
        latestPrices.put(asset, new PublishedPrice(value, OffsetDateTime.now(clock), rounds.incrementAndGet()));
    }

    @Override
    public RecordedPrice recordPrice(String marketId, String feedId, String asset) {
        PublishedPrice published = latestPrices.get(asset);
        if (published == null) {
            throw new IllegalStateException("No price published for asset " + asset + " on feed " + feedId);
        }
        RecordedPrice recorded = new RecordedPrice(
                published.value(), published.publishedAt(), published.round(), asset, true, false);
        recordedPrices.put(marketId, recorded);
        return recorded;
    }

    @Override
    public RecordedPrice recordedPrice(String marketId) {
        RecordedPrice recorded = recordedPrices.get(marketId);
        if (recorded == null) {
            return RecordedPrice.none();
        }
        Duration age = Duration.between(recorded.timestamp(), OffsetDateTime.now(clock));
        boolean stale = age.getSeconds() > properties.getInMemory().getPriceStaleAfterSeconds();
        return new RecordedPrice(
                recorded.value(), recorded.timestamp(), recorded.round(), recorded.asset(), true, stale);
    }

    private record PublishedPrice(long value, OffsetDateTime publishedAt, long round) {
    }
}
