package com.meritmarket.gateway;

import java.time.OffsetDateTime;

public interface PriceOracle {

    /**
     * Binds the current price of the feed to the market.
     */
    RecordedPrice recordPrice(String marketId, String feedId, String asset);

    RecordedPrice recordedPrice(String marketId);

    record RecordedPrice(
            long value,
            OffsetDateTime timestamp,
            long round,
            String asset,
            boolean recorded,
            boolean stale
    ) {
        public static RecordedPrice none() {
            return new RecordedPrice(0L, null, 0L, null, false, false);
        }
    }
}
