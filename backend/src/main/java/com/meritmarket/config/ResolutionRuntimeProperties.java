package com.meritmarket.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runtime wiring for the resolution protocol. Timing windows and economic constants are not
 * configurable; they live in {@code ResolutionParameters}.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "resolution")
public class ResolutionRuntimeProperties {

    /**
     * Identities holding the oracle-manager capability (evidence challenge adjudication, fee withdrawal).
     */
    private List<String> oracleManagers = new ArrayList<>();

    /**
     * Lets claim calls finalize a resolution whose finalization time has passed.
     */
    private boolean autoFinalizeOnClaim = true;

    private Collaborators collaborators = new Collaborators();
    private Finalizer finalizer = new Finalizer();
    private InMemory inMemory = new InMemory();

    @Getter
    @Setter
    public static class Collaborators {
        /**
         * in_memory wires the bundled collaborators; any other value expects external beans.
         */
        private String mode = "in_memory";
    }

    @Getter
    @Setter
    public static class Finalizer {
        private boolean enabled = false;
        private long initialDelayMs = 30_000;
        private long pollIntervalMs = 60_000;
    }

    @Getter
    @Setter
    public static class InMemory {
        private List<SeedMarket> markets = new ArrayList<>();
        private Map<String, Long> legislators = new LinkedHashMap<>();
        private Map<String, Long> wallets = new LinkedHashMap<>();
        private Map<String, Long> reputation = new LinkedHashMap<>();
        private Map<String, Long> prices = new LinkedHashMap<>();
        private long priceStaleAfterSeconds = 3_600;
    }

    @Getter
    @Setter
    public static class SeedMarket {
        private String id;
        private int outcomeCount = 2;
        private String state = "SETTLEMENT";
        private long tradingEndEpochSecond = 0;
        private long totalStake = 0;
        private String priceFeedId;
        private String priceAsset;
    }
}
