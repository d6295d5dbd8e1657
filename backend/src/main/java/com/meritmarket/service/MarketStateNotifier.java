package com.meritmarket.service;

import com.meritmarket.gateway.MarketResolutionState;
import com.meritmarket.gateway.PredictionMarketGateway;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Mirrors protocol progress into the market's own resolution-state machine.
 * The protocol's records are authoritative; every call here is best-effort.
 */
@Component
@RequiredArgsConstructor
public class MarketStateNotifier {

    private static final Logger log = LoggerFactory.getLogger(MarketStateNotifier.class);
    private static final String COLLABORATOR = "market";

    private final PredictionMarketGateway marketGateway;
    private final ExternalCallIsolator isolator;

    /**
     * Moves the market into PROPOSED and straight on into DISPUTE_WINDOW.
     */
    public boolean proposalAccepted(String marketId) {
        boolean proposed = advance(marketId, MarketResolutionState.PROPOSED);
        boolean windowOpened = advance(marketId, MarketResolutionState.DISPUTE_WINDOW);
        return proposed && windowOpened;
    }

    public boolean disputeFiled(String marketId) {
        return advance(marketId, MarketResolutionState.DISPUTED);
    }

    public boolean returnedToSettlement(String marketId) {
        return advance(marketId, MarketResolutionState.SETTLEMENT);
    }

    public boolean finalized(String marketId, int outcome) {
        boolean outcomeSet = isolator.run(COLLABORATOR, "setFinalOutcome", marketId,
                () -> marketGateway.setFinalOutcome(marketId, outcome)).success();
        boolean advanced = advance(marketId, MarketResolutionState.FINALIZED);
        return outcomeSet && advanced;
    }

    private boolean advance(String marketId, MarketResolutionState target) {
        boolean success = isolator.run(COLLABORATOR, "advanceState:" + target, marketId,
                () -> marketGateway.advanceState(marketId, target)).success();
        if (success) {
            log.debug("Market {} advanced to {}", marketId, target);
        }
        return success;
    }
}
