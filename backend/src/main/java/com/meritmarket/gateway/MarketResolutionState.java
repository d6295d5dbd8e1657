package com.meritmarket.gateway;

/**
 * Resolution phases of the external market, mirrored on a best-effort basis.
 */
public enum MarketResolutionState {
    TRADING,
    SETTLEMENT,
    PROPOSED,
    DISPUTE_WINDOW,
    DISPUTED,
    FINALIZED
}
