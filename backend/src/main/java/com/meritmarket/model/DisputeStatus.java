package com.meritmarket.model;

/**
 * WITHDRAWN marks a dispute that was never scored because its resolution was rejected first;
 * its backers may reclaim their principal.
 */
public enum DisputeStatus {
    ACTIVE,
    UPHELD,
    REJECTED,
    WITHDRAWN
}
