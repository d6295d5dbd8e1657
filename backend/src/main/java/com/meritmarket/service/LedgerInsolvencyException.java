package com.meritmarket.service;

/**
 * The ledger cannot cover a payout, or custody holds less than the earmarked total.
 * Payouts are never partial: the whole operation is rejected.
 */
public class LedgerInsolvencyException extends RuntimeException {

    public LedgerInsolvencyException(String message) {
        super(message);
    }
}
