package com.meritmarket.gateway;

/**
 * Moves native funds between participants and the protocol's custody account.
 * Both transfer methods are load-bearing: they throw {@link CustodyTransferException} on failure.
 */
public interface CustodyGateway {

    void collect(String from, long amount);

    void disburse(String to, long amount);

    long custodiedBalance();
}
