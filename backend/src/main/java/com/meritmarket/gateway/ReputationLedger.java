package com.meritmarket.gateway;

public interface ReputationLedger {

    long balanceOf(String identity);

    void slash(String identity, long amount);
}
