package com.meritmarket.gateway;

import java.util.List;

/**
 * Currently elected legislators, produced by the election mechanism.
 */
public interface LegislatorRoster {

    boolean isLegislator(String identity);

    long votingWeight(String identity);

    List<String> legislators();
}
