package com.meritmarket.config;

import com.meritmarket.service.TreasuryLedgerService;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

@Component
public class TreasurySolvencyHealthIndicator implements HealthIndicator {

    private final TreasuryLedgerService treasuryLedgerService;

    public TreasurySolvencyHealthIndicator(TreasuryLedgerService treasuryLedgerService) {
        this.treasuryLedgerService = treasuryLedgerService;
    }

    @Override
    public Health health() {
        try {
            TreasuryLedgerService.TreasurySnapshot snapshot = treasuryLedgerService.snapshot();

            Health.Builder builder = snapshot.solvent() ? Health.up() : Health.down();
            return builder
                    .withDetail("custodiedBalance", snapshot.custodiedBalance())
                    .withDetail("earmarkedFunds", snapshot.earmarkedFunds())
                    .withDetail("protocolFees", snapshot.protocolFees())
                    .withDetail("totalSlashed", snapshot.totalSlashed())
                    .withDetail("totalPaidOut", snapshot.totalPaidOut())
                    .build();
        } catch (Exception e) {
            return Health.down()
                    .withException(e)
                    .build();
        }
    }
}
