package com.meritmarket.config;

import com.meritmarket.service.TreasuryLedgerService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TreasurySolvencyHealthIndicatorTest {

    @Mock
    private TreasuryLedgerService treasuryLedgerService;

    @InjectMocks
    private TreasurySolvencyHealthIndicator indicator;

    @Test
    void upWhenCustodyCoversEarmarkedFunds() {
        when(treasuryLedgerService.snapshot())
                .thenReturn(new TreasuryLedgerService.TreasurySnapshot(1_000L, 900L, 100L, 0L, 0L));

        Health health = indicator.health();

        assertEquals(Status.UP, health.getStatus());
        assertEquals(900L, health.getDetails().get("earmarkedFunds"));
    }

    @Test
    void downWhenCustodyFallsShort() {
        when(treasuryLedgerService.snapshot())
                .thenReturn(new TreasuryLedgerService.TreasurySnapshot(500L, 900L, 100L, 0L, 0L));

        assertEquals(Status.DOWN, indicator.health().getStatus());
    }

    @Test
    void downWhenLedgerUnreadable() {
        when(treasuryLedgerService.snapshot()).thenThrow(new IllegalStateException("ledger row missing"));

        Health health = indicator.health();

        assertEquals(Status.DOWN, health.getStatus());
        assertEquals("java.lang.IllegalStateException: ledger row missing", health.getDetails().get("error"));
    }
}
