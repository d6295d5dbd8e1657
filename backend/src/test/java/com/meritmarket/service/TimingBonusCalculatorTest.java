package com.meritmarket.service;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TimingBonusCalculatorTest {

    private static final OffsetDateTime REFERENCE = OffsetDateTime.of(2026, 3, 1, 12, 0, 0, 0, ZoneOffset.UTC);

    private final TimingBonusCalculator calculator = new TimingBonusCalculator();

    @Test
    void fullBonusInsideEarlyWindow() {
        assertEquals(ResolutionParameters.MAX_TIMING_BONUS_BPS, calculator.bonusBps(REFERENCE, REFERENCE));
        assertEquals(ResolutionParameters.MAX_TIMING_BONUS_BPS,
                calculator.bonusBps(REFERENCE, REFERENCE.plus(ResolutionParameters.EARLY_BONUS_WINDOW)));
    }

    @Test
    void noBonusBeforeReferenceOrAfterSupportPeriod() {
        assertEquals(0L, calculator.bonusBps(REFERENCE, REFERENCE.minusSeconds(1)));
        assertEquals(0L, calculator.bonusBps(REFERENCE, REFERENCE.plus(ResolutionParameters.SUPPORT_PERIOD)));
        assertEquals(0L, calculator.bonusBps(REFERENCE, REFERENCE.plusDays(3)));
    }

    @Test
    void decaysLinearlyBetweenEarlyWindowAndPeriodEnd() {
        // 11.5h of the 23h decay span remain
        assertEquals(1_000L, calculator.bonusBps(REFERENCE, REFERENCE.plus(Duration.ofMinutes(750))));
    }

    @Test
    void bonusNeverIncreasesOverTime() {
        long previous = Long.MAX_VALUE;
        for (int minutes = 0; minutes <= 25 * 60; minutes += 17) {
            long bonus = calculator.bonusBps(REFERENCE, REFERENCE.plusMinutes(minutes));
            assertTrue(bonus <= previous, "bonus increased at minute " + minutes);
            assertTrue(bonus >= 0 && bonus <= ResolutionParameters.MAX_TIMING_BONUS_BPS);
            previous = bonus;
        }
    }

    @Test
    void weightedAmountAppliesBonusAndRoundsDown() {
        assertEquals(1_200L, calculator.weightedAmount(1_000L, 2_000L));
        assertEquals(1_000L, calculator.weightedAmount(1_000L, 0L));
        assertEquals(10L, calculator.weightedAmount(9L, 1_500L));
    }
}
