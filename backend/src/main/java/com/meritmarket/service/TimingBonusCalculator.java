package com.meritmarket.service;

import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.time.Duration;
import java.time.OffsetDateTime;

import static com.meritmarket.service.ResolutionParameters.BASIS_POINTS;
import static com.meritmarket.service.ResolutionParameters.EARLY_BONUS_WINDOW;
import static com.meritmarket.service.ResolutionParameters.MAX_TIMING_BONUS_BPS;
import static com.meritmarket.service.ResolutionParameters.SUPPORT_PERIOD;

/**
 * Early-participation bonus.
 * Full {@code MAX_TIMING_BONUS_BPS} inside the first {@code EARLY_BONUS_WINDOW} after the reference time,
 * then linear decay to zero at the end of the support period. Zero before the reference time.
 */
@Component
public class TimingBonusCalculator {

    public long bonusBps(OffsetDateTime reference, OffsetDateTime at) {
        if (at.isBefore(reference)) {
            return 0L;
        }
        long elapsedMillis = Duration.between(reference, at).toMillis();
        long earlyMillis = EARLY_BONUS_WINDOW.toMillis();
        long periodMillis = SUPPORT_PERIOD.toMillis();
        if (elapsedMillis <= earlyMillis) {
            return MAX_TIMING_BONUS_BPS;
        }
        if (elapsedMillis >= periodMillis) {
            return 0L;
        }
        long remaining = periodMillis - elapsedMillis;
        return MAX_TIMING_BONUS_BPS * remaining / (periodMillis - earlyMillis);
    }

    /**
     * Stake amount scaled by {@code (BASIS_POINTS + bonusBps) / BASIS_POINTS}, rounded down.
     */
    public long weightedAmount(long amount, long bonusBps) {
        return BigInteger.valueOf(amount)
                .multiply(BigInteger.valueOf(BASIS_POINTS + bonusBps))
                .divide(BigInteger.valueOf(BASIS_POINTS))
                .longValueExact();
    }
}
