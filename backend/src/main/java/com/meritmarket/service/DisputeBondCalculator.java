package com.meritmarket.service;

import com.meritmarket.model.Resolution;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.time.Duration;
import java.time.OffsetDateTime;

import static com.meritmarket.service.ResolutionParameters.BASIS_POINTS;
import static com.meritmarket.service.ResolutionParameters.DISPUTE_BASE_MULTIPLIER;
import static com.meritmarket.service.ResolutionParameters.DISPUTE_PERIOD;
import static com.meritmarket.service.ResolutionParameters.MAX_DISPUTE_BOND;
import static com.meritmarket.service.ResolutionParameters.MIN_DISPUTE_BOND;

/**
 * Minimum bond for a new dispute: twice the current support stake, scaled from 100% up to 200% as the
 * dispute window elapses, then clamped into {@code [MIN_DISPUTE_BOND, MAX_DISPUTE_BOND]}.
 */
@Component
public class DisputeBondCalculator {

    public long requiredBond(Resolution resolution, OffsetDateTime at) {
        long periodSeconds = DISPUTE_PERIOD.getSeconds();
        long elapsedSeconds = Math.max(0L, Duration.between(resolution.getProposedAt(), at).getSeconds());
        elapsedSeconds = Math.min(elapsedSeconds, periodSeconds);

        long multiplierBps = BASIS_POINTS + elapsedSeconds * BASIS_POINTS / periodSeconds;
        BigInteger required = BigInteger.valueOf(resolution.getSupportStake())
                .multiply(BigInteger.valueOf(DISPUTE_BASE_MULTIPLIER))
                .multiply(BigInteger.valueOf(multiplierBps))
                .divide(BigInteger.valueOf(BASIS_POINTS));

        if (required.compareTo(BigInteger.valueOf(MAX_DISPUTE_BOND)) > 0) {
            return MAX_DISPUTE_BOND;
        }
        return Math.max(MIN_DISPUTE_BOND, required.longValue());
    }
}
