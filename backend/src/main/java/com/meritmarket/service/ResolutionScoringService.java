package com.meritmarket.service;

import com.meritmarket.model.Dispute;
import com.meritmarket.model.Resolution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.meritmarket.service.ResolutionParameters.LEGISLATOR_VOTE_WEIGHT;
import static com.meritmarket.service.ResolutionParameters.MAX_SCORED_BACKERS;
import static com.meritmarket.service.ResolutionParameters.STAKE_SCORE_WEIGHT_BPS;
import static com.meritmarket.service.ResolutionParameters.TOKEN_UNIT;
import static com.meritmarket.service.ResolutionParameters.VOTE_SCORE_WEIGHT_BPS;

/**
 * Sybil-resistant scoring of a resolution against its disputes.
 * <p>
 * score = isqrt(stake in whole tokens) * min(backers, 10) * 60% + votes * vote weight * 40%.
 * Scores are kept in basis-point scale (not divided back down) so small scores keep their ordering.
 * <p>
 * A dispute wins only if its score is strictly greater than the best seen so far, starting from the
 * resolution's own score; on an exact tie the earlier dispute index keeps the win.
 */
@Service
public class ResolutionScoringService {

    private static final Logger log = LoggerFactory.getLogger(ResolutionScoringService.class);

    public long score(long stake, long backers, long votes) {
        long stakeComponent = isqrt(stake / TOKEN_UNIT) * Math.min(backers, MAX_SCORED_BACKERS);
        long voteComponent = votes * LEGISLATOR_VOTE_WEIGHT;
        return Math.addExact(
                Math.multiplyExact(stakeComponent, STAKE_SCORE_WEIGHT_BPS),
                Math.multiplyExact(voteComponent, VOTE_SCORE_WEIGHT_BPS));
    }

    public long resolutionScore(Resolution resolution) {
        return score(resolution.getSupportStake(), resolution.getSupporterCount(),
                resolution.getLegislatorSupportVotes());
    }

    public long disputeScore(Dispute dispute) {
        return score(dispute.totalPool(), dispute.getSupporterCount() + 1L, dispute.getEndorsementCount());
    }

    /**
     * @param disputes candidate disputes; only active ones are scored
     */
    public ScoringOutcome selectWinner(Resolution resolution, List<Dispute> disputes) {
        long resolutionScore = resolutionScore(resolution);
        long bestScore = resolutionScore;
        Integer winner = null;
        Map<Integer, Long> disputeScores = new LinkedHashMap<>();

        for (Dispute dispute : disputes) {
            if (!dispute.isActive()) {
                continue;
            }
            long disputeScore = disputeScore(dispute);
            disputeScores.put(dispute.getDisputeIndex(), disputeScore);
            if (disputeScore > bestScore) {
                bestScore = disputeScore;
                winner = dispute.getDisputeIndex();
            }
        }

        log.debug("Scored market {} cycle {}: resolution={}, disputes={}, winner={}",
                resolution.getMarketId(), resolution.getCycle(), resolutionScore, disputeScores, winner);
        return new ScoringOutcome(resolutionScore, disputeScores, winner);
    }

    /**
     * Integer square root, rounded down.
     */
    public static long isqrt(long value) {
        if (value < 0) {
            throw new IllegalArgumentException("isqrt of negative value " + value);
        }
        if (value < 2) {
            return value;
        }
        long x = (long) Math.sqrt((double) value);
        while (x > value / x) {
            x--;
        }
        while (x + 1 <= value / (x + 1)) {
            x++;
        }
        return x;
    }

    public record ScoringOutcome(long resolutionScore, Map<Integer, Long> disputeScores, Integer winningIndex) {
        public boolean disputeWon() {
            return winningIndex != null;
        }
    }
}
