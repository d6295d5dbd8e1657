package com.meritmarket.repository;

import com.meritmarket.model.Resolution;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface ResolutionRepository extends JpaRepository<Resolution, Long> {
    Optional<Resolution> findTopByMarketIdOrderByCycleDesc(String marketId);
    Optional<Resolution> findByMarketIdAndCycle(String marketId, Integer cycle);
    List<Resolution> findByMarketIdOrderByCycleAsc(String marketId);
    List<Resolution> findByFinalizedFalseAndProposedAtBefore(OffsetDateTime proposedBefore);
}
