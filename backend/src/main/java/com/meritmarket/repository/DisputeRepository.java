package com.meritmarket.repository;

import com.meritmarket.model.Dispute;
import com.meritmarket.model.DisputeStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface DisputeRepository extends JpaRepository<Dispute, Long> {
    List<Dispute> findByResolutionIdOrderByDisputeIndexAsc(Long resolutionId);
    Optional<Dispute> findByResolutionIdAndDisputeIndex(Long resolutionId, Integer disputeIndex);
    boolean existsByResolutionIdAndStatus(Long resolutionId, DisputeStatus status);
}
