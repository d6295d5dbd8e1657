package com.meritmarket.repository;

import com.meritmarket.model.DisputeEndorsement;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface DisputeEndorsementRepository extends JpaRepository<DisputeEndorsement, Long> {
    boolean existsByResolutionIdAndDisputeIndexAndLegislator(Long resolutionId, Integer disputeIndex, String legislator);
}
