package com.meritmarket.repository;

import com.meritmarket.model.LegislatorSnapshot;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface LegislatorSnapshotRepository extends JpaRepository<LegislatorSnapshot, Long> {
    boolean existsByResolutionIdAndLegislator(Long resolutionId, String legislator);
    List<LegislatorSnapshot> findByResolutionId(Long resolutionId);
}
