package com.meritmarket.repository;

import com.meritmarket.model.LegislatorVoteCommit;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface LegislatorVoteCommitRepository extends JpaRepository<LegislatorVoteCommit, Long> {
    Optional<LegislatorVoteCommit> findByResolutionIdAndLegislator(Long resolutionId, String legislator);
    List<LegislatorVoteCommit> findByResolutionId(Long resolutionId);
}
