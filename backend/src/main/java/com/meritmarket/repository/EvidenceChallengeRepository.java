package com.meritmarket.repository;

import com.meritmarket.model.EvidenceChallenge;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface EvidenceChallengeRepository extends JpaRepository<EvidenceChallenge, Long> {
    List<EvidenceChallenge> findByResolutionIdOrderByChallengeIndexAsc(Long resolutionId);
    Optional<EvidenceChallenge> findByResolutionIdAndChallengeIndex(Long resolutionId, Integer challengeIndex);
    long countByResolutionId(Long resolutionId);
    boolean existsByResolutionIdAndResolvedFalse(Long resolutionId);
}
