package com.meritmarket.repository;

import com.meritmarket.model.ResolutionCommit;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ResolutionCommitRepository extends JpaRepository<ResolutionCommit, Long> {
    Optional<ResolutionCommit> findFirstByMarketIdAndCommitterAndRevealedFalseAndSlashedFalse(
            String marketId, String committer);
    Optional<ResolutionCommit> findTopByCommitterOrderByCommittedAtDesc(String committer);
    Optional<ResolutionCommit> findTopByMarketIdAndCommitterOrderByCommittedAtDesc(String marketId, String committer);
    List<ResolutionCommit> findByMarketId(String marketId);
}
