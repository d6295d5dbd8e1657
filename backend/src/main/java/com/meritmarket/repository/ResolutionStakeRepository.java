package com.meritmarket.repository;

import com.meritmarket.model.ResolutionStake;
import com.meritmarket.model.StakeRole;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ResolutionStakeRepository extends JpaRepository<ResolutionStake, Long> {
    Optional<ResolutionStake> findByResolutionIdAndRoleAndParticipantAndDisputeIndexIsNull(
            Long resolutionId, StakeRole role, String participant);
    Optional<ResolutionStake> findByResolutionIdAndRoleAndParticipantAndDisputeIndex(
            Long resolutionId, StakeRole role, String participant, Integer disputeIndex);
    List<ResolutionStake> findByResolutionId(Long resolutionId);
    List<ResolutionStake> findByResolutionIdAndParticipant(Long resolutionId, String participant);
}
