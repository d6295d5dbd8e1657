package com.meritmarket.repository;

import com.meritmarket.model.MarketEscrow;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface MarketEscrowRepository extends JpaRepository<MarketEscrow, String> {
}
