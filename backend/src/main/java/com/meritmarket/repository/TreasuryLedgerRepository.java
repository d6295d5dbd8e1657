package com.meritmarket.repository;

import com.meritmarket.model.TreasuryLedger;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface TreasuryLedgerRepository extends JpaRepository<TreasuryLedger, Integer> {
}
