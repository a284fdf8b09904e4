package com.guildledger.bank;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for bank history.
 */
@Repository
public interface BankTransactionRepository extends JpaRepository<BankTransaction, String> {

    List<BankTransaction> findByTenantIdAndUserIdAndAssetIdOrderByCreatedAtDesc(
        String tenantId, String userId, String assetId, Pageable pageable);

    @Modifying
    @Query("delete from BankTransaction t where t.assetId = :assetId")
    int deleteByAssetId(@Param("assetId") String assetId);
}
