package com.guildledger.bank;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for member bank balances.
 */
@Repository
public interface BankAccountRepository extends JpaRepository<BankAccount, String> {

    Optional<BankAccount> findByUserIdAndAssetId(String userId, String assetId);

    List<BankAccount> findByTenantIdAndAssetId(String tenantId, String assetId);

    @Modifying
    @Query("delete from BankAccount a where a.assetId = :assetId")
    int deleteByAssetId(@Param("assetId") String assetId);
}
