package com.guildledger.ledger;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for materialized balances.
 */
@Repository
public interface AccountBalanceRepository extends JpaRepository<AccountBalance, String> {

    Optional<AccountBalance> findByAccountIdAndAssetId(String accountId, String assetId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select b from AccountBalance b where b.accountId = :accountId and b.assetId = :assetId")
    Optional<AccountBalance> findForUpdate(@Param("accountId") String accountId, @Param("assetId") String assetId);

    List<AccountBalance> findByAssetId(String assetId);

    @Modifying
    @Query("delete from AccountBalance b where b.assetId = :assetId")
    int deleteByAssetId(@Param("assetId") String assetId);
}
