package com.guildledger.ledger;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for postings.
 */
@Repository
public interface LedgerEntryRepository extends JpaRepository<LedgerEntry, String> {

    List<LedgerEntry> findByTransactionId(String transactionId);

    List<LedgerEntry> findByAccountIdOrderByCreatedAtDesc(String accountId);

    List<LedgerEntry> findByAccountIdAndAssetId(String accountId, String assetId);

    long countByAssetId(String assetId);

    @Modifying
    @Query("delete from LedgerEntry e where e.assetId = :assetId")
    int deleteByAssetId(@Param("assetId") String assetId);
}
