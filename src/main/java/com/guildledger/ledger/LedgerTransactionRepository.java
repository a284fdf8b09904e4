package com.guildledger.ledger;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for transaction headers.
 */
@Repository
public interface LedgerTransactionRepository extends JpaRepository<LedgerTransaction, String> {

    Optional<LedgerTransaction> findByKindAndIdempotencyKey(TransactionKind kind, String idempotencyKey);

    List<LedgerTransaction> findByKindOrderByCreatedAtAsc(TransactionKind kind);
}
