package com.guildledger.ledger;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Header of one economic action. Its postings are {@link LedgerEntry} rows
 * sharing the transaction id.
 *
 * Immutable once written. A (kind, idempotency key) pair identifies at most
 * one transaction; headers without a key are never deduplicated.
 */
@Entity
@Table(name = "transactions", uniqueConstraints = {
    @UniqueConstraint(name = "uk_transactions_kind_idempotency", columnNames = {"kind", "idempotency_key"})
}, indexes = {
    @Index(name = "idx_transactions_created_at", columnList = "created_at")
})
@Data
@NoArgsConstructor
public class LedgerTransaction {

    @Id
    private String id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private TransactionKind kind;

    @Column(name = "created_by")
    private String createdBy;

    @Column(name = "idempotency_key", length = 200)
    private String idempotencyKey;

    @Column(length = 500)
    private String reference;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public LedgerTransaction(TransactionKind kind, String createdBy, String idempotencyKey, String reference) {
        this.id = UUID.randomUUID().toString();
        this.kind = kind;
        this.createdBy = createdBy;
        this.idempotencyKey = idempotencyKey;
        this.reference = reference;
        this.createdAt = Instant.now();
    }
}
