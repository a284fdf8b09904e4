package com.guildledger.ledger;

import com.guildledger.common.DecimalTextConverter;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * One posting: a signed amount of one asset against one account.
 *
 * Positive amounts credit the account, negative amounts debit it. The postings
 * of a transaction net to zero per asset. Entries are append-only; they are only
 * removed when their asset is deleted.
 */
@Entity
@Table(name = "ledger_entries", indexes = {
    @Index(name = "idx_ledger_transaction_id", columnList = "transaction_id"),
    @Index(name = "idx_ledger_account_asset", columnList = "account_id, asset_id"),
    @Index(name = "idx_ledger_asset_id", columnList = "asset_id")
})
@Data
@NoArgsConstructor
public class LedgerEntry {

    @Id
    private String id;

    @Column(name = "transaction_id", nullable = false)
    private String transactionId;

    @Column(name = "account_id", nullable = false)
    private String accountId;

    @Column(name = "asset_id", nullable = false)
    private String assetId;

    /**
     * Exact decimal text; never a floating point column.
     */
    @Convert(converter = DecimalTextConverter.class)
    @Column(nullable = false, length = 64)
    private BigDecimal amount;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public LedgerEntry(String transactionId, String accountId, String assetId, BigDecimal amount) {
        this.id = UUID.randomUUID().toString();
        this.transactionId = transactionId;
        this.accountId = accountId;
        this.assetId = assetId;
        this.amount = amount;
        this.createdAt = Instant.now();
    }
}
