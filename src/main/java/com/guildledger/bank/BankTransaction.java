package com.guildledger.bank;

import com.guildledger.common.DecimalTextConverter;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * One line of a member's bank history.
 */
@Entity
@Table(name = "bank_transactions", indexes = {
    @Index(name = "idx_bank_transactions_user_asset", columnList = "user_id, asset_id, created_at"),
    @Index(name = "idx_bank_transactions_asset_id", columnList = "asset_id")
})
@Data
@NoArgsConstructor
public class BankTransaction {

    @Id
    private String id;

    @Column(name = "tenant_id", nullable = false)
    private String tenantId;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Column(name = "asset_id", nullable = false)
    private String assetId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private BankTransactionType type;

    @Convert(converter = DecimalTextConverter.class)
    @Column(nullable = false, length = 64)
    private BigDecimal amount;

    @Convert(converter = DecimalTextConverter.class)
    @Column(name = "balance_after", nullable = false, length = 64)
    private BigDecimal balanceAfter;

    /**
     * The ledger transaction that moved the funds.
     */
    @Column(name = "ledger_transaction_id", nullable = false)
    private String ledgerTransactionId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public BankTransaction(BankAccount account, BankTransactionType type, BigDecimal amount,
                           String ledgerTransactionId, Instant createdAt) {
        this.id = UUID.randomUUID().toString();
        this.tenantId = account.getTenantId();
        this.userId = account.getUserId();
        this.assetId = account.getAssetId();
        this.type = type;
        this.amount = amount;
        this.balanceAfter = account.getBalance();
        this.ledgerTransactionId = ledgerTransactionId;
        this.createdAt = createdAt;
    }
}
