package com.guildledger.ledger;

import com.guildledger.common.DecimalTextConverter;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Materialized running balance of one (account, asset) pair.
 *
 * Updated in the same transaction as every posting that touches the pair and
 * always reconstructible from the postings themselves.
 */
@Entity
@Table(name = "account_balances", uniqueConstraints = {
    @UniqueConstraint(name = "uk_account_balances_account_asset", columnNames = {"account_id", "asset_id"})
})
@Data
@NoArgsConstructor
public class AccountBalance {

    @Id
    private String id;

    @Column(name = "account_id", nullable = false)
    private String accountId;

    @Column(name = "asset_id", nullable = false)
    private String assetId;

    @Convert(converter = DecimalTextConverter.class)
    @Column(nullable = false, length = 64)
    private BigDecimal balance;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public AccountBalance(String accountId, String assetId) {
        this.id = UUID.randomUUID().toString();
        this.accountId = accountId;
        this.assetId = assetId;
        this.balance = BigDecimal.ZERO;
        this.updatedAt = Instant.now();
    }

    public void apply(BigDecimal delta) {
        this.balance = this.balance.add(delta);
        this.updatedAt = Instant.now();
    }
}
