package com.guildledger.bank;

import com.guildledger.common.DecimalTextConverter;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A member's savings in one asset.
 *
 * The funds themselves sit on the tenant's bank system account; this row only
 * records how much of it belongs to the member.
 */
@Entity
@Table(name = "bank_accounts", uniqueConstraints = {
    @UniqueConstraint(name = "uk_bank_accounts_user_asset", columnNames = {"user_id", "asset_id"})
}, indexes = {
    @Index(name = "idx_bank_accounts_asset_id", columnList = "asset_id")
})
@Data
@NoArgsConstructor
public class BankAccount {

    @Id
    private String id;

    @Column(name = "tenant_id", nullable = false)
    private String tenantId;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Column(name = "asset_id", nullable = false)
    private String assetId;

    @Convert(converter = DecimalTextConverter.class)
    @Column(nullable = false, length = 64)
    private BigDecimal balance;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public BankAccount(String tenantId, String userId, String assetId) {
        this.id = UUID.randomUUID().toString();
        this.tenantId = tenantId;
        this.userId = userId;
        this.assetId = assetId;
        this.balance = BigDecimal.ZERO;
        this.updatedAt = Instant.now();
    }
}
