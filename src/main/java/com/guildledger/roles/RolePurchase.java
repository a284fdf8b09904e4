package com.guildledger.roles;

import com.guildledger.common.DecimalTextConverter;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * A role a member paid for, held until {@code expiresAt}.
 */
@Entity
@Table(name = "role_purchases", indexes = {
    @Index(name = "idx_role_purchases_expires_at", columnList = "expires_at"),
    @Index(name = "idx_role_purchases_asset_id", columnList = "asset_id")
})
@Data
@NoArgsConstructor
public class RolePurchase {

    @Id
    private String id;

    @Column(name = "tenant_id", nullable = false)
    private String tenantId;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Column(name = "plan_id", nullable = false)
    private String planId;

    @Column(name = "role_id", nullable = false)
    private String roleId;

    @Column(name = "asset_id", nullable = false)
    private String assetId;

    @Convert(converter = DecimalTextConverter.class)
    @Column(nullable = false, length = 64)
    private BigDecimal price;

    @Column(name = "transaction_id", nullable = false)
    private String transactionId;

    @Column(name = "purchased_at", nullable = false)
    private Instant purchasedAt;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    public RolePurchase(String tenantId, String userId, RolePlan plan, String transactionId, Instant purchasedAt) {
        this.id = UUID.randomUUID().toString();
        this.tenantId = tenantId;
        this.userId = userId;
        this.planId = plan.getId();
        this.roleId = plan.getRoleId();
        this.assetId = plan.getAssetId();
        this.price = plan.getPrice();
        this.transactionId = transactionId;
        this.purchasedAt = purchasedAt;
        this.expiresAt = purchasedAt.plus(Duration.ofHours(plan.getDurationHours()));
    }

    public boolean isExpired(Instant now) {
        return !expiresAt.isAfter(now);
    }
}
