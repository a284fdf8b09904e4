package com.guildledger.voice;

import com.guildledger.common.DecimalTextConverter;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * A voice channel opened from a plan, deleted once {@code expiresAt} passes.
 *
 * {@code transactionId} is null when the owner did not pay.
 */
@Entity
@Table(name = "vc_creations", indexes = {
    @Index(name = "idx_vc_creations_expires_at", columnList = "expires_at"),
    @Index(name = "idx_vc_creations_asset_id", columnList = "asset_id")
})
@Data
@NoArgsConstructor
public class VcCreation {

    @Id
    private String id;

    @Column(name = "tenant_id", nullable = false)
    private String tenantId;

    @Column(name = "owner_user_id", nullable = false)
    private String ownerUserId;

    @Column(name = "plan_id", nullable = false)
    private String planId;

    @Column(name = "channel_id", nullable = false)
    private String channelId;

    @Column(name = "asset_id", nullable = false)
    private String assetId;

    @Convert(converter = DecimalTextConverter.class)
    @Column(nullable = false, length = 64)
    private BigDecimal price;

    @Column(name = "transaction_id")
    private String transactionId;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    public VcCreation(String tenantId, String ownerUserId, VcCreationPlan plan, String channelId, BigDecimal price,
                      String transactionId, Instant createdAt) {
        this.id = UUID.randomUUID().toString();
        this.tenantId = tenantId;
        this.ownerUserId = ownerUserId;
        this.planId = plan.getId();
        this.channelId = channelId;
        this.assetId = plan.getAssetId();
        this.price = price;
        this.transactionId = transactionId;
        this.createdAt = createdAt;
        this.expiresAt = createdAt.plus(Duration.ofHours(plan.getDurationHours()));
    }

    public boolean isPaid() {
        return transactionId != null;
    }
}
