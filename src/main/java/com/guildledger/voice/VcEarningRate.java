package com.guildledger.voice;

import com.guildledger.common.DecimalTextConverter;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Amount of an asset earned per minute in the channels of a category.
 */
@Entity
@Table(name = "vc_earning_rates", uniqueConstraints = {
    @UniqueConstraint(name = "uk_vc_earning_rates_category_asset", columnNames = {"tenant_id", "category_id", "asset_id"})
})
@Data
@NoArgsConstructor
public class VcEarningRate {

    @Id
    private String id;

    @Column(name = "tenant_id", nullable = false)
    private String tenantId;

    @Column(name = "category_id", nullable = false)
    private String categoryId;

    @Column(name = "asset_id", nullable = false)
    private String assetId;

    @Convert(converter = DecimalTextConverter.class)
    @Column(name = "rate_per_minute", nullable = false, length = 64)
    private BigDecimal ratePerMinute;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public VcEarningRate(String tenantId, String categoryId, String assetId, BigDecimal ratePerMinute) {
        this.id = UUID.randomUUID().toString();
        this.tenantId = tenantId;
        this.categoryId = categoryId;
        this.assetId = assetId;
        this.ratePerMinute = ratePerMinute;
        this.createdAt = Instant.now();
    }
}
