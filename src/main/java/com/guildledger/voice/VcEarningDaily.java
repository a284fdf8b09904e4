package com.guildledger.voice;

import com.guildledger.common.DecimalTextConverter;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Running total a member earned in voice on one day.
 */
@Entity
@Table(name = "vc_earning_daily", uniqueConstraints = {
    @UniqueConstraint(name = "uk_vc_earning_daily_day", columnNames = {"tenant_id", "user_id", "asset_id", "earned_on"})
}, indexes = {
    @Index(name = "idx_vc_earning_daily_earned_on", columnList = "earned_on"),
    @Index(name = "idx_vc_earning_daily_asset_id", columnList = "asset_id")
})
@Data
@NoArgsConstructor
public class VcEarningDaily {

    @Id
    private String id;

    @Column(name = "tenant_id", nullable = false)
    private String tenantId;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Column(name = "asset_id", nullable = false)
    private String assetId;

    @Column(name = "earned_on", nullable = false)
    private LocalDate earnedOn;

    @Convert(converter = DecimalTextConverter.class)
    @Column(nullable = false, length = 64)
    private BigDecimal total;

    public VcEarningDaily(String tenantId, String userId, String assetId, LocalDate earnedOn) {
        this.id = UUID.randomUUID().toString();
        this.tenantId = tenantId;
        this.userId = userId;
        this.assetId = assetId;
        this.earnedOn = earnedOn;
        this.total = BigDecimal.ZERO;
    }
}
