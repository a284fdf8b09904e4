package com.guildledger.allowance;

import com.guildledger.common.DecimalTextConverter;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Amount paid every month to each member holding a role.
 */
@Entity
@Table(name = "monthly_allowances", uniqueConstraints = {
    @UniqueConstraint(name = "uk_monthly_allowances_role_asset", columnNames = {"tenant_id", "role_id", "asset_id"})
})
@Data
@NoArgsConstructor
public class MonthlyAllowance {

    @Id
    private String id;

    @Column(name = "tenant_id", nullable = false)
    private String tenantId;

    @Column(name = "role_id", nullable = false)
    private String roleId;

    @Column(name = "asset_id", nullable = false)
    private String assetId;

    @Convert(converter = DecimalTextConverter.class)
    @Column(nullable = false, length = 64)
    private BigDecimal amount;

    @Column(nullable = false)
    private boolean enabled;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public MonthlyAllowance(String tenantId, String roleId, String assetId, BigDecimal amount) {
        this.id = UUID.randomUUID().toString();
        this.tenantId = tenantId;
        this.roleId = roleId;
        this.assetId = assetId;
        this.amount = amount;
        this.enabled = true;
        this.createdAt = Instant.now();
    }
}
