package com.guildledger.allowance;

import com.guildledger.common.DecimalTextConverter;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * One allowance paid to one member for one month. Never written twice for the same month.
 */
@Entity
@Table(name = "monthly_allowance_history", uniqueConstraints = {
    @UniqueConstraint(name = "uk_monthly_allowance_history_payment",
        columnNames = {"tenant_id", "role_id", "user_id", "asset_id", "year_month"})
}, indexes = {
    @Index(name = "idx_monthly_allowance_history_asset_id", columnList = "asset_id")
})
@Data
@NoArgsConstructor
public class MonthlyAllowanceHistory {

    @Id
    private String id;

    @Column(name = "tenant_id", nullable = false)
    private String tenantId;

    @Column(name = "role_id", nullable = false)
    private String roleId;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Column(name = "asset_id", nullable = false)
    private String assetId;

    @Convert(converter = DecimalTextConverter.class)
    @Column(nullable = false, length = 64)
    private BigDecimal amount;

    /** {@code yyyy-MM} in the configured zone. */
    @Column(name = "year_month", nullable = false, length = 7)
    private String yearMonth;

    @Column(name = "transaction_id", nullable = false)
    private String transactionId;

    @Column(name = "paid_at", nullable = false)
    private Instant paidAt;

    public MonthlyAllowanceHistory(MonthlyAllowance allowance, String userId, String yearMonth,
                                   String transactionId, Instant paidAt) {
        this.id = UUID.randomUUID().toString();
        this.tenantId = allowance.getTenantId();
        this.roleId = allowance.getRoleId();
        this.userId = userId;
        this.assetId = allowance.getAssetId();
        this.amount = allowance.getAmount();
        this.yearMonth = yearMonth;
        this.transactionId = transactionId;
        this.paidAt = paidAt;
    }
}
