package com.guildledger.roles;

import com.guildledger.common.DecimalTextConverter;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * A role for sale: price, currency and how long the role is kept.
 */
@Entity
@Table(name = "role_plans", indexes = {
    @Index(name = "idx_role_plans_panel_id", columnList = "panel_id"),
    @Index(name = "idx_role_plans_asset_id", columnList = "asset_id")
})
@Data
@NoArgsConstructor
public class RolePlan {

    @Id
    private String id;

    @Column(name = "panel_id", nullable = false)
    private String panelId;

    @Column(nullable = false)
    private String name;

    @Column(name = "role_id", nullable = false)
    private String roleId;

    @Convert(converter = DecimalTextConverter.class)
    @Column(nullable = false, length = 64)
    private BigDecimal price;

    @Column(name = "asset_id", nullable = false)
    private String assetId;

    @Column(name = "duration_hours", nullable = false)
    private int durationHours;

    @Column(length = 1000)
    private String description;

    public RolePlan(String panelId, String name, String roleId, BigDecimal price, String assetId,
                    int durationHours, String description) {
        this.id = UUID.randomUUID().toString();
        this.panelId = panelId;
        this.name = name;
        this.roleId = roleId;
        this.price = price;
        this.assetId = assetId;
        this.durationHours = durationHours;
        this.description = description;
    }
}
