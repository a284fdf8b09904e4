package com.guildledger.roles;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * A shop window listing role plans priced in one currency.
 */
@Entity
@Table(name = "role_panels", uniqueConstraints = {
    @UniqueConstraint(name = "uk_role_panels_number", columnNames = {"tenant_id", "panel_number"})
}, indexes = {
    @Index(name = "idx_role_panels_asset_id", columnList = "asset_id")
})
@Data
@NoArgsConstructor
public class RolePanel {

    @Id
    private String id;

    @Column(name = "tenant_id", nullable = false)
    private String tenantId;

    @Column(name = "panel_number", nullable = false)
    private int panelNumber;

    @Column(nullable = false)
    private String name;

    /** Role shown on the panel; plans carry the role they actually grant. */
    @Column(name = "role_id")
    private String roleId;

    @Column(name = "asset_id", nullable = false)
    private String assetId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public RolePanel(String tenantId, int panelNumber, String name, String roleId, String assetId) {
        this.id = UUID.randomUUID().toString();
        this.tenantId = tenantId;
        this.panelNumber = panelNumber;
        this.name = name;
        this.roleId = roleId;
        this.assetId = assetId;
        this.createdAt = Instant.now();
    }
}
