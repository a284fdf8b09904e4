package com.guildledger.voice;

import com.guildledger.common.DecimalTextConverter;
import com.guildledger.providers.VoiceChannelAccess;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * A voice channel members can pay to open for a limited time.
 *
 * Plans are grouped by template for display; names are unique per tenant.
 * Holders of {@code freeRoleId} open the channel without paying.
 */
@Entity
@Table(name = "vc_creation_plans", uniqueConstraints = {
    @UniqueConstraint(name = "uk_vc_creation_plans_tenant_name", columnNames = {"tenant_id", "name"})
}, indexes = {
    @Index(name = "idx_vc_creation_plans_asset_id", columnList = "asset_id")
})
@Data
@NoArgsConstructor
public class VcCreationPlan {

    public static final String USER_PLACEHOLDER = "{user}";

    @Id
    private String id;

    @Column(name = "tenant_id", nullable = false)
    private String tenantId;

    @Column(name = "template_name", nullable = false)
    private String templateName;

    @Column(nullable = false)
    private String name;

    @Column(name = "channel_name_template", nullable = false)
    private String channelNameTemplate;

    @Convert(converter = DecimalTextConverter.class)
    @Column(nullable = false, length = 64)
    private BigDecimal price;

    @Column(name = "asset_id", nullable = false)
    private String assetId;

    @Column(name = "duration_hours", nullable = false)
    private int durationHours;

    @Column(name = "user_limit", nullable = false)
    private int userLimit;

    @Enumerated(EnumType.STRING)
    @Column(name = "access_type", nullable = false, length = 16)
    private VoiceChannelAccess access;

    @Column(name = "free_role_id")
    private String freeRoleId;

    @Column(name = "category_id")
    private String categoryId;

    public VcCreationPlan(String tenantId, VcPlanRequest request, BigDecimal price, String assetId) {
        this.id = UUID.randomUUID().toString();
        this.tenantId = tenantId;
        this.templateName = request.getTemplateName();
        this.name = request.getName();
        this.channelNameTemplate = request.getChannelNameTemplate();
        this.price = price;
        this.assetId = assetId;
        this.durationHours = request.getDurationHours();
        this.userLimit = request.getUserLimit();
        this.access = request.getAccess();
        this.freeRoleId = request.getFreeRoleId();
        this.categoryId = request.getCategoryId();
    }

    public String channelName(String ownerDisplayName) {
        return channelNameTemplate.replace(USER_PLACEHOLDER, ownerDisplayName);
    }
}
