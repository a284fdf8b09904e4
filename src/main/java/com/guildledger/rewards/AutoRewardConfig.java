package com.guildledger.rewards;

import com.guildledger.common.DecimalTextConverter;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A one-time reward paid to every member who posts the trigger message in a channel.
 *
 * At most one config per channel.
 */
@Entity
@Table(name = "auto_reward_configs", uniqueConstraints = {
    @UniqueConstraint(name = "uk_auto_reward_configs_channel", columnNames = {"tenant_id", "channel_id"})
}, indexes = {
    @Index(name = "idx_auto_reward_configs_asset_id", columnList = "asset_id")
})
@Data
@NoArgsConstructor
public class AutoRewardConfig {

    @Id
    private String id;

    @Column(name = "tenant_id", nullable = false)
    private String tenantId;

    @Column(name = "channel_id", nullable = false)
    private String channelId;

    @Column(name = "trigger_message", nullable = false, length = 2000)
    private String triggerMessage;

    @Convert(converter = DecimalTextConverter.class)
    @Column(nullable = false, length = 64)
    private BigDecimal amount;

    @Column(name = "asset_id", nullable = false)
    private String assetId;

    @Column(nullable = false)
    private boolean enabled;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public AutoRewardConfig(String tenantId, String channelId, String triggerMessage, BigDecimal amount,
                            String assetId) {
        this.id = UUID.randomUUID().toString();
        this.tenantId = tenantId;
        this.channelId = channelId;
        this.triggerMessage = triggerMessage;
        this.amount = amount;
        this.assetId = assetId;
        this.enabled = true;
        this.createdAt = Instant.now();
    }

    /**
     * Whether a message, ignoring surrounding whitespace, is exactly the trigger.
     */
    public boolean matches(String content) {
        return content != null && content.strip().equals(triggerMessage);
    }
}
