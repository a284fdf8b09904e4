package com.guildledger.voice;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * A member currently sitting in a voice channel. One per member per tenant.
 */
@Entity
@Table(name = "vc_earning_sessions", uniqueConstraints = {
    @UniqueConstraint(name = "uk_vc_earning_sessions_user", columnNames = {"tenant_id", "user_id"})
})
@Data
@NoArgsConstructor
public class VcSession {

    @Id
    private String id;

    @Column(name = "tenant_id", nullable = false)
    private String tenantId;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Column(name = "channel_id", nullable = false)
    private String channelId;

    /** Category of the channel; channels outside a category earn nothing. */
    @Column(name = "category_id")
    private String categoryId;

    @Column(name = "started_at", nullable = false)
    private Instant startedAt;

    @Column(name = "last_paid_at")
    private Instant lastPaidAt;

    public VcSession(String tenantId, String userId, String channelId, String categoryId, Instant startedAt) {
        this.id = UUID.randomUUID().toString();
        this.tenantId = tenantId;
        this.userId = userId;
        this.channelId = channelId;
        this.categoryId = categoryId;
        this.startedAt = startedAt;
    }
}
