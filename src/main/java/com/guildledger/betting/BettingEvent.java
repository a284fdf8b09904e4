package com.guildledger.betting;

import com.guildledger.common.DecimalTextConverter;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A pari-mutuel pool: members bet on which player wins.
 *
 * A tenant has at most one active event at a time. The pool equals the sum of
 * stakes held in escrow for the event until it is settled or cancelled.
 */
@Entity
@Table(name = "betting_events", indexes = {
    @Index(name = "idx_betting_events_tenant_status", columnList = "tenant_id, status"),
    @Index(name = "idx_betting_events_asset_id", columnList = "asset_id")
})
@Data
@NoArgsConstructor
public class BettingEvent {

    @Id
    private String id;

    @Column(name = "tenant_id", nullable = false)
    private String tenantId;

    @Column(nullable = false)
    private String name;

    @Column(name = "asset_id", nullable = false)
    private String assetId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private BettingStatus status;

    @Convert(converter = DecimalTextConverter.class)
    @Column(nullable = false, length = 64)
    private BigDecimal pool;

    @Column(name = "winner_user_id")
    private String winnerUserId;

    @Column(name = "created_by")
    private String createdBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "closed_at")
    private Instant closedAt;

    public BettingEvent(String tenantId, String name, String assetId, String createdBy, Instant createdAt) {
        this.id = UUID.randomUUID().toString();
        this.tenantId = tenantId;
        this.name = name;
        this.assetId = assetId;
        this.status = BettingStatus.ACTIVE;
        this.pool = BigDecimal.ZERO;
        this.createdBy = createdBy;
        this.createdAt = createdAt;
    }

    public void requireActive() {
        if (status != BettingStatus.ACTIVE) {
            throw new IllegalStateException(String.format("Betting event %s is %s", id, status));
        }
    }

    public void close(BettingStatus finalStatus, String winnerUserId, Instant at) {
        requireActive();
        this.status = finalStatus;
        this.winnerUserId = winnerUserId;
        this.closedAt = at;
    }
}
