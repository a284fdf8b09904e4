package com.guildledger.betting;

import com.guildledger.common.DecimalTextConverter;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A stake placed by a member on a player.
 */
@Entity
@Table(name = "bets", indexes = {
    @Index(name = "idx_bets_event_id", columnList = "event_id"),
    @Index(name = "idx_bets_event_target", columnList = "event_id, target_user_id")
})
@Data
@NoArgsConstructor
public class Bet {

    @Id
    private String id;

    @Column(name = "event_id", nullable = false)
    private String eventId;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Column(name = "target_user_id", nullable = false)
    private String targetUserId;

    @Convert(converter = DecimalTextConverter.class)
    @Column(nullable = false, length = 64)
    private BigDecimal amount;

    @Column(name = "transaction_id", nullable = false)
    private String transactionId;

    @Column(name = "placed_at", nullable = false, updatable = false)
    private Instant placedAt;

    public Bet(String eventId, String userId, String targetUserId, BigDecimal amount, String transactionId,
               Instant placedAt) {
        this.id = UUID.randomUUID().toString();
        this.eventId = eventId;
        this.userId = userId;
        this.targetUserId = targetUserId;
        this.amount = amount;
        this.transactionId = transactionId;
        this.placedAt = placedAt;
    }
}
