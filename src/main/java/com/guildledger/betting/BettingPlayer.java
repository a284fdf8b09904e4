package com.guildledger.betting;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * A contestant that members can bet on.
 */
@Entity
@Table(name = "betting_players", uniqueConstraints = {
    @UniqueConstraint(name = "uk_betting_players_event_user", columnNames = {"event_id", "user_id"})
})
@Data
@NoArgsConstructor
public class BettingPlayer {

    @Id
    private String id;

    @Column(name = "event_id", nullable = false)
    private String eventId;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Column(name = "added_at", nullable = false, updatable = false)
    private Instant addedAt;

    public BettingPlayer(String eventId, String userId, Instant addedAt) {
        this.id = UUID.randomUUID().toString();
        this.eventId = eventId;
        this.userId = userId;
        this.addedAt = addedAt;
    }
}
