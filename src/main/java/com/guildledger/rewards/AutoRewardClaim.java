package com.guildledger.rewards;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Proof that a member received a reward; a member can hold one per config.
 */
@Entity
@Table(name = "auto_reward_claims", uniqueConstraints = {
    @UniqueConstraint(name = "uk_auto_reward_claims_config_user", columnNames = {"config_id", "user_id"})
})
@Data
@NoArgsConstructor
public class AutoRewardClaim {

    @Id
    private String id;

    @Column(name = "config_id", nullable = false)
    private String configId;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Column(name = "transaction_id", nullable = false)
    private String transactionId;

    @Column(name = "claimed_at", nullable = false, updatable = false)
    private Instant claimedAt;

    public AutoRewardClaim(String configId, String userId, String transactionId, Instant claimedAt) {
        this.id = UUID.randomUUID().toString();
        this.configId = configId;
        this.userId = userId;
        this.transactionId = transactionId;
        this.claimedAt = claimedAt;
    }
}
