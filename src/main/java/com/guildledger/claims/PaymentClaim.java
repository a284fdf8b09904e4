package com.guildledger.claims;

import com.guildledger.common.DecimalTextConverter;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A request from one member to be paid by another.
 *
 * Only pending claims can change state; every other status is final.
 */
@Entity
@Table(name = "claims", indexes = {
    @Index(name = "idx_claims_payer_status", columnList = "tenant_id, from_user_id, status"),
    @Index(name = "idx_claims_asset_id", columnList = "asset_id")
})
@Data
@NoArgsConstructor
public class PaymentClaim {

    @Id
    private String id;

    @Column(name = "tenant_id", nullable = false)
    private String tenantId;

    /**
     * The member asked to pay.
     */
    @Column(name = "from_user_id", nullable = false)
    private String fromUserId;

    /**
     * The member who raised the claim and receives the payment.
     */
    @Column(name = "to_user_id", nullable = false)
    private String toUserId;

    @Column(name = "asset_id", nullable = false)
    private String assetId;

    @Convert(converter = DecimalTextConverter.class)
    @Column(nullable = false, length = 64)
    private BigDecimal amount;

    @Column(length = 500)
    private String memo;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private ClaimStatus status;

    @Column(name = "transaction_id")
    private String transactionId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "resolved_at")
    private Instant resolvedAt;

    public PaymentClaim(String tenantId, String fromUserId, String toUserId, String assetId,
                        BigDecimal amount, String memo) {
        this.id = UUID.randomUUID().toString();
        this.tenantId = tenantId;
        this.fromUserId = fromUserId;
        this.toUserId = toUserId;
        this.assetId = assetId;
        this.amount = amount;
        this.memo = memo;
        this.status = ClaimStatus.PENDING;
        this.createdAt = Instant.now();
    }

    public void resolve(ClaimStatus newStatus, Instant at) {
        if (status != ClaimStatus.PENDING) {
            throw new IllegalStateException(String.format(
                "Claim %s is already %s", id, status.name().toLowerCase()));
        }
        this.status = newStatus;
        this.resolvedAt = at;
    }
}
