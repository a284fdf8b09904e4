package com.guildledger.accounts;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * A named ledger participant.
 *
 * The name is globally unique and is the lookup key: {@code user:{user}:{tenant}}
 * for members and {@code {type}:{tenant}} for system accounts.
 * Accounts hold no balance themselves; balances live in the ledger.
 */
@Entity
@Table(name = "accounts", uniqueConstraints = {
    @UniqueConstraint(name = "uk_accounts_name", columnNames = "name")
}, indexes = {
    @Index(name = "idx_accounts_tenant", columnList = "tenant_id")
})
@Data
@NoArgsConstructor
public class Account {

    @Id
    private String id;

    /** Null for system accounts. */
    @Column(name = "owner_user_id")
    private String ownerUserId;

    @Column(name = "tenant_id", nullable = false)
    private String tenantId;

    @Column(nullable = false)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "account_type", nullable = false)
    private AccountType type;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public Account(String ownerUserId, String tenantId, String name, AccountType type) {
        this.id = UUID.randomUUID().toString();
        this.ownerUserId = ownerUserId;
        this.tenantId = tenantId;
        this.name = name;
        this.type = type;
        this.createdAt = Instant.now();
    }

    public static String userAccountName(String tenantId, String userId) {
        return "user:" + userId + ":" + tenantId;
    }

    public static String systemAccountName(String tenantId, AccountType type) {
        return type.getCode() + ":" + tenantId;
    }
}
