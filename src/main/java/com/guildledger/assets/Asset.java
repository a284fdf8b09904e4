package com.guildledger.assets;

import com.guildledger.common.Amounts;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.Locale;
import java.util.UUID;

/**
 * A currency defined inside one tenant.
 *
 * Symbols are stored upper-cased and are unique per tenant. An asset is never
 * modified after creation; it can only be deleted as a whole.
 */
@Entity
@Table(name = "assets", uniqueConstraints = {
    @UniqueConstraint(name = "uk_assets_tenant_symbol", columnNames = {"tenant_id", "symbol"})
})
@Data
@NoArgsConstructor
public class Asset {

    public static final int MAX_DECIMALS = 8;

    @Id
    private String id;

    @Column(name = "tenant_id", nullable = false)
    private String tenantId;

    @Column(nullable = false)
    private String symbol;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false)
    private int decimals;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public Asset(String tenantId, String symbol, String name, int decimals) {
        if (decimals < 0 || decimals > MAX_DECIMALS) {
            throw new IllegalArgumentException("Decimals must be between 0 and " + MAX_DECIMALS + ": " + decimals);
        }
        this.id = UUID.randomUUID().toString();
        this.tenantId = tenantId;
        this.symbol = normalizeSymbol(symbol);
        this.name = name;
        this.decimals = decimals;
        this.createdAt = Instant.now();
    }

    public static String normalizeSymbol(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("Symbol cannot be blank");
        }
        return symbol.strip().toUpperCase(Locale.ROOT);
    }

    /**
     * Quantize an amount to this asset's precision with the caller's rounding rule.
     */
    public BigDecimal quantize(BigDecimal amount, RoundingMode rounding) {
        return Amounts.quantize(amount, decimals, rounding);
    }

    /**
     * Truncate toward zero, so a user never moves more than they asked for.
     */
    public BigDecimal quantizeDown(BigDecimal amount) {
        return quantize(amount, RoundingMode.DOWN);
    }

    /**
     * Truncate a user supplied amount and require what is left to be positive.
     */
    public BigDecimal truncatePositive(BigDecimal amount) {
        if (amount == null) {
            throw new IllegalArgumentException("Amount is required");
        }
        BigDecimal truncated = quantizeDown(amount);
        if (truncated.signum() <= 0) {
            throw new IllegalArgumentException(String.format(
                "Amount must be positive at %d decimals: %s", decimals, amount.toPlainString()));
        }
        return truncated;
    }

    public boolean fitsPrecision(BigDecimal amount) {
        return Amounts.fitsPrecision(amount, decimals);
    }
}
