package com.guildledger.common;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Helpers for exact decimal amounts.
 */
public final class Amounts {

    private Amounts() {
    }

    /**
     * Quantize to {@code decimals} fraction digits.
     */
    public static BigDecimal quantize(BigDecimal amount, int decimals, RoundingMode rounding) {
        if (amount == null) {
            throw new IllegalArgumentException("Amount cannot be null");
        }
        return amount.setScale(decimals, rounding);
    }

    /**
     * Whether the amount already fits in {@code decimals} fraction digits.
     */
    public static boolean fitsPrecision(BigDecimal amount, int decimals) {
        return amount.stripTrailingZeros().scale() <= decimals;
    }
}
