package com.guildledger.betting;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Pari-mutuel odds.
 */
public final class OddsCalculator {

    public static final BigDecimal DEFAULT_ODDS = new BigDecimal("2.00");
    public static final BigDecimal MIN_ODDS = new BigDecimal("1.10");

    private OddsCalculator() {
    }

    /**
     * Pool divided by the stakes on the target, to 2 places, never below 1.1.
     * Even odds of 2.0 while either side is still empty.
     */
    public static BigDecimal odds(BigDecimal pool, BigDecimal stakedOnTarget) {
        if (pool.signum() == 0 || stakedOnTarget.signum() == 0) {
            return DEFAULT_ODDS;
        }
        BigDecimal odds = pool.divide(stakedOnTarget, 2, RoundingMode.HALF_EVEN);
        return odds.max(MIN_ODDS);
    }

    /**
     * Winnings for a stake, rounded down to whole units.
     */
    public static BigDecimal payout(BigDecimal stake, BigDecimal odds) {
        return stake.multiply(odds).setScale(0, RoundingMode.DOWN);
    }
}
