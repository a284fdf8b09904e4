package com.guildledger.betting;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class OddsCalculatorTest {

    @Test
    void testEvenOddsWhileEmpty() {
        assertEquals(OddsCalculator.DEFAULT_ODDS, OddsCalculator.odds(BigDecimal.ZERO, BigDecimal.ZERO));
        assertEquals(OddsCalculator.DEFAULT_ODDS, OddsCalculator.odds(new BigDecimal("50"), BigDecimal.ZERO));
    }

    @Test
    void testPoolOverStake() {
        assertEquals(0, new BigDecimal("1.33").compareTo(
            OddsCalculator.odds(new BigDecimal("200"), new BigDecimal("150"))));
        assertEquals(0, new BigDecimal("4.00").compareTo(
            OddsCalculator.odds(new BigDecimal("200"), new BigDecimal("50"))));
    }

    @Test
    void testOddsNeverDropBelowMinimum() {
        assertEquals(0, OddsCalculator.MIN_ODDS.compareTo(
            OddsCalculator.odds(new BigDecimal("105"), new BigDecimal("100"))));
        assertEquals(0, OddsCalculator.MIN_ODDS.compareTo(
            OddsCalculator.odds(new BigDecimal("100"), new BigDecimal("100"))));
    }

    @Test
    void testPayoutRoundsDown() {
        assertEquals(0, new BigDecimal("66").compareTo(OddsCalculator.payout(new BigDecimal("50"), new BigDecimal("1.33"))));
        assertEquals(0, new BigDecimal("110").compareTo(OddsCalculator.payout(new BigDecimal("100"), new BigDecimal("1.10"))));
        assertEquals(0, BigDecimal.ONE.compareTo(OddsCalculator.payout(BigDecimal.ONE, new BigDecimal("1.99"))));
    }
}
