package com.guildledger.betting;

import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;

/**
 * How a settled pool was paid out.
 */
@Value
public class BettingSettlement {
    String eventId;
    String winnerUserId;
    BigDecimal pool;
    BigDecimal odds;
    /** Winnings per bettor. */
    Map<String, BigDecimal> payouts;
    /** Pool minus payouts; negative when the treasury funded a shortfall. */
    BigDecimal treasuryDelta;
    /** Null when the pool was empty and nothing moved. */
    String transactionId;
}
