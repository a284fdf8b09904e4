package com.guildledger.rewards;

import lombok.Value;

import java.math.BigDecimal;

/**
 * A reward that was just paid.
 */
@Value
public class AutoRewardPayout {
    String configId;
    String userId;
    String symbol;
    BigDecimal amount;
    String transactionId;
}
