package com.guildledger.payments;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Outcome of a committed payment.
 */
@Value
public class PaymentReceipt {
    String transactionId;
    String symbol;
    BigDecimal amount;
}
