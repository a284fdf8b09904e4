package com.guildledger.bank;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Wallet and bank holdings of a member in one asset.
 */
@Value
public class BankStatement {
    String symbol;
    BigDecimal wallet;
    BigDecimal bank;

    public BigDecimal getTotal() {
        return wallet.add(bank);
    }
}
