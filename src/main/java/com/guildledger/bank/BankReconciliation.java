package com.guildledger.bank;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Ledger balance of the bank system account against the member balances it backs.
 */
@Value
public class BankReconciliation {
    String symbol;
    BigDecimal ledgerBalance;
    BigDecimal memberBalances;

    public boolean isBalanced() {
        return ledgerBalance.compareTo(memberBalances) == 0;
    }
}
