package com.guildledger.bank;

public enum BankTransactionType {
    DEPOSIT,
    WITHDRAW
}
