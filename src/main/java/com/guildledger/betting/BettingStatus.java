package com.guildledger.betting;

public enum BettingStatus {
    ACTIVE,
    SETTLED,
    CANCELLED
}
