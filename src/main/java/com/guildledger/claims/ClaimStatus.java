package com.guildledger.claims;

public enum ClaimStatus {
    PENDING,
    PAID,
    DECLINED,
    CANCELLED
}
