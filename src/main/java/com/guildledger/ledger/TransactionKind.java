package com.guildledger.ledger;

/**
 * The economic action a transaction records.
 */
public enum TransactionKind {
    TRANSFER("transfer"),
    ISSUE("issue"),
    INITIAL_ISSUE("initial_issue"),
    BURN("burn"),
    AUTO_REWARD("auto_reward"),
    BANK_DEPOSIT("bank_deposit"),
    BANK_WITHDRAW("bank_withdraw"),
    ROLE_PURCHASE("role_purchase"),
    MONTHLY_ALLOWANCE("monthly_allowance"),
    VC_EARNING("vc_earning"),
    AUTO_TREASURY_REFILL("auto_treasury_refill"),
    VC_CREATION("vc_creation"),
    BET_STAKE("bet_stake"),
    BET_SETTLEMENT("bet_settlement"),
    BET_REFUND("bet_refund"),
    CLAIM_PAYMENT("claim_payment");

    private final String code;

    TransactionKind(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
