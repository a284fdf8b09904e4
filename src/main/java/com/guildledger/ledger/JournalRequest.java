package com.guildledger.ledger;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * A balanced set of postings for one economic action.
 */
@Value
@Builder
public class JournalRequest {

    TransactionKind kind;
    String createdBy;
    String idempotencyKey;
    String reference;

    @Singular
    List<Leg> legs;

    /**
     * Net amount per asset; every value is zero for a balanced request.
     */
    public Map<String, BigDecimal> netByAsset() {
        Map<String, BigDecimal> net = new TreeMap<>();
        for (Leg leg : legs) {
            net.merge(leg.getAssetId(), leg.getAmount(), BigDecimal::add);
        }
        return net;
    }

    @Value
    public static class Leg {
        String accountId;
        String assetId;
        BigDecimal amount;
    }

    public static class JournalRequestBuilder {

        /**
         * Debit {@code from} and credit {@code to} with the same amount.
         */
        public JournalRequestBuilder move(String from, String to, String assetId, BigDecimal amount) {
            leg(new Leg(from, assetId, amount.negate()));
            leg(new Leg(to, assetId, amount));
            return this;
        }
    }
}
