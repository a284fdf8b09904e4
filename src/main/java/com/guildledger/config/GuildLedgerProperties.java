package com.guildledger.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.ZoneId;

/**
 * Settings bound from the {@code guild-ledger} prefix.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "guild-ledger")
public class GuildLedgerProperties {

    @NotNull
    private ZoneId zone = ZoneId.of("Asia/Tokyo");

    @Valid
    private Scheduling scheduling = new Scheduling();

    @Valid
    private Treasury treasury = new Treasury();

    @Valid
    private Locking locking = new Locking();

    @Valid
    private Retry retry = new Retry();

    @Valid
    private Roles roles = new Roles();

    @Valid
    private Allowance allowance = new Allowance();

    @Valid
    private Voice voice = new Voice();

    @Data
    public static class Scheduling {

        /** Read by {@link SchedulingConfig}; tests switch the periodic sweeps off. */
        private boolean enabled = true;
    }

    @Data
    public static class Treasury {

        /** Amount credited to a treasury each time it runs dry. Not scaled by decimals. */
        @NotNull
        @Positive
        private BigDecimal refillQuantum = new BigDecimal("1000000000");

        /** Balance issued to the treasury when a currency is created. */
        @NotNull
        private BigDecimal initialIssue = new BigDecimal("1000000000");
    }

    @Data
    public static class Locking {

        @Positive
        private long timeoutMs = 10_000;
    }

    @Data
    public static class Retry {

        @Min(1)
        private int maxAttempts = 3;

        @Positive
        private long initialBackoffMs = 50;

        @Positive
        private long maxBackoffMs = 1_000;
    }

    @Data
    public static class Roles {

        @Positive
        private long expirySweepIntervalMs = 300_000;
    }

    @Data
    public static class Allowance {

        @Min(1)
        @Max(28)
        private int payDay = 28;
    }

    @Data
    public static class Voice {

        @NotNull
        private FundingSource fundingSource = FundingSource.MINT;

        @Min(1)
        private int dailyRetentionDays = 7;

        @Positive
        private long creationSweepIntervalMs = 300_000;
    }

    /**
     * Where per-minute voice earnings are debited from.
     */
    public enum FundingSource {
        /** Newly minted supply: the earning is inflationary. */
        MINT,
        /** Paid by the treasury like every other reward. */
        TREASURY
    }
}
