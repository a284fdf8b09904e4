package com.guildledger.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.retry.support.RetryTemplate;

import java.time.Clock;

/**
 * Infrastructure beans shared by the ledger and the subledgers.
 */
@Configuration
public class LedgerConfig {

    @Bean
    public Clock clock(GuildLedgerProperties properties) {
        return Clock.system(properties.getZone());
    }

    /**
     * Retries a whole atomic unit after a lost row lock or a unique constraint
     * race; the replay re-reads what the winner committed.
     */
    @Bean
    public RetryTemplate ledgerRetryTemplate(GuildLedgerProperties properties) {
        GuildLedgerProperties.Retry retry = properties.getRetry();
        return RetryTemplate.builder()
            .maxAttempts(retry.getMaxAttempts())
            .exponentialBackoff(retry.getInitialBackoffMs(), 2.0, retry.getMaxBackoffMs())
            .retryOn(ConcurrencyFailureException.class)
            .retryOn(DataIntegrityViolationException.class)
            .traversingCauses()
            .build();
    }
}
