package com.guildledger.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Turns on the periodic sweeps. Disabled in tests, which drive the sweeps directly.
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(name = "guild-ledger.scheduling.enabled", havingValue = "true", matchIfMissing = true)
public class SchedulingConfig {
}
