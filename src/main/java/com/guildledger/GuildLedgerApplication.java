package com.guildledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the Guild Ledger.
 *
 * Guild Ledger is a multi-tenant double-entry ledger for guild currencies.
 * Chat front ends call its services in-process; the application itself only
 * hosts the ledger and the periodic sweeps (role expiry, monthly allowance,
 * voice earnings).
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class GuildLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(GuildLedgerApplication.class, args);
    }
}
