package com.guildledger.allowance;

import com.guildledger.config.GuildLedgerProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.YearMonth;

/**
 * Checks every hour whether today is pay day in the configured zone.
 * Every run on pay day pays only the members still unpaid for the month.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MonthlyAllowanceScheduler {

    private final MonthlyAllowanceService allowanceService;
    private final GuildLedgerProperties properties;
    private final Clock clock;

    @Scheduled(cron = "0 0 * * * *", zone = "${guild-ledger.zone:Asia/Tokyo}")
    public void payIfDue() {
        LocalDate today = LocalDate.now(clock.withZone(properties.getZone()));
        if (today.getDayOfMonth() != properties.getAllowance().getPayDay()) {
            return;
        }
        log.debug("Pay day {} reached, running monthly allowance", today);
        allowanceService.executeMonth(YearMonth.from(today));
    }
}
