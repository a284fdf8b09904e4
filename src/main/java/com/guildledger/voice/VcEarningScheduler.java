package com.guildledger.voice;

import com.guildledger.config.GuildLedgerProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;

@Component
@RequiredArgsConstructor
public class VcEarningScheduler {

    private final VcEarningService earningService;
    private final GuildLedgerProperties properties;
    private final Clock clock;

    @Scheduled(fixedRate = 60_000, initialDelay = 60_000)
    public void payoutTick() {
        earningService.payoutTick(clock.instant());
    }

    @Scheduled(cron = "0 5 0 * * *", zone = "${guild-ledger.zone:Asia/Tokyo}")
    public void purgeDailyTotals() {
        earningService.purgeDailyTotals(LocalDate.now(clock.withZone(properties.getZone())));
    }
}
