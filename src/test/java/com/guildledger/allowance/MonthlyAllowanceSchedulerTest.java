package com.guildledger.allowance;

import com.guildledger.config.GuildLedgerProperties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.YearMonth;
import java.time.ZoneOffset;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Pay day is evaluated in the configured zone (Asia/Tokyo by default).
 */
@ExtendWith(MockitoExtension.class)
class MonthlyAllowanceSchedulerTest {

    @Mock
    private MonthlyAllowanceService allowanceService;

    private final GuildLedgerProperties properties = new GuildLedgerProperties();

    @Test
    void testRunsOnPayDay() {
        scheduler("2024-05-28T03:00:00Z").payIfDue();

        verify(allowanceService).executeMonth(YearMonth.of(2024, 5));
    }

    @Test
    void testSkipsOtherDays() {
        scheduler("2024-05-27T03:00:00Z").payIfDue();

        verify(allowanceService, never()).executeMonth(any());
    }

    @Test
    void testUsesConfiguredZone() {
        // 01:00 on the 28th in Tokyo, still the 27th in UTC.
        scheduler("2024-05-27T16:00:00Z").payIfDue();

        verify(allowanceService).executeMonth(YearMonth.of(2024, 5));
    }

    private MonthlyAllowanceScheduler scheduler(String instant) {
        Clock clock = Clock.fixed(Instant.parse(instant), ZoneOffset.UTC);
        return new MonthlyAllowanceScheduler(allowanceService, properties, clock);
    }
}
