package com.guildledger.roles;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class RoleExpirySchedulerTest {

    @Mock
    private RoleExpiryService roleExpiryService;

    @Test
    void testSweepsAtCurrentTime() {
        Instant now = Instant.parse("2024-05-01T12:00:00Z");
        RoleExpiryScheduler scheduler = new RoleExpiryScheduler(roleExpiryService, Clock.fixed(now, ZoneOffset.UTC));

        scheduler.sweepExpiredRoles();

        verify(roleExpiryService).sweep(now);
    }
}
