package com.guildledger.roles;

import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;

@Component
@RequiredArgsConstructor
public class RoleExpiryScheduler {

    private final RoleExpiryService roleExpiryService;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${guild-ledger.roles.expiry-sweep-interval-ms:300000}",
        initialDelayString = "${guild-ledger.roles.expiry-sweep-interval-ms:300000}")
    public void sweepExpiredRoles() {
        roleExpiryService.sweep(clock.instant());
    }
}
