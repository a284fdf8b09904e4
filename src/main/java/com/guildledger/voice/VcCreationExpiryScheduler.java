package com.guildledger.voice;

import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;

@Component
@RequiredArgsConstructor
public class VcCreationExpiryScheduler {

    private final VcCreatorService vcCreatorService;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${guild-ledger.voice.creation-sweep-interval-ms:300000}",
        initialDelayString = "${guild-ledger.voice.creation-sweep-interval-ms:300000}")
    public void sweepExpiredChannels() {
        vcCreatorService.sweepExpired(clock.instant());
    }
}
