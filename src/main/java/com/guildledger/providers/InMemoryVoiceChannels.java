package com.guildledger.providers;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory voice channels for development and tests.
 */
@Component
@Slf4j
public class InMemoryVoiceChannels implements VoiceChannelGateway {

    // tenant:channel -> spec
    private final ConcurrentMap<String, VoiceChannelSpec> channels = new ConcurrentHashMap<>();

    @Override
    public String createChannel(String tenantId, VoiceChannelSpec spec) {
        String channelId = "vc-" + UUID.randomUUID();
        channels.put(key(tenantId, channelId), spec);
        log.debug("Created voice channel {} ({}) for {} in tenant {}", spec.getName(), channelId,
            spec.getOwnerUserId(), tenantId);
        return channelId;
    }

    @Override
    public void deleteChannel(String tenantId, String channelId) {
        channels.remove(key(tenantId, channelId));
        log.debug("Deleted voice channel {} in tenant {}", channelId, tenantId);
    }

    public Optional<VoiceChannelSpec> channel(String tenantId, String channelId) {
        return Optional.ofNullable(channels.get(key(tenantId, channelId)));
    }

    public long channelCount(String tenantId) {
        String prefix = tenantId + ":";
        return channels.keySet().stream().filter(key -> key.startsWith(prefix)).count();
    }

    private static String key(String tenantId, String channelId) {
        return tenantId + ":" + channelId;
    }
}
