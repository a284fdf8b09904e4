package com.guildledger.providers;

/**
 * Opens and closes voice channels on the chat platform.
 */
public interface VoiceChannelGateway {

    /**
     * Create a channel owned by {@code spec.ownerUserId}.
     *
     * @return the platform's id of the new channel
     */
    String createChannel(String tenantId, VoiceChannelSpec spec);

    /**
     * Delete a channel. Deleting a channel that no longer exists is a no-op.
     */
    void deleteChannel(String tenantId, String channelId);
}
