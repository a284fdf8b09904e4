package com.guildledger.providers;

import lombok.Value;

/**
 * A voice channel to open for a member. A {@code userLimit} of zero means unlimited.
 */
@Value
public class VoiceChannelSpec {
    String ownerUserId;
    String name;
    String categoryId;
    int userLimit;
    VoiceChannelAccess access;
}
