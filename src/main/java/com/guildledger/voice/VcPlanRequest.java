package com.guildledger.voice;

import com.guildledger.providers.VoiceChannelAccess;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Settings of a new voice channel plan. {@code channelNameTemplate} may contain
 * {@value VcCreationPlan#USER_PLACEHOLDER}, replaced by the owner's display name.
 */
@Value
@Builder
public class VcPlanRequest {
    String templateName;
    String name;
    String channelNameTemplate;
    String symbol;
    BigDecimal price;
    int durationHours;
    int userLimit;
    @Builder.Default
    VoiceChannelAccess access = VoiceChannelAccess.BASIC;
    String freeRoleId;
    String categoryId;
}
