package com.guildledger.providers;

import java.util.Locale;

/**
 * What the owner of a created voice channel may do with it.
 */
public enum VoiceChannelAccess {
    /** Joins and speaks; permissions follow the category. */
    BASIC,
    /** Hidden from everyone else; the owner may invite members. */
    SECRET,
    /** Full control over the channel and its permissions. */
    FREEDOM;

    public String getCode() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static VoiceChannelAccess fromCode(String code) {
        String normalized = code == null ? "" : code.strip().toUpperCase(Locale.ROOT);
        for (VoiceChannelAccess access : values()) {
            if (access.name().equals(normalized)) {
                return access;
            }
        }
        throw new IllegalArgumentException("Access must be basic, secret or freedom: " + code);
    }
}
