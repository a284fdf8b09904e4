package com.guildledger.common;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Utility class for building and validating idempotency keys.
 *
 * Scheduled jobs derive their keys from the logical event they pay for
 * (e.g. {@code allowance:tenant:role:user:asset:2024-05}) so that a retried run
 * collapses onto the original transaction instead of paying twice.
 */
public final class IdempotencyKey {

    static final int MAX_LENGTH = 200;

    private IdempotencyKey() {
    }

    public static String of(String namespace, Object... parts) {
        String suffix = Arrays.stream(parts)
            .map(String::valueOf)
            .collect(Collectors.joining(":"));
        String key = suffix.isEmpty() ? namespace : namespace + ":" + suffix;
        validate(key);
        return key;
    }

    public static boolean isValid(String key) {
        return key != null && !key.isBlank() && key.length() <= MAX_LENGTH;
    }

    public static void validate(String key) {
        if (!isValid(key)) {
            throw new IllegalArgumentException("Invalid idempotency key: " + key);
        }
    }
}
