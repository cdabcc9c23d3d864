package com.deskhub.inbox.common.constants;

import java.util.Arrays;
import java.util.Optional;

/**
 * Engage list/count status buckets; {@code yours} depends on the viewer.
 */
public enum EngageStatus {
    LIVE("live"),
    DRAFT("draft"),
    PAUSED("paused"),
    YOURS("yours");

    private final String value;

    EngageStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<EngageStatus> fromValue(String value) {
        if (value == null) return Optional.empty();
        return Arrays.stream(values()).filter(v -> v.value.equals(value)).findFirst();
    }
}
