package com.deskhub.inbox.conversation.service;

import java.util.Arrays;
import java.util.Optional;

/**
 * Values of the {@code only} argument of the grouped counts.
 */
public enum ConversationCountGroup {
    BY_CHANNELS("byChannels"),
    BY_INTEGRATION_TYPES("byIntegrationTypes"),
    BY_BRANDS("byBrands"),
    BY_TAGS("byTags");

    private final String value;

    ConversationCountGroup(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<ConversationCountGroup> fromValue(String value) {
        if (value == null) return Optional.empty();
        return Arrays.stream(values()).filter(v -> v.value.equals(value)).findFirst();
    }
}
