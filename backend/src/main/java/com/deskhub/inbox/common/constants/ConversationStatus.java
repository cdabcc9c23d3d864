package com.deskhub.inbox.common.constants;

import java.util.Arrays;
import java.util.Optional;

public enum ConversationStatus {
    NEW("new"),
    OPEN("open"),
    CLOSED("closed");

    private final String value;

    ConversationStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<ConversationStatus> fromValue(String value) {
        if (value == null) return Optional.empty();
        return Arrays.stream(values()).filter(v -> v.value.equals(value)).findFirst();
    }
}
