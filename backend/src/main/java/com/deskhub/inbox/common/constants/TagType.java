package com.deskhub.inbox.common.constants;

import java.util.Arrays;
import java.util.Optional;

/**
 * Which entity kind a tag partition belongs to.
 */
public enum TagType {
    CONVERSATION("conversation"),
    CUSTOMER("customer"),
    ENGAGE_MESSAGE("engageMessage"),
    COMPANY("company"),
    INTEGRATION("integration");

    private final String value;

    TagType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<TagType> fromValue(String value) {
        if (value == null) return Optional.empty();
        return Arrays.stream(values()).filter(v -> v.value.equals(value)).findFirst();
    }
}
