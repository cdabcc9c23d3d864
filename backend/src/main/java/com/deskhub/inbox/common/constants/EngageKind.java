package com.deskhub.inbox.common.constants;

import java.util.Arrays;
import java.util.Optional;

public enum EngageKind {
    AUTO("auto"),
    VISITOR_AUTO("visitorAuto"),
    MANUAL("manual");

    private final String value;

    EngageKind(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<EngageKind> fromValue(String value) {
        if (value == null) return Optional.empty();
        return Arrays.stream(values()).filter(v -> v.value.equals(value)).findFirst();
    }
}
