package com.deskhub.inbox.common.constants;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

public enum IntegrationKind {
    MESSENGER("messenger"),
    FORM("form"),
    FACEBOOK("facebook"),
    GMAIL("gmail"),
    CALLPRO("callpro");

    private final String value;

    IntegrationKind(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<IntegrationKind> fromValue(String value) {
        if (value == null) return Optional.empty();
        return Arrays.stream(values()).filter(v -> v.value.equals(value)).findFirst();
    }

    public static List<String> allValues() {
        return Arrays.stream(values()).map(IntegrationKind::value).toList();
    }
}
