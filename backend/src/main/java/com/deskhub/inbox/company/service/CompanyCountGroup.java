package com.deskhub.inbox.company.service;

import java.util.Arrays;
import java.util.Optional;

public enum CompanyCountGroup {
    BY_TAGS("byTags"),
    BY_LEAD_STATUS("byLeadStatus"),
    BY_LIFECYCLE_STATE("byLifecycleState");

    private final String value;

    CompanyCountGroup(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<CompanyCountGroup> fromValue(String value) {
        if (value == null) return Optional.empty();
        return Arrays.stream(values()).filter(v -> v.value.equals(value)).findFirst();
    }
}
