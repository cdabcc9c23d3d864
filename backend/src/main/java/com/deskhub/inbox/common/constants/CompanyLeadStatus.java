package com.deskhub.inbox.common.constants;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

public enum CompanyLeadStatus {
    NEW("new"),
    OPEN("open"),
    IN_PROGRESS("inProgress"),
    OPEN_DEAL("openDeal"),
    UNQUALIFIED("unqualified"),
    ATTEMPTED_TO_CONTACT("attemptedToContact"),
    CONNECTED("connected"),
    BAD_TIMING("badTiming");

    private final String value;

    CompanyLeadStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<CompanyLeadStatus> fromValue(String value) {
        if (value == null) return Optional.empty();
        return Arrays.stream(values()).filter(v -> v.value.equals(value)).findFirst();
    }

    public static List<String> allValues() {
        return Arrays.stream(values()).map(CompanyLeadStatus::value).toList();
    }
}
