package com.deskhub.inbox.common.constants;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

public enum CompanyLifecycleState {
    SUBSCRIBER("subscriber"),
    LEAD("lead"),
    MARKETING_QUALIFIED_LEAD("marketingQualifiedLead"),
    SALES_QUALIFIED_LEAD("salesQualifiedLead"),
    OPPORTUNITY("opportunity"),
    CUSTOMER("customer"),
    EVANGELIST("evangelist"),
    OTHER("other");

    private final String value;

    CompanyLifecycleState(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<CompanyLifecycleState> fromValue(String value) {
        if (value == null) return Optional.empty();
        return Arrays.stream(values()).filter(v -> v.value.equals(value)).findFirst();
    }

    public static List<String> allValues() {
        return Arrays.stream(values()).map(CompanyLifecycleState::value).toList();
    }
}
