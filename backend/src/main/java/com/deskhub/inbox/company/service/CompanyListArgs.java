package com.deskhub.inbox.company.service;

import java.util.List;

public record CompanyListArgs(
        List<String> ids,
        String searchValue,
        String tag,
        String leadStatus,
        String lifecycleState
) {

    public CompanyListArgs {
        ids = ids == null ? List.of() : List.copyOf(ids);
        searchValue = blankToNull(searchValue);
        tag = blankToNull(tag);
        leadStatus = blankToNull(leadStatus);
        lifecycleState = blankToNull(lifecycleState);
    }

    public static CompanyListArgs empty() {
        return new CompanyListArgs(null, null, null, null, null);
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }
}
