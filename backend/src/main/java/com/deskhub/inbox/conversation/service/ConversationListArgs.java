package com.deskhub.inbox.conversation.service;

import java.util.List;

/**
 * Conversation list/count arguments. Every field is optional.
 */
public record ConversationListArgs(
        List<String> ids,
        String channelId,
        String brandId,
        String tag,
        String integrationType,
        String status,
        boolean starred,
        boolean participating,
        boolean unassigned,
        String searchValue,
        int limit
) {

    public ConversationListArgs {
        ids = ids == null ? List.of() : ids.stream().filter(s -> s != null && !s.isBlank()).toList();
        channelId = blankToNull(channelId);
        brandId = blankToNull(brandId);
        tag = blankToNull(tag);
        integrationType = blankToNull(integrationType);
        status = blankToNull(status);
        searchValue = blankToNull(searchValue);
        limit = Math.max(0, limit);
    }

    public static ConversationListArgs empty() {
        return new ConversationListArgs(null, null, null, null, null, null, false, false, false, null, 0);
    }

    private static String blankToNull(String s) {
        if (s == null) return null;
        var t = s.trim();
        return t.isBlank() ? null : t;
    }
}
