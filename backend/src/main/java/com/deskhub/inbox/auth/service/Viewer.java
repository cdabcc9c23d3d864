package com.deskhub.inbox.auth.service;

import java.util.List;

/**
 * The agent a query runs for. Starred ids are read once per request.
 */
public record Viewer(String userId, String tenantId, List<String> starredConversationIds) {

    public Viewer {
        starredConversationIds = starredConversationIds == null ? List.of() : List.copyOf(starredConversationIds);
    }

    public Viewer withoutStars() {
        return new Viewer(userId, tenantId, List.of());
    }
}
