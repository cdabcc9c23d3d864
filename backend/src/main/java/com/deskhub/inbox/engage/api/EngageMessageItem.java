package com.deskhub.inbox.engage.api;

import java.util.List;

public record EngageMessageItem(
        String id,
        String kind,
        String title,
        String method,
        String from_user_id,
        boolean is_live,
        boolean is_draft,
        List<String> tag_ids,
        long created_at
) {
}
