package com.deskhub.inbox.company.api;

import java.util.List;

public record CompanyItem(
        String id,
        String name,
        String website,
        String industry,
        String plan,
        Integer size,
        String lead_status,
        String lifecycle_state,
        List<String> tag_ids,
        long created_at,
        long modified_at
) {
}
