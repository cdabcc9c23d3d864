package com.deskhub.inbox.channel.api;

import java.util.List;

public record ChannelItem(
        String id,
        String name,
        String description,
        List<String> member_ids,
        List<String> integration_ids,
        long created_at
) {
}
