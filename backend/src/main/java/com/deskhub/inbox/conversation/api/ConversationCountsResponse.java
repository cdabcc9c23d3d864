package com.deskhub.inbox.conversation.api;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * Grouped conversation counts. Only the requested {@code by_*} map is present; when present it has
 * one key per existing entity of that dimension.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ConversationCountsResponse(
        Map<String, Long> by_channels,
        Map<String, Long> by_integration_types,
        Map<String, Long> by_brands,
        Map<String, Long> by_tags,
        long unassigned,
        long participating,
        long starred,
        long resolved
) {
}
