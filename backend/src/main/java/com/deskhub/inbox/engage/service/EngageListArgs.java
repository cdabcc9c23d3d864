package com.deskhub.inbox.engage.service;

import java.util.List;

/**
 * Engage list filters. {@code ids}, {@code segmentIds}, {@code brandIds} and {@code tagIds} are
 * exclusive, checked in that order; otherwise {@code kind}, {@code status} and {@code tag} compose.
 */
public record EngageListArgs(
        String kind,
        String status,
        String tag,
        List<String> ids,
        List<String> segmentIds,
        List<String> brandIds,
        List<String> tagIds
) {

    public EngageListArgs {
        ids = ids == null ? List.of() : List.copyOf(ids);
        segmentIds = segmentIds == null ? List.of() : List.copyOf(segmentIds);
        brandIds = brandIds == null ? List.of() : List.copyOf(brandIds);
        tagIds = tagIds == null ? List.of() : List.copyOf(tagIds);
    }
}
