package com.deskhub.inbox.engage.service;

import com.deskhub.inbox.common.api.Pagination;
import com.deskhub.inbox.common.constants.EngageKind;
import com.deskhub.inbox.common.constants.EngageStatus;
import com.deskhub.inbox.common.constants.TagType;
import com.deskhub.inbox.common.query.Predicate;
import com.deskhub.inbox.engage.api.EngageMessageItem;
import com.deskhub.inbox.engage.repo.EngageMessageRepository;
import com.deskhub.inbox.tag.repo.TagRepository;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
public class EngageQueryService {

    private final EngageMessageRepository engageMessageRepository;
    private final TagRepository tagRepository;

    public EngageQueryService(EngageMessageRepository engageMessageRepository, TagRepository tagRepository) {
        this.engageMessageRepository = engageMessageRepository;
        this.tagRepository = tagRepository;
    }

    public Predicate kindFilter(String kind) {
        return EngageKind.fromValue(kind)
                .map(k -> Predicate.eq("kind", k.value()))
                .orElse(Predicate.none());
    }

    /**
     * Unknown statuses, and {@code yours} without a user, impose nothing.
     */
    public Predicate statusFilter(String status, String userId) {
        var parsed = EngageStatus.fromValue(status).orElse(null);
        if (parsed == EngageStatus.LIVE) {
            return Predicate.eq("isLive", true);
        }
        if (parsed == EngageStatus.DRAFT) {
            return Predicate.eq("isDraft", true);
        }
        if (parsed == EngageStatus.PAUSED) {
            return Predicate.eq("isLive", false);
        }
        if (parsed == EngageStatus.YOURS && userId != null) {
            return Predicate.eq("fromUserId", userId);
        }
        return Predicate.all();
    }

    public Predicate tagFilter(String tagId) {
        return Predicate.eq("tagIds", tagId);
    }

    public Predicate listQuery(String tenantId, EngageListArgs args, String userId) {
        var common = Predicate.eq("tenantId", tenantId);

        if (!args.ids().isEmpty()) {
            return Predicate.and(common, Predicate.in("id", args.ids()));
        }
        if (!args.segmentIds().isEmpty()) {
            return Predicate.and(common, Predicate.in("segmentIds", args.segmentIds()));
        }
        if (!args.brandIds().isEmpty()) {
            return Predicate.and(common, Predicate.in("brandIds", args.brandIds()));
        }
        if (!args.tagIds().isEmpty()) {
            return Predicate.and(common, Predicate.in("tagIds", args.tagIds()));
        }

        var query = common;
        if (args.kind() != null && !args.kind().isBlank()) {
            query = Predicate.and(query, kindFilter(args.kind()));
        }
        if (args.status() != null && !args.status().isBlank()) {
            query = Predicate.and(query, statusFilter(args.status(), userId));
        }
        if (args.tag() != null && !args.tag().isBlank()) {
            var tag = tagRepository.findByIdAndType(tenantId, args.tag(), TagType.ENGAGE_MESSAGE);
            query = Predicate.and(query, tag.map(t -> tagFilter(t.id())).orElse(Predicate.none()));
        }
        return query;
    }

    public List<EngageMessageItem> listMessages(String tenantId, EngageListArgs args, String userId, Pagination pagination) {
        return engageMessageRepository.listPage(listQuery(tenantId, args, userId), pagination).stream()
                .map(this::toItem)
                .toList();
    }

    public long totalCount(String tenantId, EngageListArgs args, String userId) {
        return engageMessageRepository.count(listQuery(tenantId, args, userId));
    }

    public Optional<EngageMessageItem> findMessage(String tenantId, String id) {
        return engageMessageRepository.findById(tenantId, id).map(this::toItem);
    }

    /**
     * {@code name} is one of {@code kind}, {@code status} or {@code tag}.
     */
    public Map<String, Long> counts(String tenantId, String name, String kind, String status, String userId) {
        if ("kind".equals(name)) {
            return countsByKind(tenantId);
        }
        if ("status".equals(name)) {
            return countsByStatus(tenantId, kind, userId);
        }
        if ("tag".equals(name)) {
            return countsByTag(tenantId, kind, status, userId);
        }
        throw new IllegalArgumentException("invalid_name");
    }

    public Map<String, Long> countsByKind(String tenantId) {
        var common = Predicate.eq("tenantId", tenantId);
        var counts = new LinkedHashMap<String, Long>();
        counts.put("all", engageMessageRepository.count(common));
        for (var k : EngageKind.values()) {
            counts.put(k.value(), engageMessageRepository.count(Predicate.and(common, kindFilter(k.value()))));
        }
        return counts;
    }

    public Map<String, Long> countsByStatus(String tenantId, String kind, String userId) {
        var query = scoped(tenantId, kind, null, userId);
        var counts = new LinkedHashMap<String, Long>();
        for (var s : EngageStatus.values()) {
            counts.put(s.value(), engageMessageRepository.count(Predicate.and(query, statusFilter(s.value(), userId))));
        }
        return counts;
    }

    public Map<String, Long> countsByTag(String tenantId, String kind, String status, String userId) {
        var query = scoped(tenantId, kind, status, userId);
        var counts = new LinkedHashMap<String, Long>();
        for (var tag : tagRepository.listByType(tenantId, TagType.ENGAGE_MESSAGE)) {
            counts.put(tag.id(), engageMessageRepository.count(Predicate.and(query, tagFilter(tag.id()))));
        }
        return counts;
    }

    private Predicate scoped(String tenantId, String kind, String status, String userId) {
        var query = Predicate.eq("tenantId", tenantId);
        if (kind != null && !kind.isBlank()) {
            query = Predicate.and(query, kindFilter(kind));
        }
        if (status != null && !status.isBlank()) {
            query = Predicate.and(query, statusFilter(status, userId));
        }
        return query;
    }

    private EngageMessageItem toItem(EngageMessageRepository.EngageMessageRow row) {
        return new EngageMessageItem(
                row.id(),
                row.kind(),
                row.title(),
                row.method(),
                row.fromUserId(),
                row.isLive(),
                row.isDraft(),
                engageMessageRepository.listTagIds(row.id()),
                row.createdAt().getEpochSecond()
        );
    }
}
