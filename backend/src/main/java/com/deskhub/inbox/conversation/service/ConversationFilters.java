package com.deskhub.inbox.conversation.service;

import com.deskhub.inbox.auth.service.Viewer;
import com.deskhub.inbox.channel.repo.ChannelRepository;
import com.deskhub.inbox.common.constants.ConversationStatus;
import com.deskhub.inbox.common.constants.IntegrationKind;
import com.deskhub.inbox.common.constants.TagType;
import com.deskhub.inbox.common.query.Predicate;
import com.deskhub.inbox.integration.repo.IntegrationRepository;
import com.deskhub.inbox.tag.repo.TagRepository;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Single-dimension conversation predicates.
 *
 * Lookups that find nothing (a channel without integrations, an unknown brand, a tag from another
 * partition) yield {@link Predicate#none()}; they never drop the restriction.
 */
@Component
public class ConversationFilters {

    public static final String INTEGRATION_ID = "integrationId";

    private final ChannelRepository channelRepository;
    private final IntegrationRepository integrationRepository;
    private final TagRepository tagRepository;

    public ConversationFilters(
            ChannelRepository channelRepository,
            IntegrationRepository integrationRepository,
            TagRepository tagRepository
    ) {
        this.channelRepository = channelRepository;
        this.integrationRepository = integrationRepository;
        this.tagRepository = tagRepository;
    }

    /**
     * Tenant scoping plus the engage exclusion: a conversation started by a staff user (auto
     * messages) only shows once the customer has replied.
     */
    public Predicate defaultFilter(String tenantId) {
        return Predicate.and(
                Predicate.eq("tenantId", tenantId),
                Predicate.or(
                        Predicate.and(Predicate.exists("userId"), Predicate.gt("messageCount", 1)),
                        Predicate.notExists("userId")
                )
        );
    }

    /**
     * Integrations reachable through the channels the viewer belongs to.
     */
    public Predicate integrationsFilter(Viewer viewer) {
        var ids = channelRepository.listIntegrationIdsForMember(viewer.tenantId(), viewer.userId());
        return Predicate.in(INTEGRATION_ID, ids);
    }

    public Predicate channelFilter(String tenantId, String channelId) {
        var channel = channelRepository.findById(tenantId, channelId);
        if (channel.isEmpty()) {
            return Predicate.none();
        }
        return Predicate.in(INTEGRATION_ID, channelRepository.listIntegrationIds(channel.get().id()));
    }

    public Predicate brandFilter(String tenantId, String brandId) {
        if (brandId == null || brandId.isBlank()) {
            return Predicate.none();
        }
        return Predicate.in(INTEGRATION_ID, integrationRepository.listIdsByBrand(tenantId, brandId));
    }

    public Predicate integrationTypeFilter(String tenantId, String kind) {
        var parsed = IntegrationKind.fromValue(kind);
        if (parsed.isEmpty()) {
            return Predicate.none();
        }
        return Predicate.in(INTEGRATION_ID, integrationRepository.listIdsByKind(tenantId, parsed.get().value()));
    }

    public Predicate tagFilter(String tagId) {
        if (tagId == null || tagId.isBlank()) {
            return Predicate.none();
        }
        return Predicate.eq("tagIds", tagId);
    }

    /**
     * {@link #tagFilter(String)} for ids that must belong to the conversation partition.
     */
    public Predicate conversationTagFilter(String tenantId, String tagId) {
        return tagRepository.findByIdAndType(tenantId, tagId, TagType.CONVERSATION)
                .map(tag -> tagFilter(tag.id()))
                .orElse(Predicate.none());
    }

    public Predicate statusFilter(Collection<String> statuses) {
        var valid = new LinkedHashSet<String>();
        if (statuses != null) {
            for (var s : statuses) {
                ConversationStatus.fromValue(s).ifPresent(v -> valid.add(v.value()));
            }
        }
        return Predicate.in("status", valid);
    }

    public Predicate unassignedFilter() {
        return Predicate.notExists("assignedUserId");
    }

    public Predicate participatingFilter(Viewer viewer) {
        return Predicate.eq("participatedUserIds", viewer.userId());
    }

    public Predicate starredFilter(Viewer viewer) {
        return Predicate.in("id", viewer.starredConversationIds());
    }

    /**
     * Intersects integration-id memberships.
     *
     * {@code null} and {@link Predicate.MatchAll} operands impose nothing; a {@link Predicate.MatchNone}
     * operand or an empty intersection gives {@link Predicate.MatchNone}. With a single restricting
     * operand that operand is returned as is.
     */
    public static Predicate intersectIntegrationIds(Predicate... operands) {
        Predicate single = null;
        Set<Object> ids = null;
        for (var op : operands) {
            if (op == null || op instanceof Predicate.MatchAll) continue;
            if (op instanceof Predicate.MatchNone) return Predicate.none();

            Set<Object> values;
            if (op instanceof Predicate.FieldIn in && INTEGRATION_ID.equals(in.field())) {
                values = in.values();
            } else if (op instanceof Predicate.FieldEquals eq && INTEGRATION_ID.equals(eq.field()) && eq.value() != null) {
                values = Set.of(eq.value());
            } else {
                throw new IllegalArgumentException("not_integration_membership");
            }

            if (ids == null) {
                single = op;
                ids = new LinkedHashSet<>(values);
            } else {
                single = null;
                ids.retainAll(values);
            }
        }
        if (ids == null) {
            return Predicate.all();
        }
        if (single != null) {
            return single;
        }
        return Predicate.in(INTEGRATION_ID, ids);
    }
}
