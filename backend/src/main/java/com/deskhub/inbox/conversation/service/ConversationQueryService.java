package com.deskhub.inbox.conversation.service;

import com.deskhub.inbox.auth.service.Viewer;
import com.deskhub.inbox.common.constants.ConversationStatus;
import com.deskhub.inbox.common.query.Predicate;
import com.deskhub.inbox.conversation.api.ConversationCountsResponse;
import com.deskhub.inbox.conversation.api.ConversationDetailResponse;
import com.deskhub.inbox.conversation.api.ConversationItem;
import com.deskhub.inbox.conversation.api.ConversationMessageItem;
import com.deskhub.inbox.conversation.repo.ConversationMessageRepository;
import com.deskhub.inbox.conversation.repo.ConversationRepository;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

@Service
public class ConversationQueryService {

    private static final int DEFAULT_MESSAGE_PAGE = 50;

    private final ConversationRepository conversationRepository;
    private final ConversationMessageRepository conversationMessageRepository;
    private final ConversationFilters filters;
    private final ConversationAggregator aggregator;

    public ConversationQueryService(
            ConversationRepository conversationRepository,
            ConversationMessageRepository conversationMessageRepository,
            ConversationFilters filters,
            ConversationAggregator aggregator
    ) {
        this.conversationRepository = conversationRepository;
        this.conversationMessageRepository = conversationMessageRepository;
        this.filters = filters;
        this.aggregator = aggregator;
    }

    public ConversationQueryBuilder newBuilder(ConversationListArgs args, Viewer viewer) {
        validate(args);
        return new ConversationQueryBuilder(filters, args, viewer).buildAllQueries();
    }

    /**
     * Explicit ids bypass the builder and come back newest-created first; otherwise the main query
     * sorted by last update.
     */
    public List<ConversationItem> listConversations(Viewer viewer, ConversationListArgs args) {
        if (!args.ids().isEmpty()) {
            return conversationRepository.listByIds(viewer.tenantId(), args.ids()).stream()
                    .map(ConversationItem::from)
                    .toList();
        }
        var qb = newBuilder(args, viewer);
        return conversationRepository.listRecentlyUpdated(qb.mainQuery(), args.limit()).stream()
                .map(ConversationItem::from)
                .toList();
    }

    public long totalCount(Viewer viewer, ConversationListArgs args) {
        var qb = newBuilder(args, viewer);
        return conversationRepository.count(qb.mainQuery());
    }

    public Optional<ConversationItem> lastConversation(Viewer viewer, ConversationListArgs args) {
        var qb = newBuilder(args, viewer);
        return conversationRepository.findLastUpdated(qb.mainQuery()).map(ConversationItem::from);
    }

    public ConversationCountsResponse counts(Viewer viewer, ConversationListArgs args, String only) {
        ConversationCountGroup group = null;
        if (only != null && !only.isBlank()) {
            group = ConversationCountGroup.fromValue(only.trim())
                    .orElseThrow(() -> new IllegalArgumentException("invalid_only"));
        }
        var qb = newBuilder(args, viewer);
        return aggregator.conversationCounts(qb, group);
    }

    /**
     * Unread new/open conversations in the viewer's channels, without building the full query.
     */
    public long totalUnreadCount(Viewer viewer) {
        var qb = new ConversationQueryBuilder(filters, ConversationListArgs.empty(), viewer.withoutStars());
        var filter = Predicate.and(
                qb.integrationsFilter(),
                filters.statusFilter(List.of(ConversationStatus.NEW.value(), ConversationStatus.OPEN.value())),
                Predicate.notContains("readUserIds", viewer.userId()),
                filters.defaultFilter(viewer.tenantId())
        );
        return conversationRepository.count(filter);
    }

    public ConversationDetailResponse detail(Viewer viewer, String conversationId) {
        var row = conversationRepository.findById(viewer.tenantId(), conversationId)
                .orElseThrow(() -> new IllegalArgumentException("conversation_not_found"));
        return new ConversationDetailResponse(
                ConversationItem.from(row),
                conversationRepository.listTagIds(row.id()),
                conversationRepository.listParticipantIds(row.id())
        );
    }

    /**
     * With a limit: the page {@code skip} messages back from the newest, in chronological order.
     * Without: the first 50 messages.
     */
    public List<ConversationMessageItem> messages(Viewer viewer, String conversationId, Integer skip, Integer limit) {
        var row = conversationRepository.findById(viewer.tenantId(), conversationId)
                .orElseThrow(() -> new IllegalArgumentException("conversation_not_found"));

        if (limit != null && limit > 0) {
            var page = new ArrayList<>(conversationMessageRepository.listNewestFirst(
                    row.id(), skip == null ? 0 : skip, Math.min(limit, 200)));
            Collections.reverse(page);
            return page.stream().map(ConversationMessageItem::from).toList();
        }
        return conversationMessageRepository.listOldestFirst(row.id(), DEFAULT_MESSAGE_PAGE).stream()
                .map(ConversationMessageItem::from)
                .toList();
    }

    public long messagesTotalCount(Viewer viewer, String conversationId) {
        var row = conversationRepository.findById(viewer.tenantId(), conversationId)
                .orElseThrow(() -> new IllegalArgumentException("conversation_not_found"));
        return conversationMessageRepository.countByConversation(row.id());
    }

    private static void validate(ConversationListArgs args) {
        if (args.status() != null && ConversationStatus.fromValue(args.status()).isEmpty()) {
            throw new IllegalArgumentException("invalid_status");
        }
    }
}
