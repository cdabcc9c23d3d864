package com.deskhub.inbox.conversation.service;

import com.deskhub.inbox.auth.service.Viewer;
import com.deskhub.inbox.common.constants.ConversationStatus;
import com.deskhub.inbox.common.query.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Composes the conversation main query for one request.
 *
 * {@link #buildAllQueries()} runs every lookup (viewer channels, channel, brand, integration kind,
 * tag partition) once and caches the resulting sub-predicates; all other accessors are pure and can
 * be called any number of times afterwards. Instances are request-scoped and not thread-safe while
 * building; after the build they are read-only and may be shared by aggregation workers.
 */
public class ConversationQueryBuilder {

    private static final Logger log = LoggerFactory.getLogger(ConversationQueryBuilder.class);

    public enum Key {
        DEFAULT,
        SCOPE,
        CHANNEL,
        BRAND,
        INTEGRATIONS,
        INTEGRATION_KIND,
        INTEGRATION_TYPE,
        UNASSIGNED,
        PARTICIPATING,
        STARRED,
        STATUS,
        TAG,
        IDS,
        SEARCH
    }

    private static final List<String> OPEN_STATUSES = List.of(
            ConversationStatus.NEW.value(),
            ConversationStatus.OPEN.value()
    );

    private final ConversationFilters filters;
    private final ConversationListArgs args;
    private final Viewer viewer;
    private Map<Key, Predicate> queries;

    public ConversationQueryBuilder(ConversationFilters filters, ConversationListArgs args, Viewer viewer) {
        this.filters = filters;
        this.args = args == null ? ConversationListArgs.empty() : args;
        this.viewer = viewer;
    }

    public ConversationFilters filters() {
        return filters;
    }

    public ConversationListArgs args() {
        return args;
    }

    public Viewer viewer() {
        return viewer;
    }

    public ConversationQueryBuilder buildAllQueries() {
        var tenantId = viewer.tenantId();
        var q = new EnumMap<Key, Predicate>(Key.class);

        q.put(Key.DEFAULT, filters.defaultFilter(tenantId));
        q.put(Key.SCOPE, filters.integrationsFilter(viewer));
        q.put(Key.CHANNEL, args.channelId() == null ? Predicate.all() : filters.channelFilter(tenantId, args.channelId()));
        q.put(Key.BRAND, args.brandId() == null ? Predicate.all() : filters.brandFilter(tenantId, args.brandId()));
        q.put(Key.INTEGRATIONS, ConversationFilters.intersectIntegrationIds(
                q.get(Key.SCOPE), q.get(Key.CHANNEL), q.get(Key.BRAND)));

        var kind = args.integrationType() == null
                ? Predicate.all()
                : filters.integrationTypeFilter(tenantId, args.integrationType());
        q.put(Key.INTEGRATION_KIND, kind);
        q.put(Key.INTEGRATION_TYPE, args.integrationType() == null
                ? Predicate.all()
                : Predicate.and(q.get(Key.INTEGRATIONS), kind));

        q.put(Key.UNASSIGNED, args.unassigned() ? filters.unassignedFilter() : Predicate.all());
        q.put(Key.PARTICIPATING, args.participating() ? filters.participatingFilter(viewer) : Predicate.all());
        q.put(Key.STARRED, args.starred() ? filters.starredFilter(viewer) : Predicate.all());
        q.put(Key.STATUS, filters.statusFilter(args.status() == null ? OPEN_STATUSES : List.of(args.status())));
        q.put(Key.TAG, args.tag() == null ? Predicate.all() : filters.conversationTagFilter(tenantId, args.tag()));
        q.put(Key.IDS, args.ids().isEmpty() ? Predicate.all() : Predicate.in("id", args.ids()));
        q.put(Key.SEARCH, Predicate.text(args.searchValue(), "content"));

        this.queries = q;
        log.debug("conversation_queries_built tenant={} user={} queries={}", tenantId, viewer.userId(), q);
        return this;
    }

    public boolean isBuilt() {
        return queries != null;
    }

    public Predicate query(Key key) {
        return built().get(key);
    }

    /**
     * Viewer scope: conversations of integrations in the viewer's channels. Does not need
     * {@link #buildAllQueries()}.
     */
    public Predicate integrationsFilter() {
        if (queries != null) {
            return queries.get(Key.SCOPE);
        }
        return filters.integrationsFilter(viewer);
    }

    public Predicate mainQuery() {
        return compose(null);
    }

    /**
     * The main query with one dimension's contribution removed. For {@link Dimension#CHANNEL} and
     * {@link Dimension#BRAND} the integration restriction is re-intersected from the remaining
     * operands; the viewer scope always stays.
     */
    public Predicate mainQueryExcluding(Dimension dimension) {
        return compose(dimension);
    }

    private Predicate compose(Dimension excluded) {
        var q = built();

        Predicate integrations;
        if (excluded == Dimension.CHANNEL) {
            integrations = ConversationFilters.intersectIntegrationIds(q.get(Key.SCOPE), q.get(Key.BRAND));
        } else if (excluded == Dimension.BRAND) {
            integrations = ConversationFilters.intersectIntegrationIds(q.get(Key.SCOPE), q.get(Key.CHANNEL));
        } else {
            integrations = q.get(Key.INTEGRATIONS);
        }

        Predicate integrationType = Predicate.all();
        if (excluded != Dimension.INTEGRATION_TYPE && args.integrationType() != null) {
            integrationType = Predicate.and(integrations, q.get(Key.INTEGRATION_KIND));
        }

        return Predicate.and(
                q.get(Key.DEFAULT),
                integrations,
                integrationType,
                excluded == Dimension.UNASSIGNED ? null : q.get(Key.UNASSIGNED),
                excluded == Dimension.PARTICIPATING ? null : q.get(Key.PARTICIPATING),
                excluded == Dimension.STARRED ? null : q.get(Key.STARRED),
                excluded == Dimension.STATUS ? null : q.get(Key.STATUS),
                excluded == Dimension.TAG ? null : q.get(Key.TAG),
                q.get(Key.IDS),
                q.get(Key.SEARCH)
        );
    }

    private Map<Key, Predicate> built() {
        if (queries == null) {
            throw new IllegalStateException("queries_not_built");
        }
        return queries;
    }
}
