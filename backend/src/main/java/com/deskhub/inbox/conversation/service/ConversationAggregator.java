package com.deskhub.inbox.conversation.service;

import com.deskhub.inbox.brand.repo.BrandRepository;
import com.deskhub.inbox.channel.repo.ChannelRepository;
import com.deskhub.inbox.common.config.AggregationProperties;
import com.deskhub.inbox.common.constants.ConversationStatus;
import com.deskhub.inbox.common.constants.IntegrationKind;
import com.deskhub.inbox.common.constants.TagType;
import com.deskhub.inbox.common.query.Predicate;
import com.deskhub.inbox.conversation.api.ConversationCountsResponse;
import com.deskhub.inbox.conversation.repo.ConversationRepository;
import com.deskhub.inbox.tag.repo.TagRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Conversation counts grouped by channel, integration kind, brand or tag.
 *
 * Every entity of the dimension gets a key, zero counts included. Counts for one dimension run in
 * parallel on the aggregation pool under one deadline taken before the first submission; the first
 * failing count, or the deadline passing, fails the whole call and interrupts the remaining counts.
 */
@Service
public class ConversationAggregator {

    private static final Logger log = LoggerFactory.getLogger(ConversationAggregator.class);

    private final ConversationRepository conversationRepository;
    private final ChannelRepository channelRepository;
    private final BrandRepository brandRepository;
    private final TagRepository tagRepository;
    private final ExecutorService executor;
    private final long timeoutMs;
    private final MeterRegistry meterRegistry;
    private final Counter failures;

    public ConversationAggregator(
            ConversationRepository conversationRepository,
            ChannelRepository channelRepository,
            BrandRepository brandRepository,
            TagRepository tagRepository,
            @Qualifier("aggregationExecutor") ExecutorService executor,
            AggregationProperties properties,
            MeterRegistry meterRegistry
    ) {
        this.conversationRepository = conversationRepository;
        this.channelRepository = channelRepository;
        this.brandRepository = brandRepository;
        this.tagRepository = tagRepository;
        this.executor = executor;
        this.timeoutMs = properties.timeoutMs();
        this.meterRegistry = meterRegistry;
        this.failures = Counter.builder("inbox.aggregation.failures")
                .description("Grouped count requests that failed as a whole")
                .register(meterRegistry);
    }

    public Map<String, Long> countByChannels(ConversationQueryBuilder qb) {
        var tenantId = qb.viewer().tenantId();
        var base = qb.mainQueryExcluding(Dimension.CHANNEL);
        var channelIds = channelRepository.listAll(tenantId).stream()
                .map(ChannelRepository.ChannelRow::id)
                .toList();
        return countEach("channel", tenantId, channelIds,
                channelId -> Predicate.and(base, qb.filters().channelFilter(tenantId, channelId)));
    }

    public Map<String, Long> countByIntegrationTypes(ConversationQueryBuilder qb) {
        var tenantId = qb.viewer().tenantId();
        var base = qb.mainQueryExcluding(Dimension.INTEGRATION_TYPE);
        var integrations = qb.query(ConversationQueryBuilder.Key.INTEGRATIONS);
        return countEach("integration_type", tenantId, IntegrationKind.allValues(),
                kind -> Predicate.and(base, integrations, qb.filters().integrationTypeFilter(tenantId, kind)));
    }

    /**
     * Brand counts intersect the requested channel with each brand's integrations.
     */
    public Map<String, Long> countByBrands(ConversationQueryBuilder qb) {
        var tenantId = qb.viewer().tenantId();
        var base = qb.mainQueryExcluding(Dimension.BRAND);
        var channel = qb.query(ConversationQueryBuilder.Key.CHANNEL);
        var brandIds = brandRepository.listAll(tenantId).stream()
                .map(BrandRepository.BrandRow::id)
                .toList();
        return countEach("brand", tenantId, brandIds,
                brandId -> Predicate.and(base, ConversationFilters.intersectIntegrationIds(
                        channel, qb.filters().brandFilter(tenantId, brandId))));
    }

    /**
     * Tag counts cover conversation tags only; tags of other partitions never get a key.
     */
    public Map<String, Long> countByTags(ConversationQueryBuilder qb) {
        var tenantId = qb.viewer().tenantId();
        var base = qb.mainQueryExcluding(Dimension.TAG);
        var integrations = qb.query(ConversationQueryBuilder.Key.INTEGRATIONS);
        var integrationType = qb.query(ConversationQueryBuilder.Key.INTEGRATION_TYPE);
        var tagIds = tagRepository.listByType(tenantId, TagType.CONVERSATION).stream()
                .map(TagRepository.TagRow::id)
                .toList();
        return countEach("tag", tenantId, tagIds,
                tagId -> Predicate.and(base, integrations, integrationType, qb.filters().tagFilter(tagId)));
    }

    public ConversationCountsResponse conversationCounts(ConversationQueryBuilder qb, ConversationCountGroup only) {
        Map<String, Long> byChannels = null;
        Map<String, Long> byIntegrationTypes = null;
        Map<String, Long> byBrands = null;
        Map<String, Long> byTags = null;

        if (only == ConversationCountGroup.BY_CHANNELS) {
            byChannels = countByChannels(qb);
        } else if (only == ConversationCountGroup.BY_INTEGRATION_TYPES) {
            byIntegrationTypes = countByIntegrationTypes(qb);
        } else if (only == ConversationCountGroup.BY_BRANDS) {
            byBrands = countByBrands(qb);
        } else if (only == ConversationCountGroup.BY_TAGS) {
            byTags = countByTags(qb);
        }

        var fixed = countFixedGroups(qb);
        return new ConversationCountsResponse(
                byChannels,
                byIntegrationTypes,
                byBrands,
                byTags,
                fixed.get("unassigned"),
                fixed.get("participating"),
                fixed.get("starred"),
                fixed.get("resolved")
        );
    }

    private Map<String, Long> countFixedGroups(ConversationQueryBuilder qb) {
        var filters = qb.filters();
        var viewer = qb.viewer();
        var integrations = qb.query(ConversationQueryBuilder.Key.INTEGRATIONS);
        var integrationType = qb.query(ConversationQueryBuilder.Key.INTEGRATION_TYPE);

        Function<String, Predicate> predicateFor = group -> {
            if ("unassigned".equals(group)) {
                return Predicate.and(qb.mainQueryExcluding(Dimension.UNASSIGNED), integrations, integrationType,
                        filters.unassignedFilter());
            }
            if ("participating".equals(group)) {
                return Predicate.and(qb.mainQueryExcluding(Dimension.PARTICIPATING), integrations, integrationType,
                        filters.participatingFilter(viewer));
            }
            if ("starred".equals(group)) {
                return Predicate.and(qb.mainQueryExcluding(Dimension.STARRED), integrations, integrationType,
                        filters.starredFilter(viewer));
            }
            return Predicate.and(qb.mainQueryExcluding(Dimension.STATUS), integrations, integrationType,
                    filters.statusFilter(List.of(ConversationStatus.CLOSED.value())));
        };

        return countEach("fixed", viewer.tenantId(),
                List.of("unassigned", "participating", "starred", "resolved"), predicateFor);
    }

    private Map<String, Long> countEach(
            String dimension,
            String tenantId,
            List<String> keys,
            Function<String, Predicate> predicateFor
    ) {
        var sample = Timer.start(meterRegistry);
        // counts run by the caller under CallerRunsPolicy spend the same budget
        var deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
        var completion = new ExecutorCompletionService<Long>(executor);
        var futures = new LinkedHashMap<String, Future<Long>>();
        try {
            for (var key : keys) {
                futures.put(key, completion.submit(
                        () -> conversationRepository.count(predicateFor.apply(key), queryTimeoutSeconds(deadline))));
                if (System.nanoTime() - deadline >= 0) {
                    throw new TimeoutException();
                }
            }
            for (int i = 0; i < futures.size(); i++) {
                var next = completion.poll(Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
                if (next == null) {
                    throw new TimeoutException();
                }
                next.get();
            }

            var result = new LinkedHashMap<String, Long>();
            for (var e : futures.entrySet()) {
                result.put(e.getKey(), e.getValue().get());
            }
            return result;
        } catch (ExecutionException e) {
            cancelAll(futures.values());
            failures.increment();
            log.warn("aggregation_failed dimension={} tenant={} values={}", dimension, tenantId, keys.size(), e.getCause());
            throw unwrap(e.getCause());
        } catch (TimeoutException e) {
            cancelAll(futures.values());
            failures.increment();
            log.warn("aggregation_timeout dimension={} tenant={} timeoutMs={}", dimension, tenantId, timeoutMs);
            throw new IllegalStateException("aggregation_timeout");
        } catch (InterruptedException e) {
            cancelAll(futures.values());
            Thread.currentThread().interrupt();
            throw new IllegalStateException("aggregation_interrupted");
        } finally {
            sample.stop(meterRegistry.timer("inbox.aggregation.duration", "dimension", dimension));
        }
    }

    /**
     * Whole seconds left before the deadline, at least one so the driver never treats it as unlimited.
     */
    private static int queryTimeoutSeconds(long deadline) {
        var remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
        return (int) Math.max(1L, Math.min(Integer.MAX_VALUE, (remainingMs + 999) / 1000));
    }

    /**
     * Interrupts counts still running on pool threads and drops queued ones.
     */
    private static void cancelAll(Collection<Future<Long>> futures) {
        for (var f : futures) {
            f.cancel(true);
        }
    }

    private static RuntimeException unwrap(Throwable cause) {
        if (cause instanceof RuntimeException re) {
            return re;
        }
        if (cause instanceof Error err) {
            throw err;
        }
        return new IllegalStateException("aggregation_failed", cause);
    }
}
