package com.deskhub.inbox.conversation.service;

import com.deskhub.inbox.auth.service.Viewer;
import com.deskhub.inbox.brand.repo.BrandRepository;
import com.deskhub.inbox.channel.repo.ChannelRepository;
import com.deskhub.inbox.common.config.AggregationProperties;
import com.deskhub.inbox.common.query.Predicate;
import com.deskhub.inbox.conversation.repo.ConversationRepository;
import com.deskhub.inbox.tag.repo.TagRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ConversationAggregatorFailureTest {

    ConversationRepository conversationRepository;
    ChannelRepository channelRepository;
    ConversationFilters filters;
    ExecutorService executor;
    SimpleMeterRegistry meterRegistry;

    @BeforeEach
    void setUp() {
        conversationRepository = mock(ConversationRepository.class);
        channelRepository = mock(ChannelRepository.class);
        filters = mock(ConversationFilters.class);
        executor = Executors.newFixedThreadPool(4);
        meterRegistry = new SimpleMeterRegistry();

        var now = Instant.now();
        when(channelRepository.listAll("t1")).thenReturn(List.of(
                new ChannelRepository.ChannelRow("c1", "t1", "Sales", null, now),
                new ChannelRepository.ChannelRow("c2", "t1", "Support", null, now),
                new ChannelRepository.ChannelRow("c3", "t1", "Billing", null, now)));
        when(filters.channelFilter("t1", "c1")).thenReturn(Predicate.eq(ConversationFilters.INTEGRATION_ID, "i1"));
        when(filters.channelFilter("t1", "c2")).thenReturn(Predicate.eq(ConversationFilters.INTEGRATION_ID, "broken"));
        when(filters.channelFilter("t1", "c3")).thenReturn(Predicate.eq(ConversationFilters.INTEGRATION_ID, "slow"));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private ConversationAggregator aggregator(long timeoutMs) {
        return aggregator(executor, timeoutMs);
    }

    private ConversationAggregator aggregator(ExecutorService executor, long timeoutMs) {
        return new ConversationAggregator(conversationRepository, channelRepository, mock(BrandRepository.class),
                mock(TagRepository.class), executor, new AggregationProperties(4, 10, timeoutMs), meterRegistry);
    }

    private ConversationQueryBuilder builder() {
        return new ConversationQueryBuilder(filters, ConversationListArgs.empty(), new Viewer("u1", "t1", List.of()))
                .buildAllQueries();
    }

    @Test
    void one_failing_count_fails_the_whole_aggregation() {
        when(conversationRepository.count(any(), anyInt())).thenAnswer(inv -> {
            var predicate = String.valueOf((Object) inv.getArgument(0));
            if (predicate.contains("broken")) {
                throw new DataAccessResourceFailureException("connection reset");
            }
            return 3L;
        });

        var aggregator = aggregator(5_000);
        var ex = assertThrows(DataAccessResourceFailureException.class, () -> aggregator.countByChannels(builder()));
        assertEquals("connection reset", ex.getMessage());
        assertEquals(1.0, meterRegistry.counter("inbox.aggregation.failures").count());
    }

    @Test
    void slow_count_times_out() {
        when(conversationRepository.count(any(), anyInt())).thenAnswer(inv -> {
            var predicate = String.valueOf((Object) inv.getArgument(0));
            if (predicate.contains("slow")) {
                Thread.sleep(2_000);
            }
            return 1L;
        });

        var aggregator = aggregator(100);
        var ex = assertThrows(IllegalStateException.class, () -> aggregator.countByChannels(builder()));
        assertEquals("aggregation_timeout", ex.getMessage());
        assertEquals(1.0, meterRegistry.counter("inbox.aggregation.failures").count());
    }

    @Test
    void successful_aggregation_keeps_channel_order() {
        when(conversationRepository.count(any(), anyInt())).thenReturn(4L);

        var counts = aggregator(5_000).countByChannels(builder());
        assertEquals(List.of("c1", "c2", "c3"), List.copyOf(counts.keySet()));
        assertEquals(0.0, meterRegistry.counter("inbox.aggregation.failures").count());
    }

    @Test
    void timed_out_count_is_interrupted() throws Exception {
        var interrupted = new CountDownLatch(1);
        var completed = new AtomicInteger();
        when(conversationRepository.count(any(), anyInt())).thenAnswer(inv -> {
            var predicate = String.valueOf((Object) inv.getArgument(0));
            if (predicate.contains("slow")) {
                try {
                    Thread.sleep(1_000);
                    completed.incrementAndGet();
                } catch (InterruptedException e) {
                    interrupted.countDown();
                    throw e;
                }
            }
            return 1L;
        });

        var ex = assertThrows(IllegalStateException.class, () -> aggregator(100).countByChannels(builder()));
        assertEquals("aggregation_timeout", ex.getMessage());
        assertTrue(interrupted.await(2, TimeUnit.SECONDS));
        Thread.sleep(1_200);
        assertEquals(0, completed.get());
    }

    @Test
    void counts_run_by_the_caller_share_the_deadline() {
        var channels = new ArrayList<ChannelRepository.ChannelRow>();
        var now = Instant.now();
        for (int i = 1; i <= 8; i++) {
            channels.add(new ChannelRepository.ChannelRow("s" + i, "t1", "Slow " + i, null, now));
            when(filters.channelFilter("t1", "s" + i)).thenReturn(Predicate.eq(ConversationFilters.INTEGRATION_ID, "slow"));
        }
        when(channelRepository.listAll("t1")).thenReturn(channels);
        var started = new AtomicInteger();
        when(conversationRepository.count(any(), anyInt())).thenAnswer(inv -> {
            started.incrementAndGet();
            Thread.sleep(200);
            return 1L;
        });

        // one worker and one queue slot, so the third submission runs on the calling thread
        var tiny = new ThreadPoolExecutor(1, 1, 60, TimeUnit.SECONDS, new LinkedBlockingQueue<>(1),
                new ThreadPoolExecutor.CallerRunsPolicy());
        try {
            var ex = assertThrows(IllegalStateException.class, () -> aggregator(tiny, 100).countByChannels(builder()));
            assertEquals("aggregation_timeout", ex.getMessage());
            assertTrue(started.get() < channels.size(), "started " + started.get());
        } finally {
            tiny.shutdownNow();
        }
    }
}
