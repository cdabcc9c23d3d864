package com.deskhub.inbox.conversation.service;

import com.deskhub.inbox.auth.service.Viewer;
import com.deskhub.inbox.bootstrap.InboxApplication;
import com.deskhub.inbox.common.query.Predicate;
import com.deskhub.inbox.conversation.repo.ConversationRepository;
import com.deskhub.inbox.support.InboxSeed;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest(classes = InboxApplication.class)
@ActiveProfiles("test")
class ConversationQueryBuilderTest {

    @Autowired
    JdbcTemplate jdbcTemplate;

    @Autowired
    ConversationFilters filters;

    @Autowired
    ConversationRepository conversationRepository;

    InboxSeed seed;

    @BeforeEach
    void setUp() {
        seed = new InboxSeed(jdbcTemplate)
                .brand("b1")
                .integration("i1", "messenger", "b1")
                .integration("i2", "form", null)
                .integration("i3", "messenger", null)
                .channel("c1", List.of("u1"), List.of("i1", "i2"))
                .channel("c_empty", List.of("u1"), List.of())
                .conversation("conv1", "i1", "new")
                .conversation("conv2", "i2", "open")
                .conversation("conv3", "i1", "closed")
                .conversation("conv4", "i3", "new");
    }

    private Viewer viewer(String... starred) {
        return new Viewer("u1", seed.tenantId(), seed.ids(starred));
    }

    private ConversationQueryBuilder build(ConversationListArgs args, Viewer viewer) {
        return new ConversationQueryBuilder(filters, args, viewer).buildAllQueries();
    }

    private static ConversationListArgs args(String channelId, String brandId, String tag, String integrationType,
                                             String status, boolean starred, String searchValue) {
        return new ConversationListArgs(null, channelId, brandId, tag, integrationType, status,
                starred, false, false, searchValue, 0);
    }

    private List<String> ids(Predicate filter) {
        return conversationRepository.listRecentlyUpdated(filter, 0).stream()
                .map(ConversationRepository.ConversationRow::id)
                .sorted()
                .toList();
    }

    @Test
    void main_query_is_subset_of_everything_and_idempotent() {
        var qb = build(ConversationListArgs.empty(), viewer());

        var everything = ids(Predicate.eq("tenantId", seed.tenantId()));
        var first = qb.mainQuery();
        var second = qb.mainQuery();

        assertEquals(first, second);
        var matched = ids(first);
        assertTrue(everything.containsAll(matched));
        assertEquals(seed.ids("conv1", "conv2"), matched);
        assertEquals(matched, ids(second));
    }

    @Test
    void explicit_status_replaces_the_open_default() {
        var qb = build(args(null, null, null, null, "closed", false, null), viewer());
        assertEquals(seed.ids("conv3"), ids(qb.mainQuery()));
    }

    @Test
    void channel_without_integrations_matches_nothing() {
        assertSame(Predicate.NONE, filters.channelFilter(seed.tenantId(), seed.id("c_empty")));

        var qb = build(args(seed.id("c_empty"), null, null, null, null, false, null), viewer());
        assertEquals(0L, conversationRepository.count(qb.mainQuery()));
    }

    @Test
    void unknown_channel_matches_nothing() {
        var qb = build(args("missing", null, null, null, null, false, null), viewer());
        assertEquals(0L, conversationRepository.count(qb.mainQuery()));
    }

    @Test
    void channel_and_brand_intersect() {
        var qb = build(args(seed.id("c1"), seed.id("b1"), null, null, null, false, null), viewer());
        assertEquals(seed.ids("conv1"), ids(qb.mainQuery()));
    }

    @Test
    void viewer_scope_is_kept_when_brand_reaches_outside_it() {
        seed.integration("i9", "messenger", "b1").conversation("conv9", "i9", "new");

        var qb = build(args(null, seed.id("b1"), null, null, null, false, null), viewer());
        assertEquals(seed.ids("conv1"), ids(qb.mainQuery()));
    }

    @Test
    void tag_from_another_partition_matches_nothing() {
        seed.tag("ct", "conversation")
                .tag("cust", "customer")
                .tagConversation("conv1", "ct")
                .tagConversation("conv1", "cust");

        var byConversationTag = build(args(null, null, seed.id("ct"), null, null, false, null), viewer());
        assertEquals(seed.ids("conv1"), ids(byConversationTag.mainQuery()));

        var byCustomerTag = build(args(null, null, seed.id("cust"), null, null, false, null), viewer());
        assertEquals(0L, conversationRepository.count(byCustomerTag.mainQuery()));
    }

    @Test
    void starred_filter_counts_only_starred_conversations() {
        var qb = build(args(null, null, null, null, null, true, null), viewer("conv1"));
        assertEquals(1L, conversationRepository.count(qb.mainQuery()));
    }

    @Test
    void starred_without_any_star_matches_nothing() {
        var qb = build(args(null, null, null, null, null, true, null), viewer());
        assertEquals(0L, conversationRepository.count(qb.mainQuery()));
    }

    @Test
    void integration_type_restricts_kind() {
        var messenger = build(args(null, null, null, "messenger", null, false, null), viewer());
        assertEquals(seed.ids("conv1"), ids(messenger.mainQuery()));

        var unknown = build(args(null, null, null, "carrier-pigeon", null, false, null), viewer());
        assertEquals(0L, conversationRepository.count(unknown.mainQuery()));
    }

    @Test
    void staff_started_conversation_shows_only_after_customer_reply() {
        seed.startedByStaff("conv1", "u7", 1);
        var qb = build(ConversationListArgs.empty(), viewer());
        assertFalse(ids(qb.mainQuery()).contains(seed.id("conv1")));

        seed.startedByStaff("conv1", "u7", 2);
        assertTrue(ids(qb.mainQuery()).contains(seed.id("conv1")));
    }

    @Test
    void search_value_matches_content_case_insensitively() {
        seed.content("conv2", "Need a REFUND please");
        var qb = build(args(null, null, null, null, null, false, "refund"), viewer());
        assertEquals(seed.ids("conv2"), ids(qb.mainQuery()));
    }

    @Test
    void excluding_a_dimension_drops_only_that_restriction() {
        var qb = build(args(null, null, null, null, "closed", false, null), viewer());
        assertEquals(seed.ids("conv1", "conv2", "conv3"), ids(qb.mainQueryExcluding(Dimension.STATUS)));
    }

    @Test
    void accessors_require_build() {
        var qb = new ConversationQueryBuilder(filters, ConversationListArgs.empty(), viewer());
        assertFalse(qb.isBuilt());
        assertThrows(IllegalStateException.class, qb::mainQuery);
        assertThrows(IllegalStateException.class, () -> qb.query(ConversationQueryBuilder.Key.STATUS));
        assertEquals(Predicate.in(ConversationFilters.INTEGRATION_ID, seed.ids("i1", "i2")), qb.integrationsFilter());
    }
}
