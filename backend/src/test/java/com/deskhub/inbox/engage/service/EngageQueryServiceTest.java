package com.deskhub.inbox.engage.service;

import com.deskhub.inbox.bootstrap.InboxApplication;
import com.deskhub.inbox.common.api.Pagination;
import com.deskhub.inbox.common.query.Predicate;
import com.deskhub.inbox.engage.api.EngageMessageItem;
import com.deskhub.inbox.support.InboxSeed;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

@SpringBootTest(classes = InboxApplication.class)
@ActiveProfiles("test")
class EngageQueryServiceTest {

    @Autowired
    JdbcTemplate jdbcTemplate;

    @Autowired
    EngageQueryService engageQueryService;

    InboxSeed seed;

    @BeforeEach
    void setUp() {
        seed = new InboxSeed(jdbcTemplate)
                .brand("b1")
                .tag("promo", "engageMessage")
                .tag("vip", "engageMessage")
                .tag("conv", "conversation")
                .engageMessage("e1", "auto", true, false, "u1")
                .engageMessage("e2", "auto", false, true, "u2")
                .engageMessage("e3", "manual", false, false, "u1")
                .engageMessage("e4", "visitorAuto", true, false, "u2")
                .tagEngageMessage("e1", "promo")
                .tagEngageMessage("e3", "promo")
                .tagEngageMessage("e4", "conv")
                .engageSegment("e2", "seg1")
                .engageBrand("e4", "b1");
    }

    private List<String> list(EngageListArgs args, String userId) {
        return engageQueryService.listMessages(seed.tenantId(), args, userId, Pagination.of(null, null)).stream()
                .map(EngageMessageItem::id)
                .toList();
    }

    private static EngageListArgs args(String kind, String status, String tag) {
        return new EngageListArgs(kind, status, tag, null, null, null, null);
    }

    @Test
    void status_filters() {
        assertEquals(Predicate.eq("isLive", true), engageQueryService.statusFilter("live", "u1"));
        assertEquals(Predicate.eq("isDraft", true), engageQueryService.statusFilter("draft", "u1"));
        assertEquals(Predicate.eq("isLive", false), engageQueryService.statusFilter("paused", "u1"));
        assertEquals(Predicate.eq("fromUserId", "u1"), engageQueryService.statusFilter("yours", "u1"));
        assertSame(Predicate.ALL, engageQueryService.statusFilter("whatever", "u1"));
        assertSame(Predicate.ALL, engageQueryService.statusFilter("yours", null));
    }

    @Test
    void list_combines_kind_status_and_tag() {
        assertEquals(seed.ids("e4", "e1"), list(args(null, "live", null), "u1"));
        assertEquals(seed.ids("e1"), list(args("auto", "live", null), "u1"));
        assertEquals(seed.ids("e3", "e1"), list(args(null, "yours", null), "u1"));
        assertEquals(seed.ids("e3", "e1"), list(args(null, null, seed.id("promo")), "u1"));
        assertEquals(seed.ids("e3"), list(args("manual", null, seed.id("promo")), "u1"));
    }

    @Test
    void tag_outside_engage_partition_matches_nothing() {
        assertEquals(List.of(), list(args(null, null, seed.id("conv")), "u1"));
    }

    @Test
    void exclusive_selectors_take_precedence() {
        var byIds = new EngageListArgs("manual", "live", null, seed.ids("e2"), null, null, null);
        assertEquals(seed.ids("e2"), list(byIds, "u1"));

        var bySegment = new EngageListArgs("manual", null, null, null, List.of("seg1"), null, null);
        assertEquals(seed.ids("e2"), list(bySegment, "u1"));

        var byBrand = new EngageListArgs(null, null, null, null, null, seed.ids("b1"), null);
        assertEquals(seed.ids("e4"), list(byBrand, "u1"));

        var byTags = new EngageListArgs(null, "draft", null, null, null, null, seed.ids("promo"));
        assertEquals(seed.ids("e3", "e1"), list(byTags, "u1"));
    }

    @Test
    void counts_by_kind() {
        assertEquals(Map.of("all", 4L, "auto", 2L, "visitorAuto", 1L, "manual", 1L),
                engageQueryService.counts(seed.tenantId(), "kind", null, null, "u1"));
    }

    @Test
    void counts_by_status_within_kind() {
        var counts = engageQueryService.counts(seed.tenantId(), "status", "auto", null, "u1");
        assertEquals(List.of("live", "draft", "paused", "yours"), List.copyOf(counts.keySet()));
        assertEquals(1L, counts.get("live"));
        assertEquals(1L, counts.get("draft"));
        assertEquals(1L, counts.get("paused"));
        assertEquals(1L, counts.get("yours"));
    }

    @Test
    void counts_by_tag_cover_every_engage_tag() {
        var counts = engageQueryService.counts(seed.tenantId(), "tag", null, null, "u1");
        assertEquals(Map.of(seed.id("promo"), 2L, seed.id("vip"), 0L), counts);

        var live = engageQueryService.counts(seed.tenantId(), "tag", null, "live", "u1");
        assertEquals(Map.of(seed.id("promo"), 1L, seed.id("vip"), 0L), live);
    }

    @Test
    void unknown_count_name_is_rejected() {
        var ex = assertThrows(IllegalArgumentException.class,
                () -> engageQueryService.counts(seed.tenantId(), "weather", null, null, "u1"));
        assertEquals("invalid_name", ex.getMessage());
    }

    @Test
    void total_count_matches_list() {
        var args = args("auto", null, null);
        assertEquals(2L, engageQueryService.totalCount(seed.tenantId(), args, "u1"));
        assertEquals(2, list(args, "u1").size());
    }
}
