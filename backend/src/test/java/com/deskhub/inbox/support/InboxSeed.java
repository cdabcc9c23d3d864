package com.deskhub.inbox.support;

import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;

/**
 * Inserts read-model rows for one throwaway tenant. Entity ids are prefixed with the tenant so
 * tests sharing the in-memory database never see each other's rows; user ids are left as given.
 */
public class InboxSeed {

    private final JdbcTemplate jdbcTemplate;
    private final String tenantId;
    private Instant clock = Instant.parse("2024-01-01T00:00:00Z");

    public InboxSeed(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
        this.tenantId = "t_" + UUID.randomUUID().toString().substring(0, 8);
    }

    public String tenantId() {
        return tenantId;
    }

    public String id(String local) {
        return tenantId + "_" + local;
    }

    public List<String> ids(String... locals) {
        return Arrays.stream(locals).map(this::id).toList();
    }

    /**
     * Strictly increasing timestamps, so insertion order is creation order.
     */
    private Timestamp tick() {
        clock = clock.plusSeconds(60);
        return Timestamp.from(clock);
    }

    public InboxSeed brand(String brand) {
        jdbcTemplate.update("insert into brand(id, tenant_id, name, created_at) values (?, ?, ?, ?)",
                id(brand), tenantId, brand, tick());
        return this;
    }

    public InboxSeed integration(String integration, String kind, String brand) {
        jdbcTemplate.update("insert into integration(id, tenant_id, kind, name, brand_id, created_at) values (?, ?, ?, ?, ?, ?)",
                id(integration), tenantId, kind, integration, brand == null ? null : id(brand), tick());
        return this;
    }

    public InboxSeed channel(String channel, List<String> memberUserIds, List<String> integrations) {
        jdbcTemplate.update("insert into channel(id, tenant_id, name, description, created_at) values (?, ?, ?, ?, ?)",
                id(channel), tenantId, channel, null, tick());
        for (var userId : memberUserIds) {
            jdbcTemplate.update("insert into channel_member(channel_id, user_id) values (?, ?)", id(channel), userId);
        }
        for (var integration : integrations) {
            jdbcTemplate.update("insert into channel_integration(channel_id, integration_id) values (?, ?)",
                    id(channel), id(integration));
        }
        return this;
    }

    public InboxSeed tag(String tag, String type) {
        jdbcTemplate.update("insert into tag(id, tenant_id, type, name, color, created_at) values (?, ?, ?, ?, ?, ?)",
                id(tag), tenantId, type, tag, null, tick());
        return this;
    }

    /**
     * A customer-started conversation.
     */
    public InboxSeed conversation(String conversation, String integration, String status) {
        var ts = tick();
        jdbcTemplate.update("""
                        insert into conversation(id, tenant_id, integration_id, customer_id, user_id, assigned_user_id,
                                                 status, content, message_count, created_at, updated_at)
                        values (?, ?, ?, ?, null, null, ?, ?, 1, ?, ?)
                        """,
                id(conversation), tenantId, id(integration), "cust_" + conversation, status, conversation, ts, ts);
        return this;
    }

    /**
     * Marks a conversation as started by a staff user with the given message count.
     */
    public InboxSeed startedByStaff(String conversation, String userId, int messageCount) {
        jdbcTemplate.update("update conversation set user_id = ?, message_count = ? where id = ?",
                userId, messageCount, id(conversation));
        return this;
    }

    public InboxSeed content(String conversation, String content) {
        jdbcTemplate.update("update conversation set content = ? where id = ?", content, id(conversation));
        return this;
    }

    public InboxSeed assign(String conversation, String userId) {
        jdbcTemplate.update("update conversation set assigned_user_id = ? where id = ?", userId, id(conversation));
        return this;
    }

    public InboxSeed touch(String conversation) {
        jdbcTemplate.update("update conversation set updated_at = ? where id = ?", tick(), id(conversation));
        return this;
    }

    public InboxSeed tagConversation(String conversation, String tag) {
        jdbcTemplate.update("insert into conversation_tag(conversation_id, tag_id) values (?, ?)", id(conversation), id(tag));
        return this;
    }

    public InboxSeed participate(String conversation, String userId) {
        jdbcTemplate.update("insert into conversation_participant(conversation_id, user_id) values (?, ?)",
                id(conversation), userId);
        return this;
    }

    public InboxSeed read(String conversation, String userId) {
        jdbcTemplate.update("insert into conversation_read(conversation_id, user_id) values (?, ?)", id(conversation), userId);
        return this;
    }

    public InboxSeed star(String conversation, String userId) {
        jdbcTemplate.update("""
                        insert into conversation_mark(tenant_id, conversation_id, user_id, starred, updated_at)
                        values (?, ?, ?, true, ?)
                        """,
                tenantId, id(conversation), userId, tick());
        return this;
    }

    public InboxSeed message(String message, String conversation, String content) {
        jdbcTemplate.update("""
                        insert into conversation_message(id, conversation_id, user_id, customer_id, content, internal, created_at)
                        values (?, ?, null, ?, ?, false, ?)
                        """,
                id(message), id(conversation), "cust_" + conversation, content, tick());
        return this;
    }

    public InboxSeed engageMessage(String message, String kind, boolean live, boolean draft, String fromUserId) {
        jdbcTemplate.update("""
                        insert into engage_message(id, tenant_id, kind, title, method, from_user_id, is_live, is_draft, created_at)
                        values (?, ?, ?, ?, 'messenger', ?, ?, ?, ?)
                        """,
                id(message), tenantId, kind, message, fromUserId, live, draft, tick());
        return this;
    }

    public InboxSeed tagEngageMessage(String message, String tag) {
        jdbcTemplate.update("insert into engage_message_tag(engage_message_id, tag_id) values (?, ?)", id(message), id(tag));
        return this;
    }

    public InboxSeed engageSegment(String message, String segmentId) {
        jdbcTemplate.update("insert into engage_message_segment(engage_message_id, segment_id) values (?, ?)",
                id(message), segmentId);
        return this;
    }

    public InboxSeed engageBrand(String message, String brand) {
        jdbcTemplate.update("insert into engage_message_brand(engage_message_id, brand_id) values (?, ?)", id(message), id(brand));
        return this;
    }

    public InboxSeed company(String company, String website, String leadStatus, String lifecycleState) {
        var ts = tick();
        jdbcTemplate.update("""
                        insert into company(id, tenant_id, name, website, industry, plan, size, lead_status, lifecycle_state,
                                            created_at, modified_at)
                        values (?, ?, ?, ?, null, null, null, ?, ?, ?, ?)
                        """,
                id(company), tenantId, company, website, leadStatus, lifecycleState, ts, ts);
        return this;
    }

    public InboxSeed tagCompany(String company, String tag) {
        jdbcTemplate.update("insert into company_tag(company_id, tag_id) values (?, ?)", id(company), id(tag));
        return this;
    }
}
