package com.deskhub.inbox.conversation.repo;

import com.deskhub.inbox.common.query.DocumentTable;
import com.deskhub.inbox.common.query.JdbcCollection;
import com.deskhub.inbox.common.query.Predicate;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public class ConversationRepository {

    public record ConversationRow(
            String id,
            String tenantId,
            String integrationId,
            String customerId,
            String userId,
            String assignedUserId,
            String status,
            String content,
            int messageCount,
            Instant createdAt,
            Instant updatedAt
    ) {
    }

    public static final DocumentTable TABLE = DocumentTable.builder("conversation", "c")
            .id("id")
            .column("tenantId", "tenant_id")
            .column("integrationId", "integration_id")
            .column("customerId", "customer_id")
            .column("userId", "user_id")
            .column("assignedUserId", "assigned_user_id")
            .column("status", "status")
            .column("content", "content")
            .column("messageCount", "message_count")
            .column("createdAt", "created_at")
            .column("updatedAt", "updated_at")
            .link("tagIds", "conversation_tag", "conversation_id", "tag_id")
            .link("participatedUserIds", "conversation_participant", "conversation_id", "user_id")
            .link("readUserIds", "conversation_read", "conversation_id", "user_id")
            .build();

    private final JdbcTemplate jdbcTemplate;
    private final JdbcCollection<ConversationRow> conversations;

    public ConversationRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
        this.conversations = new JdbcCollection<>(jdbcTemplate, TABLE, (rs, rowNum) -> new ConversationRow(
                rs.getString("id"),
                rs.getString("tenant_id"),
                rs.getString("integration_id"),
                rs.getString("customer_id"),
                rs.getString("user_id"),
                rs.getString("assigned_user_id"),
                rs.getString("status"),
                rs.getString("content"),
                rs.getInt("message_count"),
                rs.getTimestamp("created_at").toInstant(),
                rs.getTimestamp("updated_at").toInstant()
        ));
    }

    public long count(Predicate filter) {
        return conversations.countDocuments(filter);
    }

    public long count(Predicate filter, int queryTimeoutSeconds) {
        return conversations.countDocuments(filter, queryTimeoutSeconds);
    }

    public List<ConversationRow> listByIds(String tenantId, List<String> ids) {
        return conversations.find(Predicate.and(
                        Predicate.eq("tenantId", tenantId),
                        Predicate.in("id", ids)))
                .sort("createdAt", JdbcCollection.Direction.DESC)
                .list();
    }

    /**
     * Most recently updated first; {@code limit} of zero means no limit.
     */
    public List<ConversationRow> listRecentlyUpdated(Predicate filter, int limit) {
        return conversations.find(filter)
                .sort("updatedAt", JdbcCollection.Direction.DESC)
                .limit(limit)
                .list();
    }

    public Optional<ConversationRow> findLastUpdated(Predicate filter) {
        return conversations.find(filter)
                .sort("updatedAt", JdbcCollection.Direction.DESC)
                .first();
    }

    public Optional<ConversationRow> findById(String tenantId, String conversationId) {
        if (conversationId == null || conversationId.isBlank()) return Optional.empty();
        return conversations.findOne(Predicate.and(
                Predicate.eq("tenantId", tenantId),
                Predicate.eq("id", conversationId)));
    }

    public List<String> listTagIds(String conversationId) {
        var sql = """
                select tag_id
                from conversation_tag
                where conversation_id = ?
                order by tag_id asc
                """;
        return jdbcTemplate.query(sql, (rs, rowNum) -> rs.getString("tag_id"), conversationId);
    }

    public List<String> listParticipantIds(String conversationId) {
        var sql = """
                select user_id
                from conversation_participant
                where conversation_id = ?
                order by user_id asc
                """;
        return jdbcTemplate.query(sql, (rs, rowNum) -> rs.getString("user_id"), conversationId);
    }
}
