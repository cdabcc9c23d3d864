package com.deskhub.inbox.conversation.repo;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public class ConversationMessageRepository {

    public record MessageRow(
            String id,
            String conversationId,
            String userId,
            String customerId,
            String content,
            boolean internal,
            Instant createdAt
    ) {
    }

    private static final RowMapper<MessageRow> ROW_MAPPER = (rs, rowNum) -> new MessageRow(
            rs.getString("id"),
            rs.getString("conversation_id"),
            rs.getString("user_id"),
            rs.getString("customer_id"),
            rs.getString("content"),
            rs.getBoolean("internal"),
            rs.getTimestamp("created_at").toInstant()
    );

    private final JdbcTemplate jdbcTemplate;

    public ConversationMessageRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Newest first, starting {@code skip} messages back from the latest.
     */
    public List<MessageRow> listNewestFirst(String conversationId, int skip, int limit) {
        var sql = """
                select id, conversation_id, user_id, customer_id, content, internal, created_at
                from conversation_message
                where conversation_id = ?
                order by created_at desc, id desc
                offset ? rows fetch first ? rows only
                """;
        return jdbcTemplate.query(sql, ROW_MAPPER, conversationId, Math.max(0, skip), limit);
    }

    public List<MessageRow> listOldestFirst(String conversationId, int limit) {
        var sql = """
                select id, conversation_id, user_id, customer_id, content, internal, created_at
                from conversation_message
                where conversation_id = ?
                order by created_at asc, id asc
                fetch first ? rows only
                """;
        return jdbcTemplate.query(sql, ROW_MAPPER, conversationId, limit);
    }

    public long countByConversation(String conversationId) {
        var sql = "select count(1) from conversation_message where conversation_id = ?";
        Long n = jdbcTemplate.queryForObject(sql, Long.class, conversationId);
        return n == null ? 0L : n;
    }
}
