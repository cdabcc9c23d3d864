package com.deskhub.inbox.conversation.repo;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public class ConversationMarkRepository {

    private final JdbcTemplate jdbcTemplate;

    public ConversationMarkRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public List<String> listStarredConversationIds(String tenantId, String userId) {
        if (userId == null || userId.isBlank()) return List.of();
        var sql = """
                select conversation_id
                from conversation_mark
                where tenant_id = ? and user_id = ? and starred = true
                order by conversation_id asc
                """;
        return jdbcTemplate.query(sql, (rs, rowNum) -> rs.getString("conversation_id"), tenantId, userId);
    }
}
