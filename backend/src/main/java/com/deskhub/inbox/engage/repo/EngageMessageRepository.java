package com.deskhub.inbox.engage.repo;

import com.deskhub.inbox.common.api.Pagination;
import com.deskhub.inbox.common.query.DocumentTable;
import com.deskhub.inbox.common.query.JdbcCollection;
import com.deskhub.inbox.common.query.Predicate;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public class EngageMessageRepository {

    public record EngageMessageRow(
            String id,
            String tenantId,
            String kind,
            String title,
            String method,
            String fromUserId,
            boolean isLive,
            boolean isDraft,
            Instant createdAt
    ) {
    }

    static final DocumentTable TABLE = DocumentTable.builder("engage_message", "e")
            .id("id")
            .column("tenantId", "tenant_id")
            .column("kind", "kind")
            .column("title", "title")
            .column("method", "method")
            .column("fromUserId", "from_user_id")
            .column("isLive", "is_live")
            .column("isDraft", "is_draft")
            .column("createdAt", "created_at")
            .link("tagIds", "engage_message_tag", "engage_message_id", "tag_id")
            .link("segmentIds", "engage_message_segment", "engage_message_id", "segment_id")
            .link("brandIds", "engage_message_brand", "engage_message_id", "brand_id")
            .build();

    private final JdbcTemplate jdbcTemplate;
    private final JdbcCollection<EngageMessageRow> messages;

    public EngageMessageRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
        this.messages = new JdbcCollection<>(jdbcTemplate, TABLE, (rs, rowNum) -> new EngageMessageRow(
                rs.getString("id"),
                rs.getString("tenant_id"),
                rs.getString("kind"),
                rs.getString("title"),
                rs.getString("method"),
                rs.getString("from_user_id"),
                rs.getBoolean("is_live"),
                rs.getBoolean("is_draft"),
                rs.getTimestamp("created_at").toInstant()
        ));
    }

    public List<EngageMessageRow> listPage(Predicate filter, Pagination pagination) {
        return messages.find(filter)
                .sort("createdAt", JdbcCollection.Direction.DESC)
                .skip(pagination.skip())
                .limit(pagination.perPage())
                .list();
    }

    public long count(Predicate filter) {
        return messages.countDocuments(filter);
    }

    public Optional<EngageMessageRow> findById(String tenantId, String id) {
        if (id == null || id.isBlank()) return Optional.empty();
        return messages.findOne(Predicate.and(
                Predicate.eq("tenantId", tenantId),
                Predicate.eq("id", id)));
    }

    public List<String> listTagIds(String engageMessageId) {
        var sql = """
                select tag_id
                from engage_message_tag
                where engage_message_id = ?
                order by tag_id asc
                """;
        return jdbcTemplate.query(sql, (rs, rowNum) -> rs.getString("tag_id"), engageMessageId);
    }
}
