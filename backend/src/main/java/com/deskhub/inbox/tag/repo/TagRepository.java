package com.deskhub.inbox.tag.repo;

import com.deskhub.inbox.common.constants.TagType;
import com.deskhub.inbox.common.query.DocumentTable;
import com.deskhub.inbox.common.query.JdbcCollection;
import com.deskhub.inbox.common.query.Predicate;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public class TagRepository {

    public record TagRow(String id, String tenantId, String type, String name, String color, Instant createdAt) {
    }

    static final DocumentTable TABLE = DocumentTable.builder("tag", "t")
            .id("id")
            .column("tenantId", "tenant_id")
            .column("type", "type")
            .column("name", "name")
            .column("color", "color")
            .column("createdAt", "created_at")
            .build();

    private final JdbcCollection<TagRow> tags;

    public TagRepository(JdbcTemplate jdbcTemplate) {
        this.tags = new JdbcCollection<>(jdbcTemplate, TABLE, (rs, rowNum) -> new TagRow(
                rs.getString("id"),
                rs.getString("tenant_id"),
                rs.getString("type"),
                rs.getString("name"),
                rs.getString("color"),
                rs.getTimestamp("created_at").toInstant()
        ));
    }

    /**
     * Every tag of one partition, oldest first.
     */
    public List<TagRow> listByType(String tenantId, TagType type) {
        return tags.find(Predicate.and(
                        Predicate.eq("tenantId", tenantId),
                        Predicate.eq("type", type.value())))
                .sort("createdAt", JdbcCollection.Direction.ASC)
                .list();
    }

    /**
     * Tag lookup restricted to one partition: an id from another partition is not found.
     */
    public Optional<TagRow> findByIdAndType(String tenantId, String tagId, TagType type) {
        if (tagId == null || tagId.isBlank()) return Optional.empty();
        return tags.findOne(Predicate.and(
                Predicate.eq("tenantId", tenantId),
                Predicate.eq("id", tagId),
                Predicate.eq("type", type.value())));
    }
}
