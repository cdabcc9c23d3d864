package com.deskhub.inbox.channel.repo;

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
public class ChannelRepository {

    public record ChannelRow(String id, String tenantId, String name, String description, Instant createdAt) {
    }

    static final DocumentTable TABLE = DocumentTable.builder("channel", "ch")
            .id("id")
            .column("tenantId", "tenant_id")
            .column("name", "name")
            .column("description", "description")
            .column("createdAt", "created_at")
            .link("memberIds", "channel_member", "channel_id", "user_id")
            .link("integrationIds", "channel_integration", "channel_id", "integration_id")
            .build();

    private final JdbcTemplate jdbcTemplate;
    private final JdbcCollection<ChannelRow> channels;

    public ChannelRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
        this.channels = new JdbcCollection<>(jdbcTemplate, TABLE, (rs, rowNum) -> new ChannelRow(
                rs.getString("id"),
                rs.getString("tenant_id"),
                rs.getString("name"),
                rs.getString("description"),
                rs.getTimestamp("created_at").toInstant()
        ));
    }

    public List<ChannelRow> listAll(String tenantId) {
        return channels.find(Predicate.eq("tenantId", tenantId))
                .sort("createdAt", JdbcCollection.Direction.ASC)
                .list();
    }

    public List<ChannelRow> listPage(Predicate filter, Pagination pagination) {
        return channels.find(filter)
                .sort("createdAt", JdbcCollection.Direction.DESC)
                .skip(pagination.skip())
                .limit(pagination.perPage())
                .list();
    }

    public long count(Predicate filter) {
        return channels.countDocuments(filter);
    }

    public Optional<ChannelRow> findById(String tenantId, String channelId) {
        if (channelId == null || channelId.isBlank()) return Optional.empty();
        return channels.findOne(Predicate.and(
                Predicate.eq("tenantId", tenantId),
                Predicate.eq("id", channelId)));
    }

    public Optional<ChannelRow> findLast(String tenantId) {
        return channels.find(Predicate.eq("tenantId", tenantId))
                .sort("createdAt", JdbcCollection.Direction.DESC)
                .first();
    }

    public List<String> listIntegrationIds(String channelId) {
        var sql = """
                select integration_id
                from channel_integration
                where channel_id = ?
                order by integration_id asc
                """;
        return jdbcTemplate.query(sql, (rs, rowNum) -> rs.getString("integration_id"), channelId);
    }

    public List<String> listMemberIds(String channelId) {
        var sql = """
                select user_id
                from channel_member
                where channel_id = ?
                order by user_id asc
                """;
        return jdbcTemplate.query(sql, (rs, rowNum) -> rs.getString("user_id"), channelId);
    }

    /**
     * Union of the integration ids of every channel {@code userId} is a member of.
     */
    public List<String> listIntegrationIdsForMember(String tenantId, String userId) {
        var sql = """
                select distinct ci.integration_id
                from channel_integration ci
                join channel c on c.id = ci.channel_id
                join channel_member m on m.channel_id = c.id
                where c.tenant_id = ?
                  and m.user_id = ?
                order by ci.integration_id asc
                """;
        return jdbcTemplate.query(sql, (rs, rowNum) -> rs.getString("integration_id"), tenantId, userId);
    }
}
