package com.deskhub.inbox.brand.repo;

import com.deskhub.inbox.common.query.DocumentTable;
import com.deskhub.inbox.common.query.JdbcCollection;
import com.deskhub.inbox.common.query.Predicate;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public class BrandRepository {

    public record BrandRow(String id, String tenantId, String name, Instant createdAt) {
    }

    static final DocumentTable TABLE = DocumentTable.builder("brand", "b")
            .id("id")
            .column("tenantId", "tenant_id")
            .column("name", "name")
            .column("createdAt", "created_at")
            .build();

    private final JdbcCollection<BrandRow> brands;

    public BrandRepository(JdbcTemplate jdbcTemplate) {
        this.brands = new JdbcCollection<>(jdbcTemplate, TABLE, (rs, rowNum) -> new BrandRow(
                rs.getString("id"),
                rs.getString("tenant_id"),
                rs.getString("name"),
                rs.getTimestamp("created_at").toInstant()
        ));
    }

    public List<BrandRow> listAll(String tenantId) {
        return brands.find(Predicate.eq("tenantId", tenantId))
                .sort("createdAt", JdbcCollection.Direction.ASC)
                .list();
    }
}
