package com.deskhub.inbox.integration.repo;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public class IntegrationRepository {

    private final JdbcTemplate jdbcTemplate;

    public IntegrationRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public List<String> listIdsByKind(String tenantId, String kind) {
        var sql = """
                select id
                from integration
                where tenant_id = ? and kind = ?
                order by id asc
                """;
        return jdbcTemplate.query(sql, (rs, rowNum) -> rs.getString("id"), tenantId, kind);
    }

    public List<String> listIdsByBrand(String tenantId, String brandId) {
        var sql = """
                select id
                from integration
                where tenant_id = ? and brand_id = ?
                order by id asc
                """;
        return jdbcTemplate.query(sql, (rs, rowNum) -> rs.getString("id"), tenantId, brandId);
    }
}
