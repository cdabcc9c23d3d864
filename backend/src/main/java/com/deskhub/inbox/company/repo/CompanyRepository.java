package com.deskhub.inbox.company.repo;

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
public class CompanyRepository {

    public record CompanyRow(
            String id,
            String tenantId,
            String name,
            String website,
            String industry,
            String plan,
            Integer size,
            String leadStatus,
            String lifecycleState,
            Instant createdAt,
            Instant modifiedAt
    ) {
    }

    static final DocumentTable TABLE = DocumentTable.builder("company", "co")
            .id("id")
            .column("tenantId", "tenant_id")
            .column("name", "name")
            .column("website", "website")
            .column("industry", "industry")
            .column("plan", "plan")
            .column("size", "size")
            .column("leadStatus", "lead_status")
            .column("lifecycleState", "lifecycle_state")
            .column("createdAt", "created_at")
            .column("modifiedAt", "modified_at")
            .link("tagIds", "company_tag", "company_id", "tag_id")
            .build();

    private final JdbcTemplate jdbcTemplate;
    private final JdbcCollection<CompanyRow> companies;

    public CompanyRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
        this.companies = new JdbcCollection<>(jdbcTemplate, TABLE, (rs, rowNum) -> new CompanyRow(
                rs.getString("id"),
                rs.getString("tenant_id"),
                rs.getString("name"),
                rs.getString("website"),
                rs.getString("industry"),
                rs.getString("plan"),
                (Integer) rs.getObject("size"),
                rs.getString("lead_status"),
                rs.getString("lifecycle_state"),
                rs.getTimestamp("created_at").toInstant(),
                rs.getTimestamp("modified_at").toInstant()
        ));
    }

    public boolean isSortable(String field) {
        return field != null && TABLE.columns().containsKey(field);
    }

    public List<CompanyRow> listPage(Predicate filter, String sortField, JdbcCollection.Direction direction, Pagination pagination) {
        return companies.find(filter)
                .sort(sortField, direction)
                .skip(pagination.skip())
                .limit(pagination.perPage())
                .list();
    }

    public long count(Predicate filter) {
        return companies.countDocuments(filter);
    }

    public Optional<CompanyRow> findById(String tenantId, String id) {
        if (id == null || id.isBlank()) return Optional.empty();
        return companies.findOne(Predicate.and(
                Predicate.eq("tenantId", tenantId),
                Predicate.eq("id", id)));
    }

    public List<String> listTagIds(String companyId) {
        var sql = """
                select tag_id
                from company_tag
                where company_id = ?
                order by tag_id asc
                """;
        return jdbcTemplate.query(sql, (rs, rowNum) -> rs.getString("tag_id"), companyId);
    }
}
