package com.deskhub.inbox.common.query;

import org.springframework.jdbc.core.ArgumentPreparedStatementSetter;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.PreparedStatementCreator;
import org.springframework.jdbc.core.ResultSetExtractor;
import org.springframework.jdbc.core.RowMapper;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Read-only collection view over one table: {@code find} with sort/skip/limit, {@code countDocuments}
 * and {@code findOne}, all driven by {@link Predicate}s.
 *
 * {@link #countDocuments(Predicate)} and {@link #find(Predicate)} render the same where-clause, so a
 * count always agrees with what the matching find would enumerate.
 */
public class JdbcCollection<T> {

    public enum Direction {
        ASC, DESC
    }

    private final JdbcTemplate jdbcTemplate;
    private final DocumentTable table;
    private final RowMapper<T> rowMapper;

    public JdbcCollection(JdbcTemplate jdbcTemplate, DocumentTable table, RowMapper<T> rowMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.table = table;
        this.rowMapper = rowMapper;
    }

    public Find find(Predicate predicate) {
        return new Find(predicate);
    }

    public long countDocuments(Predicate predicate) {
        if (predicate instanceof Predicate.MatchNone) {
            return 0L;
        }
        var where = SqlPredicateRenderer.render(predicate, table);
        var sql = "select count(1) from " + table.table() + " " + table.alias() + " where " + where.sql();
        Long n = jdbcTemplate.queryForObject(sql, Long.class, where.argArray());
        return n == null ? 0L : n;
    }

    /**
     * Same as {@link #countDocuments(Predicate)}, but the statement is cancelled by the driver once
     * {@code queryTimeoutSeconds} have passed. Zero means no timeout.
     */
    public long countDocuments(Predicate predicate, int queryTimeoutSeconds) {
        if (predicate instanceof Predicate.MatchNone) {
            return 0L;
        }
        var where = SqlPredicateRenderer.render(predicate, table);
        var sql = "select count(1) from " + table.table() + " " + table.alias() + " where " + where.sql();
        PreparedStatementCreator creator = con -> {
            var ps = con.prepareStatement(sql);
            ps.setQueryTimeout(Math.max(0, queryTimeoutSeconds));
            return ps;
        };
        ResultSetExtractor<Long> extractor = rs -> rs.next() ? rs.getLong(1) : 0L;
        Long n = jdbcTemplate.query(creator, new ArgumentPreparedStatementSetter(where.argArray()), extractor);
        return n == null ? 0L : n;
    }

    public Optional<T> findOne(Predicate predicate) {
        return find(predicate).limit(1).list().stream().findFirst();
    }

    public final class Find {
        private final Predicate predicate;
        private final List<String> orderBy = new ArrayList<>();
        private int skip;
        private int limit;

        private Find(Predicate predicate) {
            this.predicate = predicate;
        }

        public Find sort(String field, Direction direction) {
            orderBy.add(table.qualified(field) + (direction == Direction.DESC ? " desc" : " asc"));
            return this;
        }

        public Find skip(int n) {
            this.skip = Math.max(0, n);
            return this;
        }

        /**
         * Zero means unlimited.
         */
        public Find limit(int n) {
            this.limit = Math.max(0, n);
            return this;
        }

        public Optional<T> first() {
            return limit(1).list().stream().findFirst();
        }

        public List<T> list() {
            if (predicate instanceof Predicate.MatchNone) {
                return List.of();
            }
            var where = SqlPredicateRenderer.render(predicate, table);
            var args = new ArrayList<>(where.args());

            var sql = new StringBuilder();
            sql.append("select ").append(table.selectList());
            sql.append(" from ").append(table.table()).append(' ').append(table.alias());
            sql.append(" where ").append(where.sql());
            if (!orderBy.isEmpty()) {
                sql.append(" order by ").append(String.join(", ", orderBy));
                // stable paging
                sql.append(", ").append(table.alias()).append('.').append(table.idColumn()).append(" asc");
            }
            if (skip > 0) {
                sql.append(" offset ? rows");
                args.add(skip);
            }
            if (limit > 0) {
                sql.append(" fetch first ? rows only");
                args.add(limit);
            }
            return jdbcTemplate.query(sql.toString(), rowMapper, args.toArray());
        }
    }
}
