package com.deskhub.inbox.common.query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Renders a {@link Predicate} into a parameterised SQL condition for a {@link DocumentTable}.
 *
 * Link-table fields render as correlated {@code exists (...)} sub-selects, which keeps the outer
 * row count stable (no joins, no duplicates) for {@code count(1)} and paging.
 */
public final class SqlPredicateRenderer {

    private final DocumentTable table;
    private final List<Object> args = new ArrayList<>();
    private int linkAliasSeq = 0;

    private SqlPredicateRenderer(DocumentTable table) {
        this.table = table;
    }

    public static SqlFragment render(Predicate predicate, DocumentTable table) {
        var renderer = new SqlPredicateRenderer(table);
        var sql = renderer.visit(predicate == null ? Predicate.all() : predicate);
        return new SqlFragment(sql, renderer.args);
    }

    private String visit(Predicate predicate) {
        if (predicate instanceof Predicate.MatchAll) {
            return "1 = 1";
        }
        if (predicate instanceof Predicate.MatchNone) {
            return "1 = 0";
        }
        if (predicate instanceof Predicate.FieldEquals eq) {
            return renderEquals(eq);
        }
        if (predicate instanceof Predicate.FieldIn in) {
            return renderIn(in);
        }
        if (predicate instanceof Predicate.FieldExists ex) {
            return renderExists(ex);
        }
        if (predicate instanceof Predicate.FieldGreaterThan gt) {
            args.add(gt.value());
            return table.qualified(gt.field()) + " > ?";
        }
        if (predicate instanceof Predicate.NotContains nc) {
            return "not " + linkExists(nc.field(), " = ?", List.of(nc.value()));
        }
        if (predicate instanceof Predicate.TextMatch tm) {
            return renderText(tm);
        }
        if (predicate instanceof Predicate.And and) {
            return join(and.parts(), " and ");
        }
        if (predicate instanceof Predicate.Or or) {
            return join(or.parts(), " or ");
        }
        throw new IllegalArgumentException("unsupported_predicate:" + predicate.getClass().getSimpleName());
    }

    private String renderEquals(Predicate.FieldEquals eq) {
        if (table.isLink(eq.field())) {
            if (eq.value() == null) {
                return "not " + linkExists(eq.field(), null, List.of());
            }
            return linkExists(eq.field(), " = ?", List.of(eq.value()));
        }
        if (eq.value() == null) {
            return table.qualified(eq.field()) + " is null";
        }
        args.add(eq.value());
        return table.qualified(eq.field()) + " = ?";
    }

    private String renderIn(Predicate.FieldIn in) {
        var placeholders = " in (" + String.join(", ", Collections.nCopies(in.values().size(), "?")) + ")";
        if (table.isLink(in.field())) {
            return linkExists(in.field(), placeholders, new ArrayList<>(in.values()));
        }
        args.addAll(in.values());
        return table.qualified(in.field()) + placeholders;
    }

    private String renderExists(Predicate.FieldExists ex) {
        if (table.isLink(ex.field())) {
            var sub = linkExists(ex.field(), null, List.of());
            return ex.exists() ? sub : "not " + sub;
        }
        return table.qualified(ex.field()) + (ex.exists() ? " is not null" : " is null");
    }

    private String renderText(Predicate.TextMatch tm) {
        var pattern = "%" + escapeLike(tm.text().toLowerCase(Locale.ROOT)) + "%";
        var parts = new ArrayList<String>();
        for (var field : tm.fields()) {
            args.add(pattern);
            parts.add("lower(" + table.qualified(field) + ") like ?");
        }
        return parts.size() == 1 ? parts.get(0) : "(" + String.join(" or ", parts) + ")";
    }

    private String linkExists(String field, String valueCondition, List<Object> values) {
        var link = table.link(field);
        var alias = "l" + (++linkAliasSeq);
        var sb = new StringBuilder();
        sb.append("exists (select 1 from ").append(link.table()).append(' ').append(alias);
        sb.append(" where ").append(alias).append('.').append(link.ownerColumn());
        sb.append(" = ").append(table.alias()).append('.').append(table.idColumn());
        if (valueCondition != null) {
            sb.append(" and ").append(alias).append('.').append(link.valueColumn()).append(valueCondition);
            args.addAll(values);
        }
        sb.append(')');
        return sb.toString();
    }

    private String join(List<Predicate> parts, String op) {
        var rendered = new ArrayList<String>();
        for (var p : parts) {
            rendered.add(visit(p));
        }
        return "(" + String.join(op, rendered) + ")";
    }

    private static String escapeLike(String s) {
        return s.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }
}
