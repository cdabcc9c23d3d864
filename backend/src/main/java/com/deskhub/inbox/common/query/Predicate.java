package com.deskhub.inbox.common.query;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Filter fragment over a document collection.
 *
 * Field names are logical (camelCase) document fields; {@link SqlPredicateRenderer} maps them to
 * columns or link tables through a {@link DocumentTable}. A field backed by a link table is
 * multi-valued: {@link FieldEquals} and {@link FieldIn} on it mean "any element matches".
 *
 * Build instances through the static factories, they keep compositions normalised:
 * <ul>
 *     <li>{@code in(field, [])} is {@link MatchNone}, never an empty membership test</li>
 *     <li>{@code and(...)} drops {@link MatchAll} and collapses to {@link MatchNone}</li>
 *     <li>{@code or(...)} drops {@link MatchNone} and collapses to {@link MatchAll}</li>
 * </ul>
 */
public sealed interface Predicate permits
        Predicate.MatchAll,
        Predicate.MatchNone,
        Predicate.FieldEquals,
        Predicate.FieldIn,
        Predicate.FieldExists,
        Predicate.FieldGreaterThan,
        Predicate.NotContains,
        Predicate.TextMatch,
        Predicate.And,
        Predicate.Or {

    record MatchAll() implements Predicate {
    }

    record MatchNone() implements Predicate {
    }

    record FieldEquals(String field, Object value) implements Predicate {
        public FieldEquals {
            Objects.requireNonNull(field, "field");
        }
    }

    record FieldIn(String field, Set<Object> values) implements Predicate {
        public FieldIn {
            Objects.requireNonNull(field, "field");
            if (values == null || values.isEmpty()) {
                throw new IllegalArgumentException("empty_membership:" + field);
            }
            values = Set.copyOf(values);
        }
    }

    record FieldExists(String field, boolean exists) implements Predicate {
    }

    record FieldGreaterThan(String field, long value) implements Predicate {
    }

    /**
     * Multi-valued field does not hold {@code value}.
     */
    record NotContains(String field, Object value) implements Predicate {
    }

    record TextMatch(List<String> fields, String text) implements Predicate {
        public TextMatch {
            fields = List.copyOf(fields);
        }
    }

    record And(List<Predicate> parts) implements Predicate {
        public And {
            parts = List.copyOf(parts);
        }
    }

    record Or(List<Predicate> parts) implements Predicate {
        public Or {
            parts = List.copyOf(parts);
        }
    }

    MatchAll ALL = new MatchAll();

    MatchNone NONE = new MatchNone();

    static Predicate all() {
        return ALL;
    }

    static Predicate none() {
        return NONE;
    }

    static Predicate eq(String field, Object value) {
        return new FieldEquals(field, value);
    }

    static Predicate in(String field, Collection<?> values) {
        if (values == null || values.isEmpty()) {
            return NONE;
        }
        var cleaned = new LinkedHashSet<Object>();
        for (var v : values) {
            if (v != null) cleaned.add(v);
        }
        if (cleaned.isEmpty()) {
            return NONE;
        }
        return new FieldIn(field, cleaned);
    }

    static Predicate exists(String field) {
        return new FieldExists(field, true);
    }

    static Predicate notExists(String field) {
        return new FieldExists(field, false);
    }

    static Predicate gt(String field, long value) {
        return new FieldGreaterThan(field, value);
    }

    static Predicate notContains(String field, Object value) {
        return new NotContains(field, value);
    }

    static Predicate text(String text, String... fields) {
        if (text == null || text.isBlank() || fields.length == 0) {
            return ALL;
        }
        return new TextMatch(List.of(fields), text.trim());
    }

    static Predicate and(Predicate... parts) {
        return and(Arrays.asList(parts));
    }

    static Predicate and(List<Predicate> parts) {
        var flat = new ArrayList<Predicate>();
        for (var p : parts) {
            if (p == null || p instanceof MatchAll) continue;
            if (p instanceof MatchNone) return NONE;
            if (p instanceof And nested) {
                flat.addAll(nested.parts());
            } else {
                flat.add(p);
            }
        }
        if (flat.isEmpty()) return ALL;
        if (flat.size() == 1) return flat.get(0);
        return new And(flat);
    }

    static Predicate or(Predicate... parts) {
        var flat = new ArrayList<Predicate>();
        for (var p : parts) {
            if (p == null || p instanceof MatchNone) continue;
            if (p instanceof MatchAll) return ALL;
            if (p instanceof Or nested) {
                flat.addAll(nested.parts());
            } else {
                flat.add(p);
            }
        }
        if (flat.isEmpty()) return NONE;
        if (flat.size() == 1) return flat.get(0);
        return new Or(flat);
    }
}
