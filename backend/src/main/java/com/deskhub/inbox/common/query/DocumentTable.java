package com.deskhub.inbox.common.query;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps the logical fields of a document collection onto a table and its link tables.
 */
public record DocumentTable(
        String table,
        String alias,
        String idColumn,
        Map<String, String> columns,
        Map<String, LinkTable> links
) {

    /**
     * Multi-valued field stored one row per value: {@code table(ownerColumn, valueColumn)}.
     */
    public record LinkTable(String table, String ownerColumn, String valueColumn) {
    }

    public DocumentTable {
        columns = Map.copyOf(columns);
        links = Map.copyOf(links);
    }

    public static Builder builder(String table, String alias) {
        return new Builder(table, alias);
    }

    public boolean isLink(String field) {
        return links.containsKey(field);
    }

    public LinkTable link(String field) {
        var link = links.get(field);
        if (link == null) {
            throw new IllegalArgumentException("unknown_field:" + field);
        }
        return link;
    }

    public String column(String field) {
        var column = columns.get(field);
        if (column == null) {
            throw new IllegalArgumentException("unknown_field:" + field);
        }
        return column;
    }

    public String qualified(String field) {
        return alias + "." + column(field);
    }

    public String selectList() {
        var sb = new StringBuilder();
        for (var column : columns.values()) {
            if (!sb.isEmpty()) sb.append(", ");
            sb.append(alias).append('.').append(column);
        }
        return sb.toString();
    }

    public static final class Builder {
        private final String table;
        private final String alias;
        private String idColumn = "id";
        private final Map<String, String> columns = new LinkedHashMap<>();
        private final Map<String, LinkTable> links = new LinkedHashMap<>();

        private Builder(String table, String alias) {
            this.table = table;
            this.alias = alias;
        }

        public Builder id(String column) {
            this.idColumn = column;
            this.columns.put("id", column);
            return this;
        }

        public Builder column(String field, String column) {
            columns.put(field, column);
            return this;
        }

        public Builder link(String field, String table, String ownerColumn, String valueColumn) {
            links.put(field, new LinkTable(table, ownerColumn, valueColumn));
            return this;
        }

        public DocumentTable build() {
            columns.putIfAbsent("id", idColumn);
            return new DocumentTable(table, alias, idColumn, columns, links);
        }
    }
}
