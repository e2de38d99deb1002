package com.incarts.analytics.domain.schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A fact table of measured events and the foreign keys through which it reaches
 * its dimensions.
 *
 * A source without a date key cannot be range-filtered; reference listings such as
 * the page catalog are declared that way.
 */
public final class FactRef implements TableRef {

    private final String tableName;
    private final String alias;
    private final String primaryKey;
    private final String dateKeyColumn;
    private final Map<DimensionKind, String> foreignKeys;
    private final List<ColumnRef> columns;

    private FactRef(Builder builder) {
        this.tableName = builder.tableName;
        this.alias = builder.alias;
        this.primaryKey = builder.primaryKey;
        this.dateKeyColumn = builder.dateKeyColumn;
        this.foreignKeys = Collections.unmodifiableMap(new LinkedHashMap<>(builder.foreignKeys));
        this.columns = Collections.unmodifiableList(new ArrayList<>(builder.columns));
    }

    public static Builder builder(String tableName, String alias) {
        return new Builder(tableName, alias);
    }

    @Override
    public String getTableName() {
        return tableName;
    }

    @Override
    public String getAlias() {
        return alias;
    }

    @Override
    public String getKeyColumn() {
        return primaryKey;
    }

    /**
     * Integer {@code yyyyMMdd} key shared with the date dimension.
     */
    public String getDateKeyColumn() {
        return dateKeyColumn;
    }

    @Override
    public List<ColumnRef> getColumns() {
        return columns;
    }

    public boolean canJoin(DimensionRef dimension) {
        return foreignKeys.containsKey(dimension.getKind());
    }

    public Optional<String> foreignKeyFor(DimensionRef dimension) {
        return Optional.ofNullable(foreignKeys.get(dimension.getKind()));
    }

    public String requireForeignKey(DimensionRef dimension) {
        return foreignKeyFor(dimension).orElseThrow(() ->
                new IllegalArgumentException(tableName + " does not join " + dimension.getTableName()));
    }

    @Override
    public String toString() {
        return tableName;
    }

    public static final class Builder {

        private final String tableName;
        private final String alias;
        private String primaryKey;
        private String dateKeyColumn;
        private final Map<DimensionKind, String> foreignKeys = new LinkedHashMap<>();
        private final List<ColumnRef> columns = new ArrayList<>();

        private Builder(String tableName, String alias) {
            this.tableName = tableName;
            this.alias = alias;
        }

        public Builder primaryKey(String primaryKey) {
            this.primaryKey = primaryKey;
            columns.add(new ColumnRef(tableName, alias, primaryKey, ColumnType.INTEGER,
                    EnumSet.noneOf(ColumnUsage.class), null));
            return this;
        }

        public Builder dateKey(String dateKeyColumn) {
            this.dateKeyColumn = dateKeyColumn;
            foreignKeys.put(DimensionKind.DATE, dateKeyColumn);
            columns.add(new ColumnRef(tableName, alias, dateKeyColumn, ColumnType.INTEGER,
                    EnumSet.noneOf(ColumnUsage.class), null));
            return this;
        }

        public Builder joins(DimensionKind kind, String foreignKey) {
            foreignKeys.put(kind, foreignKey);
            columns.add(new ColumnRef(tableName, alias, foreignKey, ColumnType.INTEGER,
                    EnumSet.noneOf(ColumnUsage.class), null));
            return this;
        }

        public Builder column(String name, ColumnType type, ColumnUsage... usages) {
            EnumSet<ColumnUsage> set = EnumSet.noneOf(ColumnUsage.class);
            Collections.addAll(set, usages);
            columns.add(new ColumnRef(tableName, alias, name, type, set, null));
            return this;
        }

        public FactRef build() {
            if (primaryKey == null) {
                throw new IllegalStateException("Fact " + tableName + " needs a primary key");
            }
            return new FactRef(this);
        }
    }
}
