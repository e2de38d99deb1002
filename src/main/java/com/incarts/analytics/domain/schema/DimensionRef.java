package com.incarts.analytics.domain.schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;

/**
 * A dimension table of the warehouse: its surrogate key, its natural key (the
 * identifier callers filter on) and the columns that may be filtered or grouped on.
 *
 * Instances are defined once in {@link WarehouseSchema} and compared by identity.
 */
public final class DimensionRef implements TableRef {

    private final DimensionKind kind;
    private final String tableName;
    private final String alias;
    private final String keyColumn;
    private final String naturalKeyColumn;
    private final List<ColumnRef> columns;

    private DimensionRef(Builder builder) {
        this.kind = builder.kind;
        this.tableName = builder.tableName;
        this.alias = builder.alias;
        this.keyColumn = builder.keyColumn;
        this.naturalKeyColumn = builder.naturalKeyColumn;
        this.columns = Collections.unmodifiableList(new ArrayList<>(builder.columns));
    }

    public static Builder builder(DimensionKind kind, String tableName, String alias) {
        return new Builder(kind, tableName, alias);
    }

    public DimensionKind getKind() {
        return kind;
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
        return keyColumn;
    }

    /**
     * Location and device rows have no external identifier; their attribute columns
     * are used directly.
     */
    public Optional<String> getNaturalKeyColumn() {
        return Optional.ofNullable(naturalKeyColumn);
    }

    @Override
    public List<ColumnRef> getColumns() {
        return columns;
    }

    @Override
    public String toString() {
        return tableName;
    }

    public static final class Builder {

        private final DimensionKind kind;
        private final String tableName;
        private final String alias;
        private String keyColumn;
        private String naturalKeyColumn;
        private final List<ColumnRef> columns = new ArrayList<>();

        private Builder(DimensionKind kind, String tableName, String alias) {
            this.kind = kind;
            this.tableName = tableName;
            this.alias = alias;
        }

        public Builder key(String keyColumn) {
            this.keyColumn = keyColumn;
            columns.add(new ColumnRef(tableName, alias, keyColumn, ColumnType.INTEGER,
                    EnumSet.of(ColumnUsage.GROUP), null));
            return this;
        }

        public Builder naturalKey(String naturalKeyColumn, ColumnType type) {
            this.naturalKeyColumn = naturalKeyColumn;
            return column(naturalKeyColumn, type, ColumnUsage.FILTER, ColumnUsage.GROUP);
        }

        public Builder column(String name, ColumnType type, ColumnUsage... usages) {
            columns.add(new ColumnRef(tableName, alias, name, type, usageSet(usages), null));
            return this;
        }

        public Builder derived(String name, ColumnType type, String expression, ColumnUsage... usages) {
            columns.add(new ColumnRef(tableName, alias, name, type, usageSet(usages), expression));
            return this;
        }

        public DimensionRef build() {
            if (keyColumn == null) {
                throw new IllegalStateException("Dimension " + tableName + " needs a key column");
            }
            return new DimensionRef(this);
        }

        private static EnumSet<ColumnUsage> usageSet(ColumnUsage... usages) {
            EnumSet<ColumnUsage> set = EnumSet.noneOf(ColumnUsage.class);
            Collections.addAll(set, usages);
            return set;
        }
    }
}
