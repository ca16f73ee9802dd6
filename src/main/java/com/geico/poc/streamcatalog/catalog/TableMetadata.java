package com.geico.poc.streamcatalog.catalog;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.OptionalLong;

/**
 * Catalog entry for a table-shaped relation: user tables, materialized views, the backing
 * tables of indexes and internal state tables.
 *
 * A table created with a connector carries {@code associatedSourceId}; that source and this
 * table are created and dropped together.
 */
public class TableMetadata implements SchemaScopedObject {

    public enum TableType {
        TABLE,
        MATERIALIZED_VIEW,
        INDEX,
        INTERNAL
    }

    private final long id;
    private final long schemaId;
    private final long databaseId;
    private final String name;
    private final TableType tableType;
    private final List<ColumnMetadata> columns;
    private final List<ColumnOrder> pk;
    private final List<Long> dependentRelations;
    private final OptionalLong associatedSourceId;
    private final List<Integer> distributionKey;
    private final List<Integer> streamKey;
    private final boolean appendOnly;
    private final int owner;
    private final Map<String, String> properties;
    private final OptionalInt vnodeColIndex;
    private final OptionalInt rowIdIndex;
    private final List<Integer> valueIndices;
    private final String definition;
    private final boolean handlePkConflict;
    private final int readPrefixLenHint;
    private final List<Integer> watermarkIndices;
    private final Optional<TableVersion> version;

    @JsonCreator
    public TableMetadata(
            @JsonProperty("id") long id,
            @JsonProperty("schemaId") long schemaId,
            @JsonProperty("databaseId") long databaseId,
            @JsonProperty("name") String name,
            @JsonProperty("tableType") TableType tableType,
            @JsonProperty("columns") List<ColumnMetadata> columns,
            @JsonProperty("pk") List<ColumnOrder> pk,
            @JsonProperty("dependentRelations") List<Long> dependentRelations,
            @JsonProperty("associatedSourceId") OptionalLong associatedSourceId,
            @JsonProperty("distributionKey") List<Integer> distributionKey,
            @JsonProperty("streamKey") List<Integer> streamKey,
            @JsonProperty("appendOnly") boolean appendOnly,
            @JsonProperty("owner") int owner,
            @JsonProperty("properties") Map<String, String> properties,
            @JsonProperty("vnodeColIndex") OptionalInt vnodeColIndex,
            @JsonProperty("rowIdIndex") OptionalInt rowIdIndex,
            @JsonProperty("valueIndices") List<Integer> valueIndices,
            @JsonProperty("definition") String definition,
            @JsonProperty("handlePkConflict") boolean handlePkConflict,
            @JsonProperty("readPrefixLenHint") int readPrefixLenHint,
            @JsonProperty("watermarkIndices") List<Integer> watermarkIndices,
            @JsonProperty("version") Optional<TableVersion> version) {
        this.id = id;
        this.schemaId = schemaId;
        this.databaseId = databaseId;
        this.name = name;
        this.tableType = tableType != null ? tableType : TableType.TABLE;
        this.columns = immutable(columns);
        this.pk = immutable(pk);
        this.dependentRelations = immutable(dependentRelations);
        this.associatedSourceId = associatedSourceId != null ? associatedSourceId : OptionalLong.empty();
        this.distributionKey = immutable(distributionKey);
        this.streamKey = immutable(streamKey);
        this.appendOnly = appendOnly;
        this.owner = owner;
        this.properties = properties != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(properties))
                : Collections.emptyMap();
        this.vnodeColIndex = vnodeColIndex != null ? vnodeColIndex : OptionalInt.empty();
        this.rowIdIndex = rowIdIndex != null ? rowIdIndex : OptionalInt.empty();
        this.valueIndices = immutable(valueIndices);
        this.definition = definition != null ? definition : "";
        this.handlePkConflict = handlePkConflict;
        this.readPrefixLenHint = readPrefixLenHint;
        this.watermarkIndices = immutable(watermarkIndices);
        this.version = version != null ? version : Optional.empty();
    }

    private static <T> List<T> immutable(List<T> list) {
        return list != null ? Collections.unmodifiableList(new ArrayList<>(list)) : Collections.emptyList();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    @Override
    public long getId() {
        return id;
    }

    @Override
    public long getSchemaId() {
        return schemaId;
    }

    @Override
    public long getDatabaseId() {
        return databaseId;
    }

    @Override
    public String getName() {
        return name;
    }

    public TableType getTableType() {
        return tableType;
    }

    public List<ColumnMetadata> getColumns() {
        return columns;
    }

    public List<ColumnOrder> getPk() {
        return pk;
    }

    @Override
    public List<Long> getDependentRelations() {
        return dependentRelations;
    }

    public OptionalLong getAssociatedSourceId() {
        return associatedSourceId;
    }

    public List<Integer> getDistributionKey() {
        return distributionKey;
    }

    public List<Integer> getStreamKey() {
        return streamKey;
    }

    public boolean isAppendOnly() {
        return appendOnly;
    }

    @Override
    public int getOwner() {
        return owner;
    }

    public Map<String, String> getProperties() {
        return properties;
    }

    public OptionalInt getVnodeColIndex() {
        return vnodeColIndex;
    }

    public OptionalInt getRowIdIndex() {
        return rowIdIndex;
    }

    public List<Integer> getValueIndices() {
        return valueIndices;
    }

    public String getDefinition() {
        return definition;
    }

    public boolean isHandlePkConflict() {
        return handlePkConflict;
    }

    public int getReadPrefixLenHint() {
        return readPrefixLenHint;
    }

    public List<Integer> getWatermarkIndices() {
        return watermarkIndices;
    }

    public Optional<TableVersion> getVersion() {
        return version;
    }

    @Override
    public ObjectKind kind() {
        return ObjectKind.TABLE;
    }

    @Override
    public TableMetadata withId(long newId) {
        return toBuilder().id(newId).build();
    }

    // Helper methods

    public boolean hasAssociatedSource() {
        return associatedSourceId.isPresent();
    }

    public int findColumnIndex(String columnName) {
        for (int i = 0; i < columns.size(); i++) {
            if (columns.get(i).getName().equalsIgnoreCase(columnName)) {
                return i;
            }
        }
        return -1;
    }

    public boolean isPkColumn(int columnIndex) {
        for (ColumnOrder order : pk) {
            if (order.getColumnIndex() == columnIndex) {
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TableMetadata that = (TableMetadata) o;
        return id == that.id
                && schemaId == that.schemaId
                && databaseId == that.databaseId
                && appendOnly == that.appendOnly
                && owner == that.owner
                && handlePkConflict == that.handlePkConflict
                && readPrefixLenHint == that.readPrefixLenHint
                && Objects.equals(name, that.name)
                && tableType == that.tableType
                && columns.equals(that.columns)
                && pk.equals(that.pk)
                && dependentRelations.equals(that.dependentRelations)
                && associatedSourceId.equals(that.associatedSourceId)
                && distributionKey.equals(that.distributionKey)
                && streamKey.equals(that.streamKey)
                && properties.equals(that.properties)
                && vnodeColIndex.equals(that.vnodeColIndex)
                && rowIdIndex.equals(that.rowIdIndex)
                && valueIndices.equals(that.valueIndices)
                && definition.equals(that.definition)
                && watermarkIndices.equals(that.watermarkIndices)
                && version.equals(that.version);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, schemaId, name, tableType, columns, version);
    }

    @Override
    public String toString() {
        return "TableMetadata{" +
                "id=" + id +
                ", name='" + name + '\'' +
                ", type=" + tableType +
                ", columns=" + columns.size() +
                (associatedSourceId.isPresent() ? ", associatedSource=" + associatedSourceId.getAsLong() : "") +
                version.map(v -> ", version=" + v.getVersion()).orElse("") +
                '}';
    }

    /**
     * Builder for request descriptions and for derived versions of an existing table.
     */
    public static class Builder {
        private long id;
        private long schemaId;
        private long databaseId;
        private String name;
        private TableType tableType = TableType.TABLE;
        private List<ColumnMetadata> columns = new ArrayList<>();
        private List<ColumnOrder> pk = new ArrayList<>();
        private List<Long> dependentRelations = new ArrayList<>();
        private OptionalLong associatedSourceId = OptionalLong.empty();
        private List<Integer> distributionKey = new ArrayList<>();
        private List<Integer> streamKey = new ArrayList<>();
        private boolean appendOnly;
        private int owner;
        private Map<String, String> properties = new LinkedHashMap<>();
        private OptionalInt vnodeColIndex = OptionalInt.empty();
        private OptionalInt rowIdIndex = OptionalInt.empty();
        private List<Integer> valueIndices = new ArrayList<>();
        private String definition = "";
        private boolean handlePkConflict;
        private int readPrefixLenHint;
        private List<Integer> watermarkIndices = new ArrayList<>();
        private Optional<TableVersion> version = Optional.empty();

        private Builder() {
        }

        private Builder(TableMetadata table) {
            this.id = table.id;
            this.schemaId = table.schemaId;
            this.databaseId = table.databaseId;
            this.name = table.name;
            this.tableType = table.tableType;
            this.columns = new ArrayList<>(table.columns);
            this.pk = new ArrayList<>(table.pk);
            this.dependentRelations = new ArrayList<>(table.dependentRelations);
            this.associatedSourceId = table.associatedSourceId;
            this.distributionKey = new ArrayList<>(table.distributionKey);
            this.streamKey = new ArrayList<>(table.streamKey);
            this.appendOnly = table.appendOnly;
            this.owner = table.owner;
            this.properties = new LinkedHashMap<>(table.properties);
            this.vnodeColIndex = table.vnodeColIndex;
            this.rowIdIndex = table.rowIdIndex;
            this.valueIndices = new ArrayList<>(table.valueIndices);
            this.definition = table.definition;
            this.handlePkConflict = table.handlePkConflict;
            this.readPrefixLenHint = table.readPrefixLenHint;
            this.watermarkIndices = new ArrayList<>(table.watermarkIndices);
            this.version = table.version;
        }

        public Builder id(long id) {
            this.id = id;
            return this;
        }

        public Builder schemaId(long schemaId) {
            this.schemaId = schemaId;
            return this;
        }

        public Builder databaseId(long databaseId) {
            this.databaseId = databaseId;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder tableType(TableType tableType) {
            this.tableType = tableType;
            return this;
        }

        public Builder columns(List<ColumnMetadata> columns) {
            this.columns = new ArrayList<>(columns);
            return this;
        }

        public Builder addColumn(ColumnMetadata column) {
            this.columns.add(column);
            return this;
        }

        public Builder pk(List<ColumnOrder> pk) {
            this.pk = new ArrayList<>(pk);
            return this;
        }

        public Builder dependentRelations(List<Long> dependentRelations) {
            this.dependentRelations = new ArrayList<>(dependentRelations);
            return this;
        }

        public Builder associatedSourceId(long sourceId) {
            this.associatedSourceId = OptionalLong.of(sourceId);
            return this;
        }

        public Builder noAssociatedSource() {
            this.associatedSourceId = OptionalLong.empty();
            return this;
        }

        public Builder distributionKey(List<Integer> distributionKey) {
            this.distributionKey = new ArrayList<>(distributionKey);
            return this;
        }

        public Builder streamKey(List<Integer> streamKey) {
            this.streamKey = new ArrayList<>(streamKey);
            return this;
        }

        public Builder appendOnly(boolean appendOnly) {
            this.appendOnly = appendOnly;
            return this;
        }

        public Builder owner(int owner) {
            this.owner = owner;
            return this;
        }

        public Builder properties(Map<String, String> properties) {
            this.properties = new LinkedHashMap<>(properties);
            return this;
        }

        public Builder property(String key, String value) {
            this.properties.put(key, value);
            return this;
        }

        public Builder vnodeColIndex(OptionalInt vnodeColIndex) {
            this.vnodeColIndex = vnodeColIndex;
            return this;
        }

        public Builder rowIdIndex(OptionalInt rowIdIndex) {
            this.rowIdIndex = rowIdIndex;
            return this;
        }

        public Builder valueIndices(List<Integer> valueIndices) {
            this.valueIndices = new ArrayList<>(valueIndices);
            return this;
        }

        public Builder definition(String definition) {
            this.definition = definition;
            return this;
        }

        public Builder handlePkConflict(boolean handlePkConflict) {
            this.handlePkConflict = handlePkConflict;
            return this;
        }

        public Builder readPrefixLenHint(int readPrefixLenHint) {
            this.readPrefixLenHint = readPrefixLenHint;
            return this;
        }

        public Builder watermarkIndices(List<Integer> watermarkIndices) {
            this.watermarkIndices = new ArrayList<>(watermarkIndices);
            return this;
        }

        public Builder version(TableVersion version) {
            this.version = Optional.ofNullable(version);
            return this;
        }

        public TableMetadata build() {
            return new TableMetadata(id, schemaId, databaseId, name, tableType, columns, pk,
                    dependentRelations, associatedSourceId, distributionKey, streamKey, appendOnly,
                    owner, properties, vnodeColIndex, rowIdIndex, valueIndices, definition,
                    handlePkConflict, readPrefixLenHint, watermarkIndices, version);
        }
    }
}
