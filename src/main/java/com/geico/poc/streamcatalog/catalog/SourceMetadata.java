package com.geico.poc.streamcatalog.catalog;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * External ingestion endpoint.
 *
 * A source is either standalone ({@code CREATE SOURCE}) or the hidden ingestion pipeline of a
 * connector-backed table, in which case it shares the table's name and the table points at it
 * through {@link TableMetadata#getAssociatedSourceId()}.
 */
public class SourceMetadata implements SchemaScopedObject {

    public static final String CONNECTOR_PROPERTY = "connector";

    private final long id;
    private final long schemaId;
    private final long databaseId;
    private final String name;
    private final OptionalInt rowIdIndex;
    private final List<ColumnMetadata> columns;
    private final List<Integer> pkColumnIds;
    private final Map<String, String> properties;
    private final int owner;
    private final StreamSourceInfo info;
    private final List<WatermarkDesc> watermarkDescs;

    @JsonCreator
    public SourceMetadata(
            @JsonProperty("id") long id,
            @JsonProperty("schemaId") long schemaId,
            @JsonProperty("databaseId") long databaseId,
            @JsonProperty("name") String name,
            @JsonProperty("rowIdIndex") OptionalInt rowIdIndex,
            @JsonProperty("columns") List<ColumnMetadata> columns,
            @JsonProperty("pkColumnIds") List<Integer> pkColumnIds,
            @JsonProperty("properties") Map<String, String> properties,
            @JsonProperty("owner") int owner,
            @JsonProperty("info") StreamSourceInfo info,
            @JsonProperty("watermarkDescs") List<WatermarkDesc> watermarkDescs) {
        this.id = id;
        this.schemaId = schemaId;
        this.databaseId = databaseId;
        this.name = name;
        this.rowIdIndex = rowIdIndex != null ? rowIdIndex : OptionalInt.empty();
        this.columns = columns != null ? Collections.unmodifiableList(new ArrayList<>(columns)) : Collections.emptyList();
        this.pkColumnIds = pkColumnIds != null ? Collections.unmodifiableList(new ArrayList<>(pkColumnIds)) : Collections.emptyList();
        this.properties = properties != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(properties))
                : Collections.emptyMap();
        this.owner = owner;
        this.info = info != null ? info : StreamSourceInfo.of(StreamSourceInfo.RowFormatType.ROW_UNSPECIFIED);
        this.watermarkDescs = watermarkDescs != null
                ? Collections.unmodifiableList(new ArrayList<>(watermarkDescs))
                : Collections.emptyList();
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

    public OptionalInt getRowIdIndex() {
        return rowIdIndex;
    }

    public List<ColumnMetadata> getColumns() {
        return columns;
    }

    public List<Integer> getPkColumnIds() {
        return pkColumnIds;
    }

    public Map<String, String> getProperties() {
        return properties;
    }

    @Override
    public int getOwner() {
        return owner;
    }

    public StreamSourceInfo getInfo() {
        return info;
    }

    public List<WatermarkDesc> getWatermarkDescs() {
        return watermarkDescs;
    }

    @Override
    @JsonIgnore
    public List<Long> getDependentRelations() {
        return Collections.emptyList();
    }

    @Override
    public ObjectKind kind() {
        return ObjectKind.SOURCE;
    }

    public String connector() {
        return properties.get(CONNECTOR_PROPERTY);
    }

    @Override
    public SourceMetadata withId(long newId) {
        return new SourceMetadata(newId, schemaId, databaseId, name, rowIdIndex, columns, pkColumnIds,
                properties, owner, info, watermarkDescs);
    }

    public SourceMetadata withName(String newName) {
        return new SourceMetadata(id, schemaId, databaseId, newName, rowIdIndex, columns, pkColumnIds,
                properties, owner, info, watermarkDescs);
    }

    public SourceMetadata withColumns(List<ColumnMetadata> newColumns, OptionalInt newRowIdIndex) {
        return new SourceMetadata(id, schemaId, databaseId, name, newRowIdIndex, newColumns, pkColumnIds,
                properties, owner, info, watermarkDescs);
    }

    public SourceMetadata withLocation(long newSchemaId, long newDatabaseId) {
        return new SourceMetadata(id, newSchemaId, newDatabaseId, name, rowIdIndex, columns, pkColumnIds,
                properties, owner, info, watermarkDescs);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SourceMetadata that = (SourceMetadata) o;
        return id == that.id && schemaId == that.schemaId && databaseId == that.databaseId
                && owner == that.owner
                && Objects.equals(name, that.name)
                && rowIdIndex.equals(that.rowIdIndex)
                && columns.equals(that.columns)
                && pkColumnIds.equals(that.pkColumnIds)
                && properties.equals(that.properties)
                && info.equals(that.info)
                && watermarkDescs.equals(that.watermarkDescs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, schemaId, name, columns);
    }

    @Override
    public String toString() {
        return "SourceMetadata{id=" + id + ", name='" + name + "', connector=" + connector()
                + ", columns=" + columns.size() + '}';
    }
}
