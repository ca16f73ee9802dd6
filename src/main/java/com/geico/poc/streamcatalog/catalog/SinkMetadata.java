package com.geico.poc.streamcatalog.catalog;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Output endpoint fed by a streaming query over one or more relations.
 */
public class SinkMetadata implements SchemaScopedObject {

    private final long id;
    private final long schemaId;
    private final long databaseId;
    private final String name;
    private final List<ColumnMetadata> columns;
    private final List<ColumnOrder> pk;
    private final List<Long> dependentRelations;
    private final List<Integer> distributionKey;
    private final List<Integer> streamKey;
    private final boolean appendOnly;
    private final int owner;
    private final Map<String, String> properties;
    private final String definition;

    @JsonCreator
    public SinkMetadata(
            @JsonProperty("id") long id,
            @JsonProperty("schemaId") long schemaId,
            @JsonProperty("databaseId") long databaseId,
            @JsonProperty("name") String name,
            @JsonProperty("columns") List<ColumnMetadata> columns,
            @JsonProperty("pk") List<ColumnOrder> pk,
            @JsonProperty("dependentRelations") List<Long> dependentRelations,
            @JsonProperty("distributionKey") List<Integer> distributionKey,
            @JsonProperty("streamKey") List<Integer> streamKey,
            @JsonProperty("appendOnly") boolean appendOnly,
            @JsonProperty("owner") int owner,
            @JsonProperty("properties") Map<String, String> properties,
            @JsonProperty("definition") String definition) {
        this.id = id;
        this.schemaId = schemaId;
        this.databaseId = databaseId;
        this.name = name;
        this.columns = copy(columns);
        this.pk = copy(pk);
        this.dependentRelations = copy(dependentRelations);
        this.distributionKey = copy(distributionKey);
        this.streamKey = copy(streamKey);
        this.appendOnly = appendOnly;
        this.owner = owner;
        this.properties = properties != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(properties))
                : Collections.emptyMap();
        this.definition = definition != null ? definition : "";
    }

    private static <T> List<T> copy(List<T> list) {
        return list != null ? Collections.unmodifiableList(new ArrayList<>(list)) : Collections.emptyList();
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

    public String getDefinition() {
        return definition;
    }

    @Override
    public ObjectKind kind() {
        return ObjectKind.SINK;
    }

    @Override
    public SinkMetadata withId(long newId) {
        return new SinkMetadata(newId, schemaId, databaseId, name, columns, pk, dependentRelations,
                distributionKey, streamKey, appendOnly, owner, properties, definition);
    }

    public SinkMetadata withName(String newName) {
        return new SinkMetadata(id, schemaId, databaseId, newName, columns, pk, dependentRelations,
                distributionKey, streamKey, appendOnly, owner, properties, definition);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SinkMetadata that = (SinkMetadata) o;
        return id == that.id && schemaId == that.schemaId && databaseId == that.databaseId
                && appendOnly == that.appendOnly && owner == that.owner
                && Objects.equals(name, that.name)
                && columns.equals(that.columns)
                && pk.equals(that.pk)
                && dependentRelations.equals(that.dependentRelations)
                && distributionKey.equals(that.distributionKey)
                && streamKey.equals(that.streamKey)
                && properties.equals(that.properties)
                && definition.equals(that.definition);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, schemaId, name, dependentRelations);
    }

    @Override
    public String toString() {
        return "SinkMetadata{id=" + id + ", name='" + name + "', dependentRelations=" + dependentRelations + '}';
    }
}
