package com.geico.poc.streamcatalog.catalog;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Namespace within a database. Owns tables, sources, sinks, indexes, views and functions.
 */
public class SchemaMetadata implements CatalogObject {

    private final long id;
    private final long databaseId;
    private final String name;
    private final int owner;

    @JsonCreator
    public SchemaMetadata(
            @JsonProperty("id") long id,
            @JsonProperty("databaseId") long databaseId,
            @JsonProperty("name") String name,
            @JsonProperty("owner") int owner) {
        this.id = id;
        this.databaseId = databaseId;
        this.name = name;
        this.owner = owner;
    }

    @Override
    public long getId() {
        return id;
    }

    public long getDatabaseId() {
        return databaseId;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public int getOwner() {
        return owner;
    }

    @Override
    public ObjectKind kind() {
        return ObjectKind.SCHEMA;
    }

    @Override
    public SchemaMetadata withId(long newId) {
        return new SchemaMetadata(newId, databaseId, name, owner);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SchemaMetadata that = (SchemaMetadata) o;
        return id == that.id && databaseId == that.databaseId && owner == that.owner
                && Objects.equals(name, that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, databaseId, name, owner);
    }

    @Override
    public String toString() {
        return "SchemaMetadata{id=" + id + ", databaseId=" + databaseId + ", name='" + name + "'}";
    }
}
