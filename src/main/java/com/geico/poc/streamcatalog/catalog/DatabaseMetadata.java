package com.geico.poc.streamcatalog.catalog;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Top-level namespace. Owns schemas.
 */
public class DatabaseMetadata implements CatalogObject {

    private final long id;
    private final String name;
    private final int owner;

    @JsonCreator
    public DatabaseMetadata(
            @JsonProperty("id") long id,
            @JsonProperty("name") String name,
            @JsonProperty("owner") int owner) {
        this.id = id;
        this.name = name;
        this.owner = owner;
    }

    @Override
    public long getId() {
        return id;
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
        return ObjectKind.DATABASE;
    }

    @Override
    public DatabaseMetadata withId(long newId) {
        return new DatabaseMetadata(newId, name, owner);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DatabaseMetadata that = (DatabaseMetadata) o;
        return id == that.id && owner == that.owner && Objects.equals(name, that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, owner);
    }

    @Override
    public String toString() {
        return "DatabaseMetadata{id=" + id + ", name='" + name + "', owner=" + owner + '}';
    }
}
