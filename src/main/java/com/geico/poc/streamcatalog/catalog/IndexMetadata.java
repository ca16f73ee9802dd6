package com.geico.poc.streamcatalog.catalog;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Secondary index over a primary table. Physically an index is a covering table, referenced
 * through {@code indexTableId}; that backing table carries the dependency on the primary table.
 */
public class IndexMetadata implements SchemaScopedObject {

    private final long id;
    private final long schemaId;
    private final long databaseId;
    private final String name;
    private final int owner;
    private final long indexTableId;
    private final long primaryTableId;
    private final List<IndexItem> indexItems;
    private final List<Integer> originalColumns;

    @JsonCreator
    public IndexMetadata(
            @JsonProperty("id") long id,
            @JsonProperty("schemaId") long schemaId,
            @JsonProperty("databaseId") long databaseId,
            @JsonProperty("name") String name,
            @JsonProperty("owner") int owner,
            @JsonProperty("indexTableId") long indexTableId,
            @JsonProperty("primaryTableId") long primaryTableId,
            @JsonProperty("indexItems") List<IndexItem> indexItems,
            @JsonProperty("originalColumns") List<Integer> originalColumns) {
        this.id = id;
        this.schemaId = schemaId;
        this.databaseId = databaseId;
        this.name = name;
        this.owner = owner;
        this.indexTableId = indexTableId;
        this.primaryTableId = primaryTableId;
        this.indexItems = indexItems != null ? Collections.unmodifiableList(new ArrayList<>(indexItems)) : Collections.emptyList();
        this.originalColumns = originalColumns != null
                ? Collections.unmodifiableList(new ArrayList<>(originalColumns))
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

    @Override
    public int getOwner() {
        return owner;
    }

    public long getIndexTableId() {
        return indexTableId;
    }

    public long getPrimaryTableId() {
        return primaryTableId;
    }

    public List<IndexItem> getIndexItems() {
        return indexItems;
    }

    public List<Integer> getOriginalColumns() {
        return originalColumns;
    }

    @Override
    @JsonIgnore
    public List<Long> getDependentRelations() {
        return Collections.emptyList();
    }

    @Override
    public ObjectKind kind() {
        return ObjectKind.INDEX;
    }

    @Override
    public IndexMetadata withId(long newId) {
        return new IndexMetadata(newId, schemaId, databaseId, name, owner, indexTableId, primaryTableId,
                indexItems, originalColumns);
    }

    public IndexMetadata withIndexTableId(long newIndexTableId) {
        return new IndexMetadata(id, schemaId, databaseId, name, owner, newIndexTableId, primaryTableId,
                indexItems, originalColumns);
    }

    public IndexMetadata withName(String newName) {
        return new IndexMetadata(id, schemaId, databaseId, newName, owner, indexTableId, primaryTableId,
                indexItems, originalColumns);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        IndexMetadata that = (IndexMetadata) o;
        return id == that.id && schemaId == that.schemaId && databaseId == that.databaseId
                && owner == that.owner && indexTableId == that.indexTableId
                && primaryTableId == that.primaryTableId
                && Objects.equals(name, that.name)
                && indexItems.equals(that.indexItems)
                && originalColumns.equals(that.originalColumns);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, indexTableId, primaryTableId);
    }

    @Override
    public String toString() {
        return "IndexMetadata{id=" + id + ", name='" + name + "', primaryTable=" + primaryTableId
                + ", indexTable=" + indexTableId + '}';
    }

    /**
     * Index key expression. Only plain column references into the primary table are
     * supported.
     */
    public static class IndexItem {
        private final int inputRef;
        private final String returnType;

        @JsonCreator
        public IndexItem(
                @JsonProperty("inputRef") int inputRef,
                @JsonProperty("returnType") String returnType) {
            this.inputRef = inputRef;
            this.returnType = returnType;
        }

        public int getInputRef() {
            return inputRef;
        }

        public String getReturnType() {
            return returnType;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            IndexItem that = (IndexItem) o;
            return inputRef == that.inputRef && Objects.equals(returnType, that.returnType);
        }

        @Override
        public int hashCode() {
            return Objects.hash(inputRef, returnType);
        }

        @Override
        public String toString() {
            return "$" + inputRef;
        }
    }
}
