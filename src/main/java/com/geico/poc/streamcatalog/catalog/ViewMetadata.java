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
 * A named SQL query. Nothing is materialized; the query is expanded when the view is read.
 */
public class ViewMetadata implements SchemaScopedObject {

    private final long id;
    private final long schemaId;
    private final long databaseId;
    private final String name;
    private final int owner;
    private final Map<String, String> properties;
    private final String sql;
    private final List<Long> dependentRelations;
    private final List<Field> columns;

    @JsonCreator
    public ViewMetadata(
            @JsonProperty("id") long id,
            @JsonProperty("schemaId") long schemaId,
            @JsonProperty("databaseId") long databaseId,
            @JsonProperty("name") String name,
            @JsonProperty("owner") int owner,
            @JsonProperty("properties") Map<String, String> properties,
            @JsonProperty("sql") String sql,
            @JsonProperty("dependentRelations") List<Long> dependentRelations,
            @JsonProperty("columns") List<Field> columns) {
        this.id = id;
        this.schemaId = schemaId;
        this.databaseId = databaseId;
        this.name = name;
        this.owner = owner;
        this.properties = properties != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(properties))
                : Collections.emptyMap();
        this.sql = sql;
        this.dependentRelations = dependentRelations != null
                ? Collections.unmodifiableList(new ArrayList<>(dependentRelations))
                : Collections.emptyList();
        this.columns = columns != null ? Collections.unmodifiableList(new ArrayList<>(columns)) : Collections.emptyList();
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

    public Map<String, String> getProperties() {
        return properties;
    }

    public String getSql() {
        return sql;
    }

    @Override
    public List<Long> getDependentRelations() {
        return dependentRelations;
    }

    public List<Field> getColumns() {
        return columns;
    }

    @Override
    public ObjectKind kind() {
        return ObjectKind.VIEW;
    }

    @Override
    public ViewMetadata withId(long newId) {
        return new ViewMetadata(newId, schemaId, databaseId, name, owner, properties, sql,
                dependentRelations, columns);
    }

    public ViewMetadata withName(String newName) {
        return new ViewMetadata(id, schemaId, databaseId, newName, owner, properties, sql,
                dependentRelations, columns);
    }

    public String createStatement() {
        StringBuilder sb = new StringBuilder("CREATE VIEW ").append(name);
        if (!columns.isEmpty()) {
            sb.append(" (");
            for (int i = 0; i < columns.size(); i++) {
                if (i > 0) {
                    sb.append(", ");
                }
                sb.append(columns.get(i).getName());
            }
            sb.append(")");
        }
        return sb.append(" AS ").append(sql).toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ViewMetadata that = (ViewMetadata) o;
        return id == that.id && schemaId == that.schemaId && databaseId == that.databaseId
                && owner == that.owner
                && Objects.equals(name, that.name)
                && properties.equals(that.properties)
                && Objects.equals(sql, that.sql)
                && dependentRelations.equals(that.dependentRelations)
                && columns.equals(that.columns);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, sql);
    }

    @Override
    public String toString() {
        return "ViewMetadata{id=" + id + ", name='" + name + "', columns=" + columns
                + ", dependentRelations=" + dependentRelations + '}';
    }

    /**
     * Output column of a view.
     */
    public static class Field {
        private final String name;
        private final String dataType;

        @JsonCreator
        public Field(
                @JsonProperty("name") String name,
                @JsonProperty("dataType") String dataType) {
            this.name = name;
            this.dataType = dataType;
        }

        public String getName() {
            return name;
        }

        public String getDataType() {
            return dataType;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Field field = (Field) o;
            return Objects.equals(name, field.name) && Objects.equals(dataType, field.dataType);
        }

        @Override
        public int hashCode() {
            return Objects.hash(name, dataType);
        }

        @Override
        public String toString() {
            return name + " " + dataType;
        }
    }
}
