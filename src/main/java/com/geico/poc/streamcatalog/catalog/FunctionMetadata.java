package com.geico.poc.streamcatalog.catalog;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * User-defined function. Functions are identified within a schema by name plus argument
 * types, so overloads may coexist.
 */
public class FunctionMetadata implements SchemaScopedObject {

    private final long id;
    private final long schemaId;
    private final long databaseId;
    private final String name;
    private final List<String> argTypes;
    private final String returnType;
    private final String language;
    private final String path;
    private final int owner;

    @JsonCreator
    public FunctionMetadata(
            @JsonProperty("id") long id,
            @JsonProperty("schemaId") long schemaId,
            @JsonProperty("databaseId") long databaseId,
            @JsonProperty("name") String name,
            @JsonProperty("argTypes") List<String> argTypes,
            @JsonProperty("returnType") String returnType,
            @JsonProperty("language") String language,
            @JsonProperty("path") String path,
            @JsonProperty("owner") int owner) {
        this.id = id;
        this.schemaId = schemaId;
        this.databaseId = databaseId;
        this.name = name;
        this.argTypes = argTypes != null ? Collections.unmodifiableList(new ArrayList<>(argTypes)) : Collections.emptyList();
        this.returnType = returnType;
        this.language = language;
        this.path = path;
        this.owner = owner;
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

    public List<String> getArgTypes() {
        return argTypes;
    }

    public String getReturnType() {
        return returnType;
    }

    public String getLanguage() {
        return language;
    }

    public String getPath() {
        return path;
    }

    @Override
    public int getOwner() {
        return owner;
    }

    @Override
    @JsonIgnore
    public List<Long> getDependentRelations() {
        return Collections.emptyList();
    }

    @Override
    public ObjectKind kind() {
        return ObjectKind.FUNCTION;
    }

    /**
     * {@code name(type, ...)}, the identity of the function inside its schema.
     */
    public String signature() {
        return name + "(" + String.join(", ", argTypes) + ")";
    }

    @Override
    public FunctionMetadata withId(long newId) {
        return new FunctionMetadata(newId, schemaId, databaseId, name, argTypes, returnType, language, path, owner);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FunctionMetadata that = (FunctionMetadata) o;
        return id == that.id && schemaId == that.schemaId && databaseId == that.databaseId
                && owner == that.owner
                && Objects.equals(name, that.name)
                && argTypes.equals(that.argTypes)
                && Objects.equals(returnType, that.returnType)
                && Objects.equals(language, that.language)
                && Objects.equals(path, that.path);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, argTypes);
    }

    @Override
    public String toString() {
        return "FunctionMetadata{id=" + id + ", signature=" + signature() + ", language=" + language + '}';
    }
}
