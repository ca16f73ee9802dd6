package com.geico.poc.streamcatalog.catalog;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Common view over every catalog object.
 *
 * Objects are immutable; a mutation produces a new instance with the same id.
 * The JSON form carries a {@code kind} discriminator so stored values and
 * notification payloads can be decoded without knowing the key.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
    @JsonSubTypes.Type(value = DatabaseMetadata.class, name = "DATABASE"),
    @JsonSubTypes.Type(value = SchemaMetadata.class, name = "SCHEMA"),
    @JsonSubTypes.Type(value = TableMetadata.class, name = "TABLE"),
    @JsonSubTypes.Type(value = SourceMetadata.class, name = "SOURCE"),
    @JsonSubTypes.Type(value = SinkMetadata.class, name = "SINK"),
    @JsonSubTypes.Type(value = IndexMetadata.class, name = "INDEX"),
    @JsonSubTypes.Type(value = ViewMetadata.class, name = "VIEW"),
    @JsonSubTypes.Type(value = FunctionMetadata.class, name = "FUNCTION")
})
public interface CatalogObject {

    long getId();

    String getName();

    int getOwner();

    ObjectKind kind();

    /**
     * Same object with a different id. Used when a request description is turned into a
     * committed object.
     */
    CatalogObject withId(long id);
}
