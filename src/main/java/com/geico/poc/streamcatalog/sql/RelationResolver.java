package com.geico.poc.streamcatalog.sql;

import com.geico.poc.streamcatalog.catalog.SchemaScopedObject;

import java.util.List;

/**
 * Resolves a possibly qualified relation name ({@code rel}, {@code schema.rel} or
 * {@code database.schema.rel}) in the scope a view is being created in.
 */
@FunctionalInterface
public interface RelationResolver {

    /**
     * @throws com.geico.poc.streamcatalog.error.ObjectNotFoundException if no relation has that name
     */
    SchemaScopedObject resolve(List<String> qualifiedName);
}
