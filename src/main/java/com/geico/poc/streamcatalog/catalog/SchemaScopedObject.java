package com.geico.poc.streamcatalog.catalog;

import java.util.List;

/**
 * A catalog object living inside a schema: relations and functions.
 */
public interface SchemaScopedObject extends CatalogObject {

    long getSchemaId();

    long getDatabaseId();

    /**
     * Ids of the relations this object reads from. Empty for objects that read nothing.
     */
    List<Long> getDependentRelations();
}
