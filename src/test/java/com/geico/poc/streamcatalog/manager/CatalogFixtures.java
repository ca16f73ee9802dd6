package com.geico.poc.streamcatalog.manager;

import com.geico.poc.streamcatalog.catalog.ColumnMetadata;
import com.geico.poc.streamcatalog.catalog.ColumnOrder;
import com.geico.poc.streamcatalog.catalog.DatabaseMetadata;
import com.geico.poc.streamcatalog.catalog.SchemaMetadata;
import com.geico.poc.streamcatalog.catalog.TableMetadata;
import com.geico.poc.streamcatalog.config.StreamCatalogConfig;
import com.geico.poc.streamcatalog.notification.NotificationBroadcaster;
import com.geico.poc.streamcatalog.sql.ViewQueryAnalyzer;
import com.geico.poc.streamcatalog.store.CatalogStore;
import com.geico.poc.streamcatalog.store.InMemoryCatalogStore;

import java.util.ArrayList;
import java.util.List;

/**
 * Builders for catalog managers and table requests used across the manager tests.
 */
public final class CatalogFixtures {

    public static final String DEFAULT_DATABASE = "dev";
    public static final String PUBLIC_SCHEMA = "public";
    public static final int OWNER = 1;

    private CatalogFixtures() {
    }

    public static CatalogManager newManager() {
        return newManager(new InMemoryCatalogStore());
    }

    public static CatalogManager newManager(CatalogStore store) {
        return newManager(store, new NotificationBroadcaster(1024));
    }

    public static CatalogManager newManager(CatalogStore store, NotificationBroadcaster broadcaster) {
        CatalogManager manager = new CatalogManager(store, broadcaster, new ViewQueryAnalyzer(), new StreamCatalogConfig());
        manager.initialize();
        return manager;
    }

    public static DatabaseMetadata defaultDatabase(CatalogManager manager) {
        return manager.snapshot().findDatabase(DEFAULT_DATABASE)
                .orElseThrow(() -> new AssertionError("default database missing"));
    }

    public static SchemaMetadata publicSchema(CatalogManager manager) {
        DatabaseMetadata database = defaultDatabase(manager);
        return manager.snapshot().findSchema(database.getId(), PUBLIC_SCHEMA)
                .orElseThrow(() -> new AssertionError("public schema missing"));
    }

    /**
     * Table request in the public schema. Column specs are {@code "name type"}; a spec ending in
     * {@code " pk"} joins the primary key.
     */
    public static TableMetadata.Builder tableRequest(CatalogManager manager, String name, String... columnSpecs) {
        SchemaMetadata schema = publicSchema(manager);
        List<ColumnMetadata> columns = new ArrayList<>();
        List<ColumnOrder> pk = new ArrayList<>();
        for (String spec : columnSpecs) {
            String[] parts = spec.trim().split("\\s+");
            if (parts.length > 2 && "pk".equalsIgnoreCase(parts[2])) {
                pk.add(ColumnOrder.asc(columns.size()));
            }
            columns.add(ColumnMetadata.of(parts[0], parts[1]));
        }
        return TableMetadata.builder()
                .schemaId(schema.getId())
                .databaseId(schema.getDatabaseId())
                .name(name)
                .columns(columns)
                .pk(pk)
                .owner(OWNER);
    }

    public static TableMetadata createTable(CatalogManager manager, String name, String... columnSpecs) {
        return manager.createTable(tableRequest(manager, name, columnSpecs).build());
    }

    public static TableMetadata createConnectorTable(CatalogManager manager, String name, String... columnSpecs) {
        return manager.createTable(tableRequest(manager, name, columnSpecs)
                .property("connector", "kafka")
                .property("topic", name)
                .property("format", "json")
                .build());
    }
}
