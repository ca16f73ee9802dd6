package com.geico.poc.streamcatalog.show;

import com.geico.poc.streamcatalog.catalog.IndexMetadata;
import com.geico.poc.streamcatalog.catalog.ObjectKind;
import com.geico.poc.streamcatalog.catalog.TableMetadata;
import com.geico.poc.streamcatalog.dto.CatalogResponse;
import com.geico.poc.streamcatalog.error.ObjectNotFoundException;
import com.geico.poc.streamcatalog.manager.CatalogManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static com.geico.poc.streamcatalog.manager.CatalogFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * SHOW statements against the application's catalog. The catalog is shared by every test in
 * the context, so each test works on uniquely named objects.
 */
@SpringBootTest
@ActiveProfiles("test")
public class ShowCatalogHandlerTest {

    @Autowired
    private CatalogManager catalogManager;

    @Autowired
    private ShowCatalogHandler showCatalogHandler;

    private String prefix;

    @BeforeEach
    public void setup() {
        prefix = "show_" + System.nanoTime();
    }

    private static List<Object> names(CatalogResponse response) {
        List<Object> names = new ArrayList<>();
        for (Map<String, Object> row : response.getRows()) {
            names.add(row.get("Name"));
        }
        return names;
    }

    private List<Object> show(ShowObject what) {
        return names(showCatalogHandler.show(what, null, null, prefix + "*"));
    }

    // ==================== SHOW <objects> ====================

    @Test
    public void testConnectorTableListedAsTableAndSource() {
        String name = prefix + "_s";
        TableMetadata table = createConnectorTable(catalogManager, name, "v int");

        assertEquals(Collections.singletonList(name), show(ShowObject.TABLES));
        assertEquals(Collections.singletonList(name), show(ShowObject.SOURCES));

        catalogManager.dropTable(table.getId());

        assertTrue(show(ShowObject.TABLES).isEmpty());
        assertTrue(show(ShowObject.SOURCES).isEmpty());
    }

    @Test
    public void testRowsSortedByNameWithCatalogVersion() {
        createTable(catalogManager, prefix + "_b", "id int pk");
        createTable(catalogManager, prefix + "_a", "id int pk");

        CatalogResponse response = showCatalogHandler.show(ShowObject.TABLES, null, null, prefix + "*");

        assertEquals(Arrays.asList(prefix + "_a", prefix + "_b"), names(response));
        assertEquals(Arrays.asList("Schema", "Name", "Owner", "Id"), response.getColumns());
        assertEquals("public", response.getRows().get(0).get("Schema"));
        assertEquals(2, response.getRowCount());
        assertTrue(response.getCatalogVersion() >= 2);
    }

    @Test
    public void testIndexesShowTableAndKey() {
        TableMetadata table = createTable(catalogManager, prefix + "_t", "id int pk", "email varchar");
        catalogManager.createIndex(new IndexMetadata(0, table.getSchemaId(), table.getDatabaseId(), prefix + "_idx",
                OWNER, 0, table.getId(), Collections.singletonList(new IndexMetadata.IndexItem(1, "varchar")), null),
                null);

        CatalogResponse response = showCatalogHandler.show(ShowObject.INDEXES, null, null, prefix + "*");

        assertEquals(1, response.getRowCount());
        assertEquals(table.getName(), response.getRows().get(0).get("On"));
        assertEquals("email", response.getRows().get(0).get("Key"));
        assertTrue(show(ShowObject.TABLES).contains(table.getName()));
        assertFalse(show(ShowObject.TABLES).contains(prefix + "_idx"), "Index backing tables are not tables");
    }

    @Test
    public void testDefaultDatabaseListed() {
        List<Object> databases = names(showCatalogHandler.show(ShowObject.DATABASES, null, null, null));
        assertTrue(databases.contains(DEFAULT_DATABASE));

        List<Object> schemas = names(showCatalogHandler.show(ShowObject.SCHEMAS, null, null, null));
        assertTrue(schemas.containsAll(Arrays.asList("public", "pg_catalog", "information_schema")));
    }

    @Test
    public void testUnknownSchemaRejected() {
        assertThrows(ObjectNotFoundException.class,
                () -> showCatalogHandler.show(ShowObject.TABLES, null, prefix + "_missing", null));
    }

    // ==================== SHOW COLUMNS / SHOW CREATE ====================

    @Test
    public void testShowColumnsFlagsRowId() {
        String name = prefix + "_events";
        createConnectorTable(catalogManager, name, "v int");

        CatalogResponse response = showCatalogHandler.showColumns(null, null, name);

        assertEquals(Arrays.asList("_row_id", "v"), names(response));
        assertEquals(Boolean.TRUE, response.getRows().get(0).get("Is Hidden"));
        assertEquals(Boolean.FALSE, response.getRows().get(1).get("Is Hidden"));
    }

    @Test
    public void testShowCreateView() {
        String name = prefix + "_v";
        TableMetadata table = createTable(catalogManager, prefix + "_base", "id int pk", "amount int");
        catalogManager.createView(table.getDatabaseId(), table.getSchemaId(), name, Collections.<String>emptyList(),
                "SELECT id FROM " + table.getName(), OWNER);

        CatalogResponse response = showCatalogHandler.showCreate(ObjectKind.VIEW, null, null, name);

        assertEquals("public." + name, response.getRows().get(0).get("Name"));
        assertEquals("CREATE VIEW " + name + " (id) AS SELECT id FROM " + table.getName(),
                response.getRows().get(0).get("Create Sql"));
        assertThrows(ObjectNotFoundException.class,
                () -> showCatalogHandler.showCreate(ObjectKind.TABLE, null, null, name));
    }

    @Test
    public void testShowCreateRendersTable() {
        String name = prefix + "_plain";
        createTable(catalogManager, name, "id int pk", "label varchar");

        Object sql = showCatalogHandler.showCreate(ObjectKind.TABLE, null, null, name).getRows().get(0).get("Create Sql");

        assertEquals("CREATE TABLE " + name + " (id int, label varchar, PRIMARY KEY (id))", sql);
    }

    // ==================== Patterns ====================

    @Test
    public void testMatchesPattern() {
        assertTrue(ShowCatalogHandler.matchesPattern("orders", null));
        assertTrue(ShowCatalogHandler.matchesPattern("orders", "ord*"));
        assertTrue(ShowCatalogHandler.matchesPattern("orders", "order?"));
        assertFalse(ShowCatalogHandler.matchesPattern("orders", "order"));
        assertTrue(ShowCatalogHandler.matchesPattern("a.b", "a.b"));
        assertFalse(ShowCatalogHandler.matchesPattern("axb", "a.b"));
    }
}
