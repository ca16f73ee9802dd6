package com.geico.poc.streamcatalog.manager;

import com.geico.poc.streamcatalog.catalog.SchemaMetadata;
import com.geico.poc.streamcatalog.catalog.TableMetadata;
import com.geico.poc.streamcatalog.catalog.ViewMetadata;
import com.geico.poc.streamcatalog.error.CatalogException;
import com.geico.poc.streamcatalog.error.DependencyViolationException;
import com.geico.poc.streamcatalog.error.InvalidDefinitionException;
import com.geico.poc.streamcatalog.error.VersionConflictException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.geico.poc.streamcatalog.manager.CatalogFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end DDL scenarios against a single catalog manager.
 */
public class CatalogScenarioTest {

    private CatalogManager manager;
    private SchemaMetadata schema;

    @BeforeEach
    public void setUp() {
        manager = newManager();
        schema = publicSchema(manager);
    }

    // ========================================
    // View column names must match the query
    // ========================================

    @Test
    public void testViewColumnNamesMustMatchQueryArity() {
        InvalidDefinitionException e = assertThrows(InvalidDefinitionException.class,
                () -> manager.createView(schema.getDatabaseId(), schema.getId(), "v2", Arrays.asList("a", "b"),
                        "SELECT 1", OWNER));
        assertTrue(e.getMessage().contains("2 column names"), e.getMessage());
        assertFalse(manager.snapshot().findRelation(schema.getId(), "v2").isPresent());

        ViewMetadata v2 = manager.createView(schema.getDatabaseId(), schema.getId(), "v2", Arrays.asList("a", "b"),
                "SELECT 1, 2", OWNER);

        assertEquals(2, v2.getColumns().size());
        assertEquals("a", v2.getColumns().get(0).getName());
        assertEquals("b", v2.getColumns().get(1).getName());
        assertEquals("integer", v2.getColumns().get(0).getDataType());
        assertTrue(v2.getDependentRelations().isEmpty());
        assertEquals("CREATE VIEW v2 (a, b) AS SELECT 1, 2", v2.createStatement());
    }

    @Test
    public void testAnonymousViewColumnsMustBeNamed() {
        assertThrows(InvalidDefinitionException.class, () -> manager.createView(schema.getDatabaseId(),
                schema.getId(), "v", Collections.<String>emptyList(), "SELECT 1, 2", OWNER));
    }

    // ========================================
    // Drop order follows dependencies
    // ========================================

    @Test
    public void testTableCannotBeDroppedWhileViewReadsIt() {
        TableMetadata t = createTable(manager, "t", "id int pk", "name varchar");
        ViewMetadata v3 = manager.createView(schema.getDatabaseId(), schema.getId(), "v3",
                Collections.<String>emptyList(), "SELECT * FROM t WHERE id > 10", OWNER);
        assertEquals(Collections.singletonList(t.getId()), v3.getDependentRelations());
        assertEquals(2, v3.getColumns().size(), "SELECT * expands to the visible columns");

        DependencyViolationException e = assertThrows(DependencyViolationException.class,
                () -> manager.dropTable(t.getId()));
        assertEquals(Collections.singletonList(v3.getId()), e.getDependentIds());
        assertTrue(e.getMessage().contains("v3"), e.getMessage());

        manager.dropView(v3.getId());
        manager.dropTable(t.getId());
        assertFalse(manager.snapshot().getTable(t.getId()).isPresent());
    }

    // ========================================
    // Racing ALTERs
    // ========================================

    @Test
    @Timeout(value = 30, unit = TimeUnit.SECONDS)
    public void testConcurrentAltersWithSameVersionHaveOneWinner() throws Exception {
        TableMetadata t = createTable(manager, "t", "id int pk");
        long version = t.getVersion().get().getVersion();

        int callers = 8;
        ExecutorService executor = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<TableMetadata>> futures = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                String column = "c" + i;
                futures.add(executor.submit(new Callable<TableMetadata>() {
                    @Override
                    public TableMetadata call() throws Exception {
                        start.await();
                        return manager.alterTableColumns(t.getId(), version,
                                Collections.singletonList(ColumnChange.add(column, "int")));
                    }
                }));
            }
            start.countDown();

            int winners = 0;
            int conflicts = 0;
            for (Future<TableMetadata> future : futures) {
                try {
                    TableMetadata altered = future.get(20, TimeUnit.SECONDS);
                    assertEquals(version + 1, altered.getVersion().get().getVersion());
                    winners++;
                } catch (ExecutionException e) {
                    assertTrue(e.getCause() instanceof VersionConflictException, "Unexpected " + e.getCause());
                    conflicts++;
                }
            }
            assertEquals(1, winners);
            assertEquals(callers - 1, conflicts);
            assertEquals(version + 1, manager.snapshot().getTable(t.getId()).get().getVersion().get().getVersion());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @Timeout(value = 30, unit = TimeUnit.SECONDS)
    public void testConcurrentCreatesGetDistinctIdsAndContiguousVersions() throws Exception {
        int callers = 16;
        long startVersion = manager.currentVersion();
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<TableMetadata>> futures = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                String name = "t" + i;
                futures.add(executor.submit(new Callable<TableMetadata>() {
                    @Override
                    public TableMetadata call() throws Exception {
                        start.await();
                        return createConnectorTable(manager, name, "v int");
                    }
                }));
            }
            start.countDown();

            Set<Long> ids = new HashSet<>();
            for (Future<TableMetadata> future : futures) {
                TableMetadata t = future.get(20, TimeUnit.SECONDS);
                assertTrue(ids.add(t.getId()));
                assertTrue(ids.add(t.getAssociatedSourceId().getAsLong()));
            }
            assertEquals(startVersion + callers, manager.currentVersion());
            assertEquals(callers, manager.snapshot().sources().size());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    public void testRejectionsCarryTheirKind() {
        TableMetadata t = createTable(manager, "t", "id int pk");
        manager.createView(schema.getDatabaseId(), schema.getId(), "v", Collections.<String>emptyList(),
                "SELECT id FROM t", OWNER);

        CatalogException e = assertThrows(CatalogException.class, () -> manager.dropTable(t.getId()));
        assertEquals(CatalogException.ErrorKind.DEPENDENCY_VIOLATION, e.getErrorKind());
        assertFalse(e.isRetryable());
    }
}
