package com.geico.poc.streamcatalog.manager;

import com.geico.poc.streamcatalog.catalog.ObjectKind;
import com.geico.poc.streamcatalog.catalog.TableMetadata;
import com.geico.poc.streamcatalog.catalog.ViewMetadata;
import com.geico.poc.streamcatalog.error.CatalogInconsistentException;
import com.geico.poc.streamcatalog.error.DependencyViolationException;
import com.geico.poc.streamcatalog.error.StoreUnavailableException;
import com.geico.poc.streamcatalog.notification.CatalogSubscription;
import com.geico.poc.streamcatalog.notification.NotificationBroadcaster;
import com.geico.poc.streamcatalog.notification.SubscriptionLaggedException;
import com.geico.poc.streamcatalog.store.CatalogKeys;
import com.geico.poc.streamcatalog.store.CatalogStore;
import com.geico.poc.streamcatalog.store.InMemoryCatalogStore;
import org.junit.jupiter.api.Test;

import java.util.Collections;

import static com.geico.poc.streamcatalog.manager.CatalogFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Restart and commit-failure behavior: what survives, what is never reissued, and what is
 * never half-applied.
 */
public class CatalogRecoveryTest {

    // ==================== Restart ====================

    @Test
    public void testRestartRecoversObjectsAndVersion() {
        InMemoryCatalogStore store = new InMemoryCatalogStore();
        CatalogManager first = newManager(store);
        TableMetadata t = createConnectorTable(first, "s", "v int");
        long version = first.currentVersion();

        CatalogManager second = newManager(store);

        assertEquals(version, second.currentVersion(), "Bootstrap must not run again on a non-empty catalog");
        assertEquals(t, second.snapshot().getTable(t.getId()).get());
        assertTrue(second.snapshot().getSource(t.getAssociatedSourceId().getAsLong()).isPresent());
    }

    @Test
    public void testIdsOfDroppedObjectsNotReissuedAfterRestart() {
        InMemoryCatalogStore store = new InMemoryCatalogStore();
        CatalogManager first = newManager(store);
        TableMetadata a = createTable(first, "a", "id int pk");
        TableMetadata b = createTable(first, "b", "id int pk");
        first.dropTable(b.getId());
        first.dropTable(a.getId());

        CatalogManager second = newManager(store);
        TableMetadata c = createTable(second, "c", "id int pk");

        assertTrue(c.getId() > b.getId(), "Id " + c.getId() + " reissued after restart");
    }

    @Test
    public void testDependencyGraphRebuiltOnRestart() {
        InMemoryCatalogStore store = new InMemoryCatalogStore();
        CatalogManager first = newManager(store);
        TableMetadata t = createTable(first, "t", "id int pk");
        ViewMetadata v = first.createView(t.getDatabaseId(), t.getSchemaId(), "v",
                Collections.<String>emptyList(), "SELECT id FROM t", OWNER);

        CatalogManager second = newManager(store);

        assertEquals(Collections.singleton(v.getId()), second.dependentsOf(t.getId()));
        assertThrows(DependencyViolationException.class, () -> second.dropTable(t.getId()));
    }

    @Test
    public void testSubscribersBeforeRecoveredVersionMustResync() {
        InMemoryCatalogStore store = new InMemoryCatalogStore();
        CatalogManager first = newManager(store);
        createTable(first, "t", "id int pk");

        NotificationBroadcaster broadcaster = new NotificationBroadcaster(16);
        CatalogManager second = newManager(store, broadcaster);

        assertThrows(SubscriptionLaggedException.class, () -> broadcaster.subscribe(0));
        CatalogSubscription subscription = broadcaster.subscribe(second.currentVersion());
        assertFalse(subscription.isLagged());
        subscription.close();
    }

    @Test
    public void testDanglingAssociatedSourceDetectedOnRecovery() {
        InMemoryCatalogStore store = new InMemoryCatalogStore();
        CatalogManager first = newManager(store);
        TableMetadata t = createConnectorTable(first, "s", "v int");

        store.commit(Collections.singletonList(CatalogStore.Write.delete(
                CatalogKeys.encodeObjectKey(ObjectKind.SOURCE, t.getAssociatedSourceId().getAsLong()))));

        assertThrows(CatalogInconsistentException.class, () -> newManager(store));
    }

    // ==================== Commit failures ====================

    @Test
    public void testFailedCommitLeavesNoTrace() {
        FailingCatalogStore store = new FailingCatalogStore();
        NotificationBroadcaster broadcaster = new NotificationBroadcaster(16);
        CatalogManager manager = newManager(store, broadcaster);
        long version = manager.currentVersion();
        int objects = manager.snapshot().size();

        store.failNextCommits(1);
        StoreUnavailableException e = assertThrows(StoreUnavailableException.class,
                () -> createConnectorTable(manager, "s", "v int"));

        assertTrue(e.isRetryable());
        assertEquals(version, manager.currentVersion());
        assertEquals(version, broadcaster.currentVersion(), "Nothing may be broadcast for a failed commit");
        assertEquals(objects, manager.snapshot().size());
        assertTrue(manager.snapshot().sources().isEmpty());

        TableMetadata retried = createConnectorTable(manager, "s", "v int");
        assertEquals(version + 1, manager.currentVersion());
        assertTrue(manager.snapshot().getSource(retried.getAssociatedSourceId().getAsLong()).isPresent());
    }

    @Test
    public void testFailedDropKeepsBothHalvesOfCoupledTable() {
        FailingCatalogStore store = new FailingCatalogStore();
        CatalogManager manager = newManager(store);
        TableMetadata t = createConnectorTable(manager, "s", "v int");

        store.failNextCommits(1);
        assertThrows(StoreUnavailableException.class, () -> manager.dropTable(t.getId()));

        assertTrue(manager.snapshot().getTable(t.getId()).isPresent());
        assertTrue(manager.snapshot().getSource(t.getAssociatedSourceId().getAsLong()).isPresent());

        CatalogManager restarted = newManager(store);
        assertTrue(restarted.snapshot().getTable(t.getId()).isPresent());
        assertTrue(restarted.snapshot().getSource(t.getAssociatedSourceId().getAsLong()).isPresent());
    }

    @Test
    public void testFailedAlterDoesNotConsumeVersion() {
        FailingCatalogStore store = new FailingCatalogStore();
        CatalogManager manager = newManager(store);
        TableMetadata t = createTable(manager, "t", "id int pk");

        store.failNextCommits(1);
        assertThrows(StoreUnavailableException.class, () -> manager.alterTableColumns(t.getId(), 0,
                Collections.singletonList(ColumnChange.add("a", "int"))));

        TableMetadata altered = manager.alterTableColumns(t.getId(), 0,
                Collections.singletonList(ColumnChange.add("a", "int")));
        assertEquals(1, altered.getVersion().get().getVersion());
    }
}
