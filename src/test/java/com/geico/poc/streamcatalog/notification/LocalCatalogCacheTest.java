package com.geico.poc.streamcatalog.notification;

import com.geico.poc.streamcatalog.catalog.DatabaseMetadata;
import com.geico.poc.streamcatalog.catalog.ObjectKind;
import com.geico.poc.streamcatalog.manager.CatalogManager;
import com.geico.poc.streamcatalog.manager.CatalogSnapshot;
import com.geico.poc.streamcatalog.store.InMemoryCatalogStore;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static com.geico.poc.streamcatalog.manager.CatalogFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

public class LocalCatalogCacheTest {

    private static CatalogNotification created(long version, long dbId) {
        return new CatalogNotification(version,
                Collections.singletonList(CatalogDelta.created(new DatabaseMetadata(dbId, "db" + dbId, 1))));
    }

    private static CatalogNotification dropped(long version, long dbId) {
        return new CatalogNotification(version,
                Collections.singletonList(CatalogDelta.dropped(ObjectKind.DATABASE, dbId)));
    }

    @Test
    public void testAppliesInOrderAndIgnoresRedelivery() {
        LocalCatalogCache cache = new LocalCatalogCache();

        assertEquals(LocalCatalogCache.ApplyResult.APPLIED, cache.apply(created(1, 10)));
        assertEquals(LocalCatalogCache.ApplyResult.DUPLICATE, cache.apply(created(1, 10)));
        assertEquals(LocalCatalogCache.ApplyResult.APPLIED, cache.apply(dropped(2, 10)));
        assertEquals(LocalCatalogCache.ApplyResult.DUPLICATE, cache.apply(dropped(2, 10)));

        assertEquals(2, cache.appliedVersion());
        assertFalse(cache.snapshot().getDatabase(10).isPresent());
    }

    @Test
    public void testGapRequiresResync() {
        LocalCatalogCache cache = new LocalCatalogCache();
        cache.apply(created(1, 10));

        assertEquals(LocalCatalogCache.ApplyResult.RESYNC_REQUIRED, cache.apply(created(3, 11)));
        assertTrue(cache.isResyncRequired());
        assertEquals(LocalCatalogCache.ApplyResult.RESYNC_REQUIRED, cache.apply(created(2, 12)),
                "Nothing applies until the cache is reset");

        cache.reset(CatalogSnapshot.of(3, Arrays.asList(new DatabaseMetadata(10, "db10", 1),
                new DatabaseMetadata(11, "db11", 1))));
        assertFalse(cache.isResyncRequired());
        assertEquals(LocalCatalogCache.ApplyResult.APPLIED, cache.apply(created(4, 12)));
        assertEquals(3, cache.snapshot().databases().size());
    }

    @Test
    public void testApplyAllStopsAtGap() {
        LocalCatalogCache cache = new LocalCatalogCache();
        int applied = cache.applyAll(Arrays.asList(created(1, 1), created(2, 2), created(4, 4), created(5, 5)));

        assertEquals(2, applied);
        assertEquals(2, cache.appliedVersion());
        assertTrue(cache.isResyncRequired());
    }

    @Test
    public void testCacheTracksManager() throws Exception {
        NotificationBroadcaster broadcaster = new NotificationBroadcaster(64);
        CatalogManager manager = newManager(new InMemoryCatalogStore(), broadcaster);
        LocalCatalogCache cache = new LocalCatalogCache(manager.snapshot());
        CatalogSubscription subscription = broadcaster.subscribe(cache.appliedVersion());

        createConnectorTable(manager, "s", "v int");
        createTable(manager, "t", "id int pk");
        cache.catchUp(subscription, 1000);
        while (cache.appliedVersion() < manager.currentVersion()) {
            cache.catchUp(subscription, 1000);
        }

        assertEquals(manager.currentVersion(), cache.appliedVersion());
        assertEquals(manager.snapshot().allObjects(), cache.snapshot().allObjects());
        subscription.close();
    }

    @Test
    public void testLaggedSubscriptionFlagsResync() throws Exception {
        NotificationBroadcaster broadcaster = new NotificationBroadcaster(1);
        CatalogManager manager = newManager(new InMemoryCatalogStore(), broadcaster);
        LocalCatalogCache cache = new LocalCatalogCache(manager.snapshot());
        CatalogSubscription subscription = broadcaster.subscribe(cache.appliedVersion());

        createTable(manager, "a", "id int pk");
        createTable(manager, "b", "id int pk");

        assertEquals(0, cache.catchUp(subscription, 100));
        assertTrue(cache.isResyncRequired());

        cache.reset(manager.snapshot());
        assertEquals(manager.currentVersion(), cache.appliedVersion());
    }
}
