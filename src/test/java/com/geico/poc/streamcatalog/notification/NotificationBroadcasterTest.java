package com.geico.poc.streamcatalog.notification;

import com.geico.poc.streamcatalog.catalog.DatabaseMetadata;
import com.geico.poc.streamcatalog.catalog.ObjectKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

public class NotificationBroadcasterTest {

    private static List<CatalogDelta> createDatabase(long id) {
        return Collections.singletonList(CatalogDelta.created(new DatabaseMetadata(id, "db" + id, 1)));
    }

    private static void publishDatabases(NotificationBroadcaster broadcaster, int count) {
        for (int i = 0; i < count; i++) {
            broadcaster.publish(createDatabase(broadcaster.currentVersion() + 1));
        }
    }

    private static List<Long> versions(List<CatalogNotification> notifications) {
        List<Long> versions = new ArrayList<>();
        for (CatalogNotification notification : notifications) {
            versions.add(notification.getVersion());
        }
        return versions;
    }

    // ==================== Versioning ====================

    @Test
    public void testPublishStampsConsecutiveVersions() {
        NotificationBroadcaster broadcaster = new NotificationBroadcaster(8);

        assertEquals(1, broadcaster.publish(createDatabase(1)).getVersion());
        assertEquals(2, broadcaster.publish(createDatabase(2)).getVersion());
        assertEquals(2, broadcaster.currentVersion());
    }

    @Test
    public void testResetContinuesFromRecoveredVersion() {
        NotificationBroadcaster broadcaster = new NotificationBroadcaster(8);
        broadcaster.reset(41);

        assertEquals(42, broadcaster.publish(createDatabase(1)).getVersion());
    }

    // ==================== Replay and ordering ====================

    @Test
    public void testResumeDeliversExactSuffix() throws Exception {
        NotificationBroadcaster broadcaster = new NotificationBroadcaster(64);
        publishDatabases(broadcaster, 5);

        CatalogSubscription subscription = broadcaster.subscribe(2);
        publishDatabases(broadcaster, 3);

        List<CatalogNotification> received = new ArrayList<>();
        CatalogNotification next;
        while ((next = subscription.poll(100, TimeUnit.MILLISECONDS)) != null) {
            received.add(next);
        }
        List<Long> expected = new ArrayList<>();
        for (long v = 3; v <= 8; v++) {
            expected.add(v);
        }
        assertEquals(expected, versions(received));
        assertEquals(8, subscription.getLastDeliveredVersion());
        subscription.close();
    }

    @Test
    public void testReconnectAfterDisconnectHasNoGap() throws Exception {
        NotificationBroadcaster broadcaster = new NotificationBroadcaster(64);
        CatalogSubscription first = broadcaster.subscribe(0);
        publishDatabases(broadcaster, 3);
        assertEquals(1, first.poll(1, TimeUnit.SECONDS).getVersion());
        long resumeFrom = first.getLastDeliveredVersion();
        first.close();

        publishDatabases(broadcaster, 2);
        CatalogSubscription second = broadcaster.subscribe(resumeFrom);

        List<Long> expected = new ArrayList<>();
        for (long v = 2; v <= 5; v++) {
            expected.add(v);
        }
        assertEquals(expected, versions(second.drain(100)));
        second.close();
    }

    @Test
    public void testFutureVersionRejected() {
        NotificationBroadcaster broadcaster = new NotificationBroadcaster(8);
        publishDatabases(broadcaster, 1);

        assertThrows(IllegalArgumentException.class, () -> broadcaster.subscribe(5));
    }

    // ==================== Slow subscribers ====================

    @Test
    public void testOverflowingSubscriberLagsWithoutBlockingPublisher() throws Exception {
        NotificationBroadcaster broadcaster = new NotificationBroadcaster(2);
        CatalogSubscription slow = broadcaster.subscribe(0);
        CatalogSubscription fast = broadcaster.subscribe(0);

        broadcaster.publish(createDatabase(1));
        assertEquals(1, fast.poll(1, TimeUnit.SECONDS).getVersion());
        broadcaster.publish(createDatabase(2));
        assertEquals(2, fast.poll(1, TimeUnit.SECONDS).getVersion());
        broadcaster.publish(createDatabase(3));

        assertTrue(slow.isLagged());
        assertFalse(fast.isLagged());
        // The lagged subscriber no longer receives publishes
        assertEquals(1, broadcaster.subscriberCount());
        SubscriptionLaggedException e = assertThrows(SubscriptionLaggedException.class,
                () -> slow.poll(10, TimeUnit.MILLISECONDS));
        assertEquals(0, e.getLastDeliveredVersion());

        CatalogSubscription resubscribed = broadcaster.subscribe(0);
        assertEquals(3, resubscribed.drain(10).size());
        fast.close();
        resubscribed.close();
        slow.close();
        assertEquals(0, broadcaster.subscriberCount());
    }

    @Test
    public void testClosedSubscriptionIsUnregistered() {
        NotificationBroadcaster broadcaster = new NotificationBroadcaster(8);
        CatalogSubscription subscription = broadcaster.subscribe(0);
        assertEquals(1, broadcaster.subscriberCount());

        subscription.close();

        assertEquals(0, broadcaster.subscriberCount());
        assertThrows(IllegalStateException.class, () -> subscription.drain(1));
        broadcaster.publish(createDatabase(1));
    }

    // ==================== Long poll ====================

    @Test
    @Timeout(value = 10, unit = TimeUnit.SECONDS)
    public void testAwaitWakesOnPublish() throws Exception {
        NotificationBroadcaster broadcaster = new NotificationBroadcaster(8);
        CountDownLatch waiting = new CountDownLatch(1);
        AtomicReference<List<CatalogNotification>> result = new AtomicReference<>();

        Thread poller = new Thread(() -> {
            try {
                waiting.countDown();
                result.set(broadcaster.awaitNotificationsSince(0, 5000));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        poller.start();
        waiting.await();
        broadcaster.publish(createDatabase(1));
        poller.join(5000);

        assertNotNull(result.get());
        assertEquals(1, result.get().size());
        assertEquals(ObjectKind.DATABASE, result.get().get(0).getDeltas().get(0).getKind());
    }

    @Test
    public void testAwaitTimesOutEmpty() throws Exception {
        NotificationBroadcaster broadcaster = new NotificationBroadcaster(8);
        assertTrue(broadcaster.awaitNotificationsSince(0, 50).isEmpty());
    }
}
