package com.geico.poc.streamcatalog.notification;

import com.geico.poc.streamcatalog.config.StreamCatalogConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Stamps committed catalog changes with the global catalog version and fans them out.
 *
 * Every published notification is appended to an in-memory log, so a subscriber can resume
 * from any version this process has produced. Publishing never waits on a subscriber.
 *
 * The catalog manager publishes from inside its writer lock, which is what keeps versions
 * in commit order.
 */
@Component
public class NotificationBroadcaster {

    private static final Logger log = LoggerFactory.getLogger(NotificationBroadcaster.class);

    private final int queueCapacity;
    private final Object monitor = new Object();
    private final List<CatalogNotification> notificationLog = new ArrayList<>();
    private final List<CatalogSubscription> subscriptions = new CopyOnWriteArrayList<>();
    private final AtomicLong subscriptionIds = new AtomicLong();

    // Versions up to and including baseVersion happened before this process started
    private long baseVersion = 0;
    private long currentVersion = 0;

    @Autowired
    public NotificationBroadcaster(StreamCatalogConfig config) {
        this(config.getNotification().getSubscriberQueueCapacity());
    }

    public NotificationBroadcaster(int queueCapacity) {
        if (queueCapacity <= 0) {
            throw new IllegalArgumentException("Subscriber queue capacity must be positive: " + queueCapacity);
        }
        this.queueCapacity = queueCapacity;
    }

    /**
     * Restart the version sequence after recovery. Existing subscriptions are closed.
     */
    public void reset(long recoveredVersion) {
        synchronized (monitor) {
            notificationLog.clear();
            baseVersion = recoveredVersion;
            currentVersion = recoveredVersion;
            for (CatalogSubscription subscription : subscriptions) {
                subscription.close();
            }
            monitor.notifyAll();
        }
        log.info("Notification log starts after catalog version {}", recoveredVersion);
    }

    public long currentVersion() {
        synchronized (monitor) {
            return currentVersion;
        }
    }

    /**
     * Stamp the deltas of one committed transaction with the next catalog version and deliver
     * them.
     */
    public CatalogNotification publish(List<CatalogDelta> deltas) {
        CatalogNotification notification;
        synchronized (monitor) {
            notification = new CatalogNotification(currentVersion + 1, deltas);
            notificationLog.add(notification);
            currentVersion = notification.getVersion();
            for (CatalogSubscription subscription : subscriptions) {
                subscription.offer(notification);
            }
            monitor.notifyAll();
        }
        log.debug("Published catalog version {} ({} deltas) to {} subscribers",
                notification.getVersion(), deltas.size(), subscriptions.size());
        return notification;
    }

    /**
     * Subscribe to every notification after {@code fromVersion}. Missed notifications are
     * replayed first, then live ones follow without gaps.
     *
     * @throws IllegalArgumentException if {@code fromVersion} is newer than the current version
     * @throws SubscriptionLaggedException if {@code fromVersion} predates this process's log
     */
    public CatalogSubscription subscribe(long fromVersion) {
        synchronized (monitor) {
            List<CatalogNotification> replay = since(fromVersion);
            CatalogSubscription subscription = new CatalogSubscription(
                    subscriptionIds.incrementAndGet(), this, fromVersion, replay, queueCapacity);
            subscriptions.add(subscription);
            log.info("Subscription {} registered from version {} ({} notifications to replay)",
                    subscription.getId(), fromVersion, replay.size());
            return subscription;
        }
    }

    /**
     * Notifications after {@code fromVersion}, waiting up to {@code timeoutMs} for at least one
     * to arrive when the caller is already up to date.
     */
    public List<CatalogNotification> awaitNotificationsSince(long fromVersion, long timeoutMs)
            throws InterruptedException {
        long deadline = System.currentTimeMillis() + timeoutMs;
        synchronized (monitor) {
            List<CatalogNotification> result = since(fromVersion);
            while (result.isEmpty()) {
                long remaining = deadline - System.currentTimeMillis();
                if (remaining <= 0) {
                    break;
                }
                monitor.wait(remaining);
                result = since(fromVersion);
            }
            return result;
        }
    }

    // Caller holds monitor
    private List<CatalogNotification> since(long fromVersion) {
        if (fromVersion > currentVersion) {
            throw new IllegalArgumentException("Version " + fromVersion
                    + " is newer than the current catalog version " + currentVersion);
        }
        if (fromVersion < baseVersion) {
            throw new SubscriptionLaggedException("Version " + fromVersion
                    + " predates the retained notification log (starts after " + baseVersion + ")",
                    fromVersion);
        }
        int start = (int) (fromVersion - baseVersion);
        if (start == notificationLog.size()) {
            return Collections.emptyList();
        }
        return new ArrayList<>(notificationLog.subList(start, notificationLog.size()));
    }

    void unsubscribe(CatalogSubscription subscription) {
        if (subscriptions.remove(subscription)) {
            log.info("Subscription {} closed at version {}", subscription.getId(),
                    subscription.getLastDeliveredVersion());
        }
    }

    public int subscriberCount() {
        return subscriptions.size();
    }
}
