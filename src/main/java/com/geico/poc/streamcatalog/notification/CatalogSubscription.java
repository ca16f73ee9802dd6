package com.geico.poc.streamcatalog.notification;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Ordered stream of catalog notifications for one subscriber.
 *
 * Notifications the subscriber missed before subscribing are held in a replay backlog and
 * always delivered first; live notifications go through a bounded queue that the writer
 * fills without blocking. When that queue overflows the subscription is marked lagged and
 * every further read throws {@link SubscriptionLaggedException}. A lagged subscription is
 * removed from the broadcaster at once.
 *
 * A subscription is meant to be read by one thread.
 */
public class CatalogSubscription implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CatalogSubscription.class);

    private final long id;
    private final NotificationBroadcaster broadcaster;
    private final Deque<CatalogNotification> backlog;
    private final BlockingQueue<CatalogNotification> queue;

    private volatile boolean lagged = false;
    private volatile boolean closed = false;
    private volatile long lastDeliveredVersion;

    CatalogSubscription(long id, NotificationBroadcaster broadcaster, long fromVersion,
                        List<CatalogNotification> replay, int capacity) {
        this.id = id;
        this.broadcaster = broadcaster;
        this.backlog = new ArrayDeque<>(replay);
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.lastDeliveredVersion = fromVersion;
    }

    /**
     * Called by the broadcaster while publishing. Never blocks.
     */
    boolean offer(CatalogNotification notification) {
        if (closed || lagged) {
            return false;
        }
        if (!queue.offer(notification)) {
            lagged = true;
            queue.clear();
            log.warn("Subscription {} lagged at version {}: queue full, resync required",
                    id, lastDeliveredVersion);
            broadcaster.unsubscribe(this);
            return false;
        }
        return true;
    }

    /**
     * Next notification in version order, waiting up to the given timeout.
     *
     * @return the notification, or null if none arrived in time
     * @throws SubscriptionLaggedException if the subscriber fell behind and must resync
     */
    public CatalogNotification poll(long timeout, TimeUnit unit) throws InterruptedException {
        ensureReadable();
        CatalogNotification next;
        synchronized (backlog) {
            next = backlog.poll();
        }
        if (next == null) {
            next = queue.poll(timeout, unit);
            // Lagging may have happened while we were waiting
            ensureReadable();
        }
        if (next != null) {
            lastDeliveredVersion = next.getVersion();
        }
        return next;
    }

    /**
     * Up to {@code max} notifications that are available right now, in version order.
     */
    public List<CatalogNotification> drain(int max) {
        ensureReadable();
        List<CatalogNotification> result = new ArrayList<>();
        synchronized (backlog) {
            while (result.size() < max && !backlog.isEmpty()) {
                result.add(backlog.poll());
            }
        }
        if (result.size() < max) {
            queue.drainTo(result, max - result.size());
        }
        ensureReadable();
        if (!result.isEmpty()) {
            lastDeliveredVersion = result.get(result.size() - 1).getVersion();
        }
        return result;
    }

    private void ensureReadable() {
        if (closed) {
            throw new IllegalStateException("Subscription " + id + " is closed");
        }
        if (lagged) {
            throw new SubscriptionLaggedException(
                    "Subscription " + id + " fell behind after version " + lastDeliveredVersion
                            + "; reload the catalog snapshot and subscribe again",
                    lastDeliveredVersion);
        }
    }

    public long getId() {
        return id;
    }

    public boolean isLagged() {
        return lagged;
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Version of the last notification handed to the reader, or the subscribe version if
     * nothing has been read yet.
     */
    public long getLastDeliveredVersion() {
        return lastDeliveredVersion;
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            queue.clear();
            broadcaster.unsubscribe(this);
        }
    }
}
