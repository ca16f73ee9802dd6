package com.geico.poc.streamcatalog.notification;

import com.geico.poc.streamcatalog.manager.CatalogSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Read cache kept by a catalog consumer and fed by a {@link CatalogSubscription}.
 *
 * Notifications are applied strictly in version order. A notification at or below the
 * applied version is a redelivery and is ignored; one that skips a version means the
 * cache can no longer be trusted and must be reset from a full snapshot.
 */
public class LocalCatalogCache {

    private static final Logger log = LoggerFactory.getLogger(LocalCatalogCache.class);

    public enum ApplyResult {
        APPLIED,
        DUPLICATE,
        RESYNC_REQUIRED
    }

    private volatile CatalogSnapshot snapshot;
    private volatile boolean resyncRequired = false;

    public LocalCatalogCache() {
        this(CatalogSnapshot.empty());
    }

    public LocalCatalogCache(CatalogSnapshot initial) {
        this.snapshot = initial;
    }

    public synchronized ApplyResult apply(CatalogNotification notification) {
        if (resyncRequired) {
            return ApplyResult.RESYNC_REQUIRED;
        }
        long applied = snapshot.getVersion();
        if (notification.getVersion() <= applied) {
            log.debug("Ignoring redelivered catalog version {} (applied {})", notification.getVersion(), applied);
            return ApplyResult.DUPLICATE;
        }
        if (notification.getVersion() != applied + 1) {
            log.warn("Catalog version gap: applied {}, received {}; resync required",
                    applied, notification.getVersion());
            resyncRequired = true;
            return ApplyResult.RESYNC_REQUIRED;
        }
        snapshot = snapshot.apply(notification.getVersion(), notification.getDeltas());
        return ApplyResult.APPLIED;
    }

    /**
     * Apply a batch in order. Stops at the first notification that requires a resync.
     *
     * @return the number of notifications applied
     */
    public int applyAll(List<CatalogNotification> notifications) {
        int applied = 0;
        for (CatalogNotification notification : notifications) {
            ApplyResult result = apply(notification);
            if (result == ApplyResult.RESYNC_REQUIRED) {
                break;
            }
            if (result == ApplyResult.APPLIED) {
                applied++;
            }
        }
        return applied;
    }

    /**
     * Apply everything the subscription has ready, waiting up to {@code timeoutMs} for the
     * first notification. A lagged subscription flags the cache for resync.
     *
     * @return the number of notifications applied
     */
    public int catchUp(CatalogSubscription subscription, long timeoutMs) throws InterruptedException {
        try {
            CatalogNotification first = subscription.poll(timeoutMs, TimeUnit.MILLISECONDS);
            if (first == null) {
                return 0;
            }
            int applied = apply(first) == ApplyResult.APPLIED ? 1 : 0;
            return applied + applyAll(subscription.drain(Integer.MAX_VALUE));
        } catch (SubscriptionLaggedException e) {
            log.warn("Subscription {} lagged: {}", subscription.getId(), e.getMessage());
            synchronized (this) {
                resyncRequired = true;
            }
            return 0;
        }
    }

    /**
     * Replace the cached catalog with a full snapshot and clear the resync flag.
     */
    public synchronized void reset(CatalogSnapshot fullSnapshot) {
        log.info("Catalog cache reset from snapshot at version {} (was {})",
                fullSnapshot.getVersion(), snapshot.getVersion());
        snapshot = fullSnapshot;
        resyncRequired = false;
    }

    public CatalogSnapshot snapshot() {
        return snapshot;
    }

    public long appliedVersion() {
        return snapshot.getVersion();
    }

    public boolean isResyncRequired() {
        return resyncRequired;
    }
}
