package com.geico.poc.streamcatalog.notification;

/**
 * Raised to a subscriber that can no longer be served incrementally: its queue overflowed,
 * or it asked to resume from a version older than this process has retained.
 *
 * The subscriber must reload a full catalog snapshot and subscribe again from the
 * snapshot's version.
 */
public class SubscriptionLaggedException extends RuntimeException {

    private final long lastDeliveredVersion;

    public SubscriptionLaggedException(String message, long lastDeliveredVersion) {
        super(message);
        this.lastDeliveredVersion = lastDeliveredVersion;
    }

    public long getLastDeliveredVersion() {
        return lastDeliveredVersion;
    }
}
