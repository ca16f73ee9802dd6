package com.geico.poc.streamcatalog.notification;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Everything one committed catalog transaction changed, stamped with the catalog version
 * that transaction produced.
 */
public class CatalogNotification {

    private final long version;
    private final List<CatalogDelta> deltas;

    @JsonCreator
    public CatalogNotification(
            @JsonProperty("version") long version,
            @JsonProperty("deltas") List<CatalogDelta> deltas) {
        this.version = version;
        this.deltas = deltas != null ? Collections.unmodifiableList(new ArrayList<>(deltas)) : Collections.emptyList();
    }

    public long getVersion() {
        return version;
    }

    public List<CatalogDelta> getDeltas() {
        return deltas;
    }

    @Override
    public String toString() {
        return "CatalogNotification{version=" + version + ", deltas=" + deltas + '}';
    }
}
