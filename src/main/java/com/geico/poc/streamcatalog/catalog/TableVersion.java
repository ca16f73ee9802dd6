package com.geico.poc.streamcatalog.catalog;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Per-table schema version. Not to be confused with the global catalog version
 * stamped on notifications.
 *
 * {@code version} grows by exactly one per accepted ALTER. {@code nextColumnId} is the id
 * the next added column receives; every id below it has been used by some column of the
 * table, live or dropped.
 */
public class TableVersion {

    public static final long INITIAL_VERSION = 0L;

    private final long version;
    private final int nextColumnId;

    @JsonCreator
    public TableVersion(
            @JsonProperty("version") long version,
            @JsonProperty("nextColumnId") int nextColumnId) {
        this.version = version;
        this.nextColumnId = nextColumnId;
    }

    public static TableVersion initial(int nextColumnId) {
        return new TableVersion(INITIAL_VERSION, nextColumnId);
    }

    public long getVersion() {
        return version;
    }

    public int getNextColumnId() {
        return nextColumnId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TableVersion that = (TableVersion) o;
        return version == that.version && nextColumnId == that.nextColumnId;
    }

    @Override
    public int hashCode() {
        return Objects.hash(version, nextColumnId);
    }

    @Override
    public String toString() {
        return "TableVersion{version=" + version + ", nextColumnId=" + nextColumnId + '}';
    }
}
