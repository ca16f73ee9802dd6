package com.geico.poc.streamcatalog.error;

/**
 * Thrown when an ALTER was computed against a table version that is no longer current.
 * The caller should refetch the table and retry.
 */
public class VersionConflictException extends CatalogException {

    private final long tableId;
    private final long expectedVersion;
    private final long actualVersion;

    public VersionConflictException(long tableId, long expectedVersion, long actualVersion) {
        super(ErrorKind.VERSION_CONFLICT, String.format(
                "Version conflict on table %d: request was based on version %d but current version is %d",
                tableId, expectedVersion, actualVersion));
        this.tableId = tableId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public long getTableId() {
        return tableId;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }

    public long getActualVersion() {
        return actualVersion;
    }
}
