package com.geico.poc.streamcatalog.error;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Thrown when a drop or a destructive alter targets an object that live objects still
 * depend on.
 */
public class DependencyViolationException extends CatalogException {

    private final long objectId;
    private final List<Long> dependentIds;

    public DependencyViolationException(long objectId, List<Long> dependentIds, String message) {
        super(ErrorKind.DEPENDENCY_VIOLATION, message);
        this.objectId = objectId;
        this.dependentIds = Collections.unmodifiableList(new ArrayList<>(dependentIds));
    }

    public long getObjectId() {
        return objectId;
    }

    public List<Long> getDependentIds() {
        return dependentIds;
    }
}
