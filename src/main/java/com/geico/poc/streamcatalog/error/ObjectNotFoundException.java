package com.geico.poc.streamcatalog.error;

import com.geico.poc.streamcatalog.catalog.ObjectKind;

/**
 * Thrown when an operation names an id or name the catalog does not know.
 */
public class ObjectNotFoundException extends CatalogException {

    private final ObjectKind kind;

    public ObjectNotFoundException(ObjectKind kind, long id) {
        super(ErrorKind.NOT_FOUND, kind.name().toLowerCase() + " with id " + id + " does not exist");
        this.kind = kind;
    }

    public ObjectNotFoundException(ObjectKind kind, String name) {
        super(ErrorKind.NOT_FOUND, kind.name().toLowerCase() + " \"" + name + "\" does not exist");
        this.kind = kind;
    }

    public ObjectKind getKind() {
        return kind;
    }
}
