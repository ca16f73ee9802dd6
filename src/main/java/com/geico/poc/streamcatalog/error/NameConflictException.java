package com.geico.poc.streamcatalog.error;

import com.geico.poc.streamcatalog.catalog.ObjectKind;

/**
 * Thrown when an object name is already in use within its scope.
 */
public class NameConflictException extends CatalogException {

    private final ObjectKind existingKind;
    private final String name;

    public NameConflictException(ObjectKind existingKind, String name, String scope) {
        super(ErrorKind.NAME_CONFLICT,
                String.format("%s \"%s\" already exists in %s", display(existingKind), name, scope));
        this.existingKind = existingKind;
        this.name = name;
    }

    private static String display(ObjectKind kind) {
        String lower = kind.name().toLowerCase();
        return Character.toUpperCase(lower.charAt(0)) + lower.substring(1);
    }

    public ObjectKind getExistingKind() {
        return existingKind;
    }

    public String getName() {
        return name;
    }
}
