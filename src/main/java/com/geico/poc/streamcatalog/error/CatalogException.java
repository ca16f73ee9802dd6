package com.geico.poc.streamcatalog.error;

/**
 * Base class for every rejection raised by the catalog.
 *
 * All catalog errors are unchecked. Validation errors are raised before anything is written,
 * so catching one never requires cleanup.
 */
public abstract class CatalogException extends RuntimeException {

    public enum ErrorKind {
        NAME_CONFLICT,
        DEPENDENCY_VIOLATION,
        VERSION_CONFLICT,
        NOT_FOUND,
        INVALID_DEFINITION,
        STORE_UNAVAILABLE,
        INCONSISTENT
    }

    private final ErrorKind errorKind;

    protected CatalogException(ErrorKind errorKind, String message) {
        super(message);
        this.errorKind = errorKind;
    }

    protected CatalogException(ErrorKind errorKind, String message, Throwable cause) {
        super(message, cause);
        this.errorKind = errorKind;
    }

    public ErrorKind getErrorKind() {
        return errorKind;
    }

    /**
     * Whether the caller may simply retry (possibly after refetching the catalog).
     */
    public boolean isRetryable() {
        return errorKind == ErrorKind.VERSION_CONFLICT || errorKind == ErrorKind.STORE_UNAVAILABLE;
    }
}
