package com.geico.poc.streamcatalog.error;

/**
 * Internal invariant violation, such as a table whose associated source is missing.
 * Fatal to the transaction that hit it. Never repaired automatically.
 */
public class CatalogInconsistentException extends CatalogException {

    public CatalogInconsistentException(String message) {
        super(ErrorKind.INCONSISTENT, message);
    }

    public CatalogInconsistentException(String message, Throwable cause) {
        super(ErrorKind.INCONSISTENT, message, cause);
    }
}
