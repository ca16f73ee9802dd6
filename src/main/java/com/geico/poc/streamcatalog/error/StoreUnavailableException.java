package com.geico.poc.streamcatalog.error;

/**
 * Thrown when the durable catalog store cannot complete a commit or a load. A failed commit
 * leaves nothing visible; the whole transaction may be retried.
 */
public class StoreUnavailableException extends CatalogException {

    public StoreUnavailableException(String message) {
        super(ErrorKind.STORE_UNAVAILABLE, message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(ErrorKind.STORE_UNAVAILABLE, message, cause);
    }
}
