package com.geico.poc.streamcatalog.error;

/**
 * Thrown when an object description is malformed, e.g. a view whose column list does not
 * match its query, or an index over a column that does not exist.
 */
public class InvalidDefinitionException extends CatalogException {

    public InvalidDefinitionException(String message) {
        super(ErrorKind.INVALID_DEFINITION, message);
    }

    public InvalidDefinitionException(String message, Throwable cause) {
        super(ErrorKind.INVALID_DEFINITION, message, cause);
    }
}
