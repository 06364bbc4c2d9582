package org.fpbjs.amlmapper;

/**
 * Raised when a document cannot be converted at all, e.g. when the AML file has no instance hierarchy or
 * the FPB.JS file has no project header. Irregularities inside an otherwise usable document never raise it.
 */
public class MappingException extends RuntimeException {

    public MappingException(String message) {
        super(message);
    }

    public MappingException(String message, Throwable cause) {
        super(message, cause);
    }
}
