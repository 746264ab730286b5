package com.eainde.auditor.error;

/**
 * Thrown by collectors when their source is unreachable or malformed.
 */
public class CollectionException extends AuditException {

    public CollectionException(String message) {
        super(ErrorKind.COLLECTION_ERROR, message);
    }

    public CollectionException(String message, Throwable cause) {
        super(ErrorKind.COLLECTION_ERROR, message, cause);
    }
}
