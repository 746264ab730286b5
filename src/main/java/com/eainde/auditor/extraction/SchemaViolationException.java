package com.eainde.auditor.extraction;

/**
 * Raw generator output did not match the expected schema.
 */
public class SchemaViolationException extends Exception {

    public SchemaViolationException(String message) {
        super(message);
    }

    public SchemaViolationException(String message, Throwable cause) {
        super(message, cause);
    }
}
