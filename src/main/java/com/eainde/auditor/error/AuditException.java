package com.eainde.auditor.error;

/**
 * Base for failures raised inside nodes. The node executor turns these into error entries
 * tagged with {@link #kind()}; they never cross a stage barrier.
 */
public class AuditException extends RuntimeException {

    private final ErrorKind kind;

    public AuditException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public AuditException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
