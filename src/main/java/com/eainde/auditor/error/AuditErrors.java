package com.eainde.auditor.error;

import java.util.Collection;

/**
 * Formatting helpers for error-list entries: {@code "<source>: <Kind>: <message>"}.
 */
public final class AuditErrors {

    private AuditErrors() {
    }

    public static String format(String source, ErrorKind kind, String message) {
        return source + ": " + kind.label() + ": " + (message == null || message.isBlank() ? "(no message)" : message);
    }

    public static boolean isOfKind(String entry, ErrorKind kind) {
        return entry != null && entry.contains(": " + kind.label() + ":");
    }

    public static long count(Collection<String> errors, ErrorKind kind) {
        return errors.stream().filter(entry -> isOfKind(entry, kind)).count();
    }
}
