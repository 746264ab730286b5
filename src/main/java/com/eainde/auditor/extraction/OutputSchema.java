package com.eainde.auditor.extraction;

import java.util.Optional;

/**
 * Typed view over raw generator text.
 *
 * @param <T> the structured payload
 */
public interface OutputSchema<T> {

    /** Strict parse. */
    T parse(String raw) throws SchemaViolationException;

    /**
     * Deterministic recovery attempted when {@link #parse} rejects the text. Must not call the
     * generator again.
     */
    Optional<T> fallback(String raw);

    /** Value substituted once the attempt budget is spent. */
    T placeholder();
}
