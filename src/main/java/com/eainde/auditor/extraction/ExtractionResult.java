package com.eainde.auditor.extraction;

/**
 * Outcome of one adapter invocation.
 *
 * @param value    parsed payload, or the schema's placeholder when {@code degraded}
 * @param degraded true when no attempt produced a conforming payload
 * @param attempts generator calls made
 * @param error    the GenerationError entry for a degraded result, otherwise {@code null}
 */
public record ExtractionResult<T>(T value, boolean degraded, int attempts, String error) {

    static <T> ExtractionResult<T> success(T value, int attempts) {
        return new ExtractionResult<>(value, false, attempts, null);
    }

    static <T> ExtractionResult<T> degraded(T placeholder, int attempts, String error) {
        return new ExtractionResult<>(placeholder, true, attempts, error);
    }
}
