package com.eainde.auditor.extraction;

import com.eainde.auditor.error.AuditErrors;
import com.eainde.auditor.error.ErrorKind;
import dev.langchain4j.exception.RateLimitException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.regex.Pattern;

/**
 * Wraps an unreliable text generator so that callers always get a typed value back.
 *
 * <p>Each attempt calls the generator under the shared {@link CallLimiter}. Output that fails the
 * strict parse goes through the schema's fallback before the attempt counts as failed. Only
 * rate-limit failures are followed by a backoff wait. When the budget is spent the schema's
 * placeholder is returned as a degraded result with exactly one GenerationError entry; raw
 * generator failures never reach the caller.</p>
 */
@Slf4j
public class StructuredExtractionAdapter {

    /** HTTP 429 as a standalone status token, or the usual rate-limit wording. */
    private static final Pattern RATE_LIMIT_MESSAGE =
            Pattern.compile("(?i)(?<![\\d.])429(?![\\d.])|rate[ _-]?limit|too many requests");

    private final RetryPolicy retryPolicy;
    private final CallLimiter callLimiter;
    private final Sleeper sleeper;

    public StructuredExtractionAdapter(RetryPolicy retryPolicy, CallLimiter callLimiter, Sleeper sleeper) {
        this.retryPolicy = retryPolicy;
        this.callLimiter = callLimiter;
        this.sleeper = sleeper;
    }

    /**
     * @param source    prefix for the error entry, normally the calling node's id
     * @param schema    how to read the generator's text
     * @param generator the external call; may throw anything
     */
    public <T> ExtractionResult<T> extract(String source, OutputSchema<T> schema, Callable<String> generator) {
        String lastFailure = "no attempt made";
        int attempts = 0;

        while (attempts < retryPolicy.maxAttempts()) {
            if (Thread.currentThread().isInterrupted()) {
                lastFailure = "interrupted after " + attempts + " attempt(s)";
                break;
            }
            attempts++;
            String raw;
            try {
                raw = callLimiter.call(generator);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                lastFailure = "interrupted while calling the generator";
                break;
            } catch (Exception e) {
                lastFailure = describe(e);
                log.warn("{}: generator attempt {}/{} failed: {}", source, attempts, retryPolicy.maxAttempts(), lastFailure);
                if (isRateLimited(e) && attempts < retryPolicy.maxAttempts() && !backOff(source, attempts)) {
                    lastFailure = "interrupted during backoff after: " + lastFailure;
                    break;
                }
                continue;
            }

            if (raw == null || raw.isBlank()) {
                lastFailure = "generator returned empty output";
                log.warn("{}: attempt {}/{} returned empty output", source, attempts, retryPolicy.maxAttempts());
                continue;
            }

            try {
                return ExtractionResult.success(schema.parse(raw), attempts);
            } catch (SchemaViolationException e) {
                Optional<T> recovered = schema.fallback(raw);
                if (recovered.isPresent()) {
                    log.info("{}: recovered output of attempt {} with the fallback extractor ({})",
                            source, attempts, e.getMessage());
                    return ExtractionResult.success(recovered.get(), attempts);
                }
                lastFailure = "schema violation: " + e.getMessage();
                log.warn("{}: attempt {}/{} unusable, {}", source, attempts, retryPolicy.maxAttempts(), lastFailure);
            }
        }

        String entry = AuditErrors.format(source, ErrorKind.GENERATION_ERROR,
                "no schema-conformant output after " + attempts + " attempt(s); last failure: " + lastFailure);
        log.error(entry);
        return ExtractionResult.degraded(schema.placeholder(), attempts, entry);
    }

    /** @return false when the wait was interrupted */
    private boolean backOff(String source, int failedAttempt) {
        Duration wait = retryPolicy.backoffAfter(failedAttempt);
        log.info("{}: rate limited, backing off {} ms before retry", source, wait.toMillis());
        try {
            sleeper.sleep(wait);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    static boolean isRateLimited(Throwable failure) {
        for (Throwable cause = failure; cause != null; cause = cause.getCause()) {
            if (cause instanceof RateLimitException) {
                return true;
            }
            String message = cause.getMessage();
            if (message != null && RATE_LIMIT_MESSAGE.matcher(message).find()) {
                return true;
            }
            if (cause.getCause() == cause) {
                break;
            }
        }
        return false;
    }

    private static String describe(Throwable failure) {
        return failure.getClass().getSimpleName()
                + (failure.getMessage() != null ? ": " + failure.getMessage() : "");
    }
}
