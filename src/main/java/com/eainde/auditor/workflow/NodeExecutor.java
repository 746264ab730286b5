package com.eainde.auditor.workflow;

import com.eainde.auditor.error.AuditErrors;
import com.eainde.auditor.error.AuditException;
import com.eainde.auditor.error.ErrorKind;
import com.eainde.auditor.nodes.AuditNode;
import com.eainde.auditor.state.AuditDelta;
import com.eainde.auditor.state.AuditState;
import com.eainde.auditor.state.StateStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs a single node against a snapshot and guarantees a delta back.
 *
 * <p>Exceptions, timeouts, {@code null} results and malformed deltas never propagate; each is
 * converted into a delta holding exactly one error entry {@code "<node-id>: <Kind>: <message>"}
 * and nothing else.</p>
 */
@Slf4j
public class NodeExecutor {

    private final Duration nodeTimeout;

    public NodeExecutor(Duration nodeTimeout) {
        if (nodeTimeout == null || nodeTimeout.isZero() || nodeTimeout.isNegative()) {
            throw new IllegalArgumentException("nodeTimeout must be positive");
        }
        this.nodeTimeout = nodeTimeout;
    }

    /**
     * Runs the node on the calling thread. Never throws.
     */
    public Map<String, Object> execute(AuditNode node, AuditState snapshot) {
        Map<String, Object> delta;
        try {
            delta = node.apply(snapshot);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return failure(node.id(), ErrorKind.NODE_TIMEOUT, "interrupted before completion");
        } catch (Exception e) {
            return failure(node, e);
        }
        Optional<String> problem = StateStore.validate(delta, node.ownedEvidenceKeys());
        if (problem.isPresent()) {
            return failure(node.id(), ErrorKind.NODE_FAILURE, "malformed delta: " + problem.get());
        }
        return delta;
    }

    /**
     * Dispatches the node onto {@code workers}. The returned future always completes normally:
     * with the node's delta, or with an error delta once the per-node timeout elapses, in which
     * case the worker running the node is interrupted. The timeout clock starts when a worker
     * picks the node up, not when it is queued.
     */
    public CompletableFuture<Map<String, Object>> submit(AuditNode node, AuditState snapshot, Executor workers) {
        CompletableFuture<Map<String, Object>> outcome = new CompletableFuture<>();
        try {
            workers.execute(() -> runGuarded(node, snapshot, outcome));
        } catch (RejectedExecutionException e) {
            outcome.complete(failure(node.id(), ErrorKind.NODE_FAILURE, "could not be dispatched: " + e.getMessage()));
        }
        return outcome;
    }

    private void runGuarded(AuditNode node, AuditState snapshot, CompletableFuture<Map<String, Object>> outcome) {
        if (outcome.isDone()) {
            return;
        }
        AtomicReference<Thread> runner = new AtomicReference<>(Thread.currentThread());
        CompletableFuture.delayedExecutor(nodeTimeout.toMillis(), TimeUnit.MILLISECONDS).execute(() -> {
            if (outcome.complete(timedOut(node))) {
                interrupt(runner);
            }
        });
        // the scheduler cancels outstanding outcomes when the run deadline passes
        outcome.whenComplete((delta, failure) -> {
            if (outcome.isCancelled()) {
                interrupt(runner);
            }
        });
        try {
            outcome.complete(execute(node, snapshot));
        } catch (Error e) {
            outcome.complete(failure(node, e));
            throw e;
        } finally {
            synchronized (runner) {
                runner.set(null);
                // a late watchdog interrupt must not leak into the next task on this worker
                Thread.interrupted();
            }
        }
    }

    private static void interrupt(AtomicReference<Thread> runner) {
        synchronized (runner) {
            Thread worker = runner.get();
            if (worker != null) {
                worker.interrupt();
            }
        }
    }

    private Map<String, Object> timedOut(AuditNode node) {
        return failure(node.id(), ErrorKind.NODE_TIMEOUT,
                "no result within " + nodeTimeout.toMillis() + " ms");
    }

    static Map<String, Object> failure(AuditNode node, Throwable cause) {
        if (cause instanceof AuditException audit) {
            return failure(node.id(), audit.kind(), audit.getMessage());
        }
        if (cause instanceof TimeoutException) {
            return failure(node.id(), ErrorKind.NODE_TIMEOUT, cause.getMessage());
        }
        String message = cause.getClass().getSimpleName()
                + (cause.getMessage() != null ? ": " + cause.getMessage() : "");
        return failure(node.id(), ErrorKind.NODE_FAILURE, message);
    }

    static Map<String, Object> failure(String nodeId, ErrorKind kind, String message) {
        String entry = AuditErrors.format(nodeId, kind, message);
        log.warn("Node failed: {}", entry);
        return AuditDelta.errorDelta(entry);
    }
}
