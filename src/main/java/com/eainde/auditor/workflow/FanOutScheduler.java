package com.eainde.auditor.workflow;

import com.eainde.auditor.nodes.AuditNode;
import com.eainde.auditor.state.AuditState;
import com.eainde.auditor.state.StateStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Dispatches every node of a stage concurrently against the same snapshot, waits for all of
 * them at a barrier, then folds their deltas into a single successor snapshot.
 *
 * <p>Deltas are merged in the order the nodes completed. Because every writable field merges
 * commutatively the resulting snapshot does not depend on that order.</p>
 */
@Slf4j
public class FanOutScheduler {

    private final NodeExecutor nodeExecutor;
    private final StateStore stateStore;
    private final Executor workers;
    private final Clock clock;

    public FanOutScheduler(NodeExecutor nodeExecutor, StateStore stateStore, Executor workers) {
        this(nodeExecutor, stateStore, workers, Clock.systemUTC());
    }

    public FanOutScheduler(NodeExecutor nodeExecutor, StateStore stateStore, Executor workers, Clock clock) {
        this.nodeExecutor = nodeExecutor;
        this.stateStore = stateStore;
        this.workers = workers;
        this.clock = clock;
    }

    /**
     * Runs one fan-out group.
     *
     * @param stage    the group to run
     * @param snapshot the state every node in the group reads
     * @param deadline global run deadline
     * @return the snapshot with all k deltas merged
     * @throws RunTimeoutException when the deadline passes before the barrier opens; in-flight
     *                             nodes are cancelled and none of the group's deltas are merged
     */
    public AuditState runStage(Stage stage, AuditState snapshot, Instant deadline) throws RunTimeoutException {
        Duration remaining = Duration.between(clock.instant(), deadline);
        if (remaining.isNegative() || remaining.isZero()) {
            throw new RunTimeoutException("run deadline passed before stage '" + stage.id() + "' was dispatched");
        }

        log.info("Stage '{}' dispatching {} node(s): {}", stage.id(), stage.nodes().size(), stage.nodeIds());
        Queue<Map<String, Object>> arrivals = new ConcurrentLinkedQueue<>();
        List<CompletableFuture<Map<String, Object>>> outcomes = new ArrayList<>();
        List<CompletableFuture<Void>> recorded = new ArrayList<>();
        for (AuditNode node : stage.nodes()) {
            CompletableFuture<Map<String, Object>> outcome = nodeExecutor.submit(node, snapshot, workers);
            outcomes.add(outcome);
            recorded.add(outcome.thenAccept(arrivals::add));
        }

        try {
            CompletableFuture.allOf(recorded.toArray(new CompletableFuture[0]))
                    .get(remaining.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            cancelAll(outcomes);
            throw new RunTimeoutException("run deadline passed while stage '" + stage.id() + "' was in flight");
        } catch (InterruptedException e) {
            cancelAll(outcomes);
            Thread.currentThread().interrupt();
            throw new RunTimeoutException("interrupted while waiting for stage '" + stage.id() + "'");
        } catch (ExecutionException e) {
            // node outcomes always complete normally, so this is a programming error
            cancelAll(outcomes);
            throw new IllegalStateException("Stage '" + stage.id() + "' barrier failed", e.getCause());
        }

        AuditState merged = snapshot;
        for (Map<String, Object> delta : arrivals) {
            merged = stateStore.merge(merged, delta);
        }
        log.info("Stage '{}' joined: {}", stage.id(), merged.summary());
        return merged;
    }

    private static void cancelAll(List<CompletableFuture<Map<String, Object>>> outcomes) {
        outcomes.forEach(outcome -> outcome.cancel(true));
    }
}
