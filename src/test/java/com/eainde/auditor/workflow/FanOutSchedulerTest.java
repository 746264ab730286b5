package com.eainde.auditor.workflow;

import com.eainde.auditor.error.AuditErrors;
import com.eainde.auditor.error.ErrorKind;
import com.eainde.auditor.model.AuditRunRequest;
import com.eainde.auditor.model.Evidence;
import com.eainde.auditor.nodes.AuditNode;
import com.eainde.auditor.state.AuditDelta;
import com.eainde.auditor.state.AuditState;
import com.eainde.auditor.state.StateStore;
import com.eainde.auditor.thread.MdcAwareExecutor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FanOutSchedulerTest {

    private final StateStore store = new StateStore();
    private MdcAwareExecutor workers;
    private FanOutScheduler scheduler;
    private AuditState snapshot;

    @BeforeEach
    void setUp() {
        workers = new MdcAwareExecutor(4, "fan-out-test-");
        scheduler = new FanOutScheduler(new NodeExecutor(Duration.ofSeconds(5)), store, workers);
        snapshot = store.initialize(AuditRunRequest.of("/repo", "/doc.md"), List.of());
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        workers.close();
        MDC.clear();
    }

    private static Instant inSeconds(long seconds) {
        return Instant.now().plusSeconds(seconds);
    }

    private static AuditNode collector(String key, Set<Integer> observedTotals) {
        return TestNodes.node("collector_" + key, Set.of(key), state -> {
            observedTotals.add(state.totalEvidence());
            Thread.sleep(ThreadLocalRandom.current().nextInt(20));
            return AuditDelta.builder()
                    .evidence(key, List.of(Evidence.of("goal " + key, true, key + "/file", 1.0, "")))
                    .build();
        });
    }

    @RepeatedTest(5)
    @DisplayName("should merge all k distinct keys regardless of completion order")
    void noLossUnderConcurrency() throws Exception {
        Set<Integer> observed = ConcurrentHashMap.newKeySet();
        List<AuditNode> nodes = new ArrayList<>();
        IntStream.range(0, 8).forEach(i -> nodes.add(collector("k" + i, observed)));

        AuditState merged = scheduler.runStage(new Stage("collect", nodes), snapshot, inSeconds(10));

        assertThat(merged.getEvidence()).hasSize(8);
        assertThat(merged.totalEvidence()).isEqualTo(8);
        assertThat(observed).as("every node reads the pre-group snapshot").containsOnly(0);
    }

    @Test
    @DisplayName("should let siblings finish when one node fails")
    void failureIsIsolated() throws Exception {
        AuditNode failing = TestNodes.node("broken", state -> {
            throw new IllegalArgumentException("bad input");
        });
        AuditNode healthy = collector("repo", ConcurrentHashMap.newKeySet());

        AuditState merged = scheduler.runStage(new Stage("collect", List.of(failing, healthy)), snapshot, inSeconds(10));

        assertThat(merged.getEvidence("repo")).hasSize(1);
        assertThat(merged.getErrors()).singleElement()
                .matches(entry -> AuditErrors.isOfKind(entry, ErrorKind.NODE_FAILURE));
    }

    @Test
    @DisplayName("should propagate the run id onto worker threads")
    void mdcPropagation() throws Exception {
        Set<String> seen = ConcurrentHashMap.newKeySet();
        MDC.put(AuditWorkflowEngine.MDC_RUN_ID, "run-42");
        AuditNode node = TestNodes.node("mdc", state -> {
            seen.add(String.valueOf(MDC.get(AuditWorkflowEngine.MDC_RUN_ID)));
            return AuditDelta.empty();
        });

        scheduler.runStage(new Stage("one", List.of(node)), snapshot, inSeconds(10));

        assertThat(seen).containsExactly("run-42");
    }

    @Test
    @DisplayName("should abort when the deadline passes and leave the snapshot untouched")
    void deadline() {
        AuditNode slow = TestNodes.node("slow", state -> {
            Thread.sleep(10_000);
            return AuditDelta.empty();
        });
        Instant deadline = Instant.now().plusMillis(200);

        assertThatThrownBy(() -> scheduler.runStage(new Stage("judge", List.of(slow)), snapshot, deadline))
                .isInstanceOf(RunTimeoutException.class)
                .hasMessageContaining("judge");
        assertThat(snapshot.getErrors()).isEmpty();
    }

    @Test
    @DisplayName("should not dispatch at all when the deadline already passed")
    void deadlineAlreadyPassed() {
        Set<Integer> observed = ConcurrentHashMap.newKeySet();

        assertThatThrownBy(() -> scheduler.runStage(new Stage("collect", List.of(collector("repo", observed))),
                snapshot, Instant.now().minusSeconds(1)))
                .isInstanceOf(RunTimeoutException.class);
        assertThat(observed).isEmpty();
    }
}
