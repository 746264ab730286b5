package com.eainde.auditor.workflow;

import com.eainde.auditor.edges.ConditionalRouter;
import com.eainde.auditor.error.AuditErrors;
import com.eainde.auditor.error.ErrorKind;
import com.eainde.auditor.model.AuditRunRequest;
import com.eainde.auditor.model.Criterion;
import com.eainde.auditor.state.AuditDelta;
import com.eainde.auditor.state.AuditState;
import com.eainde.auditor.state.StateStore;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Drives a compiled {@link AuditGraph}: runs a stage through the {@link FanOutScheduler}, asks
 * the stage's router for the next stage, and repeats until a terminal stage is reached.
 *
 * <p>Stages are totally ordered: stage N+1 is dispatched only after stage N's barrier opened
 * and its deltas were merged. The global run timeout and the transition cap stop the loop
 * early; either way the last merged snapshot is returned with an error entry explaining why.</p>
 */
@Slf4j
public class AuditWorkflowEngine {

    public static final String MDC_RUN_ID = "runId";
    static final String SOURCE = "workflow";

    private final FanOutScheduler scheduler;
    private final StateStore stateStore;
    private final SchedulerConfig config;
    private final Clock clock;

    public AuditWorkflowEngine(FanOutScheduler scheduler, StateStore stateStore, SchedulerConfig config) {
        this(scheduler, stateStore, config, Clock.systemUTC());
    }

    public AuditWorkflowEngine(FanOutScheduler scheduler, StateStore stateStore, SchedulerConfig config, Clock clock) {
        this.scheduler = scheduler;
        this.stateStore = stateStore;
        this.config = config;
        this.clock = clock;
    }

    public AuditOutcome run(AuditGraph graph, AuditRunRequest request, List<Criterion> criteria) {
        return run(graph, stateStore.initialize(request, criteria));
    }

    public AuditOutcome run(AuditGraph graph, AuditState initial) {
        Instant deadline = clock.instant().plus(config.runTimeout());
        String previousRunId = MDC.get(MDC_RUN_ID);
        MDC.put(MDC_RUN_ID, initial.getRunId());
        try {
            log.info("Audit run started (repository={}, document={}, criteria={})",
                    initial.getRepositoryRef(), initial.getDocumentRef(), initial.getCriteria().size());
            AuditState state = initial;
            String stageId = graph.entryStage();
            int transitions = 0;

            while (!graph.isTerminal(stageId)) {
                if (transitions >= config.maxStageTransitions()) {
                    String entry = AuditErrors.format(SOURCE, ErrorKind.TRANSITION_LIMIT,
                            "stopped before stage '" + stageId + "' after " + transitions + " transitions");
                    log.error(entry);
                    return new AuditOutcome(stateStore.merge(state, AuditDelta.errorDelta(entry)),
                            stageId, AuditOutcome.Status.TRANSITION_LIMIT);
                }
                try {
                    state = scheduler.runStage(graph.stage(stageId), state, deadline);
                } catch (RunTimeoutException e) {
                    String entry = AuditErrors.format(SOURCE, ErrorKind.RUN_TIMEOUT,
                            e.getMessage() + "; remaining stages skipped");
                    log.error(entry);
                    return new AuditOutcome(stateStore.merge(state, AuditDelta.errorDelta(entry)),
                            stageId, AuditOutcome.Status.TIMED_OUT);
                }
                ConditionalRouter router = graph.router(stageId);
                String next = router.apply(state);
                log.info("Routing {} -> {}", stageId, next);
                stageId = next;
                transitions++;
            }

            log.info("Audit run finished at '{}' with {} error(s)", stageId, state.getErrors().size());
            return new AuditOutcome(state, stageId, AuditOutcome.Status.COMPLETED);
        } finally {
            if (previousRunId != null) {
                MDC.put(MDC_RUN_ID, previousRunId);
            } else {
                MDC.remove(MDC_RUN_ID);
            }
        }
    }
}
