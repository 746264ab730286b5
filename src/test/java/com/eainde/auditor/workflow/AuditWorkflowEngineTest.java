package com.eainde.auditor.workflow;

import com.eainde.auditor.collector.DocumentConceptCollector;
import com.eainde.auditor.collector.RepositoryFileCollector;
import com.eainde.auditor.config.AuditorProperties;
import com.eainde.auditor.config.RubricLoader;
import com.eainde.auditor.edges.ConditionalRouter;
import com.eainde.auditor.error.AuditErrors;
import com.eainde.auditor.error.CollectionException;
import com.eainde.auditor.error.ErrorKind;
import com.eainde.auditor.extraction.CallLimiter;
import com.eainde.auditor.extraction.OpinionSchema;
import com.eainde.auditor.extraction.RetryPolicy;
import com.eainde.auditor.extraction.StructuredExtractionAdapter;
import com.eainde.auditor.generator.OpinionGenerator;
import com.eainde.auditor.model.AuditRunRequest;
import com.eainde.auditor.model.Criterion;
import com.eainde.auditor.model.CriterionVerdict;
import com.eainde.auditor.model.Evidence;
import com.eainde.auditor.model.ReviewerRole;
import com.eainde.auditor.model.ScoreScale;
import com.eainde.auditor.state.AuditDelta;
import com.eainde.auditor.state.StateStore;
import com.eainde.auditor.synthesis.SynthesisConfig;
import com.eainde.auditor.synthesis.SynthesisEngine;
import com.eainde.auditor.thread.MdcAwareExecutor;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class AuditWorkflowEngineTest {

    private static final String CRITERION = "git_forensic_analysis";
    private static final Criterion HISTORY = Criterion.of(CRITERION, "forensic");
    private static final Criterion SAFETY = Criterion.of("safe_tool_engineering", "security");
    private static final Map<ReviewerRole, Integer> SCORES =
            Map.of(ReviewerRole.PROSECUTOR, 5, ReviewerRole.DEFENSE, 3, ReviewerRole.TECH_LEAD, 4);

    @Mock
    private RepositoryFileCollector repositoryCollector;
    @Mock
    private DocumentConceptCollector documentCollector;

    private final StateStore store = new StateStore();
    private final ObjectMapper objectMapper = new ObjectMapper();
    private MdcAwareExecutor workers;

    @BeforeEach
    void setUp() throws Exception {
        workers = new MdcAwareExecutor(4, "engine-test-");
        when(repositoryCollector.sourceKey()).thenReturn(RepositoryFileCollector.SOURCE_KEY);
        when(documentCollector.sourceKey()).thenReturn(DocumentConceptCollector.SOURCE_KEY);
        when(repositoryCollector.collect("/repo")).thenReturn(List.of(
                Evidence.of("Verify required file exists: README.md", true, "README.md", 1.0, "present"),
                Evidence.of("Verify required file exists: src/graph.py", true, "src/graph.py", 1.0, "present"),
                Evidence.of("Verify version-control history is present", true, ".git", 0.6, "present")
                        .forCriterion(CRITERION)));
        when(documentCollector.collect(anyString())).thenThrow(new CollectionException("document unreadable"));
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        workers.close();
    }

    private AuditWorkflowEngine engine(SchedulerConfig config) {
        FanOutScheduler scheduler = new FanOutScheduler(new NodeExecutor(config.nodeTimeout()), store, workers);
        return new AuditWorkflowEngine(scheduler, store, config);
    }

    private AuditGraph graph(OpinionGenerator generator) throws Exception {
        return graph(generator, new CallLimiter(2), List.of(HISTORY));
    }

    private AuditGraph graph(OpinionGenerator generator, CallLimiter limiter, List<Criterion> rubric)
            throws Exception {
        StructuredExtractionAdapter adapter = new StructuredExtractionAdapter(
                new RetryPolicy(3, Duration.ZERO, 2.0, Duration.ZERO), limiter, duration -> { });
        return new AuditWorkflowGraph(repositoryCollector, documentCollector, generator, adapter,
                new OpinionSchema(objectMapper, ScoreScale.DEFAULT), new SynthesisEngine(SynthesisConfig.DEFAULT),
                new AuditorProperties(), new RubricLoader.Rubric(rubric)).build();
    }

    private static OpinionGenerator fixedScores() {
        return (role, criterion, evidence) -> "{\"score\": " + SCORES.get(role)
                + ", \"argument\": \"" + role.displayName() + " reviewed the history\", \"cited_evidence\": [\".git\"]}";
    }

    @Test
    @DisplayName("should score 4 without dissent and record exactly one CollectionError")
    void endToEnd() throws Exception {
        AuditOutcome outcome = engine(SchedulerConfig.DEFAULT).run(graph(fixedScores()),
                AuditRunRequest.of("/repo", "/report.md"), List.of(HISTORY));

        assertThat(outcome.status()).isEqualTo(AuditOutcome.Status.COMPLETED);
        assertThat(outcome.reachedEnd()).isTrue();
        assertThat(outcome.state().getEvidence(RepositoryFileCollector.SOURCE_KEY)).hasSize(3);
        assertThat(outcome.state().getEvidence(DocumentConceptCollector.SOURCE_KEY)).isEmpty();

        CriterionVerdict verdict = outcome.verdicts().get(0);
        assertThat(outcome.verdicts()).hasSize(1);
        assertThat(verdict.criterionId()).isEqualTo(CRITERION);
        assertThat(verdict.finalScore()).isEqualTo(4);
        assertThat(verdict.dissent()).isNull();
        assertThat(verdict.opinions()).extracting(o -> o.role())
                .containsExactly(ReviewerRole.PROSECUTOR, ReviewerRole.DEFENSE, ReviewerRole.TECH_LEAD);

        assertThat(outcome.errors()).hasSize(1);
        assertThat(AuditErrors.count(outcome.errors(), ErrorKind.COLLECTION_ERROR)).isEqualTo(1);
        assertThat(outcome.errors().get(0)).startsWith("doc_analyst: CollectionError:");
    }

    @Test
    @DisplayName("should stop at the failure terminal when no collector produced evidence")
    void nothingCollected() throws Exception {
        when(repositoryCollector.collect("/missing")).thenThrow(new CollectionException("not a directory"));

        AuditOutcome outcome = engine(SchedulerConfig.DEFAULT).run(graph(fixedScores()),
                AuditRunRequest.of("/missing", "/report.md"), List.of(HISTORY));

        assertThat(outcome.finalStage()).isEqualTo(AuditGraph.FAILED);
        assertThat(outcome.reachedEnd()).isFalse();
        assertThat(outcome.verdicts()).isEmpty();
        assertThat(AuditErrors.count(outcome.errors(), ErrorKind.COLLECTION_ERROR)).isEqualTo(2);
    }

    @Test
    @DisplayName("should abort on the run timeout and keep everything merged so far")
    void runTimeout() throws Exception {
        OpinionGenerator hanging = (role, criterion, evidence) -> {
            Thread.sleep(10_000);
            return "{}";
        };
        SchedulerConfig config = new SchedulerConfig(4, Duration.ofSeconds(30), Duration.ofMillis(500), 25);

        AuditOutcome outcome = engine(config).run(graph(hanging),
                AuditRunRequest.of("/repo", "/report.md"), List.of(HISTORY));

        assertThat(outcome.status()).isEqualTo(AuditOutcome.Status.TIMED_OUT);
        assertThat(outcome.finalStage()).isEqualTo(AuditWorkflowGraph.JUDGE);
        assertThat(outcome.state().getEvidence(RepositoryFileCollector.SOURCE_KEY)).hasSize(3);
        assertThat(outcome.state().getOpinions()).isEmpty();
        assertThat(outcome.report()).isEmpty();
        assertThat(AuditErrors.count(outcome.errors(), ErrorKind.RUN_TIMEOUT)).isEqualTo(1);
    }

    @Test
    @DisplayName("should keep the other criteria's opinions when one criterion stalls every judge")
    void stalledCriterion() throws Exception {
        OpinionGenerator scores = fixedScores();
        OpinionGenerator stallsOnSafety = (role, criterion, evidence) -> {
            if (criterion.id().equals(SAFETY.id())) {
                Thread.sleep(10_000);
            }
            return scores.generate(role, criterion, evidence);
        };
        SchedulerConfig config = new SchedulerConfig(4, Duration.ofMillis(500), Duration.ofSeconds(30), 25);

        AuditGraph graph = graph(stallsOnSafety, CallLimiter.unbounded(), List.of(HISTORY, SAFETY));

        AuditOutcome outcome = engine(config).run(graph,
                AuditRunRequest.of("/repo", "/report.md"), List.of(HISTORY, SAFETY));

        assertThat(outcome.status()).isEqualTo(AuditOutcome.Status.COMPLETED);
        assertThat(outcome.verdicts()).extracting(CriterionVerdict::criterionId)
                .containsExactly(CRITERION, SAFETY.id());

        CriterionVerdict history = outcome.verdicts().get(0);
        assertThat(history.finalScore()).isEqualTo(4);
        assertThat(history.opinions()).hasSize(3);

        CriterionVerdict safety = outcome.verdicts().get(1);
        assertThat(safety.isScored()).isFalse();
        assertThat(safety.opinions()).isEmpty();

        assertThat(AuditErrors.count(outcome.errors(), ErrorKind.NODE_TIMEOUT)).isEqualTo(3);
        assertThat(outcome.errors()).filteredOn(entry -> AuditErrors.isOfKind(entry, ErrorKind.NODE_TIMEOUT))
                .allMatch(entry -> entry.contains("/" + SAFETY.id() + ": "));
    }

    @Test
    @DisplayName("should stop a routing cycle at the transition cap")
    void transitionLimit() throws Exception {
        AuditGraph looping = AuditGraph.builder()
                .addNode(TestNodes.node("spin", state -> AuditDelta.empty()))
                .addStage("loop", "spin")
                .addTerminal(AuditGraph.END)
                .setEntryPoint("loop")
                .addRouter(ConditionalRouter.from("loop")
                        .when("forever", state -> true, "loop")
                        .otherwise(AuditGraph.END))
                .compile();
        SchedulerConfig config = new SchedulerConfig(2, Duration.ofSeconds(5), Duration.ofSeconds(30), 3);

        AuditOutcome outcome = engine(config).run(looping, store.initialize(AuditRunRequest.of("/repo", ""), List.of()));

        assertThat(outcome.status()).isEqualTo(AuditOutcome.Status.TRANSITION_LIMIT);
        assertThat(outcome.errors()).singleElement()
                .matches(entry -> AuditErrors.isOfKind(entry, ErrorKind.TRANSITION_LIMIT));
    }
}
