package com.eainde.auditor.state;

import com.eainde.auditor.error.AuditErrors;
import com.eainde.auditor.error.ErrorKind;
import com.eainde.auditor.model.AuditReport;
import com.eainde.auditor.model.AuditRunRequest;
import com.eainde.auditor.model.Criterion;
import com.eainde.auditor.model.Evidence;
import com.eainde.auditor.model.JudicialOpinion;
import com.eainde.auditor.model.ReviewerRole;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class StateStoreTest {

    private StateStore store;
    private AuditState initial;

    @BeforeEach
    void setUp() {
        store = new StateStore();
        initial = store.initialize(new AuditRunRequest("run-1", "/repo", "/doc.md"),
                List.of(Criterion.of("git_forensic_analysis", "forensic")));
    }

    private static Evidence evidence(String location) {
        return Evidence.of("Verify required file exists: " + location, true, location, 1.0, "present");
    }

    private static JudicialOpinion opinion(ReviewerRole role, int score) {
        return new JudicialOpinion("git_forensic_analysis", role, score, "because", List.of(), false);
    }

    // =========================================================================
    //  Initialisation
    // =========================================================================

    @Nested
    @DisplayName("initialize")
    class Initialize {

        @Test
        @DisplayName("should carry the static inputs and empty channels")
        void staticInputs() {
            assertThat(initial.getRunId()).isEqualTo("run-1");
            assertThat(initial.getRepositoryRef()).isEqualTo("/repo");
            assertThat(initial.getDocumentRef()).isEqualTo("/doc.md");
            assertThat(initial.getCriteria()).extracting(Criterion::id).containsExactly("git_forensic_analysis");
            assertThat(initial.getEvidence()).isEmpty();
            assertThat(initial.getOpinions()).isEmpty();
            assertThat(initial.getErrors()).isEmpty();
            assertThat(initial.isSealed()).isFalse();
        }
    }

    // =========================================================================
    //  Merge policies
    // =========================================================================

    @Nested
    @DisplayName("merge")
    class Merge {

        @Test
        @DisplayName("should never modify the input snapshot")
        void pure() {
            AuditState merged = store.merge(initial,
                    AuditDelta.builder().evidence("repo", List.of(evidence("README.md"))).build());

            assertThat(merged).isNotSameAs(initial);
            assertThat(initial.getEvidence()).isEmpty();
            assertThat(merged.getEvidence("repo")).hasSize(1);
        }

        @Test
        @DisplayName("should return a new snapshot even for an empty delta")
        void emptyDelta() {
            AuditState merged = store.merge(initial, AuditDelta.empty());

            assertThat(merged).isNotSameAs(initial);
            assertThat(merged.view()).isEqualTo(initial.view());
        }

        @Test
        @DisplayName("should be commutative for deltas of one fan-out group")
        void commutative() {
            Map<String, Object> d1 = AuditDelta.builder()
                    .evidence("repo", List.of(evidence("README.md"), evidence("src/graph.py")))
                    .opinion(opinion(ReviewerRole.PROSECUTOR, 2))
                    .build();
            Map<String, Object> d2 = AuditDelta.builder()
                    .evidence("doc", List.of(evidence("report.md")))
                    .opinion(opinion(ReviewerRole.DEFENSE, 4))
                    .error(AuditErrors.format("doc_analyst", ErrorKind.COLLECTION_ERROR, "partial"))
                    .build();

            AuditState left = store.merge(store.merge(initial, d1), d2);
            AuditState right = store.merge(store.merge(initial, d2), d1);

            assertThat(left.view()).isEqualTo(right.view());
            assertThat(left.getEvidence()).containsOnlyKeys("doc", "repo");
        }

        @Test
        @DisplayName("should concatenate evidence when two deltas write the same key")
        void keyedUnionConcatenates() {
            AuditState merged = store.merge(
                    store.merge(initial, AuditDelta.builder().evidence("repo", List.of(evidence("a.py"))).build()),
                    AuditDelta.builder().evidence("repo", List.of(evidence("b.py"))).build());

            assertThat(merged.getEvidence("repo")).extracting(Evidence::location).containsExactly("a.py", "b.py");
        }

        @Test
        @DisplayName("should register a key for an empty evidence list")
        void emptyEvidenceListRegistersKey() {
            AuditState merged = store.merge(initial, AuditDelta.builder().evidence("doc", List.of()).build());

            assertThat(merged.getEvidence()).containsKey("doc");
            assertThat(merged.totalEvidence()).isZero();
        }

        @Test
        @DisplayName("should keep the first final result and record a MergeConflict for a different one")
        void setOnceConflict() {
            AuditReport first = AuditReport.of(List.of());
            AuditReport second = new AuditReport(List.of(), BigDecimal.ONE);

            AuditState once = store.merge(initial, AuditDelta.builder().finalResult(first).build());
            AuditState twice = store.merge(once, AuditDelta.builder().finalResult(second).build());

            assertThat(twice.getFinalResult()).contains(first);
            assertThat(AuditErrors.count(twice.getErrors(), ErrorKind.MERGE_CONFLICT)).isEqualTo(1);
        }

        @Test
        @DisplayName("should accept the same final result twice without a conflict")
        void setOnceIdempotent() {
            AuditReport report = AuditReport.of(List.of());
            AuditState once = store.merge(initial, AuditDelta.builder().finalResult(report).build());
            AuditState twice = store.merge(once, AuditDelta.builder().finalResult(report).build());

            assertThat(twice.getErrors()).isEmpty();
        }

        @Test
        @DisplayName("should drop evidence and opinions once sealed and record the drop")
        void sealedState() {
            AuditState sealed = store.merge(initial, AuditDelta.builder().finalResult(AuditReport.of(List.of())).build());

            AuditState after = store.merge(sealed, AuditDelta.builder()
                    .evidence("repo", List.of(evidence("late.py")))
                    .opinion(opinion(ReviewerRole.TECH_LEAD, 5))
                    .error("late_node: NodeFailure: something")
                    .build());

            assertThat(after.getEvidence()).isEmpty();
            assertThat(after.getOpinions()).isEmpty();
            assertThat(after.getErrors()).contains("late_node: NodeFailure: something");
            assertThat(AuditErrors.count(after.getErrors(), ErrorKind.MERGE_CONFLICT)).isEqualTo(2);
        }

        @Test
        @DisplayName("should record a MergeConflict for writes to read-only inputs")
        void readOnlyField() {
            AuditState after = store.merge(initial, Map.of(AuditState.RUN_ID, "hijacked"));

            assertThat(after.getRunId()).isEqualTo("run-1");
            assertThat(after.getErrors()).singleElement()
                    .matches(entry -> AuditErrors.isOfKind(entry, ErrorKind.MERGE_CONFLICT));
        }
    }

    // =========================================================================
    //  Delta validation
    // =========================================================================

    @Nested
    @DisplayName("validate")
    class Validate {

        @Test
        @DisplayName("should accept a well-formed delta")
        void wellFormed() {
            Map<String, Object> delta = AuditDelta.builder()
                    .evidence("repo", List.of(evidence("README.md")))
                    .opinion(opinion(ReviewerRole.DEFENSE, 3))
                    .build();

            assertThat(StateStore.validate(delta, Set.of("repo"))).isEmpty();
        }

        @Test
        @DisplayName("should reject null, unknown keys, ill-typed values and foreign evidence keys")
        void malformed() {
            assertThat(StateStore.validate(null, Set.of())).contains("node returned no delta");
            assertThat(StateStore.validate(Map.of("status", "DONE"), Set.of())).get().asString()
                    .contains("unknown state field 'status'");
            assertThat(StateStore.validate(Map.of(AuditState.OPINIONS, List.of("not an opinion")), Set.of()))
                    .isPresent();
            assertThat(StateStore.validate(
                    AuditDelta.builder().evidence("doc", List.of(evidence("x"))).build(), Set.of("repo")))
                    .get().asString().contains("does not own");
            assertThat(StateStore.validate(Map.of(AuditState.CRITERIA, List.of()), Set.of()))
                    .get().asString().contains("read-only");
        }
    }
}
