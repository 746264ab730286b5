package com.eainde.auditor.edges;

import com.eainde.auditor.model.AuditRunRequest;
import com.eainde.auditor.model.Evidence;
import com.eainde.auditor.state.AuditDelta;
import com.eainde.auditor.state.AuditState;
import com.eainde.auditor.state.StateStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConditionalRouterTest {

    private final StateStore store = new StateStore();
    private final AuditState empty = store.initialize(AuditRunRequest.of("/repo", ""), List.of());

    @Test
    @DisplayName("should pick the first matching transition in registration order")
    void firstMatchWins() {
        ConditionalRouter router = ConditionalRouter.from("collect")
                .when("always_a", state -> true, "a")
                .when("always_b", state -> true, "b")
                .otherwise("c");

        assertThat(router.apply(empty)).isEqualTo("a");
    }

    @Test
    @DisplayName("should fall back to otherwise when nothing matches")
    void otherwise() {
        ConditionalRouter router = ConditionalRouter.from("collect")
                .when("never", state -> false, "a")
                .otherwise("aggregate");

        assertThat(router.apply(empty)).isEqualTo("aggregate");
        assertThat(router.targets()).containsExactly("a", "aggregate");
    }

    @Test
    @DisplayName("should treat a throwing predicate as not matching")
    void throwingPredicate() {
        ConditionalRouter router = ConditionalRouter.from("collect")
                .when("broken", state -> {
                    throw new IllegalStateException("bad predicate");
                }, "a")
                .otherwise("b");

        assertThat(router.apply(empty)).isEqualTo("b");
    }

    @Test
    @DisplayName("should refuse to route without a fallback")
    void noFallback() {
        ConditionalRouter router = ConditionalRouter.from("collect").withoutFallback();

        assertThat(router.otherwise()).isEmpty();
        assertThatThrownBy(() -> router.apply(empty)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("should route to failure only when nothing was collected and errors exist")
    void noEvidenceWithErrors() {
        ConditionalRouter router = ConditionalRouter.from("collect")
                .when("no_evidence", AuditRoutes.noEvidenceWithErrors(), "failed")
                .otherwise("aggregate");

        AuditState failed = store.merge(empty, AuditDelta.builder()
                .evidence("repo", List.of())
                .error("repo_investigator: CollectionError: not found")
                .build());
        AuditState collected = store.merge(failed, AuditDelta.builder()
                .evidence("doc", List.of(Evidence.of("concept", true, "doc.md", 0.7, "")))
                .build());

        assertThat(router.apply(empty)).isEqualTo("aggregate");
        assertThat(router.apply(failed)).isEqualTo("failed");
        assertThat(router.apply(collected)).isEqualTo("aggregate");
    }
}
