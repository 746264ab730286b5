package com.eainde.auditor.nodes;

import com.eainde.auditor.collector.EvidenceCollector;
import com.eainde.auditor.error.CollectionException;
import com.eainde.auditor.model.AuditRunRequest;
import com.eainde.auditor.model.Evidence;
import com.eainde.auditor.state.AuditState;
import com.eainde.auditor.state.StateStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EvidenceCollectorNodeTest {

    @Mock
    private EvidenceCollector collector;

    private final StateStore store = new StateStore();
    private AuditState state;

    @BeforeEach
    void setUp() {
        when(collector.sourceKey()).thenReturn("repo");
        state = store.initialize(AuditRunRequest.of("/work/repo", "/work/report.md"), List.of());
    }

    @Test
    @DisplayName("should write the collected evidence under the collector's key")
    void collects() {
        Evidence readme = Evidence.of("Verify required file exists: README.md", true, "README.md", 1.0, "present");
        when(collector.collect("/work/repo")).thenReturn(List.of(readme));
        EvidenceCollectorNode node = EvidenceCollectorNode.forRepository("repo_investigator", collector);

        AuditState next = store.merge(state, node.apply(state));

        assertThat(node.ownedEvidenceKeys()).containsExactly("repo");
        assertThat(next.getEvidence("repo")).containsExactly(readme);
        assertThat(next.getErrors()).isEmpty();
    }

    @Test
    @DisplayName("should record a CollectionError and an empty list when the collector fails")
    void collectionFailure() {
        when(collector.collect("/work/report.md")).thenThrow(new CollectionException("document is empty"));
        EvidenceCollectorNode node = EvidenceCollectorNode.forDocument("doc_analyst", collector);

        Map<String, Object> delta = node.apply(state);
        AuditState next = store.merge(state, delta);

        assertThat(next.getEvidence()).containsKey("repo");
        assertThat(next.getEvidence("repo")).isEmpty();
        assertThat(next.getErrors()).containsExactly("doc_analyst: CollectionError: document is empty");
    }

    @Test
    @DisplayName("should treat an unexpected collector exception as a collection failure")
    void unexpectedFailure() {
        when(collector.collect("/work/repo")).thenThrow(new IllegalStateException("disk gone"));
        EvidenceCollectorNode node = EvidenceCollectorNode.forRepository("repo_investigator", collector);

        AuditState next = store.merge(state, node.apply(state));

        assertThat(next.getErrors())
                .containsExactly("repo_investigator: CollectionError: IllegalStateException: disk gone");
    }
}
