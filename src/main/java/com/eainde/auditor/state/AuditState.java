package com.eainde.auditor.state;

import com.eainde.auditor.model.AuditReport;
import com.eainde.auditor.model.Criterion;
import com.eainde.auditor.model.Evidence;
import com.eainde.auditor.model.JudicialOpinion;
import org.bsc.langgraph4j.state.AgentState;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Snapshot of one audit run. Instances are never mutated: the {@link StateStore} produces a new
 * snapshot for every merged delta, so nodes can read a snapshot concurrently without locking.
 */
public class AuditState extends AgentState {

    // Static inputs, set once by StateStore.initialize
    public static final String RUN_ID = "runId";
    public static final String REPOSITORY_REF = "repositoryRef";
    public static final String DOCUMENT_REF = "documentRef";
    public static final String CRITERIA = "criteria";

    // Node-writable channels
    public static final String EVIDENCE = "evidence";
    public static final String OPINIONS = "opinions";
    public static final String ERRORS = "errors";
    public static final String FINAL_RESULT = "finalResult";

    public static final Map<String, MergePolicy> SCHEMA = Map.of(
            RUN_ID, MergePolicy.READ_ONLY,
            REPOSITORY_REF, MergePolicy.READ_ONLY,
            DOCUMENT_REF, MergePolicy.READ_ONLY,
            CRITERIA, MergePolicy.READ_ONLY,
            EVIDENCE, MergePolicy.KEYED_UNION,
            OPINIONS, MergePolicy.APPEND,
            ERRORS, MergePolicy.APPEND,
            FINAL_RESULT, MergePolicy.SET_ONCE
    );

    public AuditState(Map<String, Object> initData) {
        super(initData);
    }

    public String getRunId() { return (String) data().get(RUN_ID); }
    public String getRepositoryRef() { return (String) data().get(REPOSITORY_REF); }
    public String getDocumentRef() { return (String) data().get(DOCUMENT_REF); }

    @SuppressWarnings("unchecked")
    public List<Criterion> getCriteria() {
        return (List<Criterion>) data().getOrDefault(CRITERIA, List.of());
    }

    @SuppressWarnings("unchecked")
    public Map<String, List<Evidence>> getEvidence() {
        return (Map<String, List<Evidence>>) data().getOrDefault(EVIDENCE, Map.of());
    }

    public List<Evidence> getEvidence(String sourceKey) {
        return getEvidence().getOrDefault(sourceKey, List.of());
    }

    public int totalEvidence() {
        return getEvidence().values().stream().mapToInt(List::size).sum();
    }

    /** Opinions in arrival order, kept for audit. */
    @SuppressWarnings("unchecked")
    public List<JudicialOpinion> getOpinions() {
        return (List<JudicialOpinion>) data().getOrDefault(OPINIONS, List.of());
    }

    /** Opinions in the deterministic (criterion, role) order used for anything externally visible. */
    public List<JudicialOpinion> sortedOpinions() {
        return getOpinions().stream().sorted(JudicialOpinion.CANONICAL_ORDER).toList();
    }

    @SuppressWarnings("unchecked")
    public List<String> getErrors() {
        return (List<String>) data().getOrDefault(ERRORS, List.of());
    }

    public Optional<AuditReport> getFinalResult() {
        return Optional.ofNullable((AuditReport) data().get(FINAL_RESULT));
    }

    /** Once the final result is set the snapshot only accepts error entries. */
    public boolean isSealed() {
        return data().containsKey(FINAL_RESULT);
    }

    /**
     * Order-insensitive view of the snapshot. Two snapshots reached by folding the same group
     * deltas in different orders have equal views.
     */
    public StateView view() {
        return new StateView(
                Collections.unmodifiableSortedMap(new TreeMap<>(getEvidence())),
                sortedOpinions(),
                getErrors().stream().sorted().toList(),
                getFinalResult().orElse(null));
    }

    /** Compact description for log lines. */
    public String summary() {
        return "AuditState{runId=" + getRunId()
                + ", evidenceKeys=" + getEvidence().keySet()
                + ", evidence=" + totalEvidence()
                + ", opinions=" + getOpinions().size()
                + ", errors=" + getErrors().size()
                + ", sealed=" + isSealed() + '}';
    }
}
