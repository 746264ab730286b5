package com.eainde.auditor.state;

import com.eainde.auditor.model.AuditReport;
import com.eainde.auditor.model.Evidence;
import com.eainde.auditor.model.JudicialOpinion;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the partial state contribution a node returns. The result is a plain map, the same
 * shape a langgraph4j {@code NodeAction} returns.
 *
 * <pre>
 * return AuditDelta.builder()
 *         .evidence("repo", evidences)
 *         .error(AuditErrors.format(id(), ErrorKind.COLLECTION_ERROR, "clone failed"))
 *         .build();
 * </pre>
 */
public final class AuditDelta {

    private final Map<String, List<Evidence>> evidence = new LinkedHashMap<>();
    private final List<JudicialOpinion> opinions = new ArrayList<>();
    private final List<String> errors = new ArrayList<>();
    private AuditReport finalResult;

    private AuditDelta() {
    }

    public static AuditDelta builder() {
        return new AuditDelta();
    }

    public static Map<String, Object> empty() {
        return Map.of();
    }

    public static Map<String, Object> errorDelta(String entry) {
        return Map.of(AuditState.ERRORS, List.of(entry));
    }

    public AuditDelta evidence(String sourceKey, List<Evidence> items) {
        evidence.computeIfAbsent(sourceKey, k -> new ArrayList<>()).addAll(items);
        return this;
    }

    public AuditDelta opinion(JudicialOpinion opinion) {
        opinions.add(opinion);
        return this;
    }

    public AuditDelta opinions(List<JudicialOpinion> items) {
        opinions.addAll(items);
        return this;
    }

    public AuditDelta error(String entry) {
        errors.add(entry);
        return this;
    }

    public AuditDelta finalResult(AuditReport report) {
        this.finalResult = report;
        return this;
    }

    public Map<String, Object> build() {
        Map<String, Object> delta = new HashMap<>();
        if (!evidence.isEmpty()) {
            Map<String, List<Evidence>> copy = new LinkedHashMap<>();
            evidence.forEach((key, items) -> copy.put(key, List.copyOf(items)));
            delta.put(AuditState.EVIDENCE, Map.copyOf(copy));
        }
        if (!opinions.isEmpty()) {
            delta.put(AuditState.OPINIONS, List.copyOf(opinions));
        }
        if (!errors.isEmpty()) {
            delta.put(AuditState.ERRORS, List.copyOf(errors));
        }
        if (finalResult != null) {
            delta.put(AuditState.FINAL_RESULT, finalResult);
        }
        return Map.copyOf(delta);
    }
}
