package com.eainde.auditor.state;

import com.eainde.auditor.error.AuditErrors;
import com.eainde.auditor.error.ErrorKind;
import com.eainde.auditor.model.AuditReport;
import com.eainde.auditor.model.AuditRunRequest;
import com.eainde.auditor.model.Criterion;
import com.eainde.auditor.model.Evidence;
import com.eainde.auditor.model.JudicialOpinion;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Creates run snapshots and merges node deltas into them.
 *
 * <p>{@link #merge} is pure: it never touches the input snapshot or the delta and always returns
 * a fresh {@link AuditState}. Evidence (keyed union) and opinions/errors (append) merge
 * associatively and commutatively, so the result of a fan-out group does not depend on the
 * order in which its nodes completed.</p>
 */
@Slf4j
public class StateStore {

    static final String SOURCE = "state-store";

    public AuditState initialize(AuditRunRequest request, List<Criterion> criteria) {
        Map<String, Object> data = new HashMap<>();
        data.put(AuditState.RUN_ID, request.runId());
        data.put(AuditState.REPOSITORY_REF, request.repositoryRef());
        data.put(AuditState.DOCUMENT_REF, request.documentRef());
        data.put(AuditState.CRITERIA, List.copyOf(criteria));
        data.put(AuditState.EVIDENCE, Map.of());
        data.put(AuditState.OPINIONS, List.of());
        data.put(AuditState.ERRORS, List.of());
        return new AuditState(data);
    }

    public AuditState merge(AuditState current, Map<String, Object> delta) {
        Map<String, Object> next = new HashMap<>(current.data());
        if (delta == null || delta.isEmpty()) {
            return new AuditState(next);
        }

        List<String> conflicts = new ArrayList<>();
        boolean sealed = current.isSealed();

        for (Map.Entry<String, Object> entry : delta.entrySet()) {
            String key = entry.getKey();
            MergePolicy policy = AuditState.SCHEMA.get(key);
            if (policy == null || policy == MergePolicy.READ_ONLY) {
                conflicts.add(AuditErrors.format(SOURCE, ErrorKind.MERGE_CONFLICT,
                        "delta targets non-writable field '" + key + "'"));
                continue;
            }
            switch (policy) {
                case KEYED_UNION -> {
                    Map<String, List<Evidence>> incoming = evidenceOf(entry.getValue());
                    if (sealed && !incoming.isEmpty()) {
                        conflicts.add(sealedConflict("evidence", incoming.values().stream().mapToInt(List::size).sum()));
                    } else {
                        next.put(key, unionEvidence(current.getEvidence(), incoming));
                    }
                }
                case APPEND -> {
                    List<?> incoming = listOf(entry.getValue());
                    if (AuditState.OPINIONS.equals(key) && sealed && !incoming.isEmpty()) {
                        conflicts.add(sealedConflict("opinions", incoming.size()));
                    } else if (AuditState.OPINIONS.equals(key)) {
                        next.put(key, append(current.getOpinions(), incoming, JudicialOpinion.class));
                    } else {
                        next.put(key, append(current.getErrors(), incoming, String.class));
                    }
                }
                case SET_ONCE -> setOnce(current, key, entry.getValue()).ifPresentOrElse(
                        conflicts::add, () -> next.put(key, entry.getValue()));
                default -> throw new IllegalStateException("Unhandled merge policy " + policy);
            }
        }

        if (!conflicts.isEmpty()) {
            conflicts.forEach(conflict -> log.warn("{}", conflict));
            List<String> errors = new ArrayList<>(castList(next.get(AuditState.ERRORS), String.class));
            errors.addAll(conflicts);
            next.put(AuditState.ERRORS, List.copyOf(errors));
        }
        return new AuditState(next);
    }

    /**
     * Checks a delta's shape before it is merged. Returns a description of the first problem,
     * or empty when the delta is well formed and only writes evidence keys in {@code ownedEvidenceKeys}.
     */
    public static Optional<String> validate(Map<String, Object> delta, Set<String> ownedEvidenceKeys) {
        if (delta == null) {
            return Optional.of("node returned no delta");
        }
        for (Map.Entry<String, Object> entry : delta.entrySet()) {
            String key = entry.getKey();
            Object value = entry.getValue();
            MergePolicy policy = AuditState.SCHEMA.get(key);
            if (policy == null) {
                return Optional.of("unknown state field '" + key + "'");
            }
            if (policy == MergePolicy.READ_ONLY) {
                return Optional.of("field '" + key + "' is read-only");
            }
            if (value == null) {
                return Optional.of("null value for field '" + key + "'");
            }
            switch (policy) {
                case KEYED_UNION -> {
                    if (!(value instanceof Map<?, ?> map)) {
                        return Optional.of("field '" + key + "' must be a map of source key to evidence list");
                    }
                    for (Map.Entry<?, ?> sourceEntry : map.entrySet()) {
                        if (!(sourceEntry.getKey() instanceof String sourceKey)) {
                            return Optional.of("evidence source keys must be strings");
                        }
                        if (!ownedEvidenceKeys.contains(sourceKey)) {
                            return Optional.of("writes evidence key '" + sourceKey + "' it does not own");
                        }
                        if (!allOfType(sourceEntry.getValue(), Evidence.class)) {
                            return Optional.of("evidence under '" + sourceKey + "' must be a list of Evidence");
                        }
                    }
                }
                case APPEND -> {
                    Class<?> type = AuditState.OPINIONS.equals(key) ? JudicialOpinion.class : String.class;
                    if (!allOfType(value, type)) {
                        return Optional.of("field '" + key + "' must be a list of " + type.getSimpleName());
                    }
                }
                case SET_ONCE -> {
                    if (!(value instanceof AuditReport)) {
                        return Optional.of("field '" + key + "' must be an AuditReport");
                    }
                }
                default -> {
                    return Optional.of("unsupported field '" + key + "'");
                }
            }
        }
        return Optional.empty();
    }

    private Optional<String> setOnce(AuditState current, String key, Object incoming) {
        Object existing = current.data().get(key);
        if (existing == null || existing.equals(incoming)) {
            return Optional.empty();
        }
        return Optional.of(AuditErrors.format(SOURCE, ErrorKind.MERGE_CONFLICT,
                "'" + key + "' is already set; keeping the first value"));
    }

    private static String sealedConflict(String field, int count) {
        return AuditErrors.format(SOURCE, ErrorKind.MERGE_CONFLICT,
                "final result already set; dropped " + count + " " + field + " contribution(s)");
    }

    private static Map<String, List<Evidence>> unionEvidence(Map<String, List<Evidence>> existing,
                                                             Map<String, List<Evidence>> incoming) {
        Map<String, List<Evidence>> merged = new TreeMap<>(existing);
        incoming.forEach((sourceKey, items) -> merged.merge(sourceKey, List.copyOf(items), (left, right) -> {
            List<Evidence> joined = new ArrayList<>(left);
            joined.addAll(right);
            return List.copyOf(joined);
        }));
        return Collections.unmodifiableMap(merged);
    }

    private static <T> List<T> append(List<T> existing, List<?> incoming, Class<T> type) {
        List<T> joined = new ArrayList<>(existing);
        joined.addAll(castList(incoming, type));
        return List.copyOf(joined);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, List<Evidence>> evidenceOf(Object value) {
        return value == null ? Map.of() : (Map<String, List<Evidence>>) value;
    }

    private static List<?> listOf(Object value) {
        return value instanceof List<?> list ? list : List.of();
    }

    private static <T> List<T> castList(Object value, Class<T> type) {
        if (!(value instanceof Collection<?> items)) {
            return List.of();
        }
        return items.stream().map(type::cast).toList();
    }

    private static boolean allOfType(Object value, Class<?> type) {
        return value instanceof List<?> list && list.stream().allMatch(type::isInstance);
    }
}
