package com.eainde.auditor.nodes;

import com.eainde.auditor.collector.EvidenceCollector;
import com.eainde.auditor.error.AuditErrors;
import com.eainde.auditor.error.CollectionException;
import com.eainde.auditor.error.ErrorKind;
import com.eainde.auditor.model.Evidence;
import com.eainde.auditor.state.AuditDelta;
import com.eainde.auditor.state.AuditState;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Runs one {@link EvidenceCollector} and writes its findings under the collector's key.
 *
 * <p>A failing collector leaves an empty list under its key and a single CollectionError; the
 * collector is not retried.</p>
 */
@Slf4j
public class EvidenceCollectorNode implements AuditNode {

    private final String id;
    private final EvidenceCollector collector;
    private final Function<AuditState, String> reference;

    public EvidenceCollectorNode(String id, EvidenceCollector collector, Function<AuditState, String> reference) {
        this.id = id;
        this.collector = collector;
        this.reference = reference;
    }

    public static EvidenceCollectorNode forRepository(String id, EvidenceCollector collector) {
        return new EvidenceCollectorNode(id, collector, AuditState::getRepositoryRef);
    }

    public static EvidenceCollectorNode forDocument(String id, EvidenceCollector collector) {
        return new EvidenceCollectorNode(id, collector, AuditState::getDocumentRef);
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public Set<String> ownedEvidenceKeys() {
        return Set.of(collector.sourceKey());
    }

    @Override
    public Map<String, Object> apply(AuditState state) {
        String ref = reference.apply(state);
        try {
            List<Evidence> evidence = collector.collect(ref);
            log.info("{} collected {} evidence item(s) from {}", id, evidence.size(), ref);
            return AuditDelta.builder().evidence(collector.sourceKey(), evidence).build();
        } catch (CollectionException e) {
            return collectionFailure(e.getMessage());
        } catch (RuntimeException e) {
            return collectionFailure(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private Map<String, Object> collectionFailure(String message) {
        String entry = AuditErrors.format(id, ErrorKind.COLLECTION_ERROR, message);
        log.warn(entry);
        return AuditDelta.builder()
                .evidence(collector.sourceKey(), List.of())
                .error(entry)
                .build();
    }
}
