package com.eainde.auditor.collector;

import com.eainde.auditor.error.CollectionException;
import com.eainde.auditor.model.Evidence;

import java.util.List;

/**
 * Gathers findings from one source. Collectors never score; the engine does not retry them.
 */
public interface EvidenceCollector {

    /** Evidence key this collector writes; unique within its stage. */
    String sourceKey();

    /**
     * @param reference location of the source, e.g. a checked-out repository directory
     * @throws CollectionException when the source is unreachable or malformed
     */
    List<Evidence> collect(String reference) throws CollectionException;
}
