package com.eainde.auditor.edges;

import com.eainde.auditor.state.AuditState;

import java.util.function.Predicate;

/**
 * Predicates used by the audit graph's routers.
 */
public final class AuditRoutes {

    private AuditRoutes() {
    }

    /** Every collector came back empty and at least one of them reported a failure. */
    public static Predicate<AuditState> noEvidenceWithErrors() {
        return state -> state.totalEvidence() == 0 && !state.getErrors().isEmpty();
    }
}
