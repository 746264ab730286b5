package com.eainde.auditor.workflow;

import com.eainde.auditor.model.AuditReport;
import com.eainde.auditor.model.CriterionVerdict;
import com.eainde.auditor.state.AuditState;

import java.util.List;
import java.util.Optional;

/**
 * Result of one run: the last merged snapshot, where the run stopped and why.
 */
public record AuditOutcome(AuditState state, String finalStage, Status status) {

    public enum Status {
        /** A terminal stage was reached. */
        COMPLETED,
        /** The global run deadline passed. */
        TIMED_OUT,
        /** The router cycled past the configured transition cap. */
        TRANSITION_LIMIT
    }

    public Optional<AuditReport> report() {
        return state.getFinalResult();
    }

    public List<CriterionVerdict> verdicts() {
        return report().map(AuditReport::verdicts).orElse(List.of());
    }

    /** Error entries in a stable order. */
    public List<String> errors() {
        return state.getErrors().stream().sorted().toList();
    }

    public boolean reachedEnd() {
        return status == Status.COMPLETED && AuditGraph.END.equals(finalStage);
    }
}
