package com.eainde.auditor.model;

import java.util.Objects;
import java.util.UUID;

/**
 * Static inputs of one audit run.
 *
 * @param runId         identifier used for logging and external checkpointing
 * @param repositoryRef reference handed to the repository collector
 * @param documentRef   reference handed to the document collector; may be empty
 */
public record AuditRunRequest(String runId, String repositoryRef, String documentRef) {

    public AuditRunRequest {
        runId = runId == null || runId.isBlank() ? UUID.randomUUID().toString() : runId;
        repositoryRef = Objects.requireNonNullElse(repositoryRef, "");
        documentRef = Objects.requireNonNullElse(documentRef, "");
    }

    public static AuditRunRequest of(String repositoryRef, String documentRef) {
        return new AuditRunRequest(null, repositoryRef, documentRef);
    }
}
