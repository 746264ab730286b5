package com.eainde.auditor.error;

/**
 * Categories for entries in the run's error list. The label is what appears in the entry text.
 */
public enum ErrorKind {
    /** A source was unreachable or malformed; its evidence is empty for this run. */
    COLLECTION_ERROR("CollectionError"),
    /** The generator never produced a schema-conformant payload; a degraded opinion was substituted. */
    GENERATION_ERROR("GenerationError"),
    /** A set-once or read-only field was targeted by a conflicting write; the first writer wins. */
    MERGE_CONFLICT("MergeConflict"),
    /** A node threw unexpectedly or returned a malformed delta. */
    NODE_FAILURE("NodeFailure"),
    /** A node exceeded its per-node timeout. */
    NODE_TIMEOUT("NodeTimeout"),
    /** The global run deadline passed; remaining stages were not dispatched. */
    RUN_TIMEOUT("RunTimeout"),
    /** The router kept cycling past the configured number of stage transitions. */
    TRANSITION_LIMIT("TransitionLimit");

    private final String label;

    ErrorKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
