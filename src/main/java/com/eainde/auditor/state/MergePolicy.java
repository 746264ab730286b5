package com.eainde.auditor.state;

/**
 * How a state field combines an incoming delta with the current snapshot.
 */
public enum MergePolicy {
    /** Map of key to list: union of keys, lists concatenated where keys collide. */
    KEYED_UNION,
    /** List: delta appended after existing entries in arrival order. */
    APPEND,
    /** Scalar: the first value wins; a differing second write is a merge conflict. */
    SET_ONCE,
    /** Set at initialisation from run configuration; never written by nodes. */
    READ_ONLY
}
